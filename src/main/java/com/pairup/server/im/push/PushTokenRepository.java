package com.pairup.server.im.push;

import com.alibaba.fastjson.JSON;
import com.pairup.server.im.exception.StoreUnavailableException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.core.io.ClassPathResource;
import org.springframework.dao.DataAccessException;
import org.springframework.data.redis.core.StringRedisTemplate;
import org.springframework.data.redis.core.script.RedisScript;
import org.springframework.stereotype.Repository;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;

/**
 * Key: "push:tokens:{userId}" HashKey: token Value: JSON(PushToken); "push:token-owner:{token}" -> userId.
 * A token belongs to at most one user; moving it between users runs as one script.
 */
@Repository
public class PushTokenRepository {

    private static final Logger log = LoggerFactory.getLogger(PushTokenRepository.class);

    private static final String TOKENS_PREFIX = "push:tokens:";

    private static final RedisScript<Long> SAVE_TOKEN =
            RedisScript.of(new ClassPathResource("scripts/save_push_token.lua"), Long.class);
    private static final RedisScript<Long> DELETE_TOKEN =
            RedisScript.of(new ClassPathResource("scripts/delete_push_token.lua"), Long.class);

    private final StringRedisTemplate redisTemplate;

    public PushTokenRepository(StringRedisTemplate redisTemplate) {
        this.redisTemplate = redisTemplate;
    }

    public void save(PushToken pushToken) {
        String token = pushToken.getToken();
        String uid = String.valueOf(pushToken.getUserId());
        Long previousOwner;
        try {
            previousOwner = redisTemplate.execute(SAVE_TOKEN, List.of(ownerKey(token), tokensKey(uid)),
                    uid, token, JSON.toJSONString(pushToken), TOKENS_PREFIX);
        } catch (DataAccessException e) {
            throw new StoreUnavailableException("saving push token failed for user " + uid, e);
        }
        if (previousOwner != null && previousOwner >= 0) {
            log.info("Push token moved from user {} to user {}", previousOwner, uid);
        }
    }

    /**
     * @return whether the user owned the token
     */
    public boolean delete(long userId, String token) {
        String uid = String.valueOf(userId);
        try {
            Long removed = redisTemplate.execute(DELETE_TOKEN, List.of(tokensKey(uid), ownerKey(token)), uid, token);
            return removed != null && removed > 0;
        } catch (DataAccessException e) {
            throw new StoreUnavailableException("deleting push token failed for user " + uid, e);
        }
    }

    public List<PushToken> findByUser(long userId) {
        Map<Object, Object> entries;
        try {
            entries = redisTemplate.opsForHash().entries(tokensKey(String.valueOf(userId)));
        } catch (DataAccessException e) {
            throw new StoreUnavailableException("loading push tokens failed for user " + userId, e);
        }
        List<PushToken> tokens = new ArrayList<>();
        if (entries == null) {
            return tokens;
        }
        for (Object value : entries.values()) {
            PushToken pushToken = JSON.parseObject((String) value, PushToken.class);
            if (pushToken != null) {
                tokens.add(pushToken);
            }
        }
        return tokens;
    }

    private static String tokensKey(String uid) {
        return TOKENS_PREFIX + uid;
    }

    private static String ownerKey(String token) {
        return "push:token-owner:" + token;
    }
}
