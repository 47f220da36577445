package com.pairup.server.im.auth;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.dao.DataAccessException;
import org.springframework.data.redis.core.StringRedisTemplate;
import org.springframework.stereotype.Component;

import java.util.OptionalLong;

/**
 * Tokens are published by the auth service as {@code auth:token:{token} -> userId}, with the token's lifetime as TTL.
 */
@Component
public class RedisTokenVerifier implements TokenVerifier {

    private static final Logger log = LoggerFactory.getLogger(RedisTokenVerifier.class);

    private final StringRedisTemplate redisTemplate;

    public RedisTokenVerifier(StringRedisTemplate redisTemplate) {
        this.redisTemplate = redisTemplate;
    }

    @Override
    public OptionalLong verify(String token) {
        if (token == null || token.isBlank()) {
            return OptionalLong.empty();
        }
        try {
            String uid = redisTemplate.opsForValue().get("auth:token:" + token);
            return uid == null ? OptionalLong.empty() : OptionalLong.of(Long.parseLong(uid));
        } catch (NumberFormatException e) {
            log.warn("Token maps to a non-numeric user id");
            return OptionalLong.empty();
        } catch (DataAccessException e) {
            // fail closed
            log.error("Token verification failed", e);
            return OptionalLong.empty();
        }
    }
}
