package com.pairup.server.im.profile;

import com.pairup.server.im.exception.StoreUnavailableException;
import org.springframework.dao.DataAccessException;
import org.springframework.data.redis.core.StringRedisTemplate;
import org.springframework.stereotype.Component;

import java.util.Map;
import java.util.Optional;

/**
 * Reads the hash {@code profile:{userId}} ({@code displayName}, {@code avatarUrl}) maintained by the profile service.
 */
@Component
public class RedisProfileDirectory implements ProfileDirectory {

    private final StringRedisTemplate redisTemplate;

    public RedisProfileDirectory(StringRedisTemplate redisTemplate) {
        this.redisTemplate = redisTemplate;
    }

    @Override
    public Optional<UserProfile> find(long userId) {
        Map<Object, Object> fields;
        try {
            fields = redisTemplate.opsForHash().entries("profile:" + userId);
        } catch (DataAccessException e) {
            throw new StoreUnavailableException("profile lookup failed for user " + userId, e);
        }
        if (fields == null || fields.isEmpty() || fields.get("displayName") == null) {
            return Optional.empty();
        }
        return Optional.of(new UserProfile(userId, (String) fields.get("displayName"), (String) fields.get("avatarUrl")));
    }
}
