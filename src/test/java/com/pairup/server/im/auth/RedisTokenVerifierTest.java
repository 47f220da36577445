package com.pairup.server.im.auth;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.springframework.data.redis.RedisConnectionFailureException;
import org.springframework.data.redis.core.StringRedisTemplate;
import org.springframework.data.redis.core.ValueOperations;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.when;

class RedisTokenVerifierTest {

    private ValueOperations<String, String> valueOps;
    private RedisTokenVerifier verifier;

    @BeforeEach
    @SuppressWarnings("unchecked")
    void setUp() {
        valueOps = mock(ValueOperations.class);
        StringRedisTemplate template = mock(StringRedisTemplate.class);
        when(template.opsForValue()).thenReturn(valueOps);
        verifier = new RedisTokenVerifier(template);
    }

    @Test
    void knownTokenResolvesToUser() {
        when(valueOps.get("auth:token:abc")).thenReturn("42");

        assertThat(verifier.verify("abc")).hasValue(42L);
    }

    @Test
    void unknownOrBlankTokenIsRejected() {
        assertThat(verifier.verify("nope")).isEmpty();
        assertThat(verifier.verify("")).isEmpty();
        assertThat(verifier.verify(null)).isEmpty();
    }

    @Test
    void redisOutageFailsClosed() {
        when(valueOps.get("auth:token:abc")).thenThrow(new RedisConnectionFailureException("refused"));

        assertThat(verifier.verify("abc")).isEmpty();
    }
}
