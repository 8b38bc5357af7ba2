package com.acme.learnlite.auth;

import com.acme.learnlite.common.RateLimitedException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.data.redis.core.StringRedisTemplate;
import org.springframework.stereotype.Component;

import java.time.Duration;

@Component
public class LoginAttemptRateLimiter {
    private static final Logger log = LoggerFactory.getLogger(LoginAttemptRateLimiter.class);

    private final StringRedisTemplate redis;

    public LoginAttemptRateLimiter(StringRedisTemplate redis) {
        this.redis = redis;
    }

    public void check(String key, int max, Duration ttl) {
        String redisKey = "ratelimit:" + key;
        Long count = redis.opsForValue().increment(redisKey);
        if (count != null && count == 1) {
            redis.expire(redisKey, ttl);
        }
        if (count != null && count > max) {
            log.warn("rate limit exceeded key={} count={}", key, count);
            throw new RateLimitedException();
        }
    }
}
