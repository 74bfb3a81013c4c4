package com.signals.processor.store;

import java.time.Duration;
import java.util.List;
import java.util.Optional;

import org.springframework.dao.DataAccessException;
import org.springframework.data.redis.core.StringRedisTemplate;
import org.springframework.data.redis.core.script.DefaultRedisScript;
import org.springframework.data.redis.core.script.RedisScript;

import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;

/**
 * {@link TradeStore} on Redis strings and lists.
 */
@RequiredArgsConstructor
@Slf4j
public class RedisTradeStore implements TradeStore {

    /** LPUSH then LTRIM in one server-side step; returns the list length after the trim. */
    static final RedisScript<Long> PREPEND_AND_TRIM = new DefaultRedisScript<>(
            "redis.call('LPUSH', KEYS[1], ARGV[1]) "
                    + "redis.call('LTRIM', KEYS[1], 0, tonumber(ARGV[2])) "
                    + "return redis.call('LLEN', KEYS[1])",
            Long.class);

    private final StringRedisTemplate redisTemplate;

    @Override
    public Optional<String> get(String key) {
        try {
            return Optional.ofNullable(redisTemplate.opsForValue().get(key));
        } catch (DataAccessException e) {
            throw new TradeStoreException("GET " + key + " failed", e);
        }
    }

    @Override
    public void setWithTtl(String key, String value, Duration ttl) {
        try {
            redisTemplate.opsForValue().set(key, value, ttl);
        } catch (DataAccessException e) {
            throw new TradeStoreException("SETEX " + key + " failed", e);
        }
    }

    @Override
    public long increment(String key) {
        try {
            Long value = redisTemplate.opsForValue().increment(key);
            if (value == null) {
                // only happens inside a pipeline or transaction
                throw new TradeStoreException("INCR " + key + " returned no value");
            }
            return value;
        } catch (DataAccessException e) {
            throw new TradeStoreException("INCR " + key + " failed", e);
        }
    }

    @Override
    public void prependAndTrim(String key, String value, int maxSize) {
        try {
            Long length = redisTemplate.execute(PREPEND_AND_TRIM, List.of(key), value, String.valueOf(maxSize - 1));
            log.debug("LPUSH+LTRIM {} -> length {}", key, length);
        } catch (DataAccessException e) {
            throw new TradeStoreException("LPUSH/LTRIM " + key + " failed", e);
        }
    }

    @Override
    public List<String> range(String key, int limit) {
        try {
            List<String> values = redisTemplate.opsForList().range(key, 0, limit - 1);
            return values != null ? values : List.of();
        } catch (DataAccessException e) {
            throw new TradeStoreException("LRANGE " + key + " failed", e);
        }
    }
}
