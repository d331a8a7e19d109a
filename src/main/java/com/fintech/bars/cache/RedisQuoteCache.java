package com.fintech.bars.cache;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.data.redis.core.Cursor;
import org.springframework.data.redis.core.ScanOptions;
import org.springframework.data.redis.core.StringRedisTemplate;
import org.springframework.stereotype.Component;

import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;

/**
 * Redis-backed {@link QuoteCache}. Values are JSON strings written with
 * {@code SET key value EX ttl}.
 */
@Component
@ConditionalOnProperty(name = "bars.cache.type", havingValue = "redis", matchIfMissing = true)
public class RedisQuoteCache implements QuoteCache {

    private static final Logger log = LoggerFactory.getLogger(RedisQuoteCache.class);

    private static final long SCAN_BATCH = 500;

    private final StringRedisTemplate redisTemplate;
    private final ObjectMapper objectMapper;

    public RedisQuoteCache(StringRedisTemplate redisTemplate, ObjectMapper objectMapper) {
        this.redisTemplate = redisTemplate;
        this.objectMapper = objectMapper;
    }

    @Override
    public <T> Optional<T> get(String key, Class<T> type) {
        String json = redisTemplate.opsForValue().get(key);
        if (json == null) {
            return Optional.empty();
        }
        try {
            return Optional.of(objectMapper.readValue(json, type));
        } catch (JsonProcessingException e) {
            log.warn("Discarding unreadable cache entry {}: {}", key, e.getOriginalMessage());
            return Optional.empty();
        }
    }

    @Override
    public void set(String key, Object value, Duration ttl) {
        String json;
        try {
            json = objectMapper.writeValueAsString(value);
        } catch (JsonProcessingException e) {
            throw new IllegalArgumentException("Cannot serialize cache value for " + key, e);
        }
        redisTemplate.opsForValue().set(key, json, ttl);
    }

    @Override
    public boolean delete(String key) {
        return Boolean.TRUE.equals(redisTemplate.delete(key));
    }

    /**
     * Deletes every key starting with {@code prefix}. Keys are collected with
     * incremental {@code SCAN}, never {@code KEYS}.
     */
    @Override
    public long deletePattern(String prefix) {
        ScanOptions options = ScanOptions.scanOptions().match(prefix + "*").count(SCAN_BATCH).build();
        List<String> keys = new ArrayList<>();
        try (Cursor<String> cursor = redisTemplate.scan(options)) {
            while (cursor.hasNext()) {
                keys.add(cursor.next());
            }
        }
        if (keys.isEmpty()) {
            return 0;
        }
        Long deleted = redisTemplate.delete(keys);
        log.debug("Deleted {} keys with prefix {}", deleted, prefix);
        return deleted == null ? 0 : deleted;
    }
}
