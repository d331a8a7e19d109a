package com.fintech.bars.cache;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.stereotype.Component;

import java.time.Clock;
import java.time.Duration;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.atomic.AtomicLong;

/**
 * In-process {@link QuoteCache} for local runs and tests ({@code bars.cache.type=memory}).
 * Stores the same JSON the Redis cache would. Expired entries are dropped on read,
 * on every {@value #SWEEP_EVERY_WRITES}th write and on {@link #deletePattern}.
 */
@Component
@ConditionalOnProperty(name = "bars.cache.type", havingValue = "memory")
public class InMemoryQuoteCache implements QuoteCache {

    static final int SWEEP_EVERY_WRITES = 256;

    private final ObjectMapper objectMapper;
    private final Clock clock;
    private final Map<String, Entry> entries = new ConcurrentHashMap<>();
    private final AtomicLong writes = new AtomicLong();

    public InMemoryQuoteCache(ObjectMapper objectMapper, Clock clock) {
        this.objectMapper = objectMapper;
        this.clock = clock;
    }

    @Override
    public <T> Optional<T> get(String key, Class<T> type) {
        Entry entry = entries.get(key);
        if (entry == null) {
            return Optional.empty();
        }
        if (entry.expiresAt() <= clock.millis()) {
            entries.remove(key, entry);
            return Optional.empty();
        }
        try {
            return Optional.of(objectMapper.readValue(entry.json(), type));
        } catch (JsonProcessingException e) {
            throw new IllegalStateException("Corrupt cache entry " + key, e);
        }
    }

    @Override
    public void set(String key, Object value, Duration ttl) {
        try {
            entries.put(key, new Entry(objectMapper.writeValueAsString(value), clock.millis() + ttl.toMillis()));
        } catch (JsonProcessingException e) {
            throw new IllegalArgumentException("Cannot serialize cache value for " + key, e);
        }
        if (writes.incrementAndGet() % SWEEP_EVERY_WRITES == 0) {
            purgeExpired();
        }
    }

    @Override
    public boolean delete(String key) {
        return entries.remove(key) != null;
    }

    @Override
    public long deletePattern(String prefix) {
        purgeExpired();
        long removed = 0;
        for (String key : entries.keySet()) {
            if (key.startsWith(prefix) && entries.remove(key) != null) {
                removed++;
            }
        }
        return removed;
    }

    /**
     * Removes every entry whose TTL has passed.
     *
     * @return number of entries removed
     */
    public int purgeExpired() {
        long now = clock.millis();
        int removed = 0;
        for (Map.Entry<String, Entry> e : entries.entrySet()) {
            if (e.getValue().expiresAt() <= now && entries.remove(e.getKey(), e.getValue())) {
                removed++;
            }
        }
        return removed;
    }

    public int size() {
        return entries.size();
    }

    private record Entry(String json, long expiresAt) {
    }
}
