package com.fintech.bars.cache;

import java.time.Duration;
import java.util.Optional;

/**
 * Key-value cache for latest quotes and in-progress bars.
 * Values are stored as JSON; every entry carries a TTL.
 */
public interface QuoteCache {

    <T> Optional<T> get(String key, Class<T> type);

    void set(String key, Object value, Duration ttl);

    /** @return true if the key existed */
    boolean delete(String key);

    /**
     * Deletes every key starting with {@code prefix}.
     *
     * @return number of keys deleted
     */
    long deletePattern(String prefix);
}
