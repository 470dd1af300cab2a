package com.analystpilot.orchestrator.cache;

import java.time.Duration;
import java.util.Optional;

/**
 * Key-value store with per-entry expiry, used to memoize provider replies.
 *
 * Implementations must be safe for concurrent use and must never throw from
 * either method: a broken cache degrades to a miss, never to a failed request.
 */
public interface ResponseCache {

    Optional<String> get(String key);

    /** Store {@code value}; a null {@code ttl} means the cache's default expiry. */
    void put(String key, String value, Duration ttl);
}
