package com.analystpilot.orchestrator.cache;

import com.fasterxml.jackson.databind.ObjectMapper;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.FileNotFoundException;
import java.io.IOException;
import java.nio.file.AtomicMoveNotSupportedException;
import java.nio.file.Files;
import java.nio.file.NoSuchFileException;
import java.nio.file.Path;
import java.nio.file.StandardCopyOption;
import java.time.Clock;
import java.time.Duration;
import java.util.Optional;

/**
 * Disk-backed {@link ResponseCache}: one JSON file per key under the cache
 * directory, holding the value and its absolute expiry.
 *
 * Writes go to a temp file that is then moved into place, so concurrent
 * readers see either the old entry or the new one, never a torn file.
 * Expired entries are deleted lazily on read. A {@code put} without a TTL
 * uses the cache-wide default.
 */
public class FileResponseCache implements ResponseCache {

    private static final Logger log = LoggerFactory.getLogger(FileResponseCache.class);

    /** On-disk entry format. */
    record Entry(String value, long expiresAtEpochMs) {}

    private final Path         dir;
    private final ObjectMapper json;
    private final Clock        clock;
    private final Duration     defaultTtl;

    public FileResponseCache(Path dir, ObjectMapper objectMapper, Clock clock, Duration defaultTtl) {
        this.dir        = dir;
        this.json       = objectMapper;
        this.clock      = clock;
        this.defaultTtl = defaultTtl;
        try {
            Files.createDirectories(dir);
        } catch (IOException e) {
            // Every get/put will miss and log; requests still work without a cache.
            log.warn("Could not create cache directory {}: {}", dir, e.getMessage());
        }
    }

    @Override
    public Optional<String> get(String key) {
        Path file = fileFor(key);
        try {
            Entry entry = json.readValue(file.toFile(), Entry.class);
            if (clock.millis() >= entry.expiresAtEpochMs()) {
                Files.deleteIfExists(file);
                return Optional.empty();
            }
            return Optional.ofNullable(entry.value());
        } catch (NoSuchFileException | FileNotFoundException e) {
            return Optional.empty();
        } catch (IOException e) {
            log.warn("Cache get failed for key {}: {}", key, e.getMessage());
            return Optional.empty();
        }
    }

    @Override
    public void put(String key, String value, Duration ttl) {
        Path target = fileFor(key);
        Path tmp    = null;
        try {
            tmp = Files.createTempFile(dir, "entry-", ".tmp");
            Duration effective = ttl == null ? defaultTtl : ttl;
            json.writeValue(tmp.toFile(), new Entry(value, clock.millis() + effective.toMillis()));
            try {
                Files.move(tmp, target, StandardCopyOption.REPLACE_EXISTING, StandardCopyOption.ATOMIC_MOVE);
            } catch (AtomicMoveNotSupportedException e) {
                Files.move(tmp, target, StandardCopyOption.REPLACE_EXISTING);
            }
        } catch (IOException e) {
            log.warn("Cache set failed for key {}: {}", key, e.getMessage());
            deleteQuietly(tmp);
        }
    }

    /** Keys are "prefix:hex"; the colon is not portable in file names. */
    private Path fileFor(String key) {
        return dir.resolve(key.replaceAll("[^A-Za-z0-9_-]", "_") + ".json");
    }

    private void deleteQuietly(Path tmp) {
        if (tmp == null) return;
        try {
            Files.deleteIfExists(tmp);
        } catch (IOException e) {
            log.debug("Could not delete temp cache file {}: {}", tmp, e.getMessage());
        }
    }
}
