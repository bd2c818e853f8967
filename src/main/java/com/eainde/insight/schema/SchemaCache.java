package com.eainde.insight.schema;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Map;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.atomic.AtomicLong;

/**
 * In-memory schema mapping cache keyed by {@link FileFingerprint#digest()}.
 *
 * <p>Lives for the process lifetime and is safe for concurrent use. There is no eviction:
 * the entry count is bounded by the number of distinct file versions seen.
 */
public class SchemaCache {

    private static final Logger log = LoggerFactory.getLogger(SchemaCache.class);

    private final Map<String, SchemaMapping> store = new ConcurrentHashMap<>();
    private final AtomicLong hits = new AtomicLong();
    private final AtomicLong misses = new AtomicLong();

    public Optional<SchemaMapping> get(FileFingerprint fingerprint) {
        SchemaMapping mapping = store.get(fingerprint.digest());
        if (mapping == null) {
            misses.incrementAndGet();
            log.debug("Schema cache miss: {}", fingerprint.path());
            return Optional.empty();
        }
        hits.incrementAndGet();
        log.debug("Schema cache hit: {}", fingerprint.path());
        return Optional.of(mapping);
    }

    public void put(FileFingerprint fingerprint, SchemaMapping mapping) {
        store.put(fingerprint.digest(), mapping);
    }

    public int size() {
        return store.size();
    }

    public long hits() {
        return hits.get();
    }

    public long misses() {
        return misses.get();
    }

    public void clear() {
        store.clear();
    }
}
