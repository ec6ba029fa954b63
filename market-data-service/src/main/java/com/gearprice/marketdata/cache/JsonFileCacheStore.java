package com.gearprice.marketdata.cache;

import com.fasterxml.jackson.databind.JavaType;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.file.AtomicMoveNotSupportedException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardCopyOption;
import java.time.Clock;
import java.time.Duration;
import java.util.Map;
import java.util.TreeMap;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.locks.ReentrantLock;

/**
 * Durable key/value namespace persisted as one JSON map file.
 *
 * <p><strong>Reads</strong> are lock-free lookups in a {@link ConcurrentHashMap}.
 * An entry older than the namespace TTL is reported as a miss but stays in the
 * map until the next successful {@link #put} overwrites it.
 *
 * <p><strong>Writes</strong> are serialized by a per-namespace lock and persisted
 * through a temp file that replaces the target, so concurrent workers cannot
 * interleave partial files.
 *
 * <p>A file that cannot be parsed on startup is logged and replaced by an empty
 * store on the next write.
 */
public class JsonFileCacheStore<T> {

    private static final Logger log = LoggerFactory.getLogger(JsonFileCacheStore.class);

    private final String namespace;
    private final Path file;
    private final Duration ttl;
    private final ObjectMapper objectMapper;
    private final JavaType fileType;
    private final Clock clock;

    private final ConcurrentHashMap<String, CacheEntry<T>> entries = new ConcurrentHashMap<>();
    private final ReentrantLock writeLock = new ReentrantLock();

    public JsonFileCacheStore(String namespace, Path file, Duration ttl, Class<T> payloadType,
                              ObjectMapper objectMapper, Clock clock) {
        this.namespace    = namespace;
        this.file         = file;
        this.ttl          = ttl;
        this.objectMapper = objectMapper;
        this.clock        = clock;

        JavaType entryType = objectMapper.getTypeFactory()
            .constructParametricType(CacheEntry.class, payloadType);
        this.fileType = objectMapper.getTypeFactory()
            .constructMapType(TreeMap.class, objectMapper.constructType(String.class), entryType);

        load();
    }

    /**
     * Returns the entry for {@code key}, or {@code null} if absent or stale.
     */
    public CacheEntry<T> get(String key) {
        CacheEntry<T> entry = entries.get(key);
        if (entry == null) {
            return null;
        }
        if (isExpired(entry)) {
            log.debug("CACHE_STALE namespace={} key={} capturedAt={}", namespace, key, entry.capturedAt());
            return null;
        }
        return entry;
    }

    /**
     * Stores {@code payload} under {@code key}, replacing any prior entry, and persists
     * the namespace. A failed write is logged; the in-memory entry is kept.
     */
    public CacheEntry<T> put(String key, T payload) {
        CacheEntry<T> entry = new CacheEntry<>(key, payload, clock.instant());
        writeLock.lock();
        try {
            entries.put(key, entry);
            persist();
        } finally {
            writeLock.unlock();
        }
        log.info("CACHE_REFRESH namespace={} key={} ttlSeconds={}", namespace, key, ttl.toSeconds());
        return entry;
    }

    /** @return {@code true} when an entry was removed */
    public boolean invalidate(String key) {
        writeLock.lock();
        try {
            if (entries.remove(key) == null) {
                return false;
            }
            persist();
        } finally {
            writeLock.unlock();
        }
        log.info("CACHE_INVALIDATED namespace={} key={}", namespace, key);
        return true;
    }

    public void clear() {
        writeLock.lock();
        try {
            entries.clear();
            persist();
        } finally {
            writeLock.unlock();
        }
        log.info("CACHE_CLEARED namespace={}", namespace);
    }

    /** Number of stored entries, stale ones included. */
    public int size() {
        return entries.size();
    }

    private boolean isExpired(CacheEntry<T> entry) {
        return entry.isOlderThan(ttl, clock.instant());
    }

    // ── persistence ───────────────────────────────────────────────────────────

    private void load() {
        if (!Files.exists(file)) {
            log.info("CACHE_INIT namespace={} file={} entries=0", namespace, file);
            return;
        }
        try {
            Map<String, CacheEntry<T>> stored = objectMapper.readValue(file.toFile(), fileType);
            if (stored != null) {
                stored.forEach((key, entry) -> {
                    if (entry != null && entry.payload() != null && entry.capturedAt() != null) {
                        entries.put(key, entry);
                    }
                });
            }
            log.info("CACHE_INIT namespace={} file={} entries={}", namespace, file, entries.size());
        } catch (IOException e) {
            log.warn("CACHE_CORRUPT namespace={} file={} reason={} action=START_EMPTY",
                     namespace, file, e.getMessage());
            entries.clear();
        }
    }

    /** Caller holds {@link #writeLock}. */
    private void persist() {
        try {
            Path parent = file.toAbsolutePath().getParent();
            if (parent != null) {
                Files.createDirectories(parent);
            }
            Path tmp = file.resolveSibling(file.getFileName() + ".tmp");
            objectMapper.writerWithDefaultPrettyPrinter().writeValue(tmp.toFile(), new TreeMap<>(entries));
            try {
                Files.move(tmp, file, StandardCopyOption.REPLACE_EXISTING, StandardCopyOption.ATOMIC_MOVE);
            } catch (AtomicMoveNotSupportedException e) {
                Files.move(tmp, file, StandardCopyOption.REPLACE_EXISTING);
            }
        } catch (IOException e) {
            log.error("CACHE_WRITE_FAILED namespace={} file={}", namespace, file, e);
        }
    }
}
