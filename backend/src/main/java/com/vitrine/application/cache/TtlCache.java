/*
 * Copyright (C) 2025 Vitrine Edge
 * SPDX-License-Identifier: AGPL-3.0-only
 */

package com.vitrine.application.cache;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.HashMap;
import java.util.Map;
import java.util.Optional;
import java.util.TreeSet;

/**
 * Bounded key/value store whose entries expire a fixed time after they were stored.
 *
 * <p>Capacity eviction removes the entry with the oldest {@code storedAt}, whether or not it
 * has expired; reads never refresh an entry. Entries stored at the same instant are evicted
 * in insertion order.
 */
public class TtlCache<K, V> {
    private static final Logger log = LoggerFactory.getLogger(TtlCache.class);

    private final String name;
    private final Duration ttl;
    private final int maxSize;
    private final Clock clock;

    private final Map<K, CacheEntry<K, V>> entries = new HashMap<>();
    private final TreeSet<CacheEntry<?, ?>> byAge = new TreeSet<>(CacheEntry.OLDEST_FIRST);
    private long sequence;

    public TtlCache(String name, Duration ttl, int maxSize, Clock clock) {
        if (ttl == null || ttl.isNegative()) {
            throw new IllegalArgumentException("ttl must be >= 0");
        }
        if (maxSize < 1) {
            throw new IllegalArgumentException("maxSize must be >= 1");
        }
        this.name = name;
        this.ttl = ttl;
        this.maxSize = maxSize;
        this.clock = clock;
    }

    public V get(K key) {
        return get(key, clock.instant());
    }

    public synchronized V get(K key, Instant now) {
        CacheEntry<K, V> entry = entries.get(key);
        if (entry == null) return null;
        if (entry.isExpired(now, ttl)) {
            remove(entry);
            return null;
        }
        return entry.value();
    }

    public synchronized Optional<CacheEntry<K, V>> getEntry(K key, Instant now) {
        CacheEntry<K, V> entry = entries.get(key);
        if (entry == null) return Optional.empty();
        if (entry.isExpired(now, ttl)) {
            remove(entry);
            return Optional.empty();
        }
        return Optional.of(entry);
    }

    public void set(K key, V value) {
        set(key, value, clock.instant());
    }

    public synchronized void set(K key, V value, Instant now) {
        if (key == null) {
            throw new IllegalArgumentException("cache key is required");
        }
        CacheEntry<K, V> previous = entries.get(key);
        if (previous != null) {
            remove(previous);
        } else {
            while (entries.size() >= maxSize) {
                evictOldest();
            }
        }
        CacheEntry<K, V> entry = new CacheEntry<>(key, value, now, sequence++);
        entries.put(key, entry);
        byAge.add(entry);
    }

    /**
     * Stores {@code value} only when no readable entry exists for {@code key}.
     *
     * @return the entry that was already present, or empty if {@code value} was stored
     */
    public synchronized Optional<CacheEntry<K, V>> putIfAbsent(K key, V value, Instant now) {
        Optional<CacheEntry<K, V>> existing = getEntry(key, now);
        if (existing.isPresent()) return existing;
        set(key, value, now);
        return Optional.empty();
    }

    public synchronized void invalidate(K key) {
        CacheEntry<K, V> entry = entries.get(key);
        if (entry != null) remove(entry);
    }

    public synchronized int purgeExpired(Instant now) {
        int removed = 0;
        while (!byAge.isEmpty()) {
            CacheEntry<?, ?> oldest = byAge.first();
            if (!oldest.isExpired(now, ttl)) break;
            byAge.pollFirst();
            entries.remove(oldest.key());
            removed++;
        }
        return removed;
    }

    public synchronized int trimToSize(int limit) {
        int removed = 0;
        while (entries.size() > Math.max(0, limit)) {
            evictOldest();
            removed++;
        }
        return removed;
    }

    public synchronized int size() {
        return entries.size();
    }

    public synchronized CacheStats stats() {
        return new CacheStats(name, entries.size(), maxSize, ttl.toMillis());
    }

    public Duration ttl() {
        return ttl;
    }

    private void evictOldest() {
        CacheEntry<?, ?> oldest = byAge.pollFirst();
        if (oldest == null) return;
        entries.remove(oldest.key());
        log.debug("Cache capacity eviction cache={} storedAt={}", name, oldest.storedAt());
    }

    private void remove(CacheEntry<K, V> entry) {
        entries.remove(entry.key());
        byAge.remove(entry);
    }
}
