/*
 * Copyright (C) 2025 Vitrine Edge
 * SPDX-License-Identifier: AGPL-3.0-only
 */

package com.vitrine.application.cache;

import java.time.Duration;
import java.time.Instant;
import java.util.Comparator;

/**
 * @param sequence insertion counter, breaks ties between entries stored at the same instant
 */
public record CacheEntry<K, V>(
        K key,
        V value,
        Instant storedAt,
        long sequence
) {
    static final Comparator<CacheEntry<?, ?>> OLDEST_FIRST = Comparator
            .comparing((CacheEntry<?, ?> e) -> e.storedAt())
            .thenComparingLong(CacheEntry::sequence);

    public boolean isExpired(Instant now, Duration ttl) {
        return Duration.between(storedAt, now).compareTo(ttl) > 0;
    }
}
