/*
 * Copyright (C) 2025 Vitrine Edge
 * SPDX-License-Identifier: AGPL-3.0-only
 */

package com.vitrine.application.conversion;

import com.vitrine.application.cache.CacheEntry;
import com.vitrine.application.cache.CacheStats;
import com.vitrine.application.cache.TtlCache;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.Optional;

/**
 * Remembers transaction ids for a suppression window so a purchase is only counted once.
 */
public class DuplicateTransactionSuppressor {
    private static final Logger log = LoggerFactory.getLogger(DuplicateTransactionSuppressor.class);

    private final TtlCache<String, Instant> seen;
    private final int maxSize;
    private final Clock clock;

    public DuplicateTransactionSuppressor(Duration ttl, int maxSize, Clock clock) {
        this.seen = new TtlCache<>("transactions", ttl, maxSize, clock);
        this.maxSize = maxSize;
        this.clock = clock;
    }

    public boolean shouldSuppress(String transactionId) {
        return shouldSuppress(transactionId, clock.instant());
    }

    public boolean shouldSuppress(String transactionId, Instant now) {
        return firstSeenAt(transactionId, now).isPresent();
    }

    public Optional<Instant> firstSeenAt(String transactionId, Instant now) {
        String key = normalize(transactionId);
        return seen.getEntry(key, now).map(CacheEntry::value);
    }

    public void record(String transactionId, Instant now) {
        String key = normalize(transactionId);
        seen.set(key, now, now);
    }

    public SuppressionDecision checkAndRecord(String transactionId) {
        return checkAndRecord(transactionId, clock.instant());
    }

    public SuppressionDecision checkAndRecord(String transactionId, Instant now) {
        String key = normalize(transactionId);
        Optional<CacheEntry<String, Instant>> existing = seen.putIfAbsent(key, now, now);
        return existing
                .map(e -> new SuppressionDecision(key, true, e.value()))
                .orElseGet(() -> new SuppressionDecision(key, false, now));
    }

    public int sweep() {
        return sweep(clock.instant());
    }

    public int sweep(Instant now) {
        int expired = seen.purgeExpired(now);
        int trimmed = seen.trimToSize(maxSize);
        if (expired > 0 || trimmed > 0) {
            log.debug("Transaction sweep expired={} trimmed={} remaining={}", expired, trimmed, seen.size());
        }
        return expired + trimmed;
    }

    public Duration sweepInterval() {
        Duration quarter = seen.ttl().dividedBy(4);
        return quarter.isZero() ? Duration.ofSeconds(1) : quarter;
    }

    public CacheStats stats() {
        return seen.stats();
    }

    private static String normalize(String transactionId) {
        if (transactionId == null || transactionId.isBlank()) {
            throw new IllegalArgumentException("transactionId is required");
        }
        return transactionId.trim();
    }
}
