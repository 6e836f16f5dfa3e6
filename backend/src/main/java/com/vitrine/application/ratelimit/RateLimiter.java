/*
 * Copyright (C) 2025 Vitrine Edge
 * SPDX-License-Identifier: AGPL-3.0-only
 */

package com.vitrine.application.ratelimit;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ConcurrentMap;

/**
 * Fixed-window request throttle, one record per client key.
 *
 * <p>Each key is updated atomically through {@link ConcurrentMap#compute}, so admitting
 * one client never waits on another. Expired records are only swept once the store
 * grows past {@link RateLimitPolicy#storeCap()}.
 */
public class RateLimiter {
    private static final Logger log = LoggerFactory.getLogger(RateLimiter.class);

    private final String name;
    private final RateLimitPolicy policy;
    private final Clock clock;
    private final ConcurrentMap<String, RateLimitRecord> store = new ConcurrentHashMap<>();

    public RateLimiter(String name, RateLimitPolicy policy, Clock clock) {
        this.name = name;
        this.policy = policy;
        this.clock = clock;
    }

    public RateLimitDecision admit(String clientKey) {
        return admit(clientKey, clock.instant());
    }

    public RateLimitDecision admit(String clientKey, Instant now) {
        String key = policy.keyPrefix() + (clientKey == null || clientKey.isBlank() ? "unknown" : clientKey);
        Duration window = policy.window();

        if (store.size() > policy.storeCap()) {
            sweepExpired(now);
        }

        RateLimitRecord record = store.compute(key, (k, existing) ->
                existing == null || existing.isExpired(now, window)
                        ? RateLimitRecord.first(now)
                        : existing.increment(now));

        long windowSeconds = window.toSeconds();
        if (record.count() <= policy.maxRequests()) {
            return RateLimitDecision.allow(policy.maxRequests(), policy.maxRequests() - record.count(), windowSeconds);
        }

        long remainingMs = Duration.between(now, record.firstRequestAt().plus(window)).toMillis();
        long retryAfter = Math.max(1, (long) Math.ceil(remainingMs / 1000.0));
        log.warn("Rate limit exceeded limiter={} key={} count={} retryAfterSeconds={}",
                name, key, record.count(), retryAfter);
        return RateLimitDecision.deny(policy.maxRequests(), retryAfter, windowSeconds);
    }

    public int sweepExpired(Instant now) {
        int before = store.size();
        store.entrySet().removeIf(e -> e.getValue().isExpired(now, policy.window()));
        int removed = Math.max(0, before - store.size());
        if (removed > 0) {
            log.debug("Rate limit store swept limiter={} removed={} remaining={}", name, removed, store.size());
        }
        return removed;
    }

    public int size() {
        return store.size();
    }

    public String name() {
        return name;
    }
}
