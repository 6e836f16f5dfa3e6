/*
 * Copyright (C) 2025 Vitrine Edge
 * SPDX-License-Identifier: AGPL-3.0-only
 */

package com.vitrine.application.cache;

import com.stripe.model.Customer;

import java.time.Clock;
import java.time.Duration;
import java.util.Locale;

/**
 * Stripe customers by normalized email, so repeated checkouts skip the customer lookup.
 */
public class CustomerCache {
    private final TtlCache<String, Customer> cache;

    public CustomerCache(Duration ttl, int maxSize, Clock clock) {
        this.cache = new TtlCache<>("stripe-customers", ttl, maxSize, clock);
    }

    public Customer get(String email) {
        String key = normalize(email);
        return key == null ? null : cache.get(key);
    }

    public void put(String email, Customer customer) {
        String key = normalize(email);
        if (key == null || customer == null) return;
        cache.set(key, customer);
    }

    public void invalidate(String email) {
        String key = normalize(email);
        if (key != null) cache.invalidate(key);
    }

    public CacheStats stats() {
        return cache.stats();
    }

    static String normalize(String email) {
        if (email == null || email.isBlank()) return null;
        return email.trim().toLowerCase(Locale.ROOT);
    }
}
