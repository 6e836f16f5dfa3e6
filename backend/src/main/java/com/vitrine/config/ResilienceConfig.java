/*
 * Copyright (C) 2025 Vitrine Edge
 * SPDX-License-Identifier: AGPL-3.0-only
 */

package com.vitrine.config;

import com.vitrine.application.cache.CustomerCache;
import com.vitrine.application.conversion.DuplicateTransactionSuppressor;
import com.vitrine.application.ratelimit.RateLimitPolicy;
import com.vitrine.application.ratelimit.RateLimiter;
import com.vitrine.application.resilience.CircuitBreakerRegistry;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import java.time.Clock;

/**
 * Builds the process-wide resilience state. Each instance lives for the application lifetime.
 */
@Configuration
public class ResilienceConfig {
    public static final String LEAD_LIMITER = "leadRateLimiter";
    public static final String PAYMENT_INTENT_LIMITER = "paymentIntentRateLimiter";

    @Bean
    public Clock clock() {
        return Clock.systemUTC();
    }

    @Bean
    public CircuitBreakerRegistry circuitBreakerRegistry(AppProperties properties, Clock clock) {
        AppProperties.Resilience cfg = properties.resilience();
        return new CircuitBreakerRegistry(cfg.failureThreshold(), cfg.resetTimeout(), clock);
    }

    @Bean(LEAD_LIMITER)
    @Qualifier(LEAD_LIMITER)
    public RateLimiter leadRateLimiter(AppProperties properties, Clock clock) {
        return limiter("leads", properties.rateLimits().leads(), clock);
    }

    @Bean(PAYMENT_INTENT_LIMITER)
    @Qualifier(PAYMENT_INTENT_LIMITER)
    public RateLimiter paymentIntentRateLimiter(AppProperties properties, Clock clock) {
        return limiter("payment-intents", properties.rateLimits().paymentIntents(), clock);
    }

    @Bean
    public CustomerCache customerCache(AppProperties properties, Clock clock) {
        AppProperties.CacheSettings cfg = properties.customerCache();
        return new CustomerCache(cfg.ttl(), cfg.maxSize(), clock);
    }

    @Bean
    public DuplicateTransactionSuppressor duplicateTransactionSuppressor(AppProperties properties, Clock clock) {
        AppProperties.CacheSettings cfg = properties.conversions();
        return new DuplicateTransactionSuppressor(cfg.ttl(), cfg.maxSize(), clock);
    }

    private static RateLimiter limiter(String name, AppProperties.RateLimits.Policy cfg, Clock clock) {
        return new RateLimiter(name, new RateLimitPolicy(cfg.keyPrefix(), cfg.window(), cfg.maxRequests(), cfg.storeCap()), clock);
    }
}
