/*
 * Copyright (C) 2025 Vitrine Edge
 * SPDX-License-Identifier: AGPL-3.0-only
 */

package com.vitrine.config;

import org.springframework.boot.context.properties.ConfigurationProperties;

import java.time.Duration;
import java.util.List;

@ConfigurationProperties(prefix = "app")
public record AppProperties(
        String publicOrigin,
        Frontend frontend,
        Admin admin,
        Resilience resilience,
        RateLimits rateLimits,
        CacheSettings customerCache,
        CacheSettings conversions,
        TagServer tagServer,
        MailerLite mailerlite,
        Crm crm,
        Stripe stripe,
        Checkout checkout
) {
    public record Frontend(String baseUrl) {}

    public record Admin(String apiKey) {}

    public record Resilience(int failureThreshold, Duration resetTimeout) {}

    public record RateLimits(Policy leads, Policy paymentIntents) {
        public record Policy(String keyPrefix, Duration window, int maxRequests, int storeCap) {}
    }

    public record CacheSettings(Duration ttl, int maxSize) {}

    /**
     * @param fallbackOnPreviewNotFound retry a preview request on the production host when preview answers 404
     */
    public record TagServer(
            String productionUrl,
            String previewUrl,
            Duration timeout,
            boolean fallbackOnPreviewNotFound
    ) {}

    public record MailerLite(String baseUrl, String apiKey, String groupId, Duration timeout) {}

    public record Crm(
            String apiUrl,
            String apiKey,
            String companyId,
            String boardId,
            String columnId,
            List<String> tags,
            Duration timeout
    ) {}

    public record Stripe(String secretKey, Duration timeout) {}

    /**
     * @param currencies allowed lower-case currencies, the first one is the default
     */
    public record Checkout(String eventName, String source, long defaultAmountMinor, List<String> currencies) {}
}
