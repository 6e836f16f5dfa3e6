/*
 * Copyright (C) 2025 Vitrine Edge
 * SPDX-License-Identifier: AGPL-3.0-only
 */

package com.vitrine.infrastructure.stripe;

import java.util.Map;

/**
 * @param currency lower-case ISO code
 */
public record PaymentIntentDetails(
        long amountMinor,
        String currency,
        String customerId,
        String receiptEmail,
        String description,
        Map<String, String> metadata,
        String idempotencyKey
) {
    public PaymentIntentDetails {
        metadata = metadata == null ? Map.of() : Map.copyOf(metadata);
    }
}
