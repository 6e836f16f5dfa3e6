/*
 * Copyright (C) 2025 Vitrine Edge
 * SPDX-License-Identifier: AGPL-3.0-only
 */

package com.vitrine.application.checkout;

public record CheckoutResult(
        String clientSecret,
        String paymentIntentId,
        String customerId,
        long amount,
        String currency,
        String idempotencyKey,
        boolean cacheHit
) {}
