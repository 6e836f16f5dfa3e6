/*
 * Copyright (C) 2025 Vitrine Edge
 * SPDX-License-Identifier: AGPL-3.0-only
 */

package com.vitrine.application.checkout;

import java.util.Map;

/**
 * @param amountMinor optional, the configured ticket price is used when absent
 * @param currency optional, defaults to the first configured currency
 * @param idempotencyKey optional, generated when absent
 */
public record CheckoutCommand(
        String leadId,
        String fullName,
        String email,
        String phone,
        Long amountMinor,
        String currency,
        Map<String, String> utm,
        String idempotencyKey
) {
    public CheckoutCommand {
        utm = utm == null ? Map.of() : Map.copyOf(utm);
    }
}
