/*
 * Copyright (C) 2025 Vitrine Edge
 * SPDX-License-Identifier: AGPL-3.0-only
 */

package com.vitrine.application.conversion;

import java.math.BigDecimal;
import java.time.Instant;

/**
 * Conversion signal handed back to the page for the dataLayer push.
 *
 * @param originalTimestamp first-seen time of the transaction, only set for blocked duplicates
 */
public record ConversionEvent(
        String event,
        String transactionId,
        BigDecimal value,
        String currency,
        Instant occurredAt,
        Instant originalTimestamp
) {}
