/*
 * Copyright (C) 2025 Vitrine Edge
 * SPDX-License-Identifier: AGPL-3.0-only
 */

package com.vitrine.application.conversion;

import com.vitrine.support.MutableClock;
import org.junit.jupiter.api.Test;

import java.math.BigDecimal;
import java.time.Duration;
import java.time.Instant;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertNull;

class ConversionEventServiceTest {
    @Test
    void emitsCompletedOnceThenBlockedDuplicate() {
        MutableClock clock = MutableClock.startingAt("2025-03-01T12:00:00Z");
        ConversionEventService service = new ConversionEventService(
                new DuplicateTransactionSuppressor(Duration.ofHours(24), 1000, clock), clock);

        ConversionEvent first = service.purchaseCompleted("pi_1", new BigDecimal("180.00"), "eur");
        clock.advance(Duration.ofMinutes(5));
        ConversionEvent second = service.purchaseCompleted("pi_1", new BigDecimal("180.00"), "eur");

        assertEquals(ConversionEventTypes.PURCHASE_COMPLETED, first.event());
        assertEquals("EUR", first.currency());
        assertNull(first.originalTimestamp());

        assertEquals(ConversionEventTypes.PURCHASE_BLOCKED_DUPLICATE, second.event());
        assertEquals(Instant.parse("2025-03-01T12:00:00Z"), second.originalTimestamp());
        assertEquals(Instant.parse("2025-03-01T12:05:00Z"), second.occurredAt());
    }
}
