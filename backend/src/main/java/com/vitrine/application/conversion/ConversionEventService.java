/*
 * Copyright (C) 2025 Vitrine Edge
 * SPDX-License-Identifier: AGPL-3.0-only
 */

package com.vitrine.application.conversion;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.math.BigDecimal;
import java.time.Clock;
import java.time.Instant;
import java.util.Locale;

@Service
public class ConversionEventService {
    private static final Logger log = LoggerFactory.getLogger(ConversionEventService.class);

    private final DuplicateTransactionSuppressor suppressor;
    private final Clock clock;

    public ConversionEventService(DuplicateTransactionSuppressor suppressor, Clock clock) {
        this.suppressor = suppressor;
        this.clock = clock;
    }

    public ConversionEvent purchaseCompleted(String transactionId, BigDecimal value, String currency) {
        Instant now = clock.instant();
        SuppressionDecision decision = suppressor.checkAndRecord(transactionId, now);
        String normalizedCurrency = currency == null ? null : currency.trim().toUpperCase(Locale.ROOT);

        if (decision.suppressed()) {
            log.warn("Duplicate purchase blocked transactionId={} firstSeenAt={}",
                    decision.transactionId(), decision.firstSeenAt());
            return new ConversionEvent(
                    ConversionEventTypes.PURCHASE_BLOCKED_DUPLICATE,
                    decision.transactionId(),
                    value,
                    normalizedCurrency,
                    now,
                    decision.firstSeenAt()
            );
        }

        log.info("Purchase conversion recorded transactionId={} value={} currency={}",
                decision.transactionId(), value, normalizedCurrency);
        return new ConversionEvent(
                ConversionEventTypes.PURCHASE_COMPLETED,
                decision.transactionId(),
                value,
                normalizedCurrency,
                now,
                null
        );
    }
}
