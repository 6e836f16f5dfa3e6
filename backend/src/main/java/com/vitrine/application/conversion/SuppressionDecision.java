/*
 * Copyright (C) 2025 Vitrine Edge
 * SPDX-License-Identifier: AGPL-3.0-only
 */

package com.vitrine.application.conversion;

import java.time.Instant;

/**
 * @param firstSeenAt when the transaction was first recorded; for a fresh transaction this is now
 */
public record SuppressionDecision(
        String transactionId,
        boolean suppressed,
        Instant firstSeenAt
) {}
