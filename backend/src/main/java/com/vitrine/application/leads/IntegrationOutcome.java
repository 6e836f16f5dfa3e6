/*
 * Copyright (C) 2025 Vitrine Edge
 * SPDX-License-Identifier: AGPL-3.0-only
 */

package com.vitrine.application.leads;

/**
 * Result of one non-blocking integration of a lead.
 */
public record IntegrationOutcome(Status status, String reference, String reason) {
    public enum Status {
        CREATED,
        EXISTING,
        REJECTED,
        SKIPPED,
        FAILED
    }

    public static IntegrationOutcome skipped(String reason) {
        return new IntegrationOutcome(Status.SKIPPED, null, reason);
    }

    public static IntegrationOutcome failed(String reason) {
        return new IntegrationOutcome(Status.FAILED, null, reason);
    }
}
