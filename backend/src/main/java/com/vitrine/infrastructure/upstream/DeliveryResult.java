/*
 * Copyright (C) 2025 Vitrine Edge
 * SPDX-License-Identifier: AGPL-3.0-only
 */

package com.vitrine.infrastructure.upstream;

/**
 * Outcome of a write to a contact upstream (MailerLite, CRM) that did not fail outright.
 * Server errors, timeouts and transport failures are thrown as {@link UpstreamException} instead.
 */
public record DeliveryResult(DeliveryStatus status, String reference, int httpStatus, String reason) {
    public enum DeliveryStatus {
        CREATED,
        ALREADY_EXISTS,
        REJECTED
    }

    public static DeliveryResult created(String reference, int httpStatus) {
        return new DeliveryResult(DeliveryStatus.CREATED, reference, httpStatus, null);
    }

    public static DeliveryResult alreadyExists(String reference, int httpStatus) {
        return new DeliveryResult(DeliveryStatus.ALREADY_EXISTS, reference, httpStatus, "already exists");
    }

    public static DeliveryResult rejected(int httpStatus, String reason) {
        return new DeliveryResult(DeliveryStatus.REJECTED, null, httpStatus, reason);
    }
}
