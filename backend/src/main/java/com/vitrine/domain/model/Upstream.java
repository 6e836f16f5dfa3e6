/*
 * Copyright (C) 2025 Vitrine Edge
 * SPDX-License-Identifier: AGPL-3.0-only
 */

package com.vitrine.domain.model;

import java.util.Optional;

/**
 * Upstream dependencies guarded by their own circuit breaker.
 */
public enum Upstream {
    CRM("crm"),
    MAILERLITE("mailerlite"),
    STRIPE("stripe"),
    TAG_SERVER("tag-server"),
    TAG_SERVER_PREVIEW("tag-server-preview");

    private final String breakerName;

    Upstream(String breakerName) {
        this.breakerName = breakerName;
    }

    public String breakerName() {
        return breakerName;
    }

    public static Optional<Upstream> fromBreakerName(String name) {
        if (name == null) return Optional.empty();
        for (Upstream upstream : values()) {
            if (upstream.breakerName.equalsIgnoreCase(name.trim())) return Optional.of(upstream);
        }
        return Optional.empty();
    }
}
