/*
 * Copyright (C) 2025 Vitrine Edge
 * SPDX-License-Identifier: AGPL-3.0-only
 */

package com.vitrine.application.conversion;

public final class ConversionEventTypes {
    private ConversionEventTypes() {}

    public static final String PURCHASE_COMPLETED = "purchase_completed";
    public static final String PURCHASE_BLOCKED_DUPLICATE = "purchase_blocked_duplicate";
}
