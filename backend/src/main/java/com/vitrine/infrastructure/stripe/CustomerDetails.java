/*
 * Copyright (C) 2025 Vitrine Edge
 * SPDX-License-Identifier: AGPL-3.0-only
 */

package com.vitrine.infrastructure.stripe;

import java.util.Map;

public record CustomerDetails(
        String email,
        String name,
        String phone,
        Map<String, String> metadata
) {
    public CustomerDetails {
        metadata = metadata == null ? Map.of() : Map.copyOf(metadata);
    }
}
