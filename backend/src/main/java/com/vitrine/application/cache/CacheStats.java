/*
 * Copyright (C) 2025 Vitrine Edge
 * SPDX-License-Identifier: AGPL-3.0-only
 */

package com.vitrine.application.cache;

public record CacheStats(
        String name,
        int size,
        int maxSize,
        long ttlMs
) {}
