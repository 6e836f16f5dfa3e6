/*
 * Copyright (C) 2025 Vitrine Edge
 * SPDX-License-Identifier: AGPL-3.0-only
 */

package com.vitrine.api;

public record ApiErrorResponse(
        String error,
        String code,
        String message,
        String requestId
) {}
