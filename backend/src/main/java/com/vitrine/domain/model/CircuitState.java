/*
 * Copyright (C) 2025 Vitrine Edge
 * SPDX-License-Identifier: AGPL-3.0-only
 */

package com.vitrine.domain.model;

public enum CircuitState {
    CLOSED,
    OPEN,
    HALF_OPEN
}
