/*
 * Copyright (C) 2025 Vitrine Edge
 * SPDX-License-Identifier: AGPL-3.0-only
 */

package com.vitrine.infrastructure.upstream;

public enum UpstreamErrorType {
    TIMEOUT,
    NETWORK,
    HTTP_STATUS,
    NOT_CONFIGURED,
    UNKNOWN
}
