/*
 * Copyright (C) 2025 Vitrine Edge
 * SPDX-License-Identifier: AGPL-3.0-only
 */

package com.vitrine.infrastructure.upstream;

import java.util.Map;

/**
 * Raw upstream HTTP response. Header names are lower-case, first value wins.
 */
public record UpstreamResponse(int statusCode, Map<String, String> headers, String body) {
    public UpstreamResponse {
        headers = headers == null ? Map.of() : Map.copyOf(headers);
        body = body == null ? "" : body;
    }

    public boolean is2xx() {
        return statusCode >= 200 && statusCode < 300;
    }

    public String header(String name) {
        return name == null ? null : headers.get(name.toLowerCase());
    }
}
