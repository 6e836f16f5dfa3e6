/*
 * Copyright (C) 2025 Vitrine Edge
 * SPDX-License-Identifier: AGPL-3.0-only
 */

package com.vitrine.application.proxy;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;

public record ProxyResponse(
        int status,
        Map<String, String> headers,
        String body
) {
    public ProxyResponse {
        headers = headers == null ? Map.of() : Collections.unmodifiableMap(new LinkedHashMap<>(headers));
        body = body == null ? "" : body;
    }
}
