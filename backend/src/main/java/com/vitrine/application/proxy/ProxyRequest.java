/*
 * Copyright (C) 2025 Vitrine Edge
 * SPDX-License-Identifier: AGPL-3.0-only
 */

package com.vitrine.application.proxy;

import org.springframework.http.HttpHeaders;

/**
 * Inbound tag request as seen by the proxy.
 *
 * @param path  path below the proxy mount point, e.g. {@code /g/collect}
 * @param query raw query string without the leading {@code ?}, passed through untouched
 */
public record ProxyRequest(
        String method,
        String path,
        String query,
        HttpHeaders headers,
        String body,
        String clientIp
) {
    public ProxyRequest {
        method = method == null ? "GET" : method.toUpperCase();
        path = path == null ? "" : path;
        headers = headers == null ? new HttpHeaders() : HttpHeaders.readOnlyHttpHeaders(headers);
    }
}
