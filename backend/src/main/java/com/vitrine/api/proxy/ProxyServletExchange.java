/*
 * Copyright (C) 2025 Vitrine Edge
 * SPDX-License-Identifier: AGPL-3.0-only
 */

package com.vitrine.api.proxy;

import com.vitrine.application.proxy.ProxyRequest;
import com.vitrine.application.proxy.ProxyResponse;
import jakarta.servlet.http.HttpServletRequest;
import jakarta.servlet.http.HttpServletResponse;
import org.springframework.http.HttpHeaders;
import org.springframework.util.StreamUtils;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.util.Collections;

/**
 * Servlet side of the tag proxy, shared by the controller and the preflight filter.
 */
final class ProxyServletExchange {
    static final String MOUNT_PATH = "/api/gtm-proxy";

    private ProxyServletExchange() {}

    static boolean isProxyPath(HttpServletRequest request) {
        String path = request.getRequestURI().substring(request.getContextPath().length());
        return path.equals(MOUNT_PATH) || path.startsWith(MOUNT_PATH + "/");
    }

    static ProxyRequest toProxyRequest(HttpServletRequest request, String clientIp) throws IOException {
        String uri = request.getRequestURI();
        int prefix = request.getContextPath().length() + MOUNT_PATH.length();
        String path = uri.length() > prefix ? uri.substring(prefix) : "";

        HttpHeaders headers = new HttpHeaders();
        for (String name : Collections.list(request.getHeaderNames())) {
            headers.put(name, Collections.list(request.getHeaders(name)));
        }

        String body = "POST".equalsIgnoreCase(request.getMethod())
                ? StreamUtils.copyToString(request.getInputStream(), StandardCharsets.UTF_8)
                : null;

        return new ProxyRequest(request.getMethod(), path, request.getQueryString(), headers, body, clientIp);
    }

    static void write(ProxyResponse result, HttpServletResponse response) throws IOException {
        response.setStatus(result.status());
        result.headers().forEach(response::setHeader);
        if (!result.body().isEmpty()) {
            byte[] body = result.body().getBytes(StandardCharsets.UTF_8);
            response.setContentLength(body.length);
            response.getOutputStream().write(body);
        }
    }
}
