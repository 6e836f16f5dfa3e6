/*
 * Copyright (C) 2025 Vitrine Edge
 * SPDX-License-Identifier: AGPL-3.0-only
 */

package com.vitrine.api;

import jakarta.servlet.http.HttpServletRequest;
import org.springframework.stereotype.Component;

/**
 * Client identity for rate limiting and forwarding: the first proxy-reported address, else the socket peer.
 */
@Component
public class ClientKeyResolver {
    public static final String UNKNOWN = "unknown";

    public String resolve(HttpServletRequest request) {
        String forwarded = request.getHeader("X-Forwarded-For");
        if (forwarded != null && !forwarded.isBlank()) {
            String first = forwarded.split(",")[0].trim();
            if (!first.isEmpty()) return first;
        }
        String realIp = firstNonBlank(request.getHeader("X-Real-IP"), request.getHeader("CF-Connecting-IP"));
        if (realIp != null) return realIp;

        String remote = request.getRemoteAddr();
        return remote == null || remote.isBlank() ? UNKNOWN : remote;
    }

    private static String firstNonBlank(String... values) {
        for (String v : values) {
            if (v != null && !v.isBlank()) return v.trim();
        }
        return null;
    }
}
