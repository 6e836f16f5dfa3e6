/*
 * Copyright (C) 2025 Vitrine Edge
 * SPDX-License-Identifier: AGPL-3.0-only
 */

package com.vitrine.config;

import jakarta.servlet.FilterChain;
import jakarta.servlet.ServletException;
import jakarta.servlet.http.HttpServletRequest;
import jakarta.servlet.http.HttpServletResponse;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.slf4j.MDC;
import org.springframework.core.Ordered;
import org.springframework.core.annotation.Order;
import org.springframework.stereotype.Component;
import org.springframework.web.filter.OncePerRequestFilter;

import java.io.IOException;
import java.util.List;
import java.util.UUID;
import java.util.regex.Pattern;

/**
 * Correlates every request with an id taken from the caller or the edge, or generated here,
 * and logs one line per API call with status and latency.
 */
@Component
@Order(Ordered.HIGHEST_PRECEDENCE)
public class RequestIdFilter extends OncePerRequestFilter {
    private static final Logger log = LoggerFactory.getLogger(RequestIdFilter.class);

    public static final String HEADER = "X-Request-Id";
    public static final String MDC_KEY = "requestId";

    // edge/CDN ids, checked after our own header
    private static final List<String> UPSTREAM_HEADERS = List.of(HEADER, "X-Nf-Request-Id", "X-Amzn-Trace-Id");
    private static final Pattern SAFE_ID = Pattern.compile("[A-Za-z0-9._=;-]{1,64}");

    @Override
    protected void doFilterInternal(HttpServletRequest request, HttpServletResponse response, FilterChain filterChain)
            throws ServletException, IOException {
        String requestId = incomingId(request);
        long startedNanos = System.nanoTime();

        MDC.put(MDC_KEY, requestId);
        response.setHeader(HEADER, requestId);
        try {
            filterChain.doFilter(request, response);
        } finally {
            if (request.getRequestURI().startsWith("/api/")) {
                log.info("Handled method={} path={} status={} durationMs={}",
                        request.getMethod(),
                        request.getRequestURI(),
                        response.getStatus(),
                        (System.nanoTime() - startedNanos) / 1_000_000);
            }
            MDC.remove(MDC_KEY);
        }
    }

    static String incomingId(HttpServletRequest request) {
        for (String header : UPSTREAM_HEADERS) {
            String value = request.getHeader(header);
            if (value != null && SAFE_ID.matcher(value.trim()).matches()) {
                return value.trim();
            }
        }
        return UUID.randomUUID().toString().replace("-", "");
    }
}
