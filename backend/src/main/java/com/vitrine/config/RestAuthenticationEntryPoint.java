/*
 * Copyright (C) 2025 Vitrine Edge
 * SPDX-License-Identifier: AGPL-3.0-only
 */

package com.vitrine.config;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.vitrine.api.ApiErrorResponse;
import jakarta.servlet.http.HttpServletRequest;
import jakarta.servlet.http.HttpServletResponse;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.slf4j.MDC;
import org.springframework.http.HttpHeaders;
import org.springframework.http.HttpStatus;
import org.springframework.http.MediaType;
import org.springframework.security.core.AuthenticationException;
import org.springframework.security.web.AuthenticationEntryPoint;
import org.springframework.stereotype.Component;

import java.io.IOException;

/**
 * JSON 401 for anything Spring Security turns away; the only protected surface is the operator API.
 */
@Component
public class RestAuthenticationEntryPoint implements AuthenticationEntryPoint {
    private static final Logger log = LoggerFactory.getLogger(RestAuthenticationEntryPoint.class);

    private final ObjectMapper objectMapper;

    public RestAuthenticationEntryPoint(ObjectMapper objectMapper) {
        this.objectMapper = objectMapper;
    }

    @Override
    public void commence(
            HttpServletRequest request,
            HttpServletResponse response,
            AuthenticationException authException
    ) throws IOException {
        boolean operatorPath = request.getRequestURI().startsWith("/api/admin");
        String requestId = MDC.get(RequestIdFilter.MDC_KEY);
        log.warn("Unauthenticated request path={} operatorPath={}", request.getRequestURI(), operatorPath);

        ApiErrorResponse body = new ApiErrorResponse(
                HttpStatus.UNAUTHORIZED.name(),
                "UNAUTHORIZED",
                operatorPath ? "Send a valid " + AdminApiKeyAuthenticationFilter.HEADER + " header" : "Authentication required",
                requestId == null ? "" : requestId
        );
        response.setStatus(HttpStatus.UNAUTHORIZED.value());
        response.setHeader(HttpHeaders.CACHE_CONTROL, "no-store");
        response.setContentType(MediaType.APPLICATION_JSON_VALUE);
        objectMapper.writeValue(response.getOutputStream(), body);
    }
}
