/*
 * Copyright (C) 2025 Vitrine Edge
 * SPDX-License-Identifier: AGPL-3.0-only
 */

package com.vitrine.api;

import com.vitrine.application.ratelimit.RateLimitExceededException;
import com.vitrine.application.resilience.CircuitOpenException;
import com.vitrine.config.RequestIdFilter;
import com.vitrine.infrastructure.upstream.UpstreamException;
import jakarta.validation.ConstraintViolationException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.slf4j.MDC;
import org.springframework.http.HttpHeaders;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.http.converter.HttpMessageNotReadableException;
import org.springframework.web.bind.MethodArgumentNotValidException;
import org.springframework.web.bind.annotation.ExceptionHandler;
import org.springframework.web.bind.annotation.RestControllerAdvice;

@RestControllerAdvice
public class ApiExceptionHandler {

    private static final Logger log = LoggerFactory.getLogger(ApiExceptionHandler.class);

    @ExceptionHandler(ApiException.class)
    public ResponseEntity<ApiErrorResponse> handleApi(ApiException ex) {
        return respond(ex.getStatus(), ex.getCode(), ex.getMessage(), null);
    }

    @ExceptionHandler(IllegalArgumentException.class)
    public ResponseEntity<ApiErrorResponse> handleBadRequest(IllegalArgumentException ex) {
        return respond(HttpStatus.BAD_REQUEST, "BAD_REQUEST", ex.getMessage(), null);
    }

    @ExceptionHandler({MethodArgumentNotValidException.class, ConstraintViolationException.class})
    public ResponseEntity<ApiErrorResponse> handleValidation(Exception ex) {
        return respond(HttpStatus.BAD_REQUEST, "VALIDATION_ERROR", "Invalid request", null);
    }

    @ExceptionHandler(HttpMessageNotReadableException.class)
    public ResponseEntity<ApiErrorResponse> handleUnreadable(HttpMessageNotReadableException ex) {
        return respond(HttpStatus.BAD_REQUEST, "VALIDATION_ERROR", "Invalid JSON in request body", null);
    }

    @ExceptionHandler(RateLimitExceededException.class)
    public ResponseEntity<ApiErrorResponse> handleRateLimited(RateLimitExceededException ex) {
        HttpHeaders headers = RateLimitGuard.headersFor(ex.getDecision());
        return respond(HttpStatus.TOO_MANY_REQUESTS, "RATE_LIMITED", "Too many requests. Please try again later.", headers);
    }

    @ExceptionHandler(CircuitOpenException.class)
    public ResponseEntity<ApiErrorResponse> handleCircuitOpen(CircuitOpenException ex) {
        log.warn("Upstream unavailable requestId={} breaker={} retryAt={}", currentRequestId(), ex.getBreakerName(), ex.getRetryAt());
        return respond(HttpStatus.SERVICE_UNAVAILABLE, "UPSTREAM_UNAVAILABLE", "Service temporarily unavailable. Please try again.", null);
    }

    @ExceptionHandler(UpstreamException.class)
    public ResponseEntity<ApiErrorResponse> handleUpstream(UpstreamException ex) {
        log.warn("Upstream failure requestId={} upstream={} type={} status={}",
                currentRequestId(), ex.getUpstream(), ex.getType(), ex.getStatusCode());
        return respond(HttpStatus.BAD_GATEWAY, "UPSTREAM_ERROR", ex.getMessage(), null);
    }

    @ExceptionHandler(Exception.class)
    public ResponseEntity<ApiErrorResponse> handleAny(Exception ex) {
        log.error("Unhandled exception requestId={}", currentRequestId(), ex);
        return respond(HttpStatus.INTERNAL_SERVER_ERROR, "UNEXPECTED_ERROR", "Unexpected error", null);
    }

    private ResponseEntity<ApiErrorResponse> respond(HttpStatus status, String code, String message, HttpHeaders headers) {
        ApiErrorResponse body = new ApiErrorResponse(status.name(), code, message, currentRequestId());
        ResponseEntity.BodyBuilder builder = ResponseEntity.status(status);
        if (headers != null) builder.headers(headers);
        return builder.body(body);
    }

    private String currentRequestId() {
        String rid = MDC.get(RequestIdFilter.MDC_KEY);
        return (rid == null || rid.isBlank()) ? "" : rid;
    }
}
