/*
 * Copyright (C) 2025 Vitrine Edge
 * SPDX-License-Identifier: AGPL-3.0-only
 */

package com.vitrine.infrastructure.upstream;

import com.vitrine.domain.model.Upstream;

/**
 * Failure of a real upstream call. Counted as a breaker failure and never retried here.
 */
public class UpstreamException extends RuntimeException {
    private final Upstream upstream;
    private final UpstreamErrorType type;
    private final Integer statusCode;
    private final UpstreamResponse response;

    public UpstreamException(Upstream upstream, UpstreamErrorType type, String safeMessage, Throwable cause) {
        this(upstream, type, null, null, safeMessage, cause);
    }

    public UpstreamException(Upstream upstream, UpstreamErrorType type, String safeMessage) {
        this(upstream, type, null, null, safeMessage, null);
    }

    public UpstreamException(Upstream upstream, UpstreamResponse response, String safeMessage) {
        this(upstream, UpstreamErrorType.HTTP_STATUS, response.statusCode(), response, safeMessage, null);
    }

    private UpstreamException(
            Upstream upstream,
            UpstreamErrorType type,
            Integer statusCode,
            UpstreamResponse response,
            String safeMessage,
            Throwable cause
    ) {
        super(safeMessage, cause);
        this.upstream = upstream;
        this.type = type;
        this.statusCode = statusCode;
        this.response = response;
    }

    public static UpstreamException httpStatus(Upstream upstream, int statusCode, String safeMessage) {
        return new UpstreamException(upstream, UpstreamErrorType.HTTP_STATUS, statusCode, null, safeMessage, null);
    }

    public Upstream getUpstream() {
        return upstream;
    }

    public UpstreamErrorType getType() {
        return type;
    }

    public Integer getStatusCode() {
        return statusCode;
    }

    /**
     * The upstream response when it was received but rejected (for relaying it verbatim).
     */
    public UpstreamResponse getResponse() {
        return response;
    }
}
