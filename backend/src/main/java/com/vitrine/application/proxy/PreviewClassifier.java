/*
 * Copyright (C) 2025 Vitrine Edge
 * SPDX-License-Identifier: AGPL-3.0-only
 */

package com.vitrine.application.proxy;

import org.springframework.stereotype.Component;
import org.springframework.util.MultiValueMap;
import org.springframework.web.util.UriComponentsBuilder;

/**
 * Decides whether a tag request belongs to a tag-manager preview session.
 *
 * <p>Any single signal is enough: the debug query parameters only appear on the first hit of a
 * session, so later hits are recognized by the preview header or the preview cookies.
 */
@Component
public class PreviewClassifier {
    public static final String PREVIEW_HEADER = "X-Gtm-Server-Preview";
    static final String DEBUG_PARAM = "gtm_debug";
    static final String SHORT_DEBUG_PARAM = "_dbg";
    static final String AUTH_COOKIE_MARKER = "gtm_auth=";
    static final String PREVIEW_COOKIE_MARKER = "gtm_preview=";

    public boolean isPreview(ProxyRequest request) {
        return hasDebugParam(request.query())
                || request.headers().containsKey(PREVIEW_HEADER)
                || hasPreviewCookie(request.headers().getFirst("Cookie"));
    }

    boolean hasDebugParam(String query) {
        if (query == null || query.isBlank()) return false;
        MultiValueMap<String, String> params = UriComponentsBuilder.newInstance().query(query).build().getQueryParams();
        return params.containsKey(DEBUG_PARAM) || params.containsKey(SHORT_DEBUG_PARAM);
    }

    boolean hasPreviewCookie(String cookieHeader) {
        if (cookieHeader == null || cookieHeader.isEmpty()) return false;
        return cookieHeader.contains(AUTH_COOKIE_MARKER) || cookieHeader.contains(PREVIEW_COOKIE_MARKER);
    }
}
