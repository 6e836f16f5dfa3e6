/*
 * Copyright (C) 2025 Vitrine Edge
 * SPDX-License-Identifier: AGPL-3.0-only
 */

package com.vitrine.application.proxy;

import com.vitrine.domain.model.Upstream;
import org.springframework.http.HttpHeaders;
import org.springframework.http.HttpMethod;

/**
 * @param body request body, {@code null} for GET
 */
public record OutboundTagRequest(
        Upstream upstream,
        HttpMethod method,
        String targetUrl,
        HttpHeaders headers,
        String body
) {}
