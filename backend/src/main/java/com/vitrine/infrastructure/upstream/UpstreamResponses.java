/*
 * Copyright (C) 2025 Vitrine Edge
 * SPDX-License-Identifier: AGPL-3.0-only
 */

package com.vitrine.infrastructure.upstream;

import org.springframework.web.reactive.function.client.ClientResponse;
import reactor.core.publisher.Mono;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;

public final class UpstreamResponses {
    private UpstreamResponses() {}

    /**
     * Reads the whole body as text for every status, so non-2xx responses reach the caller instead of an error signal.
     */
    public static Mono<UpstreamResponse> read(ClientResponse response) {
        return response.bodyToMono(String.class)
                .defaultIfEmpty("")
                .map(body -> new UpstreamResponse(response.statusCode().value(), flatten(response), body));
    }

    private static Map<String, String> flatten(ClientResponse response) {
        Map<String, String> headers = new LinkedHashMap<>();
        for (Map.Entry<String, List<String>> e : response.headers().asHttpHeaders().entrySet()) {
            if (e.getValue() == null || e.getValue().isEmpty()) continue;
            headers.putIfAbsent(e.getKey().toLowerCase(Locale.ROOT), e.getValue().get(0));
        }
        return headers;
    }
}
