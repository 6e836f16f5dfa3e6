/*
 * Copyright (C) 2025 Vitrine Edge
 * SPDX-License-Identifier: AGPL-3.0-only
 */

package com.vitrine.infrastructure.tagserver;

import com.vitrine.application.proxy.OutboundTagRequest;
import com.vitrine.application.proxy.TagServerClient;
import com.vitrine.config.AppProperties;
import com.vitrine.infrastructure.upstream.UpstreamCalls;
import com.vitrine.infrastructure.upstream.UpstreamErrorType;
import com.vitrine.infrastructure.upstream.UpstreamException;
import com.vitrine.infrastructure.upstream.UpstreamResponse;
import com.vitrine.infrastructure.upstream.UpstreamResponses;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.stereotype.Component;
import org.springframework.web.reactive.function.client.WebClient;
import reactor.core.publisher.Mono;

import java.net.URI;
import java.time.Duration;

@Component
public class WebClientTagServerClient implements TagServerClient {
    private final WebClient webClient;
    private final Duration timeout;

    public WebClientTagServerClient(@Qualifier("tagServerWebClient") WebClient webClient, AppProperties properties) {
        this.webClient = webClient;
        this.timeout = properties.tagServer().timeout();
    }

    @Override
    public UpstreamResponse send(OutboundTagRequest request) {
        URI target;
        try {
            target = URI.create(request.targetUrl());
        } catch (IllegalArgumentException e) {
            throw new UpstreamException(request.upstream(), UpstreamErrorType.UNKNOWN, "Invalid tag server target URL", e);
        }

        WebClient.RequestBodySpec spec = webClient.method(request.method())
                .uri(target)
                .headers(h -> h.addAll(request.headers()));
        WebClient.RequestHeadersSpec<?> ready = request.body() == null ? spec : spec.bodyValue(request.body());

        Mono<UpstreamResponse> call = ready.exchangeToMono(UpstreamResponses::read);
        return UpstreamCalls.await(request.upstream(), call, timeout);
    }
}
