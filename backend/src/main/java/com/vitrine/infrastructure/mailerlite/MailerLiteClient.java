/*
 * Copyright (C) 2025 Vitrine Edge
 * SPDX-License-Identifier: AGPL-3.0-only
 */

package com.vitrine.infrastructure.mailerlite;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.vitrine.config.AppProperties;
import com.vitrine.domain.model.Upstream;
import com.vitrine.infrastructure.upstream.DeliveryResult;
import com.vitrine.infrastructure.upstream.UpstreamCalls;
import com.vitrine.infrastructure.upstream.UpstreamException;
import com.vitrine.infrastructure.upstream.UpstreamResponse;
import com.vitrine.infrastructure.upstream.UpstreamResponses;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.http.HttpHeaders;
import org.springframework.http.MediaType;
import org.springframework.stereotype.Component;
import org.springframework.web.reactive.function.client.WebClient;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

@Component
public class MailerLiteClient {
    private static final Logger log = LoggerFactory.getLogger(MailerLiteClient.class);

    static final String SUBSCRIBERS_PATH = "/api/subscribers";

    private final WebClient webClient;
    private final AppProperties.MailerLite config;
    private final ObjectMapper objectMapper;

    public MailerLiteClient(
            @Qualifier("mailerLiteWebClient") WebClient webClient,
            AppProperties properties,
            ObjectMapper objectMapper
    ) {
        this.webClient = webClient;
        this.config = properties.mailerlite();
        this.objectMapper = objectMapper;
    }

    public boolean isConfigured() {
        return config.apiKey() != null && !config.apiKey().isBlank();
    }

    /**
     * Creates or upserts a subscriber. 5xx answers are thrown so the breaker counts them;
     * 4xx answers are returned as rejections.
     */
    public DeliveryResult subscribe(MailerLiteSubscriber subscriber) {
        Map<String, Object> payload = new LinkedHashMap<>();
        payload.put("email", subscriber.email());
        payload.put("fields", subscriber.fields());
        if (config.groupId() != null && !config.groupId().isBlank()) {
            payload.put("groups", List.of(config.groupId()));
        }
        if (subscriber.ipAddress() != null) {
            payload.put("ip_address", subscriber.ipAddress());
        }

        UpstreamResponse response = UpstreamCalls.await(Upstream.MAILERLITE, webClient.post()
                .uri(SUBSCRIBERS_PATH)
                .header(HttpHeaders.AUTHORIZATION, "Bearer " + config.apiKey())
                .contentType(MediaType.APPLICATION_JSON)
                .accept(MediaType.APPLICATION_JSON)
                .bodyValue(payload)
                .exchangeToMono(UpstreamResponses::read), config.timeout());

        int status = response.statusCode();
        if (response.is2xx()) {
            String id = readText(response.body(), "/data/id");
            log.info("MailerLite subscriber stored status={} subscriberId={}", status, id);
            return DeliveryResult.created(id, status);
        }
        if (status >= 500) {
            throw UpstreamException.httpStatus(Upstream.MAILERLITE, status, "mailerlite returned HTTP " + status);
        }
        if (status == 422 && response.body().contains("already exists")) {
            log.info("MailerLite subscriber already exists");
            return DeliveryResult.alreadyExists(null, status);
        }
        log.warn("MailerLite rejected subscriber status={}", status);
        return DeliveryResult.rejected(status, rejectionReason(status));
    }

    private String readText(String body, String pointer) {
        if (body == null || body.isBlank()) return null;
        try {
            JsonNode node = objectMapper.readTree(body).at(pointer);
            return node.isMissingNode() || node.isNull() ? null : node.asText();
        } catch (JsonProcessingException e) {
            log.warn("MailerLite response is not JSON pointer={} message={}", pointer, e.getOriginalMessage());
            return null;
        }
    }

    private static String rejectionReason(int status) {
        return switch (status) {
            case 400 -> "bad request";
            case 401, 403 -> "authentication failed";
            case 422 -> "validation failed";
            case 429 -> "rate limited";
            default -> "HTTP " + status;
        };
    }
}
