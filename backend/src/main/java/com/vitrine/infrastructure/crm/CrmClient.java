/*
 * Copyright (C) 2025 Vitrine Edge
 * SPDX-License-Identifier: AGPL-3.0-only
 */

package com.vitrine.infrastructure.crm;

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
import java.util.Map;

/**
 * Contact-card API of the sales CRM.
 */
@Component
public class CrmClient {
    private static final Logger log = LoggerFactory.getLogger(CrmClient.class);

    private final WebClient webClient;
    private final AppProperties.Crm config;
    private final ObjectMapper objectMapper;

    public CrmClient(@Qualifier("crmWebClient") WebClient webClient, AppProperties properties, ObjectMapper objectMapper) {
        this.webClient = webClient;
        this.config = properties.crm();
        this.objectMapper = objectMapper;
    }

    public boolean isConfigured() {
        return notBlank(config.apiUrl()) && notBlank(config.companyId())
                && notBlank(config.boardId()) && notBlank(config.columnId());
    }

    public DeliveryResult createContact(CrmContact contact) {
        Map<String, Object> payload = new LinkedHashMap<>();
        payload.put("company_id", config.companyId());
        payload.put("board_id", config.boardId());
        payload.put("column_id", config.columnId());
        payload.put("name", contact.name());
        payload.put("email", contact.email());
        payload.put("phone", contact.phone());
        payload.put("title", contact.name());
        if (contact.amountMinor() != null) payload.put("amount", contact.amountMinor());
        if (contact.note() != null) payload.put("obs", contact.note());
        payload.put("contact_tags", config.tags());

        UpstreamResponse response = UpstreamCalls.await(Upstream.CRM, webClient.post()
                .uri(config.apiUrl())
                .headers(h -> {
                    if (notBlank(config.apiKey())) h.set(HttpHeaders.AUTHORIZATION, "Bearer " + config.apiKey());
                })
                .contentType(MediaType.APPLICATION_JSON)
                .accept(MediaType.APPLICATION_JSON)
                .bodyValue(payload)
                .exchangeToMono(UpstreamResponses::read), config.timeout());

        int status = response.statusCode();
        if (response.is2xx()) {
            String id = readText(response.body(), "/contact/id");
            log.info("CRM contact created status={} contactId={}", status, id);
            return DeliveryResult.created(id, status);
        }
        if (status >= 500) {
            throw UpstreamException.httpStatus(Upstream.CRM, status, "crm returned HTTP " + status);
        }
        if (status == 409) {
            log.info("CRM contact already exists");
            return DeliveryResult.alreadyExists(readText(response.body(), "/existing_card/contact/id"), status);
        }
        log.warn("CRM rejected contact status={}", status);
        return DeliveryResult.rejected(status, status == 429 ? "rate limited" : "HTTP " + status);
    }

    private String readText(String body, String pointer) {
        if (body == null || body.isBlank()) return null;
        try {
            JsonNode node = objectMapper.readTree(body).at(pointer);
            return node.isMissingNode() || node.isNull() ? null : node.asText();
        } catch (JsonProcessingException e) {
            log.warn("CRM response is not JSON pointer={} message={}", pointer, e.getOriginalMessage());
            return null;
        }
    }

    private static boolean notBlank(String value) {
        return value != null && !value.isBlank();
    }
}
