/*
 * Copyright (C) 2025 Vitrine Edge
 * SPDX-License-Identifier: AGPL-3.0-only
 */

package com.vitrine.infrastructure.crm;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.vitrine.infrastructure.upstream.DeliveryResult;
import com.vitrine.infrastructure.upstream.UpstreamException;
import com.vitrine.support.AppPropertiesFixtures;
import org.junit.jupiter.api.Test;
import org.springframework.http.HttpHeaders;
import org.springframework.http.HttpStatus;
import org.springframework.web.reactive.function.client.ClientRequest;
import org.springframework.web.reactive.function.client.ClientResponse;
import org.springframework.web.reactive.function.client.WebClient;
import reactor.core.publisher.Mono;

import java.net.URI;
import java.util.concurrent.atomic.AtomicReference;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

class CrmClientTest {
    private final AtomicReference<ClientRequest> lastRequest = new AtomicReference<>();

    @Test
    void createdContactReturnsItsId() {
        CrmClient client = respondingWith(HttpStatus.CREATED, "{\"contact\":{\"id\":4412}}");

        DeliveryResult result = client.createContact(contact());

        assertEquals(DeliveryResult.DeliveryStatus.CREATED, result.status());
        assertEquals("4412", result.reference());
        assertEquals(URI.create("https://crm.test/api/contact-card"), lastRequest.get().url());
        assertFalse(lastRequest.get().headers().containsKey(HttpHeaders.AUTHORIZATION));
    }

    @Test
    void conflictReportsExistingContact() {
        CrmClient client = respondingWith(HttpStatus.CONFLICT, "{\"existing_card\":{\"contact\":{\"id\":77}}}");

        DeliveryResult result = client.createContact(contact());

        assertEquals(DeliveryResult.DeliveryStatus.ALREADY_EXISTS, result.status());
        assertEquals("77", result.reference());
    }

    @Test
    void badGatewayIsThrown() {
        CrmClient client = respondingWith(HttpStatus.BAD_GATEWAY, "upstream down");

        UpstreamException ex = assertThrows(UpstreamException.class, () -> client.createContact(contact()));

        assertEquals(502, ex.getStatusCode());
    }

    @Test
    void configuredWhenBoardSettingsPresent() {
        assertTrue(respondingWith(HttpStatus.OK, "").isConfigured());
    }

    private CrmClient respondingWith(HttpStatus status, String body) {
        WebClient webClient = WebClient.builder()
                .exchangeFunction(request -> {
                    lastRequest.set(request);
                    return Mono.just(ClientResponse.create(status)
                            .header(HttpHeaders.CONTENT_TYPE, "application/json")
                            .body(body)
                            .build());
                })
                .build();
        return new CrmClient(webClient, AppPropertiesFixtures.defaults(), new ObjectMapper());
    }

    private static CrmContact contact() {
        return new CrmContact("Ana Silva", "ana@example.com", "+351 912 345 678", 18000L, "Lead ID: lead-1");
    }
}
