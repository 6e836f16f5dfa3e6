/*
 * Copyright (C) 2025 Vitrine Edge
 * SPDX-License-Identifier: AGPL-3.0-only
 */

package com.vitrine.infrastructure.mailerlite;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.vitrine.infrastructure.upstream.DeliveryResult;
import com.vitrine.infrastructure.upstream.UpstreamException;
import com.vitrine.support.AppPropertiesFixtures;
import org.junit.jupiter.api.Test;
import org.springframework.http.HttpHeaders;
import org.springframework.http.HttpMethod;
import org.springframework.http.HttpStatus;
import org.springframework.web.reactive.function.client.ClientRequest;
import org.springframework.web.reactive.function.client.ClientResponse;
import org.springframework.web.reactive.function.client.WebClient;
import reactor.core.publisher.Mono;

import java.net.URI;
import java.util.Map;
import java.util.concurrent.atomic.AtomicReference;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertNull;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

class MailerLiteClientTest {
    private final AtomicReference<ClientRequest> lastRequest = new AtomicReference<>();

    @Test
    void createdSubscriberReturnsItsId() {
        MailerLiteClient client = respondingWith(HttpStatus.CREATED, "{\"data\":{\"id\":\"98765\",\"email\":\"ana@example.com\"}}");

        DeliveryResult result = client.subscribe(subscriber());

        assertEquals(DeliveryResult.DeliveryStatus.CREATED, result.status());
        assertEquals("98765", result.reference());
        assertEquals(HttpMethod.POST, lastRequest.get().method());
        assertEquals(URI.create("https://mailerlite.test/api/subscribers"), lastRequest.get().url());
        assertEquals("Bearer ml-key", lastRequest.get().headers().getFirst(HttpHeaders.AUTHORIZATION));
    }

    @Test
    void existingSubscriberIsNotAnError() {
        MailerLiteClient client = respondingWith(HttpStatus.UNPROCESSABLE_ENTITY,
                "{\"message\":\"The email already exists.\"}");

        DeliveryResult result = client.subscribe(subscriber());

        assertEquals(DeliveryResult.DeliveryStatus.ALREADY_EXISTS, result.status());
        assertNull(result.reference());
    }

    @Test
    void clientErrorIsRejected() {
        MailerLiteClient client = respondingWith(HttpStatus.UNAUTHORIZED, "{\"message\":\"Unauthenticated.\"}");

        DeliveryResult result = client.subscribe(subscriber());

        assertEquals(DeliveryResult.DeliveryStatus.REJECTED, result.status());
        assertEquals("authentication failed", result.reason());
    }

    @Test
    void serverErrorIsThrown() {
        MailerLiteClient client = respondingWith(HttpStatus.SERVICE_UNAVAILABLE, "");

        UpstreamException ex = assertThrows(UpstreamException.class, () -> client.subscribe(subscriber()));

        assertEquals(503, ex.getStatusCode());
    }

    @Test
    void configuredOnlyWithApiKey() {
        assertTrue(respondingWith(HttpStatus.OK, "").isConfigured());
    }

    private MailerLiteClient respondingWith(HttpStatus status, String body) {
        WebClient webClient = WebClient.builder()
                .baseUrl("https://mailerlite.test")
                .exchangeFunction(request -> {
                    lastRequest.set(request);
                    return Mono.just(ClientResponse.create(status)
                            .header(HttpHeaders.CONTENT_TYPE, "application/json")
                            .body(body)
                            .build());
                })
                .build();
        return new MailerLiteClient(webClient, AppPropertiesFixtures.defaults(), new ObjectMapper());
    }

    private static MailerLiteSubscriber subscriber() {
        return new MailerLiteSubscriber("ana@example.com", Map.of("name", "Ana Silva"), "198.51.100.7");
    }
}
