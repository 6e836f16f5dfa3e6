/*
 * Copyright (C) 2025 Vitrine Edge
 * SPDX-License-Identifier: AGPL-3.0-only
 */

package com.vitrine.infrastructure.upstream;

import com.vitrine.domain.model.Upstream;
import org.junit.jupiter.api.Test;
import org.springframework.http.HttpHeaders;
import org.springframework.web.reactive.function.client.WebClientResponseException;
import reactor.core.publisher.Mono;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.time.Duration;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertSame;
import static org.junit.jupiter.api.Assertions.assertThrows;

class UpstreamCallsTest {
    @Test
    void returnsValueWithinTimeout() {
        assertEquals("ok", UpstreamCalls.await(Upstream.CRM, Mono.just("ok"), Duration.ofSeconds(1)));
    }

    @Test
    void lateResultIsATimeout() {
        Mono<String> slow = Mono.delay(Duration.ofSeconds(5)).map(t -> "late");

        UpstreamException ex = assertThrows(UpstreamException.class,
                () -> UpstreamCalls.await(Upstream.CRM, slow, Duration.ofMillis(30)));

        assertEquals(UpstreamErrorType.TIMEOUT, ex.getType());
        assertEquals("crm timed out after 30ms", ex.getMessage());
    }

    @Test
    void errorStatusKeepsTheCode() {
        Mono<String> failing = Mono.error(WebClientResponseException.create(
                502, "Bad Gateway", HttpHeaders.EMPTY, new byte[0], StandardCharsets.UTF_8));

        UpstreamException ex = assertThrows(UpstreamException.class,
                () -> UpstreamCalls.await(Upstream.MAILERLITE, failing, Duration.ofSeconds(1)));

        assertEquals(UpstreamErrorType.HTTP_STATUS, ex.getType());
        assertEquals(502, ex.getStatusCode());
    }

    @Test
    void blockingCallPassesUpstreamExceptionThrough() {
        UpstreamException original = UpstreamException.httpStatus(Upstream.STRIPE, 500, "Stripe customer lookup failed");

        UpstreamException ex = assertThrows(UpstreamException.class, () -> UpstreamCalls.awaitBlocking(
                Upstream.STRIPE, () -> {
                    throw original;
                }, Duration.ofSeconds(1)));

        assertSame(original, ex);
    }

    @Test
    void blockingCheckedFailureIsUnknown() {
        UpstreamException ex = assertThrows(UpstreamException.class, () -> UpstreamCalls.awaitBlocking(
                Upstream.STRIPE, () -> {
                    throw new IOException("boom");
                }, Duration.ofSeconds(1)));

        assertEquals(UpstreamErrorType.UNKNOWN, ex.getType());
    }
}
