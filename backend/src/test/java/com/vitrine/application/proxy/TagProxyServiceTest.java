/*
 * Copyright (C) 2025 Vitrine Edge
 * SPDX-License-Identifier: AGPL-3.0-only
 */

package com.vitrine.application.proxy;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.vitrine.application.resilience.CircuitBreakerRegistry;
import com.vitrine.domain.model.CircuitState;
import com.vitrine.domain.model.Upstream;
import com.vitrine.infrastructure.upstream.UpstreamErrorType;
import com.vitrine.infrastructure.upstream.UpstreamException;
import com.vitrine.infrastructure.upstream.UpstreamResponse;
import com.vitrine.support.AppPropertiesFixtures;
import com.vitrine.support.MutableClock;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.ArgumentCaptor;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import org.springframework.http.HttpHeaders;
import org.springframework.http.HttpMethod;

import java.time.Duration;
import java.util.List;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertNull;
import static org.junit.jupiter.api.Assertions.assertTrue;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.times;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.verifyNoInteractions;
import static org.mockito.Mockito.when;

@ExtendWith(MockitoExtension.class)
class TagProxyServiceTest {
    @Mock
    private TagServerClient tagServerClient;

    private final ObjectMapper objectMapper = new ObjectMapper();
    private CircuitBreakerRegistry breakers;
    private TagProxyService service;

    @BeforeEach
    void setUp() {
        breakers = new CircuitBreakerRegistry(2, Duration.ofSeconds(60), MutableClock.startingAt("2025-01-01T00:00:00Z"));
        service = new TagProxyService(new PreviewClassifier(), tagServerClient, breakers, objectMapper, AppPropertiesFixtures.defaults());
    }

    @Test
    void optionsAnswersPreflightWithoutUpstreamCall() {
        ProxyResponse res = service.handle(request("OPTIONS", "/g/collect", null, new HttpHeaders(), null));

        assertEquals(200, res.status());
        assertEquals("", res.body());
        assertEquals("*", res.headers().get(HttpHeaders.ACCESS_CONTROL_ALLOW_ORIGIN));
        assertEquals("GET, POST, OPTIONS", res.headers().get(HttpHeaders.ACCESS_CONTROL_ALLOW_METHODS));
        assertEquals("Content-Type, X-Gtm-Server-Preview, User-Agent, Referer",
                res.headers().get(HttpHeaders.ACCESS_CONTROL_ALLOW_HEADERS));
        assertEquals("86400", res.headers().get("Access-Control-Max-Age"));
        verifyNoInteractions(tagServerClient);
    }

    @Test
    void unsupportedMethodIsRejected() {
        ProxyResponse res = service.handle(request("DELETE", "/g/collect", null, new HttpHeaders(), null));

        assertEquals(405, res.status());
        assertEquals("GET, POST, OPTIONS", res.headers().get(HttpHeaders.ALLOW));
        verifyNoInteractions(tagServerClient);
    }

    @Test
    void productionRequestKeepsQueryAndForwardsAllowListedHeaders() {
        when(tagServerClient.send(any())).thenReturn(ok());
        HttpHeaders headers = new HttpHeaders();
        headers.set("User-Agent", "Mozilla/5.0");
        headers.set("Accept-Language", "pt-PT");
        headers.set("Authorization", "Bearer secret");
        headers.set("X-Custom", "nope");

        service.handle(request("GET", "/g/collect", "v=2&tid=G-ABC&en=page_view", headers, null));

        OutboundTagRequest sent = captureSent();
        assertEquals(Upstream.TAG_SERVER, sent.upstream());
        assertEquals(HttpMethod.GET, sent.method());
        assertEquals("https://tags.test/g/collect?v=2&tid=G-ABC&en=page_view", sent.targetUrl());
        assertNull(sent.body());

        HttpHeaders forwarded = sent.headers();
        assertEquals("Mozilla/5.0", forwarded.getFirst("user-agent"));
        assertEquals("pt-PT", forwarded.getFirst("accept-language"));
        assertFalse(forwarded.containsKey("Authorization"));
        assertFalse(forwarded.containsKey("X-Custom"));
        assertEquals("https://shop.test", forwarded.getOrigin());
        assertEquals("https", forwarded.getFirst("X-Forwarded-Proto"));
        assertEquals("shop.test", forwarded.getFirst("X-Forwarded-Host"));
        assertEquals("203.0.113.9", forwarded.getFirst("X-Forwarded-For"));
    }

    @Test
    void previewPostGoesToPreviewHostWithBody() {
        when(tagServerClient.send(any())).thenReturn(ok());
        HttpHeaders headers = new HttpHeaders();
        headers.set("X-Gtm-Server-Preview", "token");
        headers.set("Content-Type", "text/plain;charset=UTF-8");

        service.handle(request("POST", "/g/collect", "v=2", headers, "en=purchase"));

        OutboundTagRequest sent = captureSent();
        assertEquals(Upstream.TAG_SERVER_PREVIEW, sent.upstream());
        assertEquals("https://tags-preview.test/g/collect?v=2", sent.targetUrl());
        assertEquals("en=purchase", sent.body());
        assertEquals("token", sent.headers().getFirst("x-gtm-server-preview"));
        assertEquals("text/plain;charset=UTF-8", sent.headers().getFirst(HttpHeaders.CONTENT_TYPE));
    }

    @Test
    void emptyPathDefaultsToCollectEndpoint() {
        assertEquals("https://tags.test/g/collect", service.buildTargetUrl("", null, false));
        assertEquals("https://tags-preview.test/gtm.js?id=GTM-1", service.buildTargetUrl("/gtm.js", "id=GTM-1", true));
    }

    @Test
    void successRelaysOnlyContentTypeAndCacheControl() {
        when(tagServerClient.send(any())).thenReturn(new UpstreamResponse(200, Map.of(
                "content-type", "image/gif",
                "cache-control", "no-store",
                "set-cookie", "FPID=1"
        ), "GIF89a"));

        ProxyResponse res = service.handle(request("GET", "/g/collect", "v=2", new HttpHeaders(), null));

        assertEquals(200, res.status());
        assertEquals("GIF89a", res.body());
        assertEquals("image/gif", res.headers().get("content-type"));
        assertEquals("no-store", res.headers().get("cache-control"));
        assertFalse(res.headers().containsKey("set-cookie"));
        assertEquals("*", res.headers().get(HttpHeaders.ACCESS_CONTROL_ALLOW_ORIGIN));
    }

    @Test
    void clientErrorIsRelayedVerbatimWithoutCountingAsFailure() {
        when(tagServerClient.send(any())).thenReturn(new UpstreamResponse(400, Map.of("content-type", "text/plain"), "bad hit"));

        ProxyResponse res = service.handle(request("GET", "/g/collect", "v=2", new HttpHeaders(), null));

        assertEquals(400, res.status());
        assertEquals("bad hit", res.body());
        assertEquals("*", res.headers().get(HttpHeaders.ACCESS_CONTROL_ALLOW_ORIGIN));
        assertEquals(0, breakers.get(Upstream.TAG_SERVER).snapshot().failureCount());
    }

    @Test
    void serverErrorIsRelayedAndCountedAsFailure() {
        when(tagServerClient.send(any())).thenReturn(new UpstreamResponse(503, Map.of(), "unavailable"));

        ProxyResponse res = service.handle(request("GET", "/g/collect", "v=2", new HttpHeaders(), null));

        assertEquals(503, res.status());
        assertEquals("unavailable", res.body());
        assertEquals(1, breakers.get(Upstream.TAG_SERVER).snapshot().failureCount());
    }

    @Test
    void transportFailureBecomesJsonError() throws Exception {
        when(tagServerClient.send(any())).thenThrow(
                new UpstreamException(Upstream.TAG_SERVER, UpstreamErrorType.TIMEOUT, "tag-server timed out after 2000ms"));

        ProxyResponse res = service.handle(request("GET", "/g/collect", "v=2", new HttpHeaders(), null));

        assertEquals(500, res.status());
        assertEquals("application/json", res.headers().get(HttpHeaders.CONTENT_TYPE));
        JsonNode body = objectMapper.readTree(res.body());
        assertEquals("Proxy request failed", body.get("error").asText());
        assertEquals("tag-server timed out after 2000ms", body.get("message").asText());
    }

    @Test
    void openCircuitShortCircuitsToJsonError() throws Exception {
        when(tagServerClient.send(any())).thenThrow(
                new UpstreamException(Upstream.TAG_SERVER, UpstreamErrorType.NETWORK, "tag-server request failed"));
        service.handle(request("GET", "/g/collect", "v=2", new HttpHeaders(), null));
        service.handle(request("GET", "/g/collect", "v=2", new HttpHeaders(), null));
        assertEquals(CircuitState.OPEN, breakers.get(Upstream.TAG_SERVER).state());

        ProxyResponse res = service.handle(request("GET", "/g/collect", "v=2", new HttpHeaders(), null));

        assertEquals(500, res.status());
        assertTrue(objectMapper.readTree(res.body()).get("message").asText().contains("OPEN"));
        verify(tagServerClient, times(2)).send(any());
    }

    @Test
    void previewNotFoundFallsBackToProduction() {
        when(tagServerClient.send(any())).thenReturn(
                new UpstreamResponse(404, Map.of(), "no preview"),
                ok()
        );

        ProxyResponse res = service.handle(request("GET", "/g/collect", "v=2&gtm_debug=1", new HttpHeaders(), null));

        assertEquals(200, res.status());
        ArgumentCaptor<OutboundTagRequest> captor = ArgumentCaptor.forClass(OutboundTagRequest.class);
        verify(tagServerClient, times(2)).send(captor.capture());
        List<OutboundTagRequest> sent = captor.getAllValues();
        assertEquals("https://tags-preview.test/g/collect?v=2&gtm_debug=1", sent.get(0).targetUrl());
        assertEquals("https://tags.test/g/collect?v=2&gtm_debug=1", sent.get(1).targetUrl());
        assertEquals(Upstream.TAG_SERVER, sent.get(1).upstream());
    }

    private OutboundTagRequest captureSent() {
        ArgumentCaptor<OutboundTagRequest> captor = ArgumentCaptor.forClass(OutboundTagRequest.class);
        verify(tagServerClient).send(captor.capture());
        return captor.getValue();
    }

    private static UpstreamResponse ok() {
        return new UpstreamResponse(200, Map.of("content-type", "text/plain"), "ok");
    }

    private static ProxyRequest request(String method, String path, String query, HttpHeaders headers, String body) {
        return new ProxyRequest(method, path, query, headers, body, "203.0.113.9");
    }
}
