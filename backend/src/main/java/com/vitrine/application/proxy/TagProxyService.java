/*
 * Copyright (C) 2025 Vitrine Edge
 * SPDX-License-Identifier: AGPL-3.0-only
 */

package com.vitrine.application.proxy;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.vitrine.application.resilience.CircuitBreakerRegistry;
import com.vitrine.application.resilience.CircuitOpenException;
import com.vitrine.config.AppProperties;
import com.vitrine.domain.model.Upstream;
import com.vitrine.infrastructure.upstream.UpstreamException;
import com.vitrine.infrastructure.upstream.UpstreamResponse;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.http.HttpHeaders;
import org.springframework.http.HttpMethod;
import org.springframework.http.HttpStatus;
import org.springframework.http.MediaType;
import org.springframework.stereotype.Service;

import java.net.URI;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Relays tag requests to the production or the preview tag server.
 */
@Service
public class TagProxyService {
    private static final Logger log = LoggerFactory.getLogger(TagProxyService.class);

    public static final String ALLOWED_METHODS = "GET, POST, OPTIONS";
    public static final String ALLOWED_HEADERS = "Content-Type, X-Gtm-Server-Preview, User-Agent, Referer";
    static final String DEFAULT_PATH = "/g/collect";
    static final String PREFLIGHT_MAX_AGE = "86400";

    private static final List<String> FORWARDED_HEADERS = List.of(
            "user-agent",
            "accept",
            "accept-language",
            "referer",
            "cookie",
            "x-gtm-server-preview"
    );
    private static final List<String> RELAYED_RESPONSE_HEADERS = List.of("content-type", "cache-control");

    private final PreviewClassifier previewClassifier;
    private final TagServerClient tagServerClient;
    private final CircuitBreakerRegistry circuitBreakers;
    private final ObjectMapper objectMapper;
    private final String productionUrl;
    private final String previewUrl;
    private final boolean fallbackOnPreviewNotFound;
    private final String publicOrigin;
    private final String forwardedProto;
    private final String forwardedHost;

    public TagProxyService(
            PreviewClassifier previewClassifier,
            TagServerClient tagServerClient,
            CircuitBreakerRegistry circuitBreakers,
            ObjectMapper objectMapper,
            AppProperties properties
    ) {
        this.previewClassifier = previewClassifier;
        this.tagServerClient = tagServerClient;
        this.circuitBreakers = circuitBreakers;
        this.objectMapper = objectMapper;

        AppProperties.TagServer cfg = properties.tagServer();
        this.productionUrl = stripTrailingSlash(cfg.productionUrl());
        this.previewUrl = stripTrailingSlash(cfg.previewUrl());
        this.fallbackOnPreviewNotFound = cfg.fallbackOnPreviewNotFound();

        URI origin = URI.create(properties.publicOrigin().trim());
        if (origin.getScheme() == null || origin.getAuthority() == null) {
            throw new IllegalStateException("app.public-origin must be an absolute origin, got " + properties.publicOrigin());
        }
        this.publicOrigin = origin.getScheme() + "://" + origin.getAuthority();
        this.forwardedProto = origin.getScheme();
        this.forwardedHost = origin.getAuthority();
    }

    public ProxyResponse handle(ProxyRequest request) {
        if ("OPTIONS".equals(request.method())) {
            return preflight();
        }
        if (!"GET".equals(request.method()) && !"POST".equals(request.method())) {
            return methodNotAllowed();
        }

        boolean preview = previewClassifier.isPreview(request);
        HttpHeaders forwarded = buildForwardedHeaders(request);
        String body = "POST".equals(request.method()) ? request.body() : null;
        log.info("Tag proxy routing method={} mode={} path={}", request.method(), preview ? "preview" : "production", request.path());

        try {
            UpstreamResponse response = forward(request, preview, forwarded, body);
            if (preview && fallbackOnPreviewNotFound && response.statusCode() == HttpStatus.NOT_FOUND.value()) {
                log.info("Preview tag server returned 404, falling back to production path={}", request.path());
                response = forward(request, false, forwarded, body);
            }
            return relay(response);
        } catch (UpstreamException e) {
            if (e.getResponse() != null) {
                return relay(e.getResponse());
            }
            log.warn("Tag proxy upstream failure upstream={} type={}", e.getUpstream(), e.getType());
            return failure(e.getMessage());
        } catch (CircuitOpenException e) {
            log.warn("Tag proxy rejected, circuit open breaker={}", e.getBreakerName());
            return failure(e.getMessage());
        }
    }

    public String buildTargetUrl(String path, String query, boolean preview) {
        String base = preview ? previewUrl : productionUrl;
        String suffix = (path == null || path.isBlank() || "/".equals(path)) ? DEFAULT_PATH : path;
        if (!suffix.startsWith("/")) suffix = "/" + suffix;
        return (query == null || query.isEmpty()) ? base + suffix : base + suffix + "?" + query;
    }

    public HttpHeaders buildForwardedHeaders(ProxyRequest request) {
        HttpHeaders inbound = request.headers();
        HttpHeaders forwarded = new HttpHeaders();
        for (String name : FORWARDED_HEADERS) {
            List<String> values = inbound.get(name);
            if (values != null && !values.isEmpty()) {
                forwarded.put(name, values);
            }
        }
        if ("POST".equals(request.method()) && inbound.getContentType() != null) {
            forwarded.setContentType(inbound.getContentType());
        }
        if (request.clientIp() != null && !request.clientIp().isBlank()) {
            forwarded.set("X-Forwarded-For", request.clientIp());
        }
        forwarded.set(HttpHeaders.ORIGIN, publicOrigin);
        forwarded.set("X-Forwarded-Proto", forwardedProto);
        forwarded.set("X-Forwarded-Host", forwardedHost);
        return forwarded;
    }

    private UpstreamResponse forward(ProxyRequest request, boolean preview, HttpHeaders headers, String body) {
        Upstream upstream = preview ? Upstream.TAG_SERVER_PREVIEW : Upstream.TAG_SERVER;
        String targetUrl = buildTargetUrl(request.path(), request.query(), preview);
        OutboundTagRequest outbound = new OutboundTagRequest(upstream, HttpMethod.valueOf(request.method()), targetUrl, headers, body);

        return circuitBreakers.get(upstream).execute(() -> {
            UpstreamResponse response = tagServerClient.send(outbound);
            if (response.statusCode() >= 500) {
                throw new UpstreamException(upstream, response, "tag server returned HTTP " + response.statusCode());
            }
            return response;
        });
    }

    private ProxyResponse relay(UpstreamResponse response) {
        Map<String, String> headers = new LinkedHashMap<>();
        if (response.is2xx()) {
            for (String name : RELAYED_RESPONSE_HEADERS) {
                String value = response.header(name);
                if (value != null) headers.put(name, value);
            }
        } else {
            log.warn("Tag server error response status={} bodyLength={}", response.statusCode(), response.body().length());
        }
        headers.putAll(corsHeaders());
        return new ProxyResponse(response.statusCode(), headers, response.body());
    }

    private ProxyResponse preflight() {
        Map<String, String> headers = corsHeaders();
        headers.put("Access-Control-Max-Age", PREFLIGHT_MAX_AGE);
        return new ProxyResponse(HttpStatus.OK.value(), headers, "");
    }

    private ProxyResponse methodNotAllowed() {
        Map<String, String> headers = new LinkedHashMap<>();
        headers.put(HttpHeaders.ALLOW, ALLOWED_METHODS);
        headers.put(HttpHeaders.CONTENT_TYPE, MediaType.TEXT_PLAIN_VALUE);
        return new ProxyResponse(HttpStatus.METHOD_NOT_ALLOWED.value(), headers, "Method Not Allowed");
    }

    private ProxyResponse failure(String message) {
        Map<String, String> headers = new LinkedHashMap<>();
        headers.put(HttpHeaders.CONTENT_TYPE, MediaType.APPLICATION_JSON_VALUE);
        headers.put(HttpHeaders.ACCESS_CONTROL_ALLOW_ORIGIN, "*");
        try {
            String body = objectMapper.writeValueAsString(new ProxyError("Proxy request failed", message));
            return new ProxyResponse(HttpStatus.INTERNAL_SERVER_ERROR.value(), headers, body);
        } catch (JsonProcessingException e) {
            throw new IllegalStateException("proxy error body serialization failed", e);
        }
    }

    private static Map<String, String> corsHeaders() {
        Map<String, String> headers = new LinkedHashMap<>();
        headers.put(HttpHeaders.ACCESS_CONTROL_ALLOW_ORIGIN, "*");
        headers.put(HttpHeaders.ACCESS_CONTROL_ALLOW_METHODS, ALLOWED_METHODS);
        headers.put(HttpHeaders.ACCESS_CONTROL_ALLOW_HEADERS, ALLOWED_HEADERS);
        return headers;
    }

    private static String stripTrailingSlash(String url) {
        if (url == null || url.isBlank()) {
            throw new IllegalStateException("tag server url is not configured");
        }
        String trimmed = url.trim();
        return trimmed.endsWith("/") ? trimmed.substring(0, trimmed.length() - 1) : trimmed;
    }

    record ProxyError(String error, String message) {}
}
