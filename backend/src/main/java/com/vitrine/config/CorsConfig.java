/*
 * Copyright (C) 2025 Vitrine Edge
 * SPDX-License-Identifier: AGPL-3.0-only
 */

package com.vitrine.config;

import jakarta.servlet.http.HttpServletRequest;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.web.cors.CorsConfiguration;
import org.springframework.web.cors.CorsConfigurationSource;
import org.springframework.web.cors.UrlBasedCorsConfigurationSource;

import java.net.URI;
import java.util.ArrayList;
import java.util.List;

@Configuration
public class CorsConfig {
    private static final String TAG_PROXY_PATH = "/api/gtm-proxy";

    private final AppProperties appProperties;

    public CorsConfig(AppProperties appProperties) {
        this.appProperties = appProperties;
    }

    @Bean
    public CorsConfigurationSource corsConfigurationSource() {
        UrlBasedCorsConfigurationSource api = new UrlBasedCorsConfigurationSource();
        api.registerCorsConfiguration("/api/**", apiCors());
        // the tag proxy sets its own CORS headers, preflights included
        return request -> isTagProxyPath(request) ? null : api.getCorsConfiguration(request);
    }

    private static boolean isTagProxyPath(HttpServletRequest request) {
        String path = request.getRequestURI().substring(request.getContextPath().length());
        return path.equals(TAG_PROXY_PATH) || path.startsWith(TAG_PROXY_PATH + "/");
    }

    private CorsConfiguration apiCors() {
        CorsConfiguration config = new CorsConfiguration();
        config.setAllowedOrigins(resolveAllowedOrigins(appProperties.frontend().baseUrl()));
        config.setAllowedMethods(List.of("GET", "POST", "OPTIONS"));
        config.setAllowedHeaders(List.of("Content-Type", "X-Idempotency-Key", "X-Request-Id"));
        config.setExposedHeaders(List.of(
                "X-Request-Id",
                "Retry-After",
                "X-RateLimit-Limit",
                "X-RateLimit-Remaining",
                "X-RateLimit-Window"
        ));
        config.setAllowCredentials(false);
        return config;
    }

    private static List<String> resolveAllowedOrigins(String frontendBaseUrl) {
        List<String> defaults = List.of("http://localhost:8080", "http://127.0.0.1:8080");
        if (frontendBaseUrl == null || frontendBaseUrl.isBlank()) return defaults;

        URI uri;
        try {
            uri = URI.create(frontendBaseUrl.trim());
        } catch (IllegalArgumentException e) {
            return defaults;
        }

        if (uri.getScheme() == null || uri.getHost() == null) return defaults;

        String portPart = uri.getPort() == -1 ? "" : ":" + uri.getPort();
        List<String> origins = new ArrayList<>();
        origins.add(uri.getScheme() + "://" + uri.getHost() + portPart);
        if (uri.getHost().startsWith("www.")) {
            origins.add(uri.getScheme() + "://" + uri.getHost().substring(4) + portPart);
        } else {
            origins.add(uri.getScheme() + "://www." + uri.getHost() + portPart);
        }
        return origins.stream().distinct().toList();
    }
}
