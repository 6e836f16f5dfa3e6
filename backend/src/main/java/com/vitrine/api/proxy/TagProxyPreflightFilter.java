/*
 * Copyright (C) 2025 Vitrine Edge
 * SPDX-License-Identifier: AGPL-3.0-only
 */

package com.vitrine.api.proxy;

import com.vitrine.api.ClientKeyResolver;
import com.vitrine.application.proxy.TagProxyService;
import jakarta.servlet.FilterChain;
import jakarta.servlet.ServletException;
import jakarta.servlet.http.HttpServletRequest;
import jakarta.servlet.http.HttpServletResponse;
import org.springframework.core.Ordered;
import org.springframework.core.annotation.Order;
import org.springframework.http.HttpMethod;
import org.springframework.stereotype.Component;
import org.springframework.web.filter.OncePerRequestFilter;

import java.io.IOException;

/**
 * Answers every OPTIONS request on the tag proxy, browser preflights included, ahead of the
 * security chain and its CORS processing. The chain is not continued.
 */
@Component
@Order(Ordered.HIGHEST_PRECEDENCE + 10)
public class TagProxyPreflightFilter extends OncePerRequestFilter {
    private final TagProxyService tagProxyService;
    private final ClientKeyResolver clientKeyResolver;

    public TagProxyPreflightFilter(TagProxyService tagProxyService, ClientKeyResolver clientKeyResolver) {
        this.tagProxyService = tagProxyService;
        this.clientKeyResolver = clientKeyResolver;
    }

    @Override
    protected boolean shouldNotFilter(HttpServletRequest request) {
        return !HttpMethod.OPTIONS.matches(request.getMethod()) || !ProxyServletExchange.isProxyPath(request);
    }

    @Override
    protected void doFilterInternal(HttpServletRequest request, HttpServletResponse response, FilterChain filterChain)
            throws ServletException, IOException {
        ProxyServletExchange.write(
                tagProxyService.handle(ProxyServletExchange.toProxyRequest(request, clientKeyResolver.resolve(request))),
                response
        );
    }
}
