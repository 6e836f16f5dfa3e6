/*
 * Copyright (C) 2025 Vitrine Edge
 * SPDX-License-Identifier: AGPL-3.0-only
 */

package com.vitrine.api.proxy;

import com.vitrine.api.ClientKeyResolver;
import com.vitrine.application.proxy.ProxyRequest;
import com.vitrine.application.proxy.TagProxyService;
import jakarta.servlet.http.HttpServletRequest;
import jakarta.servlet.http.HttpServletResponse;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestMethod;
import org.springframework.web.bind.annotation.RestController;

import java.io.IOException;

/**
 * Writes straight to the servlet response so the relayed headers are set exactly once.
 */
@RestController
public class TagProxyController {
    static final String MOUNT_PATH = ProxyServletExchange.MOUNT_PATH;

    private final TagProxyService tagProxyService;
    private final ClientKeyResolver clientKeyResolver;

    public TagProxyController(TagProxyService tagProxyService, ClientKeyResolver clientKeyResolver) {
        this.tagProxyService = tagProxyService;
        this.clientKeyResolver = clientKeyResolver;
    }

    // OPTIONS never gets here, see TagProxyPreflightFilter
    @RequestMapping(
            value = {MOUNT_PATH, MOUNT_PATH + "/**"},
            method = {
                    RequestMethod.GET,
                    RequestMethod.POST,
                    RequestMethod.PUT,
                    RequestMethod.PATCH,
                    RequestMethod.DELETE,
                    RequestMethod.HEAD
            }
    )
    public void proxy(HttpServletRequest request, HttpServletResponse response) throws IOException {
        ProxyRequest proxyRequest = ProxyServletExchange.toProxyRequest(request, clientKeyResolver.resolve(request));
        ProxyServletExchange.write(tagProxyService.handle(proxyRequest), response);
    }
}
