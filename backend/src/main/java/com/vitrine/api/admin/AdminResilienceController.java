/*
 * Copyright (C) 2025 Vitrine Edge
 * SPDX-License-Identifier: AGPL-3.0-only
 */

package com.vitrine.api.admin;

import com.vitrine.api.ApiException;
import com.vitrine.application.health.HealthReport;
import com.vitrine.application.health.HealthService;
import com.vitrine.application.resilience.CircuitBreaker;
import com.vitrine.application.resilience.CircuitBreakerRegistry;
import com.vitrine.application.resilience.CircuitBreakerSnapshot;
import com.vitrine.domain.model.Upstream;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.http.HttpStatus;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

@RestController
@RequestMapping("/api/admin/resilience")
public class AdminResilienceController {
    private static final Logger log = LoggerFactory.getLogger(AdminResilienceController.class);

    private final HealthService healthService;
    private final CircuitBreakerRegistry breakers;

    public AdminResilienceController(HealthService healthService, CircuitBreakerRegistry breakers) {
        this.healthService = healthService;
        this.breakers = breakers;
    }

    @GetMapping
    public HealthReport status() {
        return healthService.report();
    }

    @PostMapping("/breakers/{name}/reset")
    public CircuitBreakerSnapshot reset(@PathVariable("name") String name) {
        Upstream upstream = Upstream.fromBreakerName(name)
                .orElseThrow(() -> new ApiException(HttpStatus.NOT_FOUND, "Unknown circuit breaker: " + name));
        CircuitBreaker breaker = breakers.get(upstream);
        breaker.reset();
        log.info("Circuit breaker reset by operator breaker={}", breaker.name());
        return breaker.snapshot();
    }
}
