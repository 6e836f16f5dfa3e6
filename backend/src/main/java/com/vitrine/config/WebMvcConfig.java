/*
 * Copyright (C) 2025 Vitrine Edge
 * SPDX-License-Identifier: AGPL-3.0-only
 */

package com.vitrine.config;

import com.vitrine.api.RateLimitGuard;
import com.vitrine.api.RateLimitInterceptor;
import com.vitrine.application.ratelimit.RateLimiter;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.context.annotation.Configuration;
import org.springframework.web.servlet.config.annotation.InterceptorRegistry;
import org.springframework.web.servlet.config.annotation.WebMvcConfigurer;

@Configuration
public class WebMvcConfig implements WebMvcConfigurer {
    private final RateLimitGuard rateLimitGuard;
    private final RateLimiter leadRateLimiter;
    private final RateLimiter paymentIntentRateLimiter;

    public WebMvcConfig(
            RateLimitGuard rateLimitGuard,
            @Qualifier(ResilienceConfig.LEAD_LIMITER) RateLimiter leadRateLimiter,
            @Qualifier(ResilienceConfig.PAYMENT_INTENT_LIMITER) RateLimiter paymentIntentRateLimiter
    ) {
        this.rateLimitGuard = rateLimitGuard;
        this.leadRateLimiter = leadRateLimiter;
        this.paymentIntentRateLimiter = paymentIntentRateLimiter;
    }

    @Override
    public void addInterceptors(InterceptorRegistry registry) {
        registry.addInterceptor(new RateLimitInterceptor(rateLimitGuard, leadRateLimiter))
                .addPathPatterns("/api/leads");
        registry.addInterceptor(new RateLimitInterceptor(rateLimitGuard, paymentIntentRateLimiter))
                .addPathPatterns("/api/payment-intents");
    }
}
