/*
 * Copyright (C) 2025 Vitrine Edge
 * SPDX-License-Identifier: AGPL-3.0-only
 */

package com.vitrine.application.checkout;

import com.stripe.model.Customer;
import com.stripe.model.PaymentIntent;
import com.vitrine.api.ApiException;
import com.vitrine.application.cache.CustomerCache;
import com.vitrine.application.resilience.CircuitBreaker;
import com.vitrine.application.resilience.CircuitBreakerRegistry;
import com.vitrine.config.AppProperties;
import com.vitrine.domain.model.Upstream;
import com.vitrine.infrastructure.stripe.CustomerDetails;
import com.vitrine.infrastructure.stripe.PaymentIntentDetails;
import com.vitrine.infrastructure.stripe.StripeGateway;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.http.HttpStatus;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.UUID;

@Service
public class CheckoutService {
    private static final Logger log = LoggerFactory.getLogger(CheckoutService.class);

    static final int METADATA_VALUE_MAX = 255;

    private final StripeCustomerService customers;
    private final StripeGateway stripe;
    private final CircuitBreaker breaker;
    private final CustomerCache customerCache;
    private final AppProperties.Checkout config;
    private final Clock clock;

    public CheckoutService(
            StripeCustomerService customers,
            StripeGateway stripe,
            CircuitBreakerRegistry breakers,
            CustomerCache customerCache,
            AppProperties properties,
            Clock clock
    ) {
        this.customers = customers;
        this.stripe = stripe;
        this.breaker = breakers.get(Upstream.STRIPE);
        this.customerCache = customerCache;
        this.config = properties.checkout();
        this.clock = clock;
    }

    public CheckoutResult createPaymentIntent(CheckoutCommand command) {
        String currency = resolveCurrency(command.currency());
        long amount = command.amountMinor() == null ? config.defaultAmountMinor() : command.amountMinor();
        String idempotencyKey = command.idempotencyKey() == null || command.idempotencyKey().isBlank()
                ? "pi_" + clock.millis() + "_" + UUID.randomUUID().toString().substring(0, 8)
                : command.idempotencyKey().trim();
        String email = command.email().trim().toLowerCase(Locale.ROOT);
        String name = command.fullName().trim();
        String phone = command.phone().trim();
        String now = clock.instant().toString();

        Map<String, String> customerMetadata = new LinkedHashMap<>();
        customerMetadata.put("lead_id", command.leadId());
        customerMetadata.put("source", config.source());
        customerMetadata.put("updated_at", now);
        CustomerResolution resolution = customers.resolve(new CustomerDetails(email, name, phone, customerMetadata));
        Customer customer = resolution.customer();

        Map<String, String> metadata = new LinkedHashMap<>();
        metadata.put("lead_id", command.leadId());
        metadata.put("customer_name", name);
        metadata.put("customer_email", email);
        metadata.put("customer_phone", phone);
        metadata.put("event_name", config.eventName());
        metadata.put("created_at", now);
        metadata.put("idempotency_key", idempotencyKey);
        command.utm().forEach((k, v) -> {
            if (v != null && !v.isBlank()) metadata.put(k, truncate(v.trim()));
        });

        PaymentIntentDetails details = new PaymentIntentDetails(
                amount,
                currency,
                customer.getId(),
                email,
                config.eventName() + ": " + name,
                metadata,
                idempotencyKey
        );
        PaymentIntent intent = breaker.execute(() -> stripe.createPaymentIntent(details));

        log.info("Created PaymentIntent paymentIntentId={} customerId={} cacheHit={} cacheSize={}",
                intent.getId(), customer.getId(), resolution.cacheHit(), customerCache.stats().size());

        return new CheckoutResult(
                intent.getClientSecret(),
                intent.getId(),
                customer.getId(),
                amount,
                currency,
                idempotencyKey,
                resolution.cacheHit()
        );
    }

    private String resolveCurrency(String requested) {
        List<String> allowed = config.currencies();
        if (requested == null || requested.isBlank()) {
            return allowed.get(0);
        }
        String cur = requested.trim().toLowerCase(Locale.ROOT);
        if (!allowed.contains(cur)) {
            throw new ApiException(HttpStatus.BAD_REQUEST, "VALIDATION_ERROR", "Currency must be one of: " + String.join(", ", allowed));
        }
        return cur;
    }

    private static String truncate(String value) {
        return value.length() <= METADATA_VALUE_MAX ? value : value.substring(0, METADATA_VALUE_MAX);
    }
}
