/*
 * Copyright (C) 2025 Vitrine Edge
 * SPDX-License-Identifier: AGPL-3.0-only
 */

package com.vitrine.application.checkout;

import com.stripe.model.Customer;
import com.vitrine.application.cache.CustomerCache;
import com.vitrine.application.resilience.CircuitBreaker;
import com.vitrine.application.resilience.CircuitBreakerRegistry;
import com.vitrine.domain.model.Upstream;
import com.vitrine.infrastructure.stripe.CustomerDetails;
import com.vitrine.infrastructure.stripe.StripeGateway;
import com.vitrine.infrastructure.upstream.UpstreamException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.util.Objects;
import java.util.Optional;

/**
 * Finds or creates the Stripe customer for a checkout, consulting {@link CustomerCache} first.
 */
@Service
public class StripeCustomerService {
    private static final Logger log = LoggerFactory.getLogger(StripeCustomerService.class);

    private final StripeGateway stripe;
    private final CustomerCache cache;
    private final CircuitBreaker breaker;

    public StripeCustomerService(StripeGateway stripe, CustomerCache cache, CircuitBreakerRegistry breakers) {
        this.stripe = stripe;
        this.cache = cache;
        this.breaker = breakers.get(Upstream.STRIPE);
    }

    public CustomerResolution resolve(CustomerDetails details) {
        Customer cached = cache.get(details.email());
        if (cached != null) {
            log.info("Customer cache hit customerId={}", cached.getId());
            Customer customer = cached;
            if (needsUpdate(cached, details)) {
                try {
                    customer = breaker.execute(() -> stripe.updateCustomer(cached, details));
                } catch (UpstreamException e) {
                    cache.invalidate(details.email());
                    throw e;
                }
                cache.put(details.email(), customer);
            }
            return new CustomerResolution(customer, true);
        }

        log.info("Customer cache miss, querying Stripe");
        Optional<Customer> existing = breaker.execute(() -> stripe.findCustomerByEmail(details.email()));
        Customer customer = existing.isPresent()
                ? breaker.execute(() -> stripe.updateCustomer(existing.get(), details))
                : breaker.execute(() -> stripe.createCustomer(details));
        cache.put(details.email(), customer);
        return new CustomerResolution(customer, false);
    }

    static boolean needsUpdate(Customer customer, CustomerDetails details) {
        return !Objects.equals(customer.getName(), details.name())
                || !Objects.equals(customer.getPhone(), details.phone());
    }
}
