/*
 * Copyright (C) 2025 Vitrine Edge
 * SPDX-License-Identifier: AGPL-3.0-only
 */

package com.vitrine.application.checkout;

import com.stripe.model.Customer;
import com.vitrine.application.cache.CustomerCache;
import com.vitrine.application.resilience.CircuitBreakerRegistry;
import com.vitrine.application.resilience.CircuitOpenException;
import com.vitrine.domain.model.Upstream;
import com.vitrine.infrastructure.stripe.CustomerDetails;
import com.vitrine.infrastructure.stripe.StripeGateway;
import com.vitrine.infrastructure.upstream.UpstreamException;
import com.vitrine.support.MutableClock;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import java.time.Duration;
import java.util.Map;
import java.util.Optional;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertNull;
import static org.junit.jupiter.api.Assertions.assertSame;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.times;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.verifyNoMoreInteractions;
import static org.mockito.Mockito.when;

@ExtendWith(MockitoExtension.class)
class StripeCustomerServiceTest {
    @Mock
    private StripeGateway stripe;

    private CustomerCache cache;
    private StripeCustomerService service;

    @BeforeEach
    void setUp() {
        MutableClock clock = MutableClock.startingAt("2025-01-01T00:00:00Z");
        cache = new CustomerCache(Duration.ofMinutes(10), 1000, clock);
        service = new StripeCustomerService(stripe, cache, new CircuitBreakerRegistry(2, Duration.ofSeconds(60), clock));
    }

    @Test
    void missLooksUpUpdatesAndCaches() {
        Customer existing = customer("cus_1", "Old Name", "+351 900 000 000");
        Customer updated = customer("cus_1", "Ana Silva", "+351 912 345 678");
        when(stripe.findCustomerByEmail("ana@example.com")).thenReturn(Optional.of(existing));
        when(stripe.updateCustomer(existing, details())).thenReturn(updated);

        CustomerResolution first = service.resolve(details());
        CustomerResolution second = service.resolve(details());

        assertFalse(first.cacheHit());
        assertSame(updated, first.customer());
        assertTrue(second.cacheHit());
        assertSame(updated, second.customer());
        verify(stripe, times(1)).findCustomerByEmail("ana@example.com");
        verify(stripe, times(1)).updateCustomer(existing, details());
        verifyNoMoreInteractions(stripe);
    }

    @Test
    void missWithoutExistingCustomerCreatesOne() {
        Customer created = customer("cus_2", "Ana Silva", "+351 912 345 678");
        when(stripe.findCustomerByEmail("ana@example.com")).thenReturn(Optional.empty());
        when(stripe.createCustomer(details())).thenReturn(created);

        CustomerResolution resolution = service.resolve(details());

        assertSame(created, resolution.customer());
        assertSame(created, cache.get("ana@example.com"));
    }

    @Test
    void hitWithChangedPhoneUpdatesCustomer() {
        Customer cached = customer("cus_3", "Ana Silva", "+351 000");
        Customer updated = customer("cus_3", "Ana Silva", "+351 912 345 678");
        cache.put("ana@example.com", cached);
        when(stripe.updateCustomer(cached, details())).thenReturn(updated);

        CustomerResolution resolution = service.resolve(details());

        assertTrue(resolution.cacheHit());
        assertSame(updated, resolution.customer());
        assertSame(updated, cache.get("ana@example.com"));
    }

    @Test
    void failedUpdateDropsCachedCustomer() {
        Customer cached = customer("cus_4", "Ana", "+351 000");
        cache.put("ana@example.com", cached);
        when(stripe.updateCustomer(cached, details())).thenThrow(UpstreamException.httpStatus(Upstream.STRIPE, 404, "No such customer"));

        assertThrows(UpstreamException.class, () -> service.resolve(details()));

        assertNull(cache.get("ana@example.com"));
    }

    @Test
    void repeatedStripeFailuresOpenTheCircuit() {
        when(stripe.findCustomerByEmail(any())).thenThrow(UpstreamException.httpStatus(Upstream.STRIPE, 500, "Stripe customer lookup failed"));

        assertThrows(UpstreamException.class, () -> service.resolve(details()));
        assertThrows(UpstreamException.class, () -> service.resolve(details()));
        assertThrows(CircuitOpenException.class, () -> service.resolve(details()));

        verify(stripe, times(2)).findCustomerByEmail(any());
    }

    @Test
    void needsUpdateComparesNameAndPhone() {
        assertFalse(StripeCustomerService.needsUpdate(customer("c", "Ana Silva", "+351 912 345 678"), details()));
        assertTrue(StripeCustomerService.needsUpdate(customer("c", "Ana", "+351 912 345 678"), details()));
    }

    private static CustomerDetails details() {
        return new CustomerDetails("ana@example.com", "Ana Silva", "+351 912 345 678", Map.of("lead_id", "lead-1"));
    }

    private static Customer customer(String id, String name, String phone) {
        Customer customer = new Customer();
        customer.setId(id);
        customer.setName(name);
        customer.setPhone(phone);
        return customer;
    }
}
