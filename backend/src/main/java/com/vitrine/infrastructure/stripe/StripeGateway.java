/*
 * Copyright (C) 2025 Vitrine Edge
 * SPDX-License-Identifier: AGPL-3.0-only
 */

package com.vitrine.infrastructure.stripe;

import com.stripe.model.Customer;
import com.stripe.model.PaymentIntent;

import java.util.Optional;

/**
 * Stripe calls used by checkout. Failures surface as
 * {@link com.vitrine.infrastructure.upstream.UpstreamException}.
 */
public interface StripeGateway {
    Optional<Customer> findCustomerByEmail(String email);

    Customer updateCustomer(Customer customer, CustomerDetails details);

    Customer createCustomer(CustomerDetails details);

    PaymentIntent createPaymentIntent(PaymentIntentDetails details);
}
