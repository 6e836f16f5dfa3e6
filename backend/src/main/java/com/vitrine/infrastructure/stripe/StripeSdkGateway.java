/*
 * Copyright (C) 2025 Vitrine Edge
 * SPDX-License-Identifier: AGPL-3.0-only
 */

package com.vitrine.infrastructure.stripe;

import com.stripe.Stripe;
import com.stripe.exception.ApiConnectionException;
import com.stripe.exception.StripeException;
import com.stripe.model.Customer;
import com.stripe.model.PaymentIntent;
import com.stripe.net.RequestOptions;
import com.stripe.param.CustomerCreateParams;
import com.stripe.param.CustomerListParams;
import com.stripe.param.CustomerUpdateParams;
import com.stripe.param.PaymentIntentCreateParams;
import com.vitrine.config.AppProperties;
import com.vitrine.domain.model.Upstream;
import com.vitrine.infrastructure.upstream.UpstreamCalls;
import com.vitrine.infrastructure.upstream.UpstreamErrorType;
import com.vitrine.infrastructure.upstream.UpstreamException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.time.Duration;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

@Service
public class StripeSdkGateway implements StripeGateway {
    private static final Logger log = LoggerFactory.getLogger(StripeSdkGateway.class);

    private final AppProperties.Stripe config;

    public StripeSdkGateway(AppProperties properties) {
        this.config = properties.stripe();
        Stripe.enableTelemetry = false;
    }

    @Override
    public Optional<Customer> findCustomerByEmail(String email) {
        CustomerListParams params = CustomerListParams.builder()
                .setEmail(email)
                .setLimit(1L)
                .build();
        List<Customer> found = call("customer lookup", () -> Customer.list(params, options(null)).getData());
        return found == null || found.isEmpty() ? Optional.empty() : Optional.of(found.get(0));
    }

    @Override
    public Customer updateCustomer(Customer customer, CustomerDetails details) {
        Map<String, String> metadata = new HashMap<>();
        if (customer.getMetadata() != null) metadata.putAll(customer.getMetadata());
        metadata.putAll(details.metadata());

        CustomerUpdateParams params = CustomerUpdateParams.builder()
                .setName(details.name())
                .setPhone(details.phone())
                .putAllMetadata(metadata)
                .build();
        return call("customer update", () -> customer.update(params, options(null)));
    }

    @Override
    public Customer createCustomer(CustomerDetails details) {
        CustomerCreateParams params = CustomerCreateParams.builder()
                .setEmail(details.email())
                .setName(details.name())
                .setPhone(details.phone())
                .putAllMetadata(details.metadata())
                .build();
        return call("customer creation", () -> Customer.create(params, options(null)));
    }

    @Override
    public PaymentIntent createPaymentIntent(PaymentIntentDetails details) {
        PaymentIntentCreateParams.Builder builder = PaymentIntentCreateParams.builder()
                .setAmount(details.amountMinor())
                .setCurrency(details.currency())
                .setCustomer(details.customerId())
                .setAutomaticPaymentMethods(
                        PaymentIntentCreateParams.AutomaticPaymentMethods.builder()
                                .setEnabled(true)
                                .setAllowRedirects(PaymentIntentCreateParams.AutomaticPaymentMethods.AllowRedirects.ALWAYS)
                                .build()
                )
                .putAllMetadata(details.metadata());

        if (details.receiptEmail() != null) builder.setReceiptEmail(details.receiptEmail());
        if (details.description() != null && !details.description().isBlank()) {
            builder.setDescription(details.description());
        }

        PaymentIntentCreateParams params = builder.build();
        return call("payment intent creation", () -> PaymentIntent.create(params, options(details.idempotencyKey())));
    }

    private RequestOptions options(String idempotencyKey) {
        if (config.secretKey() == null || config.secretKey().isBlank()) {
            throw new UpstreamException(Upstream.STRIPE, UpstreamErrorType.NOT_CONFIGURED, "Stripe is not configured");
        }
        RequestOptions.RequestOptionsBuilder builder = RequestOptions.builder().setApiKey(config.secretKey());
        if (idempotencyKey != null && !idempotencyKey.isBlank()) {
            builder.setIdempotencyKey(idempotencyKey);
        }
        return builder.build();
    }

    private <T> T call(String operation, StripeCall<T> call) {
        Duration timeout = config.timeout();
        return UpstreamCalls.awaitBlocking(Upstream.STRIPE, () -> {
            try {
                return call.run();
            } catch (StripeException e) {
                throw mapStripeException(operation, e);
            }
        }, timeout);
    }

    private UpstreamException mapStripeException(String operation, StripeException e) {
        Integer status = e.getStatusCode();
        UpstreamErrorType type = UpstreamErrorType.UNKNOWN;
        if (e instanceof ApiConnectionException) {
            type = UpstreamErrorType.NETWORK;
        } else if (status != null) {
            type = status == 408 ? UpstreamErrorType.TIMEOUT : UpstreamErrorType.HTTP_STATUS;
        }
        log.warn("Stripe error operation={} type={} status={} code={}", operation, type, status, e.getCode());
        if (type == UpstreamErrorType.HTTP_STATUS) {
            return UpstreamException.httpStatus(Upstream.STRIPE, status, "Stripe " + operation + " failed");
        }
        return new UpstreamException(Upstream.STRIPE, type, "Stripe " + operation + " failed", e);
    }

    @FunctionalInterface
    private interface StripeCall<T> {
        T run() throws StripeException;
    }
}
