/*
 * Copyright (C) 2025 Vitrine Edge
 * SPDX-License-Identifier: AGPL-3.0-only
 */

package com.vitrine.api.paymentintents;

import com.vitrine.application.checkout.CheckoutCommand;
import com.vitrine.application.checkout.CheckoutResult;
import com.vitrine.application.checkout.CheckoutService;
import jakarta.validation.Valid;
import jakarta.validation.constraints.Email;
import jakarta.validation.constraints.Max;
import jakarta.validation.constraints.Min;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.Pattern;
import jakarta.validation.constraints.Size;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestHeader;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

import java.util.LinkedHashMap;
import java.util.Map;

@RestController
@RequestMapping("/api/payment-intents")
public class PaymentIntentController {
    public static final String IDEMPOTENCY_HEADER = "X-Idempotency-Key";

    private final CheckoutService checkoutService;

    public PaymentIntentController(CheckoutService checkoutService) {
        this.checkoutService = checkoutService;
    }

    @PostMapping
    public CheckoutResult create(
            @Valid @RequestBody CreatePaymentIntentRequest req,
            @RequestHeader(value = IDEMPOTENCY_HEADER, required = false) String idempotencyKey
    ) {
        String key = idempotencyKey != null && !idempotencyKey.isBlank() ? idempotencyKey : req.idempotencyKey();
        return checkoutService.createPaymentIntent(new CheckoutCommand(
                req.leadId(),
                req.fullName(),
                req.email(),
                req.phone(),
                req.amount(),
                req.currency(),
                req.utm(),
                key
        ));
    }

    public record CreatePaymentIntentRequest(
            @NotBlank @Size(max = 100) String leadId,
            @NotBlank @Size(min = 2, max = 100) String fullName,
            @NotBlank @Email @Size(max = 254) String email,
            @NotBlank @Pattern(regexp = "^\\+?[0-9][\\d\\s\\-()]{7,20}$") String phone,
            @Min(50) @Max(1_000_000) Long amount,
            @Size(min = 3, max = 3) String currency,
            @Size(max = 255) String idempotencyKey,
            String utmSource,
            String utmMedium,
            String utmCampaign,
            String utmContent,
            String utmTerm
    ) {
        Map<String, String> utm() {
            Map<String, String> utm = new LinkedHashMap<>();
            utm.put("utm_source", utmSource);
            utm.put("utm_medium", utmMedium);
            utm.put("utm_campaign", utmCampaign);
            utm.put("utm_content", utmContent);
            utm.put("utm_term", utmTerm);
            utm.values().removeIf(v -> v == null || v.isBlank());
            return utm;
        }
    }
}
