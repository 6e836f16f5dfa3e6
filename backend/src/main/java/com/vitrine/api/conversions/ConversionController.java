/*
 * Copyright (C) 2025 Vitrine Edge
 * SPDX-License-Identifier: AGPL-3.0-only
 */

package com.vitrine.api.conversions;

import com.vitrine.application.conversion.ConversionEvent;
import com.vitrine.application.conversion.ConversionEventService;
import jakarta.validation.Valid;
import jakarta.validation.constraints.DecimalMin;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.Size;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

import java.math.BigDecimal;

@RestController
@RequestMapping("/api/conversions")
public class ConversionController {
    private final ConversionEventService conversionEventService;

    public ConversionController(ConversionEventService conversionEventService) {
        this.conversionEventService = conversionEventService;
    }

    /**
     * Always 200: a repeat inside the suppression window comes back as a blocked-duplicate event.
     */
    @PostMapping("/purchase")
    public ConversionEvent purchase(@Valid @RequestBody PurchaseRequest req) {
        return conversionEventService.purchaseCompleted(req.transactionId(), req.value(), req.currency());
    }

    public record PurchaseRequest(
            @NotBlank @Size(max = 200) String transactionId,
            @DecimalMin("0") BigDecimal value,
            @Size(min = 3, max = 3) String currency
    ) {}
}
