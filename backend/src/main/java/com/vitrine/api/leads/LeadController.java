/*
 * Copyright (C) 2025 Vitrine Edge
 * SPDX-License-Identifier: AGPL-3.0-only
 */

package com.vitrine.api.leads;

import com.vitrine.api.ClientKeyResolver;
import com.vitrine.application.leads.IntegrationOutcome;
import com.vitrine.application.leads.LeadCaptureResult;
import com.vitrine.application.leads.LeadCaptureService;
import com.vitrine.application.leads.LeadCommand;
import jakarta.servlet.http.HttpServletRequest;
import jakarta.validation.Valid;
import jakarta.validation.constraints.Email;
import jakarta.validation.constraints.Max;
import jakarta.validation.constraints.Min;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.Pattern;
import jakarta.validation.constraints.Size;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

import java.util.LinkedHashMap;
import java.util.Map;

@RestController
@RequestMapping("/api/leads")
public class LeadController {
    private final LeadCaptureService leadCaptureService;
    private final ClientKeyResolver clientKeyResolver;

    public LeadController(LeadCaptureService leadCaptureService, ClientKeyResolver clientKeyResolver) {
        this.leadCaptureService = leadCaptureService;
        this.clientKeyResolver = clientKeyResolver;
    }

    @PostMapping
    public LeadResponse capture(@Valid @RequestBody LeadRequest req, HttpServletRequest request) {
        LeadCaptureResult result = leadCaptureService.capture(new LeadCommand(
                req.leadId(),
                req.fullName(),
                req.email(),
                req.phone(),
                req.amountMinor(),
                req.utm(),
                clientKeyResolver.resolve(request)
        ));
        return new LeadResponse(true, result.leadId(), result.mailerlite(), result.crm());
    }

    public record LeadRequest(
            @NotBlank @Size(max = 100) String leadId,
            @NotBlank @Size(min = 2, max = 100) String fullName,
            @NotBlank @Email @Size(max = 254) String email,
            @NotBlank @Pattern(regexp = "^\\+?[0-9][\\d\\s\\-()]{7,20}$") String phone,
            @Min(50) @Max(1_000_000) Long amountMinor,
            @Size(max = 255) String utmSource,
            @Size(max = 255) String utmMedium,
            @Size(max = 255) String utmCampaign,
            @Size(max = 255) String utmContent,
            @Size(max = 255) String utmTerm
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

    public record LeadResponse(
            boolean success,
            String leadId,
            IntegrationOutcome mailerlite,
            IntegrationOutcome crm
    ) {}
}
