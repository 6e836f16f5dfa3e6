/*
 * Copyright (C) 2025 Vitrine Edge
 * SPDX-License-Identifier: AGPL-3.0-only
 */

package com.vitrine.application.leads;

import com.vitrine.application.resilience.CircuitBreakerRegistry;
import com.vitrine.application.resilience.CircuitOpenException;
import com.vitrine.domain.model.Upstream;
import com.vitrine.infrastructure.crm.CrmClient;
import com.vitrine.infrastructure.crm.CrmContact;
import com.vitrine.infrastructure.mailerlite.MailerLiteClient;
import com.vitrine.infrastructure.mailerlite.MailerLiteSubscriber;
import com.vitrine.infrastructure.upstream.DeliveryResult;
import com.vitrine.infrastructure.upstream.UpstreamException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.util.LinkedHashMap;
import java.util.Locale;
import java.util.Map;
import java.util.function.Supplier;

/**
 * Hands a captured lead to MailerLite and the CRM. Neither integration can fail the capture:
 * errors and open circuits are logged and reported in the result.
 */
@Service
public class LeadCaptureService {
    private static final Logger log = LoggerFactory.getLogger(LeadCaptureService.class);

    private final MailerLiteClient mailerLite;
    private final CrmClient crm;
    private final CircuitBreakerRegistry breakers;

    public LeadCaptureService(MailerLiteClient mailerLite, CrmClient crm, CircuitBreakerRegistry breakers) {
        this.mailerLite = mailerLite;
        this.crm = crm;
        this.breakers = breakers;
    }

    public LeadCaptureResult capture(LeadCommand lead) {
        String email = lead.email().trim().toLowerCase(Locale.ROOT);
        String name = lead.fullName().trim();
        String phone = lead.phone().trim();

        Map<String, String> fields = new LinkedHashMap<>();
        fields.put("name", name);
        fields.put("phone", phone);
        fields.put("lead_id", lead.leadId());
        lead.utm().forEach((k, v) -> {
            if (v != null && !v.isBlank()) fields.put(k, v.trim());
        });

        IntegrationOutcome mailerliteOutcome = deliver(
                Upstream.MAILERLITE,
                mailerLite.isConfigured(),
                () -> mailerLite.subscribe(new MailerLiteSubscriber(email, fields, lead.clientIp()))
        );
        IntegrationOutcome crmOutcome = deliver(
                Upstream.CRM,
                crm.isConfigured(),
                () -> crm.createContact(new CrmContact(
                        name,
                        email,
                        phone,
                        lead.amountMinor(),
                        "Lead captured via landing page. Lead ID: " + lead.leadId()
                ))
        );

        log.info("Lead captured leadId={} mailerlite={} crm={}", lead.leadId(), mailerliteOutcome.status(), crmOutcome.status());
        return new LeadCaptureResult(lead.leadId(), mailerliteOutcome, crmOutcome);
    }

    private IntegrationOutcome deliver(Upstream upstream, boolean configured, Supplier<DeliveryResult> call) {
        if (!configured) {
            log.warn("Lead integration not configured upstream={}", upstream);
            return IntegrationOutcome.skipped("not configured");
        }
        try {
            DeliveryResult result = breakers.get(upstream).execute(call);
            return switch (result.status()) {
                case CREATED -> new IntegrationOutcome(IntegrationOutcome.Status.CREATED, result.reference(), null);
                case ALREADY_EXISTS -> new IntegrationOutcome(IntegrationOutcome.Status.EXISTING, result.reference(), result.reason());
                case REJECTED -> new IntegrationOutcome(IntegrationOutcome.Status.REJECTED, null, result.reason());
            };
        } catch (CircuitOpenException e) {
            log.warn("Lead integration skipped, circuit open upstream={}", upstream);
            return IntegrationOutcome.skipped("circuit open");
        } catch (UpstreamException e) {
            log.warn("Lead integration failed upstream={} type={} status={}", upstream, e.getType(), e.getStatusCode());
            return IntegrationOutcome.failed(e.getMessage());
        }
    }
}
