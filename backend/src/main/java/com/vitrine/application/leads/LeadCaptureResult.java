/*
 * Copyright (C) 2025 Vitrine Edge
 * SPDX-License-Identifier: AGPL-3.0-only
 */

package com.vitrine.application.leads;

public record LeadCaptureResult(
        String leadId,
        IntegrationOutcome mailerlite,
        IntegrationOutcome crm
) {}
