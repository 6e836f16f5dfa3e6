/*
 * Copyright (C) 2025 Vitrine Edge
 * SPDX-License-Identifier: AGPL-3.0-only
 */

package com.vitrine.application.leads;

import java.util.Map;

public record LeadCommand(
        String leadId,
        String fullName,
        String email,
        String phone,
        Long amountMinor,
        Map<String, String> utm,
        String clientIp
) {
    public LeadCommand {
        utm = utm == null ? Map.of() : Map.copyOf(utm);
    }
}
