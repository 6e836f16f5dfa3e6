/*
 * Copyright (C) 2025 Vitrine Edge
 * SPDX-License-Identifier: AGPL-3.0-only
 */

package com.vitrine.infrastructure.crm;

public record CrmContact(
        String name,
        String email,
        String phone,
        Long amountMinor,
        String note
) {}
