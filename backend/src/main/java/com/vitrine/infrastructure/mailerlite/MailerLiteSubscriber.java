/*
 * Copyright (C) 2025 Vitrine Edge
 * SPDX-License-Identifier: AGPL-3.0-only
 */

package com.vitrine.infrastructure.mailerlite;

import java.util.Map;

/**
 * @param fields MailerLite custom fields (name, phone, utm_*), already trimmed
 */
public record MailerLiteSubscriber(
        String email,
        Map<String, String> fields,
        String ipAddress
) {}
