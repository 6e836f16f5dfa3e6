/*
 * Copyright (C) 2025 Vitrine Edge
 * SPDX-License-Identifier: AGPL-3.0-only
 */

package com.vitrine.application.checkout;

import com.stripe.model.Customer;

/**
 * @param cacheHit whether the customer came from the in-process cache
 */
public record CustomerResolution(Customer customer, boolean cacheHit) {}
