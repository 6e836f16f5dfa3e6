/*
 * Copyright (C) 2025 Vitrine Edge
 * SPDX-License-Identifier: AGPL-3.0-only
 */

package com.vitrine.application.proxy;

import com.vitrine.infrastructure.upstream.UpstreamResponse;

/**
 * Transport to a tag server. Every HTTP status comes back as a response; transport failures
 * and timeouts are thrown as {@link com.vitrine.infrastructure.upstream.UpstreamException}.
 */
public interface TagServerClient {
    UpstreamResponse send(OutboundTagRequest request);
}
