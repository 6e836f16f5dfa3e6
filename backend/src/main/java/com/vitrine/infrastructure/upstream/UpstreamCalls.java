/*
 * Copyright (C) 2025 Vitrine Edge
 * SPDX-License-Identifier: AGPL-3.0-only
 */

package com.vitrine.infrastructure.upstream;

import com.vitrine.domain.model.Upstream;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.web.reactive.function.client.WebClientRequestException;
import org.springframework.web.reactive.function.client.WebClientResponseException;
import reactor.core.Exceptions;
import reactor.core.publisher.Mono;
import reactor.core.scheduler.Schedulers;

import java.time.Duration;
import java.util.concurrent.Callable;
import java.util.concurrent.TimeoutException;

/**
 * Races upstream calls against a timer. A call that loses the race is cancelled and its
 * late result is dropped.
 */
public final class UpstreamCalls {
    private static final Logger log = LoggerFactory.getLogger(UpstreamCalls.class);

    private UpstreamCalls() {}

    public static <T> T await(Upstream upstream, Mono<T> call, Duration timeout) {
        try {
            return call.timeout(timeout).block();
        } catch (UpstreamException e) {
            throw e;
        } catch (WebClientResponseException e) {
            int status = e.getStatusCode().value();
            log.warn("Upstream error upstream={} status={}", upstream, status);
            throw UpstreamException.httpStatus(upstream, status, upstream.breakerName() + " returned HTTP " + status);
        } catch (WebClientRequestException e) {
            log.warn("Upstream transport failure upstream={} message={}", upstream, e.getMessage());
            throw new UpstreamException(upstream, UpstreamErrorType.NETWORK, upstream.breakerName() + " request failed", e);
        } catch (RuntimeException e) {
            Throwable cause = Exceptions.unwrap(e);
            if (cause instanceof TimeoutException) {
                log.warn("Upstream timeout upstream={} timeoutMs={}", upstream, timeout.toMillis());
                throw new UpstreamException(upstream, UpstreamErrorType.TIMEOUT,
                        upstream.breakerName() + " timed out after " + timeout.toMillis() + "ms", cause);
            }
            if (cause instanceof UpstreamException ue) {
                throw ue;
            }
            throw new UpstreamException(upstream, UpstreamErrorType.UNKNOWN, upstream.breakerName() + " request failed", e);
        }
    }

    /**
     * Runs a blocking client call (an SDK without a reactive API) on the bounded elastic pool.
     */
    public static <T> T awaitBlocking(Upstream upstream, Callable<T> call, Duration timeout) {
        return await(upstream, Mono.fromCallable(call).subscribeOn(Schedulers.boundedElastic()), timeout);
    }
}
