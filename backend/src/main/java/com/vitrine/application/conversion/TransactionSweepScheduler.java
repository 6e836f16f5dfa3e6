/*
 * Copyright (C) 2025 Vitrine Edge
 * SPDX-License-Identifier: AGPL-3.0-only
 */

package com.vitrine.application.conversion;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.context.annotation.Configuration;
import org.springframework.scheduling.annotation.EnableScheduling;
import org.springframework.scheduling.annotation.SchedulingConfigurer;
import org.springframework.scheduling.config.ScheduledTaskRegistrar;

/**
 * Sweeps the transaction store every quarter of its suppression window.
 */
@Configuration
@EnableScheduling
public class TransactionSweepScheduler implements SchedulingConfigurer {
    private static final Logger log = LoggerFactory.getLogger(TransactionSweepScheduler.class);

    private final DuplicateTransactionSuppressor suppressor;

    public TransactionSweepScheduler(DuplicateTransactionSuppressor suppressor) {
        this.suppressor = suppressor;
    }

    @Override
    public void configureTasks(ScheduledTaskRegistrar registrar) {
        log.info("Scheduling transaction sweep interval={}", suppressor.sweepInterval());
        registrar.addFixedDelayTask(() -> suppressor.sweep(), suppressor.sweepInterval());
    }
}
