/*
 * Copyright (C) 2025 Vitrine Edge
 * SPDX-License-Identifier: AGPL-3.0-only
 */

package com.vitrine;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.boot.context.properties.ConfigurationPropertiesScan;

@SpringBootApplication
@ConfigurationPropertiesScan
public class VitrineEdgeApplication {
    public static void main(String[] args) {
        SpringApplication.run(VitrineEdgeApplication.class, args);
    }
}
