/*
 * Copyright (C) 2025 Vitrine Edge
 * SPDX-License-Identifier: AGPL-3.0-only
 */

package com.vitrine.api.conversions;

import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.vitrine.application.conversion.ConversionEventTypes;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.context.SpringBootTest;
import org.springframework.boot.test.web.client.TestRestTemplate;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.test.annotation.DirtiesContext;
import org.springframework.test.context.ActiveProfiles;

import java.util.Map;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertNotNull;

@SpringBootTest(webEnvironment = SpringBootTest.WebEnvironment.RANDOM_PORT)
@ActiveProfiles("test")
@DirtiesContext(classMode = DirtiesContext.ClassMode.AFTER_CLASS)
class ConversionControllerTest {
    @Autowired
    private TestRestTemplate restTemplate;

    @Autowired
    private ObjectMapper objectMapper;

    @Test
    void secondPurchaseWithSameTransactionIsBlocked() throws Exception {
        Map<String, Object> purchase = Map.of("transactionId", "pi_3Ab", "value", 180.00, "currency", "EUR");

        Map<String, Object> first = post(purchase);
        Map<String, Object> second = post(purchase);

        assertEquals(ConversionEventTypes.PURCHASE_COMPLETED, first.get("event"));
        assertEquals(ConversionEventTypes.PURCHASE_BLOCKED_DUPLICATE, second.get("event"));
        assertEquals("pi_3Ab", second.get("transactionId"));
        assertNotNull(second.get("originalTimestamp"));
    }

    @Test
    void missingTransactionIdIsRejected() {
        ResponseEntity<String> res = restTemplate.postForEntity("/api/conversions/purchase", Map.of("value", 10), String.class);

        assertEquals(HttpStatus.BAD_REQUEST, res.getStatusCode());
    }

    private Map<String, Object> post(Map<String, Object> purchase) throws Exception {
        ResponseEntity<String> res = restTemplate.postForEntity("/api/conversions/purchase", purchase, String.class);
        assertEquals(HttpStatus.OK, res.getStatusCode());
        return objectMapper.readValue(res.getBody(), new TypeReference<>() {});
    }
}
