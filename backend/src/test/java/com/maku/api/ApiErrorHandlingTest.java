/*
 * Copyright (C) 2025 Maku Travel
 * SPDX-License-Identifier: AGPL-3.0-only
 */

package com.maku.api;

import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.maku.config.RequestIdFilter;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.context.SpringBootTest;
import org.springframework.boot.test.web.client.TestRestTemplate;
import org.springframework.context.annotation.Import;
import org.springframework.http.HttpEntity;
import org.springframework.http.HttpHeaders;
import org.springframework.http.HttpMethod;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.jdbc.core.JdbcTemplate;
import org.springframework.test.annotation.DirtiesContext;
import org.springframework.test.context.ActiveProfiles;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

import java.time.Instant;
import java.util.Map;
import java.util.UUID;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertNotNull;

@SpringBootTest(webEnvironment = SpringBootTest.WebEnvironment.RANDOM_PORT)
@ActiveProfiles("test")
@DirtiesContext(classMode = DirtiesContext.ClassMode.AFTER_CLASS)
@Import(ApiErrorHandlingTest.ConstraintTestController.class)
class ApiErrorHandlingTest {
    @Autowired
    private TestRestTemplate restTemplate;

    @Autowired
    private ObjectMapper objectMapper;

    @Test
    void dataIntegrityViolationIncludesRequestId() throws Exception {
        HttpHeaders headers = new HttpHeaders();
        headers.set(RequestIdFilter.HEADER, "test-req-123");
        ResponseEntity<String> res = restTemplate.exchange(
                "/api/auth/test/constraint",
                HttpMethod.POST,
                new HttpEntity<>(headers),
                String.class
        );

        assertEquals(HttpStatus.CONFLICT, res.getStatusCode());
        assertEquals("test-req-123", res.getHeaders().getFirst(RequestIdFilter.HEADER));

        Map<String, Object> body = objectMapper.readValue(res.getBody(), new TypeReference<>() {});
        assertEquals("DATA_INTEGRITY_VIOLATION", body.get("code"));
        assertEquals("test-req-123", body.get("requestId"));
        assertNotNull(body.get("message"));
    }

    @Test
    void generatedRequestIdIsEchoed() throws Exception {
        ResponseEntity<String> res = restTemplate.getForEntity("/api/ai/access", String.class);

        assertEquals(HttpStatus.UNAUTHORIZED, res.getStatusCode());
        String header = res.getHeaders().getFirst(RequestIdFilter.HEADER);
        assertNotNull(header);
        assertFalse(header.isBlank());
        Map<String, Object> body = objectMapper.readValue(res.getBody(), new TypeReference<>() {});
        assertEquals(header, body.get("requestId"));
    }

    @RestController
    @RequestMapping("/api/auth/test")
    static class ConstraintTestController {
        private final JdbcTemplate jdbcTemplate;

        ConstraintTestController(JdbcTemplate jdbcTemplate) {
            this.jdbcTemplate = jdbcTemplate;
        }

        @PostMapping("/constraint")
        public void constraintViolation() {
            for (int i = 0; i < 2; i++) {
                jdbcTemplate.update(
                        """
                        INSERT INTO provider_registry (
                          id,
                          provider_name,
                          display_name,
                          provider_type,
                          created_at
                        ) VALUES (?, ?, ?, ?, ?)
                        """,
                        UUID.randomUUID().toString(),
                        "duplicate_provider",
                        "Duplicate",
                        "HOTEL",
                        Instant.now().toEpochMilli()
                );
            }
        }
    }
}
