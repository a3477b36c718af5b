/*
 * Copyright (C) 2025 Maku Travel
 * SPDX-License-Identifier: AGPL-3.0-only
 */

package com.maku.api.admin;

import com.maku.application.health.HealthLogEntry;
import com.maku.application.health.HealthLogStore;
import com.maku.domain.model.HealthStatus;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.context.SpringBootTest;
import org.springframework.boot.test.web.client.TestRestTemplate;
import org.springframework.core.ParameterizedTypeReference;
import org.springframework.http.HttpEntity;
import org.springframework.http.HttpHeaders;
import org.springframework.http.HttpMethod;
import org.springframework.http.HttpStatus;
import org.springframework.http.MediaType;
import org.springframework.http.ResponseEntity;
import org.springframework.test.annotation.DirtiesContext;
import org.springframework.test.context.ActiveProfiles;

import java.time.Instant;
import java.util.List;
import java.util.Map;
import java.util.UUID;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertNotNull;
import static org.junit.jupiter.api.Assertions.assertTrue;

@SpringBootTest(webEnvironment = SpringBootTest.WebEnvironment.RANDOM_PORT)
@ActiveProfiles("test")
@DirtiesContext(classMode = DirtiesContext.ClassMode.AFTER_CLASS)
class ProviderAdminApiTest {
    private static final String AMADEUS_ID = "0b6f3a8e-6f0e-4c41-9d1b-3f1c7d2a0001";
    private static final String SABRE_ID = "0b6f3a8e-6f0e-4c41-9d1b-3f1c7d2a0002";
    private static final String VIATOR_ID = "0b6f3a8e-6f0e-4c41-9d1b-3f1c7d2a0008";

    @Autowired
    private TestRestTemplate restTemplate;

    @Autowired
    private HealthLogStore healthLogStore;

    @Test
    void listIsOrderedByPriority() {
        ResponseEntity<List<Map<String, Object>>> res = restTemplate.exchange(
                "/api/admin/providers", HttpMethod.GET, new HttpEntity<>(adminHeaders()),
                new ParameterizedTypeReference<>() {});

        assertEquals(HttpStatus.OK, res.getStatusCode());
        List<Map<String, Object>> providers = res.getBody();
        assertTrue(providers.size() >= 9);
        for (int i = 1; i < providers.size(); i++) {
            int previous = ((Number) providers.get(i - 1).get("priority")).intValue();
            int current = ((Number) providers.get(i).get("priority")).intValue();
            assertTrue(previous <= current);
        }
    }

    @Test
    void registerThenRejectDuplicate() {
        HttpHeaders headers = adminHeaders();
        Map<String, Object> body = Map.of(
                "providerName", "Booking_Com",
                "displayName", "Booking.com",
                "providerType", "HOTEL",
                "priority", 15
        );

        ResponseEntity<Map> created = restTemplate.exchange("/api/admin/providers", HttpMethod.POST,
                new HttpEntity<>(body, headers), Map.class);
        ResponseEntity<Map> duplicate = restTemplate.exchange("/api/admin/providers", HttpMethod.POST,
                new HttpEntity<>(body, headers), Map.class);
        ResponseEntity<Map> badType = restTemplate.exchange("/api/admin/providers", HttpMethod.POST,
                new HttpEntity<>(Map.of("providerName", "ferries", "providerType", "SHIP"), headers), Map.class);

        assertEquals(HttpStatus.CREATED, created.getStatusCode());
        assertEquals("booking_com", created.getBody().get("providerName"));
        assertEquals("UNKNOWN", created.getBody().get("healthStatus"));
        assertEquals(true, created.getBody().get("active"));
        assertEquals(HttpStatus.CONFLICT, duplicate.getStatusCode());
        assertEquals("PROVIDER_EXISTS", duplicate.getBody().get("code"));
        assertEquals(HttpStatus.BAD_REQUEST, badType.getStatusCode());
    }

    @Test
    void priorityAndActiveFlagCanBeChanged() {
        HttpHeaders headers = adminHeaders();

        ResponseEntity<Map> priority = restTemplate.exchange("/api/admin/providers/" + AMADEUS_ID + "/priority",
                HttpMethod.PATCH, new HttpEntity<>(Map.of("priority", 5), headers), Map.class);
        ResponseEntity<Map> outOfRange = restTemplate.exchange("/api/admin/providers/" + AMADEUS_ID + "/priority",
                HttpMethod.PATCH, new HttpEntity<>(Map.of("priority", 101), headers), Map.class);
        ResponseEntity<Map> missing = restTemplate.exchange("/api/admin/providers/" + UUID.randomUUID() + "/active",
                HttpMethod.PATCH, new HttpEntity<>(Map.of("active", false), headers), Map.class);

        assertEquals(HttpStatus.OK, priority.getStatusCode());
        assertEquals(5, priority.getBody().get("priority"));
        assertEquals(HttpStatus.BAD_REQUEST, outOfRange.getStatusCode());
        assertEquals(HttpStatus.NOT_FOUND, missing.getStatusCode());
        assertEquals("NOT_FOUND", missing.getBody().get("code"));
    }

    @Test
    void detailedAnalyticsSummarisesHealthLog() {
        UUID sabre = UUID.fromString(SABRE_ID);
        Instant now = Instant.now();
        String longError = "HTTP 503 Service Unavailable: upstream GDS session pool exhausted, retry later";
        healthLogStore.appendHealthLog(new HealthLogEntry(sabre, HealthStatus.HEALTHY, 100, null, Map.of(), now.minusSeconds(400)));
        healthLogStore.appendHealthLog(new HealthLogEntry(sabre, HealthStatus.HEALTHY, 120, null, Map.of(), now.minusSeconds(300)));
        healthLogStore.appendHealthLog(new HealthLogEntry(sabre, HealthStatus.UNHEALTHY, 900, longError, Map.of(), now.minusSeconds(200)));
        healthLogStore.appendHealthLog(new HealthLogEntry(sabre, HealthStatus.HEALTHY, 110, null, Map.of(), now.minusSeconds(100)));

        ResponseEntity<Map> res = restTemplate.exchange("/api/admin/providers/" + SABRE_ID + "/analytics?days=7",
                HttpMethod.GET, new HttpEntity<>(adminHeaders()), Map.class);

        assertEquals(HttpStatus.OK, res.getStatusCode());
        Map summary = (Map) res.getBody().get("healthSummary");
        assertEquals(4, summary.get("totalChecks"));
        assertEquals(3, summary.get("healthy"));
        assertEquals(1, summary.get("unhealthy"));
        assertEquals(75.0, ((Number) summary.get("uptimePercent")).doubleValue());
        assertEquals(4, ((List) res.getBody().get("responseTimeTrend")).size());
        Map errors = (Map) res.getBody().get("errorAnalysis");
        assertEquals(1, errors.get(longError.substring(0, 50)));
        assertEquals("sabre", ((Map) res.getBody().get("provider")).get("providerName"));
    }

    @Test
    void analyticsWithoutChecksReportsZeroUptime() {
        ResponseEntity<Map> res = restTemplate.exchange("/api/admin/providers/" + VIATOR_ID + "/analytics",
                HttpMethod.GET, new HttpEntity<>(adminHeaders()), Map.class);

        assertEquals(HttpStatus.OK, res.getStatusCode());
        Map summary = (Map) res.getBody().get("healthSummary");
        assertEquals(0, summary.get("totalChecks"));
        assertEquals(0.0, ((Number) summary.get("uptimePercent")).doubleValue());
        assertEquals(7, ((Map) res.getBody().get("period")).get("days"));
    }

    @Test
    void analyticsRejectsBadWindowAndUnknownProvider() {
        HttpHeaders headers = adminHeaders();

        ResponseEntity<Map> tooLong = restTemplate.exchange("/api/admin/providers/" + SABRE_ID + "/analytics?days=91",
                HttpMethod.GET, new HttpEntity<>(headers), Map.class);
        ResponseEntity<Map> unknown = restTemplate.exchange("/api/admin/providers/" + UUID.randomUUID() + "/analytics",
                HttpMethod.GET, new HttpEntity<>(headers), Map.class);

        assertEquals(HttpStatus.BAD_REQUEST, tooLong.getStatusCode());
        assertEquals(HttpStatus.NOT_FOUND, unknown.getStatusCode());
    }

    @Test
    void overviewCountsRegistry() {
        HttpHeaders headers = adminHeaders();
        ResponseEntity<List<Map<String, Object>>> all = restTemplate.exchange(
                "/api/admin/providers", HttpMethod.GET, new HttpEntity<>(headers),
                new ParameterizedTypeReference<>() {});

        ResponseEntity<Map> res = restTemplate.exchange("/api/admin/providers/analytics/overview",
                HttpMethod.GET, new HttpEntity<>(headers), Map.class);

        assertEquals(HttpStatus.OK, res.getStatusCode());
        Map body = res.getBody();
        int total = ((Number) body.get("totalProviders")).intValue();
        int active = ((Number) body.get("activeProviders")).intValue();
        int inactive = ((Number) body.get("inactiveProviders")).intValue();
        assertTrue(total >= all.getBody().size());
        assertEquals(total, active + inactive);
        assertNotNull(body.get("healthDistribution"));
        assertTrue(((List) body.get("topPerformers")).size() <= 5);
    }

    @Test
    void manualRunsAndSummary() {
        HttpHeaders headers = adminHeaders();

        ResponseEntity<Map> health = restTemplate.exchange("/api/admin/providers/health/run",
                HttpMethod.POST, new HttpEntity<>(headers), Map.class);
        ResponseEntity<Map> metrics = restTemplate.exchange("/api/admin/providers/metrics/run",
                HttpMethod.POST, new HttpEntity<>(headers), Map.class);
        ResponseEntity<Map> summary = restTemplate.exchange("/api/admin/providers/health/summary",
                HttpMethod.GET, new HttpEntity<>(headers), Map.class);
        ResponseEntity<Map> monitor = restTemplate.exchange("/api/admin/providers/monitor/status",
                HttpMethod.GET, new HttpEntity<>(headers), Map.class);

        assertEquals(HttpStatus.OK, health.getStatusCode());
        assertEquals(0, health.getBody().get("probed"));
        assertEquals(HttpStatus.OK, metrics.getStatusCode());
        assertTrue(((Number) metrics.getBody().get("providers")).intValue() >= 7);
        assertEquals(HttpStatus.OK, summary.getStatusCode());
        List<Map<String, Object>> providers = (List<Map<String, Object>>) summary.getBody().get("providers");
        assertEquals(providers.size(), summary.getBody().get("totalProviders"));
        assertEquals(HttpStatus.OK, monitor.getStatusCode());
        assertEquals(false, monitor.getBody().get("running"));
    }

    @Test
    void travellersCannotManageProviders() {
        HttpHeaders user = authHeaders(token("traveller@maku.test"));

        ResponseEntity<Map> res = restTemplate.exchange("/api/admin/providers", HttpMethod.GET, new HttpEntity<>(user), Map.class);

        assertEquals(HttpStatus.FORBIDDEN, res.getStatusCode());
    }

    private HttpHeaders adminHeaders() {
        return authHeaders(token("admin@maku.test"));
    }

    private String token(String email) {
        Map<String, Object> req = Map.of("email", email, "password", "Password123!");
        ResponseEntity<Map> res = restTemplate.postForEntity("/api/auth/register", req, Map.class);
        if (res.getStatusCode() == HttpStatus.CONFLICT) {
            res = restTemplate.postForEntity("/api/auth/login", req, Map.class);
        }
        assertTrue(res.getStatusCode().is2xxSuccessful());
        return (String) res.getBody().get("token");
    }

    private static HttpHeaders authHeaders(String token) {
        HttpHeaders headers = new HttpHeaders();
        headers.setBearerAuth(token);
        headers.setContentType(MediaType.APPLICATION_JSON);
        return headers;
    }
}
