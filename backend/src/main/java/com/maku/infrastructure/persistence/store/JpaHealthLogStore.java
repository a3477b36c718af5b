/*
 * Copyright (C) 2025 Maku Travel
 * SPDX-License-Identifier: AGPL-3.0-only
 */

package com.maku.infrastructure.persistence.store;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.maku.application.health.HealthLogEntry;
import com.maku.application.health.HealthLogStore;
import com.maku.application.health.ProviderMetrics;
import com.maku.domain.model.HealthStatus;
import com.maku.infrastructure.persistence.entity.ProviderEntity;
import com.maku.infrastructure.persistence.entity.ProviderHealthLogEntity;
import com.maku.infrastructure.persistence.repository.ProviderHealthLogRepository;
import com.maku.infrastructure.persistence.repository.ProviderRepository;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;
import org.springframework.transaction.annotation.Transactional;

import java.time.Instant;
import java.util.List;
import java.util.Map;
import java.util.UUID;

/**
 * Every method runs in its own transaction so a failed write for one provider never rolls
 * back the rows already written for others.
 */
@Component
public class JpaHealthLogStore implements HealthLogStore {
    private static final Logger log = LoggerFactory.getLogger(JpaHealthLogStore.class);
    private static final TypeReference<Map<String, Object>> MAP = new TypeReference<>() {};

    private final ProviderHealthLogRepository logRepository;
    private final ProviderRepository providerRepository;
    private final ObjectMapper objectMapper;

    public JpaHealthLogStore(
            ProviderHealthLogRepository logRepository,
            ProviderRepository providerRepository,
            ObjectMapper objectMapper
    ) {
        this.logRepository = logRepository;
        this.providerRepository = providerRepository;
        this.objectMapper = objectMapper;
    }

    @Override
    @Transactional
    public void appendHealthLog(HealthLogEntry entry) {
        ProviderHealthLogEntity row = new ProviderHealthLogEntity();
        row.setProviderId(entry.providerId());
        row.setStatus(entry.status());
        row.setResponseTimeMs(entry.responseTimeMs());
        row.setErrorMessage(entry.errorMessage());
        row.setMetadataJson(writeMetadata(entry.metadata()));
        row.setCheckTime(entry.checkedAt());
        logRepository.save(row);
    }

    @Override
    @Transactional
    public List<HealthLogEntry> queryHealthLogs(UUID providerId, Instant since) {
        return logRepository.findSince(providerId, since).stream()
                .map(row -> new HealthLogEntry(
                        row.getProviderId(),
                        row.getStatus(),
                        row.getResponseTimeMs(),
                        row.getErrorMessage(),
                        readMetadata(row.getMetadataJson()),
                        row.getCheckTime()
                ))
                .toList();
    }

    @Override
    @Transactional
    public void updateLiveStatus(UUID providerId, HealthStatus status, Instant checkedAt, long latencyMs) {
        ProviderEntity provider = requireProvider(providerId);
        provider.setHealthStatus(status);
        provider.setLastHealthCheck(checkedAt);
        provider.setResponseTimeMs(latencyMs);
        providerRepository.save(provider);
    }

    @Override
    @Transactional
    public void updateMetrics(ProviderMetrics metrics) {
        ProviderEntity provider = requireProvider(metrics.providerId());
        provider.setSuccessRatePercent(metrics.successRatePercent());
        provider.setAvgResponseTimeMs(metrics.avgResponseTimeMs());
        provider.setErrorRatePercent(metrics.errorRatePercent());
        provider.setMetricsUpdatedAt(metrics.windowEnd());
        providerRepository.save(provider);
    }

    private ProviderEntity requireProvider(UUID providerId) {
        return providerRepository.findById(providerId)
                .orElseThrow(() -> new IllegalArgumentException("provider not found: " + providerId));
    }

    private String writeMetadata(Map<String, Object> metadata) {
        if (metadata == null || metadata.isEmpty()) return null;
        try {
            return objectMapper.writeValueAsString(metadata);
        } catch (JsonProcessingException e) {
            throw new IllegalStateException("health log metadata serialization failed", e);
        }
    }

    private Map<String, Object> readMetadata(String json) {
        if (json == null || json.isBlank()) return Map.of();
        try {
            return objectMapper.readValue(json, MAP);
        } catch (JsonProcessingException e) {
            log.warn("Unreadable health log metadata: {}", e.getOriginalMessage());
            return Map.of();
        }
    }
}
