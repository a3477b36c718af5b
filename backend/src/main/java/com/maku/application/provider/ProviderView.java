/*
 * Copyright (C) 2025 Maku Travel
 * SPDX-License-Identifier: AGPL-3.0-only
 */

package com.maku.application.provider;

import com.maku.domain.model.HealthStatus;
import com.maku.domain.model.ProviderType;
import com.maku.infrastructure.persistence.entity.ProviderEntity;

import java.time.Instant;
import java.util.UUID;

public record ProviderView(
        UUID id,
        String providerName,
        String displayName,
        ProviderType providerType,
        boolean active,
        int priority,
        HealthStatus healthStatus,
        Instant lastHealthCheck,
        Long responseTimeMs,
        double avgResponseTimeMs,
        double successRatePercent,
        double errorRatePercent,
        Instant metricsUpdatedAt
) {
    static ProviderView from(ProviderEntity e) {
        return new ProviderView(
                e.getId(),
                e.getProviderName(),
                e.getDisplayName(),
                e.getProviderType(),
                e.isActive(),
                e.getPriority(),
                e.getHealthStatus(),
                e.getLastHealthCheck(),
                e.getResponseTimeMs(),
                e.getAvgResponseTimeMs(),
                e.getSuccessRatePercent(),
                e.getErrorRatePercent(),
                e.getMetricsUpdatedAt()
        );
    }
}
