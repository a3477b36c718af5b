/*
 * Copyright (C) 2025 Maku Travel
 * SPDX-License-Identifier: AGPL-3.0-only
 */

package com.maku.application.health;

import com.maku.domain.model.HealthStatus;

import java.time.Instant;
import java.util.List;
import java.util.UUID;

public record ProviderMetrics(
        UUID providerId,
        double successRatePercent,
        double avgResponseTimeMs,
        double errorRatePercent,
        int sampleCount,
        Instant windowStart,
        Instant windowEnd
) {
    /**
     * Rolls up a window of health log rows. An empty window yields zero for every rate.
     */
    public static ProviderMetrics compute(UUID providerId, List<HealthLogEntry> entries, Instant windowStart, Instant windowEnd) {
        if (entries == null || entries.isEmpty()) {
            return new ProviderMetrics(providerId, 0, 0, 0, 0, windowStart, windowEnd);
        }
        long healthy = entries.stream().filter(e -> e.status() == HealthStatus.HEALTHY).count();
        long totalLatency = entries.stream().mapToLong(HealthLogEntry::responseTimeMs).sum();
        int total = entries.size();

        double successRate = healthy * 100.0 / total;
        double avgLatency = (double) totalLatency / (double) total;
        return new ProviderMetrics(providerId, successRate, avgLatency, 100.0 - successRate, total, windowStart, windowEnd);
    }
}
