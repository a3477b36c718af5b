/*
 * Copyright (C) 2025 Maku Travel
 * SPDX-License-Identifier: AGPL-3.0-only
 */

package com.maku.application.provider;

import com.maku.api.ApiException;
import com.maku.application.health.HealthLogEntry;
import com.maku.application.health.HealthLogStore;
import com.maku.domain.model.HealthStatus;
import com.maku.infrastructure.persistence.entity.ProviderEntity;
import com.maku.infrastructure.persistence.repository.ProviderRepository;
import org.springframework.http.HttpStatus;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.Comparator;
import java.util.EnumMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.UUID;

/**
 * Read-only dashboards over the provider registry and the health log.
 */
@Service
public class ProviderAnalyticsService {
    public static final int MIN_DAYS = 1;
    public static final int MAX_DAYS = 90;
    static final int TOP_PERFORMERS = 5;
    static final int ERROR_KEY_LENGTH = 50;

    private static final Comparator<ProviderEntity> BY_PERFORMANCE = Comparator
            .comparingDouble(ProviderEntity::getSuccessRatePercent).reversed()
            .thenComparingDouble(ProviderEntity::getAvgResponseTimeMs);

    private final ProviderRepository providerRepository;
    private final HealthLogStore healthLogStore;
    private final Clock clock;

    public ProviderAnalyticsService(ProviderRepository providerRepository, HealthLogStore healthLogStore, Clock clock) {
        this.providerRepository = providerRepository;
        this.healthLogStore = healthLogStore;
        this.clock = clock;
    }

    @Transactional
    public AnalyticsOverview overview() {
        List<ProviderEntity> providers = providerRepository.findAll();
        int total = providers.size();
        int active = (int) providers.stream().filter(ProviderEntity::isActive).count();

        Map<HealthStatus, Long> distribution = new EnumMap<>(HealthStatus.class);
        double latencySum = 0;
        double successSum = 0;
        for (ProviderEntity p : providers) {
            HealthStatus status = p.getHealthStatus() == null ? HealthStatus.UNKNOWN : p.getHealthStatus();
            distribution.merge(status, 1L, Long::sum);
            latencySum += p.getAvgResponseTimeMs();
            successSum += p.getSuccessRatePercent();
        }

        List<TopPerformer> top = providers.stream()
                .sorted(BY_PERFORMANCE)
                .limit(TOP_PERFORMERS)
                .map(p -> new TopPerformer(
                        p.getProviderName(),
                        p.getDisplayName(),
                        p.getSuccessRatePercent(),
                        p.getAvgResponseTimeMs(),
                        p.getHealthStatus()
                ))
                .toList();

        return new AnalyticsOverview(
                Instant.now(clock),
                total,
                active,
                total - active,
                distribution,
                total == 0 ? 0 : Math.round(latencySum / total),
                total == 0 ? 0.0 : round2(successSum / total),
                top
        );
    }

    @Transactional
    public ProviderAnalytics providerAnalytics(UUID providerId, int days) {
        if (days < MIN_DAYS || days > MAX_DAYS) {
            throw new IllegalArgumentException("days must be between " + MIN_DAYS + " and " + MAX_DAYS);
        }
        ProviderEntity provider = providerRepository.findById(providerId)
                .orElseThrow(() -> new ApiException(HttpStatus.NOT_FOUND, "Provider not found"));

        Instant to = Instant.now(clock);
        Instant from = to.minus(Duration.ofDays(days));
        List<HealthLogEntry> logs = healthLogStore.queryHealthLogs(providerId, from);

        Map<HealthStatus, Long> counts = new EnumMap<>(HealthStatus.class);
        for (HealthStatus status : HealthStatus.values()) counts.put(status, 0L);
        Map<String, Long> errors = new LinkedHashMap<>();
        for (HealthLogEntry entry : logs) {
            counts.merge(entry.status(), 1L, Long::sum);
            String error = entry.errorMessage();
            if (error != null && !error.isEmpty()) {
                String key = error.length() > ERROR_KEY_LENGTH ? error.substring(0, ERROR_KEY_LENGTH) : error;
                errors.merge(key, 1L, Long::sum);
            }
        }

        int total = logs.size();
        long healthy = counts.get(HealthStatus.HEALTHY);
        CheckSummary summary = new CheckSummary(
                total,
                healthy,
                counts.get(HealthStatus.DEGRADED),
                counts.get(HealthStatus.UNHEALTHY),
                counts.get(HealthStatus.UNKNOWN),
                total == 0 ? 0.0 : round2(healthy * 100.0 / total)
        );

        List<LatencyPoint> trend = logs.stream()
                .map(e -> new LatencyPoint(e.checkedAt(), e.responseTimeMs()))
                .toList();

        return new ProviderAnalytics(
                ProviderView.from(provider),
                new Period(days, from, to),
                summary,
                trend,
                errors
        );
    }

    static double round2(double value) {
        return Math.round(value * 100.0) / 100.0;
    }

    public record AnalyticsOverview(
            Instant timestamp,
            int totalProviders,
            int activeProviders,
            int inactiveProviders,
            Map<HealthStatus, Long> healthDistribution,
            long avgResponseTimeMs,
            double avgSuccessRatePercent,
            List<TopPerformer> topPerformers
    ) {}

    public record TopPerformer(
            String providerName,
            String displayName,
            double successRatePercent,
            double avgResponseTimeMs,
            HealthStatus healthStatus
    ) {}

    /**
     * {@code provider} carries the current live status and metrics.
     */
    public record ProviderAnalytics(
            ProviderView provider,
            Period period,
            CheckSummary healthSummary,
            List<LatencyPoint> responseTimeTrend,
            Map<String, Long> errorAnalysis
    ) {}

    public record Period(int days, Instant from, Instant to) {}

    public record CheckSummary(
            int totalChecks,
            long healthy,
            long degraded,
            long unhealthy,
            long unknown,
            double uptimePercent
    ) {}

    public record LatencyPoint(Instant timestamp, long responseTimeMs) {}
}
