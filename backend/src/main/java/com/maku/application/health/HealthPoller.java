/*
 * Copyright (C) 2025 Maku Travel
 * SPDX-License-Identifier: AGPL-3.0-only
 */

package com.maku.application.health;

import com.maku.config.AppProperties;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.UUID;

/**
 * Orchestrates provider health checks and the rolling metrics computed from them.
 * <p>
 * Both jobs isolate failures per provider: one provider's lookup or write error is logged
 * and the batch moves on. Nothing is retried; a provider missing from one cycle is
 * attempted again on the next firing.
 */
@Service
public class HealthPoller {
    private static final Logger log = LoggerFactory.getLogger(HealthPoller.class);
    static final Duration DEFAULT_METRICS_WINDOW = Duration.ofHours(24);

    private final HealthProbe probe;
    private final ProviderRegistry registry;
    private final HealthLogStore logStore;
    private final Clock clock;
    private final Duration metricsWindow;

    public HealthPoller(
            HealthProbe probe,
            ProviderRegistry registry,
            HealthLogStore logStore,
            Clock clock,
            AppProperties properties
    ) {
        this.probe = probe;
        this.registry = registry;
        this.logStore = logStore;
        this.clock = clock;
        this.metricsWindow = metricsWindow(properties);
    }

    public HealthCheckRun runHealthChecks() {
        Instant startedAt = Instant.now(clock);
        Map<String, ProbeResult> results = probe.checkAll();

        List<String> recorded = new ArrayList<>();
        List<String> skipped = new ArrayList<>();
        List<String> failed = new ArrayList<>();

        for (Map.Entry<String, ProbeResult> entry : results.entrySet()) {
            String name = entry.getKey();
            ProbeResult result = entry.getValue();
            if (result == null) {
                log.error("Health check returned no result provider={}", name);
                failed.add(name);
                continue;
            }
            try {
                Optional<UUID> providerId = registry.findProviderId(name);
                if (providerId.isEmpty()) {
                    log.warn("Health check result for unregistered provider name={}", name);
                    skipped.add(name);
                    continue;
                }

                Instant checkedAt = Instant.now(clock);
                logStore.appendHealthLog(new HealthLogEntry(
                        providerId.get(),
                        result.status(),
                        result.latencyMs(),
                        result.detail(),
                        result.metadata(),
                        checkedAt
                ));
                logStore.updateLiveStatus(providerId.get(), result.status(), checkedAt, result.latencyMs());
                recorded.add(name);
            } catch (RuntimeException e) {
                log.error("Health check result not recorded provider={} status={}", name, result.status(), e);
                failed.add(name);
            }
        }

        Instant finishedAt = Instant.now(clock);
        log.info("Health checks completed probed={} recorded={} skipped={} failed={} durationMs={}",
                results.size(), recorded.size(), skipped.size(), failed.size(),
                Duration.between(startedAt, finishedAt).toMillis());
        return new HealthCheckRun(startedAt, finishedAt, results.size(), recorded, skipped, failed);
    }

    public List<ProviderMetrics> calculateProviderMetrics() {
        Instant windowEnd = Instant.now(clock);
        Instant windowStart = windowEnd.minus(metricsWindow);

        List<ProviderMetrics> computed = new ArrayList<>();
        int failures = 0;
        for (ProviderRef provider : registry.listActiveProviders()) {
            try {
                List<HealthLogEntry> entries = logStore.queryHealthLogs(provider.id(), windowStart);
                ProviderMetrics metrics = ProviderMetrics.compute(provider.id(), entries, windowStart, windowEnd);
                logStore.updateMetrics(metrics);
                computed.add(metrics);
                log.debug("Provider metrics updated provider={} samples={} successRate={} avgLatencyMs={}",
                        provider.name(), metrics.sampleCount(), metrics.successRatePercent(), metrics.avgResponseTimeMs());
            } catch (RuntimeException e) {
                failures++;
                log.error("Provider metrics not updated provider={}", provider.name(), e);
            }
        }

        log.info("Provider metrics computed updated={} failed={}", computed.size(), failures);
        return computed;
    }

    private static Duration metricsWindow(AppProperties properties) {
        if (properties.health() == null || properties.health().metricsWindow() == null) {
            return DEFAULT_METRICS_WINDOW;
        }
        return properties.health().metricsWindow();
    }
}
