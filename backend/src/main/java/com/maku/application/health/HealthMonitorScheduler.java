/*
 * Copyright (C) 2025 Maku Travel
 * SPDX-License-Identifier: AGPL-3.0-only
 */

package com.maku.application.health;

import com.maku.config.AppProperties;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.context.SmartLifecycle;
import org.springframework.scheduling.TaskScheduler;
import org.springframework.stereotype.Component;

import java.time.Duration;
import java.util.List;
import java.util.Optional;
import java.util.concurrent.ScheduledFuture;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.concurrent.atomic.AtomicLong;
import java.util.function.Supplier;

/**
 * Drives {@link HealthPoller} on two independent fixed-rate jobs.
 * <p>
 * Each job skips a firing while its previous run is still in flight. Stopping cancels future
 * firings only; a run already in progress completes.
 */
@Component
public class HealthMonitorScheduler implements SmartLifecycle {
    private static final Logger log = LoggerFactory.getLogger(HealthMonitorScheduler.class);
    static final Duration DEFAULT_CHECK_INTERVAL = Duration.ofMinutes(5);
    static final Duration DEFAULT_METRICS_INTERVAL = Duration.ofHours(1);

    private final HealthPoller poller;
    private final TaskScheduler taskScheduler;
    private final boolean autoStartup;
    private final Duration checkInterval;
    private final Duration metricsInterval;

    private final AtomicBoolean healthChecksInFlight = new AtomicBoolean(false);
    private final AtomicBoolean metricsInFlight = new AtomicBoolean(false);
    private final AtomicLong skippedRuns = new AtomicLong();

    private ScheduledFuture<?> healthCheckFuture;
    private ScheduledFuture<?> metricsFuture;
    private volatile boolean running;

    public HealthMonitorScheduler(
            HealthPoller poller,
            @Qualifier("healthMonitorTaskScheduler") TaskScheduler taskScheduler,
            AppProperties properties
    ) {
        this.poller = poller;
        this.taskScheduler = taskScheduler;
        AppProperties.Health.Scheduler cfg = properties.health() == null ? null : properties.health().scheduler();
        this.autoStartup = cfg != null && cfg.enabled();
        this.checkInterval = positiveOrDefault(cfg == null ? null : cfg.checkInterval(), DEFAULT_CHECK_INTERVAL);
        this.metricsInterval = positiveOrDefault(cfg == null ? null : cfg.metricsInterval(), DEFAULT_METRICS_INTERVAL);
    }

    @Override
    public synchronized void start() {
        if (running) return;
        healthCheckFuture = taskScheduler.scheduleAtFixedRate(this::scheduledHealthChecks, checkInterval);
        metricsFuture = taskScheduler.scheduleAtFixedRate(this::scheduledMetrics, metricsInterval);
        running = true;
        log.info("Health monitor started checkInterval={} metricsInterval={}", checkInterval, metricsInterval);
    }

    @Override
    public synchronized void stop() {
        if (!running) return;
        cancel(healthCheckFuture);
        cancel(metricsFuture);
        healthCheckFuture = null;
        metricsFuture = null;
        running = false;
        log.info("Health monitor stopped");
    }

    @Override
    public boolean isRunning() {
        return running;
    }

    @Override
    public boolean isAutoStartup() {
        return autoStartup;
    }

    /**
     * Runs the health checks on the calling thread unless a run is already in flight.
     *
     * @return the run summary, or empty when the run was skipped
     */
    public Optional<HealthCheckRun> runHealthChecksNow() {
        return runExclusive("health-checks", healthChecksInFlight, poller::runHealthChecks);
    }

    /**
     * Recomputes provider metrics on the calling thread unless a run is already in flight.
     */
    public Optional<List<ProviderMetrics>> calculateMetricsNow() {
        return runExclusive("provider-metrics", metricsInFlight, poller::calculateProviderMetrics);
    }

    public SchedulerStatus status() {
        return new SchedulerStatus(
                running,
                healthChecksInFlight.get(),
                metricsInFlight.get(),
                skippedRuns.get(),
                checkInterval,
                metricsInterval
        );
    }

    void scheduledHealthChecks() {
        try {
            runHealthChecksNow();
        } catch (RuntimeException e) {
            log.error("Scheduled health checks failed", e);
        }
    }

    void scheduledMetrics() {
        try {
            calculateMetricsNow();
        } catch (RuntimeException e) {
            log.error("Scheduled provider metrics failed", e);
        }
    }

    private <T> Optional<T> runExclusive(String job, AtomicBoolean inFlight, Supplier<T> task) {
        if (!inFlight.compareAndSet(false, true)) {
            skippedRuns.incrementAndGet();
            log.warn("Skipping job={}: previous run still in flight", job);
            return Optional.empty();
        }
        try {
            return Optional.ofNullable(task.get());
        } finally {
            inFlight.set(false);
        }
    }

    private static void cancel(ScheduledFuture<?> future) {
        if (future != null) {
            future.cancel(false);
        }
    }

    private static Duration positiveOrDefault(Duration value, Duration fallback) {
        if (value == null || value.isZero() || value.isNegative()) return fallback;
        return value;
    }

    public record SchedulerStatus(
            boolean running,
            boolean healthChecksInFlight,
            boolean metricsInFlight,
            long skippedRuns,
            Duration checkInterval,
            Duration metricsInterval
    ) {}
}
