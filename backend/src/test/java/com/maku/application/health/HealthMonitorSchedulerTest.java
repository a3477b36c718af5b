/*
 * Copyright (C) 2025 Maku Travel
 * SPDX-License-Identifier: AGPL-3.0-only
 */

package com.maku.application.health;

import com.maku.config.AppProperties;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import org.springframework.scheduling.TaskScheduler;

import java.time.Duration;
import java.time.Instant;
import java.util.List;
import java.util.Optional;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ScheduledFuture;
import java.util.concurrent.TimeUnit;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertTrue;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.doReturn;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.times;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

@ExtendWith(MockitoExtension.class)
class HealthMonitorSchedulerTest {
    @Mock
    private HealthPoller poller;

    @Mock
    private TaskScheduler taskScheduler;

    @Test
    void overlappingRunIsSkipped() throws Exception {
        CountDownLatch entered = new CountDownLatch(1);
        CountDownLatch release = new CountDownLatch(1);
        HealthCheckRun run = new HealthCheckRun(Instant.EPOCH, Instant.EPOCH, 0, List.of(), List.of(), List.of());
        when(poller.runHealthChecks()).thenAnswer(invocation -> {
            entered.countDown();
            assertTrue(release.await(5, TimeUnit.SECONDS));
            return run;
        });
        HealthMonitorScheduler scheduler = new HealthMonitorScheduler(poller, taskScheduler, properties(false));

        CompletableFuture<Optional<HealthCheckRun>> first = CompletableFuture.supplyAsync(scheduler::runHealthChecksNow);
        assertTrue(entered.await(5, TimeUnit.SECONDS));

        Optional<HealthCheckRun> second = scheduler.runHealthChecksNow();
        assertTrue(second.isEmpty());
        assertTrue(scheduler.status().healthChecksInFlight());
        assertEquals(1, scheduler.status().skippedRuns());

        release.countDown();
        assertEquals(Optional.of(run), first.get(5, TimeUnit.SECONDS));
        assertFalse(scheduler.status().healthChecksInFlight());
        verify(poller, times(1)).runHealthChecks();
    }

    @Test
    void guardIsReleasedAfterFailure() {
        when(poller.calculateProviderMetrics())
                .thenThrow(new IllegalStateException("boom"))
                .thenReturn(List.of());
        HealthMonitorScheduler scheduler = new HealthMonitorScheduler(poller, taskScheduler, properties(false));

        scheduler.scheduledMetrics();
        Optional<List<ProviderMetrics>> next = scheduler.calculateMetricsNow();

        assertTrue(next.isPresent());
        assertFalse(scheduler.status().metricsInFlight());
    }

    @Test
    void startSchedulesBothJobsAndStopCancelsWithoutInterrupt() {
        ScheduledFuture<?> future = mock(ScheduledFuture.class);
        doReturn(future).when(taskScheduler).scheduleAtFixedRate(any(Runnable.class), any(Duration.class));
        HealthMonitorScheduler scheduler = new HealthMonitorScheduler(poller, taskScheduler, properties(true));

        assertTrue(scheduler.isAutoStartup());
        scheduler.start();
        scheduler.start();

        assertTrue(scheduler.isRunning());
        verify(taskScheduler).scheduleAtFixedRate(any(Runnable.class), eq(Duration.ofMinutes(2)));
        verify(taskScheduler).scheduleAtFixedRate(any(Runnable.class), eq(Duration.ofMinutes(30)));

        scheduler.stop();

        assertFalse(scheduler.isRunning());
        verify(future, times(2)).cancel(false);
    }

    @Test
    void missingIntervalsUseDefaults() {
        HealthMonitorScheduler scheduler = new HealthMonitorScheduler(poller, taskScheduler, new AppProperties(null, null, null, null));

        assertFalse(scheduler.isAutoStartup());
        assertEquals(HealthMonitorScheduler.DEFAULT_CHECK_INTERVAL, scheduler.status().checkInterval());
        assertEquals(HealthMonitorScheduler.DEFAULT_METRICS_INTERVAL, scheduler.status().metricsInterval());
    }

    private static AppProperties properties(boolean enabled) {
        AppProperties.Health health = new AppProperties.Health(
                new AppProperties.Health.Scheduler(enabled, Duration.ofMinutes(2), Duration.ofMinutes(30)),
                null,
                Duration.ofHours(24)
        );
        return new AppProperties(null, null, null, health);
    }
}
