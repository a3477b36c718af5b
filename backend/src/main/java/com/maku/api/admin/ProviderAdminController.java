/*
 * Copyright (C) 2025 Maku Travel
 * SPDX-License-Identifier: AGPL-3.0-only
 */

package com.maku.api.admin;

import com.maku.api.ApiException;
import com.maku.application.health.HealthCheckRun;
import com.maku.application.health.HealthMonitorScheduler;
import com.maku.application.health.ProviderMetrics;
import com.maku.application.provider.ProviderAnalyticsService;
import com.maku.application.provider.ProviderRegistryService;
import com.maku.application.provider.ProviderView;
import com.maku.domain.model.ProviderType;
import jakarta.validation.Valid;
import jakarta.validation.constraints.Max;
import jakarta.validation.constraints.Min;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotNull;
import jakarta.validation.constraints.Pattern;
import jakarta.validation.constraints.Size;
import org.springframework.http.HttpStatus;
import org.springframework.validation.annotation.Validated;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PatchMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.ResponseStatus;
import org.springframework.web.bind.annotation.RestController;

import java.util.List;
import java.util.UUID;

@RestController
@RequestMapping("/api/admin/providers")
@Validated
public class ProviderAdminController {
    private final ProviderRegistryService registryService;
    private final ProviderAnalyticsService analyticsService;
    private final HealthMonitorScheduler healthMonitor;

    public ProviderAdminController(
            ProviderRegistryService registryService,
            ProviderAnalyticsService analyticsService,
            HealthMonitorScheduler healthMonitor
    ) {
        this.registryService = registryService;
        this.analyticsService = analyticsService;
        this.healthMonitor = healthMonitor;
    }

    @GetMapping
    public List<ProviderView> list() {
        return registryService.list();
    }

    @PostMapping
    @ResponseStatus(HttpStatus.CREATED)
    public ProviderView register(@Valid @RequestBody RegisterProviderRequest req) {
        return registryService.register(req.providerName(), req.displayName(), req.providerType(), req.priority(), req.active());
    }

    @PatchMapping("/{id}/priority")
    public ProviderView updatePriority(@PathVariable UUID id, @Valid @RequestBody UpdatePriorityRequest req) {
        return registryService.updatePriority(id, req.priority());
    }

    @PatchMapping("/{id}/active")
    public ProviderView setActive(@PathVariable UUID id, @Valid @RequestBody SetActiveRequest req) {
        return registryService.setActive(id, req.active());
    }

    @GetMapping("/health/summary")
    public ProviderRegistryService.HealthSummary healthSummary() {
        return registryService.healthSummary();
    }

    @GetMapping("/analytics/overview")
    public ProviderAnalyticsService.AnalyticsOverview overview() {
        return analyticsService.overview();
    }

    @GetMapping("/{id}/analytics")
    public ProviderAnalyticsService.ProviderAnalytics providerAnalytics(
            @PathVariable UUID id,
            @RequestParam(defaultValue = "7") @Min(1) @Max(90) int days
    ) {
        return analyticsService.providerAnalytics(id, days);
    }

    @PostMapping("/health/run")
    public HealthCheckRun runHealthChecks() {
        return healthMonitor.runHealthChecksNow()
                .orElseThrow(() -> new ApiException(HttpStatus.CONFLICT, "RUN_IN_PROGRESS", "Health checks already running"));
    }

    @PostMapping("/metrics/run")
    public MetricsRunResponse runMetrics() {
        List<ProviderMetrics> metrics = healthMonitor.calculateMetricsNow()
                .orElseThrow(() -> new ApiException(HttpStatus.CONFLICT, "RUN_IN_PROGRESS", "Metrics calculation already running"));
        return new MetricsRunResponse(metrics.size(), metrics);
    }

    @GetMapping("/monitor/status")
    public HealthMonitorScheduler.SchedulerStatus monitorStatus() {
        return healthMonitor.status();
    }

    public record RegisterProviderRequest(
            @NotBlank @Size(max = 64) @Pattern(regexp = "[A-Za-z0-9_\\-]+") String providerName,
            @Size(max = 128) String displayName,
            @NotNull ProviderType providerType,
            @Min(1) @Max(100) Integer priority,
            Boolean active
    ) {}

    public record UpdatePriorityRequest(@NotNull @Min(1) @Max(100) Integer priority) {}

    public record SetActiveRequest(@NotNull Boolean active) {}

    public record MetricsRunResponse(int providers, List<ProviderMetrics> metrics) {}
}
