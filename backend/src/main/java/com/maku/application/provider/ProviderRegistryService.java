/*
 * Copyright (C) 2025 Maku Travel
 * SPDX-License-Identifier: AGPL-3.0-only
 */

package com.maku.application.provider;

import com.maku.api.ApiException;
import com.maku.domain.model.HealthStatus;
import com.maku.domain.model.ProviderType;
import com.maku.infrastructure.persistence.entity.ProviderEntity;
import com.maku.infrastructure.persistence.repository.ProviderRepository;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.http.HttpStatus;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.time.Clock;
import java.time.Instant;
import java.util.List;
import java.util.Locale;
import java.util.UUID;

/**
 * Admin maintenance of the provider registry. Lower priority values are tried first.
 */
@Service
public class ProviderRegistryService {
    private static final Logger log = LoggerFactory.getLogger(ProviderRegistryService.class);

    public static final int MIN_PRIORITY = 1;
    public static final int MAX_PRIORITY = 100;
    static final int DEFAULT_PRIORITY = 50;

    private final ProviderRepository providerRepository;
    private final Clock clock;

    public ProviderRegistryService(ProviderRepository providerRepository, Clock clock) {
        this.providerRepository = providerRepository;
        this.clock = clock;
    }

    @Transactional
    public List<ProviderView> list() {
        return providerRepository.findAllByOrderByPriorityAsc().stream()
                .map(ProviderView::from)
                .toList();
    }

    @Transactional
    public ProviderView register(String providerName, String displayName, ProviderType type, Integer priority, Boolean active) {
        if (providerName == null || providerName.isBlank()) {
            throw new IllegalArgumentException("providerName is required");
        }
        if (type == null) {
            throw new IllegalArgumentException("providerType is required");
        }
        String name = providerName.trim().toLowerCase(Locale.ROOT);
        if (providerRepository.existsByProviderName(name)) {
            throw new ApiException(HttpStatus.CONFLICT, "PROVIDER_EXISTS", "Provider already registered: " + name);
        }

        ProviderEntity entity = new ProviderEntity();
        entity.setProviderName(name);
        entity.setDisplayName(displayName == null || displayName.isBlank() ? name : displayName.trim());
        entity.setProviderType(type);
        entity.setPriority(checkPriority(priority == null ? DEFAULT_PRIORITY : priority));
        entity.setActive(active == null || active);
        providerRepository.save(entity);
        log.info("Provider registered name={} type={} priority={}", name, type, entity.getPriority());
        return ProviderView.from(entity);
    }

    @Transactional
    public ProviderView updatePriority(UUID id, int priority) {
        ProviderEntity entity = require(id);
        entity.setPriority(checkPriority(priority));
        providerRepository.save(entity);
        log.info("Provider priority updated name={} priority={}", entity.getProviderName(), priority);
        return ProviderView.from(entity);
    }

    @Transactional
    public ProviderView setActive(UUID id, boolean active) {
        ProviderEntity entity = require(id);
        boolean previous = entity.isActive();
        entity.setActive(active);
        providerRepository.save(entity);
        log.info("Provider active flag updated name={} previous={} active={}", entity.getProviderName(), previous, active);
        return ProviderView.from(entity);
    }

    /**
     * Live status of active providers, ordered by priority.
     */
    @Transactional
    public HealthSummary healthSummary() {
        List<ProviderHealthView> providers = providerRepository.findByActiveTrueOrderByPriorityAsc().stream()
                .map(p -> new ProviderHealthView(
                        p.getProviderName(),
                        p.getDisplayName(),
                        p.getHealthStatus(),
                        p.getAvgResponseTimeMs(),
                        p.getSuccessRatePercent(),
                        p.getLastHealthCheck(),
                        p.getPriority()
                ))
                .toList();
        return new HealthSummary(Instant.now(clock), providers.size(), providers);
    }

    ProviderEntity require(UUID id) {
        return providerRepository.findById(id)
                .orElseThrow(() -> new ApiException(HttpStatus.NOT_FOUND, "Provider not found"));
    }

    private static int checkPriority(int priority) {
        if (priority < MIN_PRIORITY || priority > MAX_PRIORITY) {
            throw new IllegalArgumentException("priority must be between " + MIN_PRIORITY + " and " + MAX_PRIORITY);
        }
        return priority;
    }

    public record HealthSummary(Instant timestamp, int totalProviders, List<ProviderHealthView> providers) {}

    public record ProviderHealthView(
            String providerName,
            String displayName,
            HealthStatus healthStatus,
            double avgResponseTimeMs,
            double successRatePercent,
            Instant lastCheck,
            int priority
    ) {}
}
