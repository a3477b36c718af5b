/*
 * Copyright (C) 2025 Maku Travel
 * SPDX-License-Identifier: AGPL-3.0-only
 */

package com.maku.application.health;

import com.maku.domain.model.HealthStatus;

import java.time.Instant;
import java.util.List;
import java.util.UUID;

public interface HealthLogStore {
    void appendHealthLog(HealthLogEntry entry);

    List<HealthLogEntry> queryHealthLogs(UUID providerId, Instant since);

    void updateLiveStatus(UUID providerId, HealthStatus status, Instant checkedAt, long latencyMs);

    void updateMetrics(ProviderMetrics metrics);
}
