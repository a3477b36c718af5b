/*
 * Copyright (C) 2025 Maku Travel
 * SPDX-License-Identifier: AGPL-3.0-only
 */

package com.maku.application.health;

import com.maku.domain.model.HealthStatus;

import java.util.Map;

public record ProbeResult(
        HealthStatus status,
        long latencyMs,
        String detail,
        Map<String, Object> metadata
) {
    public ProbeResult {
        if (status == null) status = HealthStatus.UNKNOWN;
        metadata = metadata == null ? Map.of() : Map.copyOf(metadata);
    }
}
