/*
 * Copyright (C) 2025 Maku Travel
 * SPDX-License-Identifier: AGPL-3.0-only
 */

package com.maku.application.health;

import com.maku.domain.model.HealthStatus;

import java.time.Instant;
import java.util.Map;
import java.util.UUID;

public record HealthLogEntry(
        UUID providerId,
        HealthStatus status,
        long responseTimeMs,
        String errorMessage,
        Map<String, Object> metadata,
        Instant checkedAt
) {}
