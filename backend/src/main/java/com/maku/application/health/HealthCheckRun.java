/*
 * Copyright (C) 2025 Maku Travel
 * SPDX-License-Identifier: AGPL-3.0-only
 */

package com.maku.application.health;

import java.time.Instant;
import java.util.List;

public record HealthCheckRun(
        Instant startedAt,
        Instant finishedAt,
        int probed,
        List<String> recorded,
        List<String> skipped,
        List<String> failed
) {}
