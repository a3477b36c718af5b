/*
 * Copyright (C) 2025 Maku Travel
 * SPDX-License-Identifier: AGPL-3.0-only
 */

package com.maku.application.rollout;

public record PhaseSummary(
        PhaseConfig config,
        boolean current
) {}
