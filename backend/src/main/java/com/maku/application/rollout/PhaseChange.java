/*
 * Copyright (C) 2025 Maku Travel
 * SPDX-License-Identifier: AGPL-3.0-only
 */

package com.maku.application.rollout;

import com.maku.domain.model.RolloutPhase;

import java.time.Instant;

public record PhaseChange(
        Instant changedAt,
        RolloutPhase oldPhase,
        RolloutPhase newPhase,
        boolean enabled
) {}
