/*
 * Copyright (C) 2025 Maku Travel
 * SPDX-License-Identifier: AGPL-3.0-only
 */

package com.maku.application.rollout;

import com.maku.domain.model.RolloutPhase;

/**
 * Result of {@link PhaseGate#setPhase}. {@code state} is the full gate state right after this
 * change, captured under the same lock.
 */
public record PhaseTransition(
        RolloutPhase previousPhase,
        PhaseConfig currentPhase,
        PhaseChange change,
        PhaseState state
) {}
