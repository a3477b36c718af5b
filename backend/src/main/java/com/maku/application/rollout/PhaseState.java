/*
 * Copyright (C) 2025 Maku Travel
 * SPDX-License-Identifier: AGPL-3.0-only
 */

package com.maku.application.rollout;

import com.maku.domain.model.RolloutPhase;

import java.util.List;
import java.util.Map;

/**
 * Persistable form of the gate: the current phase, each phase's mutable settings and the
 * change history, newest first.
 */
public record PhaseState(
        RolloutPhase current,
        Map<RolloutPhase, PhaseSettings> settings,
        List<PhaseChange> history
) {
    public record PhaseSettings(boolean enabled, Map<String, String> models) {}
}
