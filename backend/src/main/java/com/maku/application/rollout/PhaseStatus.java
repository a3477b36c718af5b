/*
 * Copyright (C) 2025 Maku Travel
 * SPDX-License-Identifier: AGPL-3.0-only
 */

package com.maku.application.rollout;

import java.util.List;

public record PhaseStatus(
        PhaseConfig currentPhase,
        List<PhaseChange> recentChanges
) {}
