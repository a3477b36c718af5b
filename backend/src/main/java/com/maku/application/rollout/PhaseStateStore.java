/*
 * Copyright (C) 2025 Maku Travel
 * SPDX-License-Identifier: AGPL-3.0-only
 */

package com.maku.application.rollout;

import java.util.Optional;

public interface PhaseStateStore {
    Optional<PhaseState> load();

    void save(PhaseState state, PhaseChange change);
}
