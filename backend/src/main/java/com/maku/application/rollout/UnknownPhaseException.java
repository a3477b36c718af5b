/*
 * Copyright (C) 2025 Maku Travel
 * SPDX-License-Identifier: AGPL-3.0-only
 */

package com.maku.application.rollout;

public class UnknownPhaseException extends IllegalArgumentException {
    private final String phase;

    public UnknownPhaseException(String phase) {
        super("Unknown rollout phase: " + phase);
        this.phase = phase;
    }

    public String getPhase() {
        return phase;
    }
}
