/*
 * Copyright (C) 2025 Maku Travel
 * SPDX-License-Identifier: AGPL-3.0-only
 */

package com.maku.application.rollout;

public record AccessDecision(
        boolean allowed,
        String reason,
        String phase
) {
    static AccessDecision allow(String reason, String phase) {
        return new AccessDecision(true, reason, phase);
    }

    static AccessDecision deny(String reason, String phase) {
        return new AccessDecision(false, reason, phase);
    }
}
