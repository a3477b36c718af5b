/*
 * Copyright (C) 2025 Maku Travel
 * SPDX-License-Identifier: AGPL-3.0-only
 */

package com.maku.application.health;

import java.util.Map;

/**
 * Performs the actual reachability check against providers.
 */
public interface HealthProbe {
    /**
     * @return results keyed by provider name, in probe order; a null value counts as a failed
     *         check for that provider only
     */
    Map<String, ProbeResult> checkAll();
}
