/*
 * Copyright (C) 2025 Maku Travel
 * SPDX-License-Identifier: AGPL-3.0-only
 */

package com.maku.config;

import org.springframework.boot.context.properties.ConfigurationProperties;

import java.time.Duration;
import java.util.List;
import java.util.Map;

@ConfigurationProperties(prefix = "app")
public record AppProperties(
        Jwt jwt,
        Auth auth,
        Rollout rollout,
        Health health
) {
    public record Jwt(String secret, long ttlSeconds) {}

    public record Auth(List<String> adminEmails) {
        public boolean isAdminEmail(String email) {
            if (adminEmails == null || email == null) return false;
            return adminEmails.stream().anyMatch(e -> e != null && e.trim().equalsIgnoreCase(email.trim()));
        }
    }

    public record Rollout(String initialPhase) {}

    public record Health(
            Scheduler scheduler,
            Probe probe,
            Duration metricsWindow
    ) {
        public record Scheduler(
                boolean enabled,
                Duration checkInterval,
                Duration metricsInterval
        ) {}

        /**
         * @param targets provider name to health URL, probed in declaration order
         */
        public record Probe(
                Duration timeout,
                Duration degradedThreshold,
                Map<String, String> targets
        ) {}
    }
}
