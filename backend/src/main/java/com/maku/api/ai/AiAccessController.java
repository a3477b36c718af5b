/*
 * Copyright (C) 2025 Maku Travel
 * SPDX-License-Identifier: AGPL-3.0-only
 */

package com.maku.api.ai;

import com.maku.application.rollout.RolloutService;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.security.core.Authentication;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

/**
 * Tells a signed-in traveller whether the AI assistant is open to them and which model serves
 * them. Denied callers are pointed back at the legacy assistant.
 */
@RestController
@RequestMapping("/api/ai")
public class AiAccessController {
    private static final Logger log = LoggerFactory.getLogger(AiAccessController.class);

    private final RolloutService rolloutService;

    public AiAccessController(RolloutService rolloutService) {
        this.rolloutService = rolloutService;
    }

    @GetMapping("/access")
    public AiAccessResponse access(Authentication authentication) {
        RolloutService.AccessEvaluation evaluation = rolloutService.evaluateFor(authentication.getName());
        boolean allowed = evaluation.decision().allowed();
        if (!allowed) {
            log.debug("AI access denied phase={} reason={}", evaluation.decision().phase(), evaluation.decision().reason());
        }
        return new AiAccessResponse(
                allowed,
                evaluation.decision().reason(),
                evaluation.decision().phase(),
                evaluation.role(),
                evaluation.tier(),
                evaluation.recommendedModel(),
                !allowed
        );
    }

    public record AiAccessResponse(
            boolean allowed,
            String reason,
            String phase,
            String role,
            String tier,
            String model,
            boolean fallbackToLegacy
    ) {}
}
