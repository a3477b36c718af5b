/*
 * Copyright (C) 2025 Maku Travel
 * SPDX-License-Identifier: AGPL-3.0-only
 */

package com.maku.api.admin;

import com.maku.application.rollout.PhaseChange;
import com.maku.application.rollout.PhaseConfig;
import com.maku.application.rollout.PhaseStatus;
import com.maku.application.rollout.PhaseSummary;
import com.maku.application.rollout.PhaseTransition;
import com.maku.application.rollout.RolloutService;
import com.maku.domain.model.NftTier;
import jakarta.validation.Valid;
import jakarta.validation.constraints.Max;
import jakarta.validation.constraints.Min;
import jakarta.validation.constraints.NotBlank;
import org.springframework.validation.annotation.Validated;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.PutMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;

import java.time.Instant;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.stream.Collectors;

@RestController
@RequestMapping("/api/admin/rollout")
@Validated
public class RolloutAdminController {
    private final RolloutService rolloutService;

    public RolloutAdminController(RolloutService rolloutService) {
        this.rolloutService = rolloutService;
    }

    @GetMapping("/status")
    public RolloutStatusResponse status() {
        PhaseStatus status = rolloutService.status();
        return new RolloutStatusResponse(
                PhaseView.of(status.currentPhase(), true),
                status.recentChanges().stream().map(PhaseChangeView::of).toList()
        );
    }

    @GetMapping("/phases")
    public List<PhaseView> phases() {
        return rolloutService.listPhases().stream()
                .map(PhaseView::of)
                .toList();
    }

    @GetMapping("/history")
    public List<PhaseChangeView> history(@RequestParam(defaultValue = "20") @Min(1) @Max(100) int limit) {
        return rolloutService.history(limit).stream()
                .map(PhaseChangeView::of)
                .toList();
    }

    @PutMapping("/phase")
    public PhaseTransitionResponse setPhase(@Valid @RequestBody SetPhaseRequest req) {
        boolean enabled = req.enabled() == null || req.enabled();
        PhaseTransition transition = rolloutService.setPhase(req.phase(), enabled, req.modelsConfig());
        return new PhaseTransitionResponse(
                transition.previousPhase().id(),
                PhaseView.of(transition.currentPhase(), true),
                PhaseChangeView.of(transition.change())
        );
    }

    @PostMapping("/access-check")
    public AccessCheckResponse accessCheck(@RequestBody AccessCheckRequest req) {
        RolloutService.AccessEvaluation evaluation = rolloutService.evaluate(req.role(), req.tier());
        return new AccessCheckResponse(
                evaluation.role(),
                evaluation.tier(),
                evaluation.decision().allowed(),
                evaluation.decision().reason(),
                evaluation.decision().phase(),
                evaluation.recommendedModel()
        );
    }

    public record SetPhaseRequest(
            @NotBlank String phase,
            Boolean enabled,
            Map<String, String> modelsConfig
    ) {}

    public record AccessCheckRequest(String role, String tier) {}

    public record AccessCheckResponse(
            String role,
            String tier,
            boolean allowed,
            String reason,
            String phase,
            String recommendedModel
    ) {}

    public record RolloutStatusResponse(PhaseView currentPhase, List<PhaseChangeView> recentChanges) {}

    public record PhaseTransitionResponse(String previousPhase, PhaseView currentPhase, PhaseChangeView change) {}

    public record PhaseView(
            String phase,
            boolean enabled,
            String description,
            Set<String> roles,
            Set<String> tiers,
            Map<String, String> models,
            boolean current
    ) {
        static PhaseView of(PhaseSummary summary) {
            return of(summary.config(), summary.current());
        }

        static PhaseView of(PhaseConfig config, boolean current) {
            return new PhaseView(
                    config.phase().id(),
                    config.enabled(),
                    config.description(),
                    config.roles(),
                    config.tiers().stream().map(NftTier::label).collect(Collectors.toCollection(LinkedHashSet::new)),
                    config.models().asMap(),
                    current
            );
        }
    }

    public record PhaseChangeView(Instant changedAt, String oldPhase, String newPhase, boolean enabled) {
        static PhaseChangeView of(PhaseChange change) {
            return new PhaseChangeView(change.changedAt(), change.oldPhase().id(), change.newPhase().id(), change.enabled());
        }
    }
}
