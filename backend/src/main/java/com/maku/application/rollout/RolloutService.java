/*
 * Copyright (C) 2025 Maku Travel
 * SPDX-License-Identifier: AGPL-3.0-only
 */

package com.maku.application.rollout;

import com.maku.config.AppProperties;
import com.maku.domain.model.RolloutPhase;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * Owns the process-wide {@link PhaseGate}. Phase changes are saved through the
 * {@link PhaseStateStore} after they are applied in memory; a failed save is logged and the
 * in-memory change stands.
 */
@Service
public class RolloutService {
    private static final Logger log = LoggerFactory.getLogger(RolloutService.class);
    private static final String DEFAULT_INITIAL_PHASE = "admin_only";

    private final PhaseGate gate;
    private final PhaseStateStore stateStore;
    private final EntitlementSource entitlementSource;

    public RolloutService(
            AppProperties properties,
            PhaseStateStore stateStore,
            EntitlementSource entitlementSource,
            Clock clock
    ) {
        this.stateStore = stateStore;
        this.entitlementSource = entitlementSource;
        this.gate = PhaseGate.withDefaults(resolveInitialPhase(properties), clock);
        restore();
    }

    public AccessDecision checkAccess(String role, String tier) {
        return gate.checkAccess(role, tier);
    }

    public String selectModel(String role, String tier) {
        return gate.selectModel(role, tier);
    }

    public AccessEvaluation evaluate(String role, String tier) {
        AccessDecision decision = gate.checkAccess(role, tier);
        String model = decision.allowed() ? gate.selectModel(role, tier) : null;
        return new AccessEvaluation(role, tier, decision, model);
    }

    public AccessEvaluation evaluateFor(String principal) {
        String role = entitlementSource.roleOf(principal);
        String tier = entitlementSource.tierOf(principal);
        return evaluate(role, tier);
    }

    /**
     * Saves reach the store in the order the gate applied the changes.
     */
    public synchronized PhaseTransition setPhase(String name, boolean enabled, Map<String, String> modelOverrides) {
        PhaseTransition transition = gate.setPhase(name, enabled, modelOverrides);
        log.info("Rollout phase changed old={} new={} enabled={} overrides={}",
                transition.previousPhase().id(),
                transition.currentPhase().phase().id(),
                enabled,
                modelOverrides == null ? Map.of() : modelOverrides.keySet());
        try {
            stateStore.save(transition.state(), transition.change());
        } catch (RuntimeException e) {
            log.error("Rollout phase change not persisted phase={}", transition.currentPhase().phase().id(), e);
        }
        return transition;
    }

    public PhaseStatus status() {
        return gate.status();
    }

    public List<PhaseSummary> listPhases() {
        return gate.listPhases();
    }

    public List<PhaseChange> history(int limit) {
        return gate.history(limit);
    }

    private void restore() {
        try {
            Optional<PhaseState> state = stateStore.load();
            if (state.isEmpty()) return;
            gate.restore(state.get());
            log.info("Rollout state restored phase={} changes={}",
                    gate.currentPhase().phase().id(),
                    state.get().history() == null ? 0 : state.get().history().size());
        } catch (RuntimeException e) {
            log.error("Rollout state could not be restored, starting from defaults", e);
        }
    }

    private static RolloutPhase resolveInitialPhase(AppProperties properties) {
        String configured = properties.rollout() == null ? null : properties.rollout().initialPhase();
        if (configured == null || configured.isBlank()) configured = DEFAULT_INITIAL_PHASE;
        String name = configured;
        return RolloutPhase.fromId(name)
                .orElseThrow(() -> new IllegalStateException("Unknown app.rollout.initial-phase: " + name));
    }

    public record AccessEvaluation(
            String role,
            String tier,
            AccessDecision decision,
            String recommendedModel
    ) {}
}
