/*
 * Copyright (C) 2025 Maku Travel
 * SPDX-License-Identifier: AGPL-3.0-only
 */

package com.maku.application.rollout;

import com.maku.domain.model.NftTier;
import com.maku.domain.model.RolloutPhase;

import java.time.Clock;
import java.time.Instant;
import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Deque;
import java.util.EnumMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.concurrent.locks.ReadWriteLock;
import java.util.concurrent.locks.ReentrantReadWriteLock;

/**
 * Rollout state machine: a closed table of phases, exactly one of them current.
 * <p>
 * Any registered phase can be reached from any other through {@link #setPhase}; there is no
 * automatic progression. Reads and the single mutation share a read/write lock, so a reader
 * sees either the state before or after a {@code setPhase} call, never a mix.
 */
public class PhaseGate {
    public static final String FALLBACK_MODEL = "gpt-4o-mini";
    public static final int STATUS_HISTORY_LIMIT = 5;
    /** Changes kept in memory, and the number a store hands back on restore. */
    public static final int HISTORY_LIMIT = 100;

    private static final Set<String> ADMIN_ROLES = Set.of("admin", "superadmin");

    private final EnumMap<RolloutPhase, PhaseConfig> phases = new EnumMap<>(RolloutPhase.class);
    // newest first, at most HISTORY_LIMIT
    private final Deque<PhaseChange> history = new ArrayDeque<>();
    private final ReadWriteLock lock = new ReentrantReadWriteLock();
    private final Clock clock;
    private RolloutPhase current;

    public PhaseGate(Map<RolloutPhase, PhaseConfig> table, RolloutPhase initial, Clock clock) {
        if (table == null || table.isEmpty()) {
            throw new IllegalArgumentException("phase table must not be empty");
        }
        for (Map.Entry<RolloutPhase, PhaseConfig> entry : table.entrySet()) {
            if (entry.getValue() == null || entry.getValue().phase() != entry.getKey()) {
                throw new IllegalArgumentException("phase table entry mismatch for " + entry.getKey());
            }
            phases.put(entry.getKey(), entry.getValue());
        }
        if (initial == null || !phases.containsKey(initial)) {
            throw new IllegalArgumentException("initial phase is not registered: " + initial);
        }
        this.current = initial;
        this.clock = clock;
    }

    public static PhaseGate withDefaults(RolloutPhase initial, Clock clock) {
        return new PhaseGate(DefaultPhaseTable.build(), initial, clock);
    }

    public AccessDecision checkAccess(String role, String tier) {
        lock.readLock().lock();
        try {
            PhaseConfig phase = phases.get(current);
            String phaseId = current.id();
            if (!phase.enabled()) {
                return AccessDecision.deny("rollout disabled in phase " + phaseId, phaseId);
            }

            String normalizedRole = normalizeRole(role);
            if (normalizedRole != null && phase.roles().contains(normalizedRole)) {
                return AccessDecision.allow("role " + normalizedRole + " is enabled in phase " + phaseId, phaseId);
            }

            Optional<NftTier> nftTier = NftTier.fromLabel(tier);
            if (nftTier.isPresent() && phase.tiers().contains(nftTier.get())) {
                return AccessDecision.allow("tier " + nftTier.get().label() + " is enabled in phase " + phaseId, phaseId);
            }

            return AccessDecision.deny("not eligible in current phase", phaseId);
        } finally {
            lock.readLock().unlock();
        }
    }

    /**
     * Admin role beats a tier-specific mapping, which beats the phase default.
     */
    public String selectModel(String role, String tier) {
        lock.readLock().lock();
        try {
            ModelRouting models = phases.get(current).models();
            String fallback = models.defaultModel() != null ? models.defaultModel() : FALLBACK_MODEL;

            String normalizedRole = normalizeRole(role);
            if (normalizedRole != null && ADMIN_ROLES.contains(normalizedRole)) {
                return models.adminModel() != null ? models.adminModel() : fallback;
            }

            Optional<String> tierModel = NftTier.fromLabel(tier).flatMap(models::forTier);
            return tierModel.orElse(fallback);
        } finally {
            lock.readLock().unlock();
        }
    }

    /**
     * Makes {@code name} the current phase.
     *
     * @throws UnknownPhaseException when {@code name} is not a registered phase; state is unchanged
     * @throws IllegalArgumentException when an override key or value is invalid; state is unchanged
     */
    public PhaseTransition setPhase(String name, boolean enabled, Map<String, String> modelOverrides) {
        RolloutPhase target = RolloutPhase.fromId(name)
                .filter(phases::containsKey)
                .orElseThrow(() -> new UnknownPhaseException(name));

        lock.writeLock().lock();
        try {
            PhaseConfig existing = phases.get(target);
            ModelRouting models = existing.models().merge(modelOverrides);
            PhaseConfig updated = existing.withEnabled(enabled).withModels(models);

            RolloutPhase previous = current;
            phases.put(target, updated);
            current = target;

            PhaseChange change = new PhaseChange(Instant.now(clock), previous, target, enabled);
            history.addFirst(change);
            trimHistory();
            return new PhaseTransition(previous, updated, change, snapshotLocked());
        } finally {
            lock.writeLock().unlock();
        }
    }

    public PhaseConfig currentPhase() {
        lock.readLock().lock();
        try {
            return phases.get(current);
        } finally {
            lock.readLock().unlock();
        }
    }

    public PhaseStatus status() {
        lock.readLock().lock();
        try {
            return new PhaseStatus(phases.get(current), recent(STATUS_HISTORY_LIMIT));
        } finally {
            lock.readLock().unlock();
        }
    }

    public List<PhaseSummary> listPhases() {
        lock.readLock().lock();
        try {
            List<PhaseSummary> out = new ArrayList<>();
            for (PhaseConfig config : phases.values()) {
                out.add(new PhaseSummary(config, config.phase() == current));
            }
            return out;
        } finally {
            lock.readLock().unlock();
        }
    }

    public List<PhaseChange> history(int limit) {
        lock.readLock().lock();
        try {
            return recent(limit);
        } finally {
            lock.readLock().unlock();
        }
    }

    public PhaseState snapshot() {
        lock.readLock().lock();
        try {
            return snapshotLocked();
        } finally {
            lock.readLock().unlock();
        }
    }

    /**
     * Replaces current phase, per-phase settings and history with a persisted state.
     * Settings for phases missing from the state keep their defaults.
     */
    public void restore(PhaseState state) {
        if (state == null) return;
        lock.writeLock().lock();
        try {
            if (state.settings() != null) {
                for (Map.Entry<RolloutPhase, PhaseState.PhaseSettings> entry : state.settings().entrySet()) {
                    PhaseConfig existing = phases.get(entry.getKey());
                    if (existing == null || entry.getValue() == null) continue;
                    PhaseState.PhaseSettings s = entry.getValue();
                    ModelRouting models = s.models() == null ? existing.models() : ModelRouting.fromMap(s.models());
                    phases.put(entry.getKey(), existing.withEnabled(s.enabled()).withModels(models));
                }
            }
            if (state.current() != null && phases.containsKey(state.current())) {
                current = state.current();
            }
            history.clear();
            if (state.history() != null) {
                history.addAll(state.history());
                trimHistory();
            }
        } finally {
            lock.writeLock().unlock();
        }
    }

    static String normalizeRole(String role) {
        if (role == null || role.isBlank()) return null;
        return role.trim().toLowerCase();
    }

    // caller holds a lock
    private PhaseState snapshotLocked() {
        Map<RolloutPhase, PhaseState.PhaseSettings> settings = new EnumMap<>(RolloutPhase.class);
        for (PhaseConfig config : phases.values()) {
            settings.put(config.phase(), new PhaseState.PhaseSettings(config.enabled(), config.models().asMap()));
        }
        return new PhaseState(current, settings, List.copyOf(history));
    }

    private void trimHistory() {
        while (history.size() > HISTORY_LIMIT) {
            history.removeLast();
        }
    }

    private List<PhaseChange> recent(int limit) {
        if (limit <= 0) return List.of();
        List<PhaseChange> out = new ArrayList<>(Math.min(limit, history.size()));
        for (PhaseChange change : history) {
            if (out.size() >= limit) break;
            out.add(change);
        }
        return out;
    }
}
