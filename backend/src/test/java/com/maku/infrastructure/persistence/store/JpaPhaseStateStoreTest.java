/*
 * Copyright (C) 2025 Maku Travel
 * SPDX-License-Identifier: AGPL-3.0-only
 */

package com.maku.infrastructure.persistence.store;

import com.maku.application.rollout.PhaseChange;
import com.maku.application.rollout.PhaseState;
import com.maku.domain.model.RolloutPhase;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.context.SpringBootTest;
import org.springframework.jdbc.core.JdbcTemplate;
import org.springframework.test.annotation.DirtiesContext;
import org.springframework.test.context.ActiveProfiles;

import java.time.Instant;
import java.util.EnumMap;
import java.util.List;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertTrue;

@SpringBootTest
@ActiveProfiles("test")
@DirtiesContext(classMode = DirtiesContext.ClassMode.AFTER_CLASS)
class JpaPhaseStateStoreTest {
    @Autowired
    private JpaPhaseStateStore store;

    @Autowired
    private JdbcTemplate jdbcTemplate;

    @BeforeEach
    void clean() {
        jdbcTemplate.update("DELETE FROM rollout_phase_changes");
        jdbcTemplate.update("DELETE FROM rollout_phase_state");
    }

    @Test
    void emptyTablesLoadNothing() {
        assertTrue(store.load().isEmpty());
    }

    @Test
    void savedStateLoadsBack() {
        PhaseChange first = new PhaseChange(Instant.parse("2025-03-01T10:00:00.123Z"), RolloutPhase.ADMIN_ONLY, RolloutPhase.NFT_HOLDERS, true);
        PhaseChange second = new PhaseChange(Instant.parse("2025-03-02T09:30:00Z"), RolloutPhase.NFT_HOLDERS, RolloutPhase.ALL_USERS, false);

        store.save(state(RolloutPhase.NFT_HOLDERS, true), first);
        store.save(state(RolloutPhase.ALL_USERS, false), second);

        PhaseState loaded = store.load().orElseThrow();
        assertEquals(RolloutPhase.ALL_USERS, loaded.current());
        assertFalse(loaded.settings().get(RolloutPhase.ALL_USERS).enabled());
        assertEquals("o1", loaded.settings().get(RolloutPhase.ALL_USERS).models().get("Gold"));
        assertEquals(4, loaded.settings().size());
        assertEquals(List.of(second, first), loaded.history());
        assertEquals(1, jdbcTemplate.queryForObject(
                "SELECT COUNT(*) FROM rollout_phase_state WHERE is_current = 1", Integer.class));
    }

    @Test
    void unknownPersistedPhaseIsIgnored() {
        store.save(state(RolloutPhase.ADMIN_ONLY, true), null);
        jdbcTemplate.update(
                "INSERT INTO rollout_phase_state (phase, enabled, models_json, is_current, updated_at) VALUES (?, ?, ?, ?, ?)",
                "beta_testers", 1, "{}", 0, Instant.now().toEpochMilli());

        PhaseState loaded = store.load().orElseThrow();

        assertEquals(RolloutPhase.ADMIN_ONLY, loaded.current());
        assertEquals(4, loaded.settings().size());
        assertTrue(loaded.history().isEmpty());
    }

    private static PhaseState state(RolloutPhase current, boolean enabled) {
        Map<RolloutPhase, PhaseState.PhaseSettings> settings = new EnumMap<>(RolloutPhase.class);
        for (RolloutPhase phase : RolloutPhase.values()) {
            Map<String, String> models = phase == RolloutPhase.ALL_USERS
                    ? Map.of("default", "gpt-4o-mini", "Gold", "o1")
                    : Map.of("default", "gpt-4o-mini");
            settings.put(phase, new PhaseState.PhaseSettings(phase == current ? enabled : true, models));
        }
        return new PhaseState(current, settings, List.of());
    }
}
