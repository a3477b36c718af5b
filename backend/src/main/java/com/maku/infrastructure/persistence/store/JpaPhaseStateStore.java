/*
 * Copyright (C) 2025 Maku Travel
 * SPDX-License-Identifier: AGPL-3.0-only
 */

package com.maku.infrastructure.persistence.store;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.maku.application.rollout.PhaseChange;
import com.maku.application.rollout.PhaseGate;
import com.maku.application.rollout.PhaseState;
import com.maku.application.rollout.PhaseStateStore;
import com.maku.domain.model.RolloutPhase;
import com.maku.infrastructure.persistence.entity.RolloutPhaseChangeEntity;
import com.maku.infrastructure.persistence.entity.RolloutPhaseStateEntity;
import com.maku.infrastructure.persistence.repository.RolloutPhaseChangeRepository;
import com.maku.infrastructure.persistence.repository.RolloutPhaseStateRepository;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.data.domain.PageRequest;
import org.springframework.stereotype.Component;
import org.springframework.transaction.annotation.Transactional;

import java.util.ArrayList;
import java.util.EnumMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

@Component
public class JpaPhaseStateStore implements PhaseStateStore {
    private static final Logger log = LoggerFactory.getLogger(JpaPhaseStateStore.class);
    private static final TypeReference<Map<String, String>> MAP = new TypeReference<>() {};

    private final RolloutPhaseStateRepository stateRepository;
    private final RolloutPhaseChangeRepository changeRepository;
    private final ObjectMapper objectMapper;

    public JpaPhaseStateStore(
            RolloutPhaseStateRepository stateRepository,
            RolloutPhaseChangeRepository changeRepository,
            ObjectMapper objectMapper
    ) {
        this.stateRepository = stateRepository;
        this.changeRepository = changeRepository;
        this.objectMapper = objectMapper;
    }

    @Override
    @Transactional
    public Optional<PhaseState> load() {
        List<RolloutPhaseStateEntity> rows = stateRepository.findAll();
        if (rows.isEmpty()) return Optional.empty();

        RolloutPhase current = null;
        Map<RolloutPhase, PhaseState.PhaseSettings> settings = new EnumMap<>(RolloutPhase.class);
        for (RolloutPhaseStateEntity row : rows) {
            Optional<RolloutPhase> phase = RolloutPhase.fromId(row.getPhase());
            if (phase.isEmpty()) {
                log.warn("Ignoring persisted state of unknown rollout phase={}", row.getPhase());
                continue;
            }
            settings.put(phase.get(), new PhaseState.PhaseSettings(row.isEnabled(), readModels(row.getModelsJson())));
            if (row.isCurrent()) current = phase.get();
        }

        List<PhaseChange> history = new ArrayList<>();
        for (RolloutPhaseChangeEntity row : changeRepository.findRecent(PageRequest.of(0, PhaseGate.HISTORY_LIMIT))) {
            Optional<RolloutPhase> oldPhase = RolloutPhase.fromId(row.getOldPhase());
            Optional<RolloutPhase> newPhase = RolloutPhase.fromId(row.getNewPhase());
            if (oldPhase.isEmpty() || newPhase.isEmpty()) continue;
            history.add(new PhaseChange(row.getChangedAt(), oldPhase.get(), newPhase.get(), row.isEnabled()));
        }

        return Optional.of(new PhaseState(current, settings, history));
    }

    @Override
    @Transactional
    public void save(PhaseState state, PhaseChange change) {
        for (Map.Entry<RolloutPhase, PhaseState.PhaseSettings> entry : state.settings().entrySet()) {
            RolloutPhase phase = entry.getKey();
            RolloutPhaseStateEntity row = stateRepository.findById(phase.id()).orElseGet(() -> {
                RolloutPhaseStateEntity e = new RolloutPhaseStateEntity();
                e.setPhase(phase.id());
                return e;
            });
            row.setEnabled(entry.getValue().enabled());
            row.setModelsJson(writeModels(entry.getValue().models()));
            row.setCurrent(phase == state.current());
            stateRepository.save(row);
        }

        if (change != null) {
            RolloutPhaseChangeEntity row = new RolloutPhaseChangeEntity();
            row.setChangedAt(change.changedAt());
            row.setOldPhase(change.oldPhase().id());
            row.setNewPhase(change.newPhase().id());
            row.setEnabled(change.enabled());
            changeRepository.save(row);
        }
    }

    private Map<String, String> readModels(String json) {
        if (json == null || json.isBlank()) return null;
        try {
            return objectMapper.readValue(json, MAP);
        } catch (JsonProcessingException e) {
            throw new IllegalStateException("rollout model config deserialization failed", e);
        }
    }

    private String writeModels(Map<String, String> models) {
        try {
            return objectMapper.writeValueAsString(models == null ? Map.of() : models);
        } catch (JsonProcessingException e) {
            throw new IllegalStateException("rollout model config serialization failed", e);
        }
    }
}
