/*
 * Copyright (C) 2025 Maku Travel
 * SPDX-License-Identifier: AGPL-3.0-only
 */

package com.maku.infrastructure.persistence.entity;

import jakarta.persistence.Column;
import jakarta.persistence.Entity;
import jakarta.persistence.Id;
import jakarta.persistence.PrePersist;
import jakarta.persistence.Table;
import org.hibernate.annotations.JdbcTypeCode;
import org.hibernate.type.SqlTypes;

import java.time.Instant;
import java.util.UUID;

@Entity
@Table(name = "rollout_phase_changes")
public class RolloutPhaseChangeEntity {
    @Id
    @JdbcTypeCode(SqlTypes.CHAR)
    @Column(name = "id", nullable = false, length = 36)
    private UUID id;

    @Column(name = "changed_at", nullable = false)
    private Instant changedAt;

    @Column(name = "old_phase", nullable = false)
    private String oldPhase;

    @Column(name = "new_phase", nullable = false)
    private String newPhase;

    @Column(name = "enabled", nullable = false)
    private boolean enabled;

    @PrePersist
    void prePersist() {
        if (id == null) id = UUID.randomUUID();
        if (changedAt == null) changedAt = Instant.now();
    }

    public UUID getId() {
        return id;
    }

    public Instant getChangedAt() {
        return changedAt;
    }

    public void setChangedAt(Instant changedAt) {
        this.changedAt = changedAt;
    }

    public String getOldPhase() {
        return oldPhase;
    }

    public void setOldPhase(String oldPhase) {
        this.oldPhase = oldPhase;
    }

    public String getNewPhase() {
        return newPhase;
    }

    public void setNewPhase(String newPhase) {
        this.newPhase = newPhase;
    }

    public boolean isEnabled() {
        return enabled;
    }

    public void setEnabled(boolean enabled) {
        this.enabled = enabled;
    }
}
