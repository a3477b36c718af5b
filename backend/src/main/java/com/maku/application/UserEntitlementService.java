/*
 * Copyright (C) 2025 Maku Travel
 * SPDX-License-Identifier: AGPL-3.0-only
 */

package com.maku.application;

import com.maku.api.ApiException;
import com.maku.application.rollout.EntitlementSource;
import com.maku.domain.model.NftTier;
import com.maku.domain.model.UserRole;
import com.maku.infrastructure.persistence.entity.UserEntity;
import com.maku.infrastructure.persistence.repository.UserRepository;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.http.HttpStatus;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.util.Locale;
import java.util.Optional;

/**
 * Role and NFT tier of each account, as consumed by the rollout gate. Principals are e-mail
 * addresses.
 */
@Service
public class UserEntitlementService implements EntitlementSource {
    private static final Logger log = LoggerFactory.getLogger(UserEntitlementService.class);

    private final UserRepository userRepository;

    public UserEntitlementService(UserRepository userRepository) {
        this.userRepository = userRepository;
    }

    @Override
    @Transactional
    public String roleOf(String principal) {
        return find(principal).map(u -> u.getRole().id()).orElse(null);
    }

    @Override
    @Transactional
    public String tierOf(String principal) {
        return find(principal)
                .map(UserEntity::getNftTier)
                .map(NftTier::label)
                .orElse(null);
    }

    /**
     * @param role  new role, or {@code null} to keep the current one
     * @param tier  new tier label, or {@code null} to keep the current one; blank clears it
     */
    @Transactional
    public UserEntitlementView updateEntitlements(String email, UserRole role, String tier) {
        UserEntity user = find(email)
                .orElseThrow(() -> new ApiException(HttpStatus.NOT_FOUND, "User not found"));

        if (role != null) user.setRole(role);
        if (tier != null) {
            if (tier.isBlank()) {
                user.setNftTier(null);
            } else {
                user.setNftTier(NftTier.fromLabel(tier)
                        .orElseThrow(() -> new IllegalArgumentException("Unknown NFT tier: " + tier)));
            }
        }
        userRepository.save(user);
        log.info("User entitlements updated role={} tier={}", user.getRole(), user.getNftTier());
        return toView(user);
    }

    @Transactional
    public UserEntitlementView get(String email) {
        return find(email)
                .map(UserEntitlementService::toView)
                .orElseThrow(() -> new ApiException(HttpStatus.NOT_FOUND, "User not found"));
    }

    private Optional<UserEntity> find(String email) {
        if (email == null || email.isBlank()) return Optional.empty();
        return userRepository.findByEmail(email.trim().toLowerCase(Locale.ROOT));
    }

    private static UserEntitlementView toView(UserEntity user) {
        return new UserEntitlementView(
                user.getEmail(),
                user.getRole().id(),
                user.getNftTier() == null ? null : user.getNftTier().label()
        );
    }

    public record UserEntitlementView(String email, String role, String tier) {}
}
