/*
 * Copyright (C) 2025 Maku Travel
 * SPDX-License-Identifier: AGPL-3.0-only
 */

package com.maku.application;

import com.maku.api.ApiException;
import com.maku.domain.model.NftTier;
import com.maku.domain.model.UserRole;
import com.maku.infrastructure.persistence.entity.UserEntity;
import com.maku.infrastructure.persistence.repository.UserRepository;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import org.springframework.http.HttpStatus;

import java.util.Optional;
import java.util.UUID;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertNull;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

@ExtendWith(MockitoExtension.class)
class UserEntitlementServiceTest {
    @Mock
    private UserRepository userRepository;

    private UserEntitlementService service;
    private UserEntity traveller;

    @BeforeEach
    void setUp() {
        service = new UserEntitlementService(userRepository);
        traveller = new UserEntity();
        traveller.setId(UUID.randomUUID());
        traveller.setEmail("traveller@maku.test");
        traveller.setRole(UserRole.USER);
        traveller.setNftTier(NftTier.BRONZE);
    }

    @Test
    void exposesRoleIdAndTierLabel() {
        when(userRepository.findByEmail("traveller@maku.test")).thenReturn(Optional.of(traveller));

        assertEquals("user", service.roleOf(" Traveller@Maku.test "));
        assertEquals("Bronze", service.tierOf("traveller@maku.test"));
    }

    @Test
    void unknownPrincipalHasNoEntitlements() {
        when(userRepository.findByEmail("ghost@maku.test")).thenReturn(Optional.empty());

        assertNull(service.roleOf("ghost@maku.test"));
        assertNull(service.tierOf(null));
    }

    @Test
    void updateChangesOnlyGivenFields() {
        when(userRepository.findByEmail("traveller@maku.test")).thenReturn(Optional.of(traveller));

        UserEntitlementService.UserEntitlementView view = service.updateEntitlements("traveller@maku.test", null, "gold");

        assertEquals("user", view.role());
        assertEquals("Gold", view.tier());
        verify(userRepository).save(traveller);
    }

    @Test
    void blankTierClearsIt() {
        when(userRepository.findByEmail("traveller@maku.test")).thenReturn(Optional.of(traveller));

        UserEntitlementService.UserEntitlementView view = service.updateEntitlements("traveller@maku.test", UserRole.PARTNER, " ");

        assertEquals("partner", view.role());
        assertNull(view.tier());
    }

    @Test
    void unknownTierIsRejected() {
        when(userRepository.findByEmail("traveller@maku.test")).thenReturn(Optional.of(traveller));

        assertThrows(IllegalArgumentException.class,
                () -> service.updateEntitlements("traveller@maku.test", null, "Diamond"));
        verify(userRepository, never()).save(any());
    }

    @Test
    void missingUserIsNotFound() {
        when(userRepository.findByEmail("ghost@maku.test")).thenReturn(Optional.empty());

        ApiException ex = assertThrows(ApiException.class, () -> service.get("ghost@maku.test"));

        assertEquals(HttpStatus.NOT_FOUND, ex.getStatus());
    }
}
