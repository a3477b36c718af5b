/*
 * Copyright (C) 2025 Maku Travel
 * SPDX-License-Identifier: AGPL-3.0-only
 */

package com.maku.infrastructure.security;

import com.maku.config.AppProperties;
import com.maku.domain.model.UserRole;
import io.jsonwebtoken.Claims;
import io.jsonwebtoken.Jws;
import io.jsonwebtoken.JwtException;
import io.jsonwebtoken.Jwts;
import io.jsonwebtoken.SignatureAlgorithm;
import io.jsonwebtoken.security.Keys;
import org.springframework.stereotype.Service;

import javax.crypto.SecretKey;
import java.nio.charset.StandardCharsets;
import java.time.Clock;
import java.time.Instant;
import java.util.Date;

@Service
public class JwtService {
    static final long DEFAULT_TTL_SECONDS = 3600;

    private final SecretKey key;
    private final long ttlSeconds;
    private final Clock clock;

    public JwtService(AppProperties properties, Clock clock) {
        String secret = properties.jwt() == null ? null : properties.jwt().secret();
        if (secret == null || secret.isBlank() || secret.length() < 32) {
            throw new IllegalStateException("JWT_SECRET must be at least 32 chars");
        }
        this.key = Keys.hmacShaKeyFor(secret.getBytes(StandardCharsets.UTF_8));
        long ttl = properties.jwt().ttlSeconds();
        this.ttlSeconds = ttl > 0 ? ttl : DEFAULT_TTL_SECONDS;
        this.clock = clock;
    }

    public String mint(String email, UserRole role) {
        Instant now = Instant.now(clock);
        Instant exp = now.plusSeconds(ttlSeconds);
        return Jwts.builder()
                .setSubject(email)
                .claim("role", role.name())
                .setIssuedAt(Date.from(now))
                .setExpiration(Date.from(exp))
                .signWith(key, SignatureAlgorithm.HS256)
                .compact();
    }

    public long ttlSeconds() {
        return ttlSeconds;
    }

    /**
     * @throws IllegalArgumentException when the token is malformed, expired, badly signed or
     *                                  carries an unknown role
     */
    public JwtPrincipal parseAndValidate(String token) {
        try {
            Jws<Claims> jws = Jwts.parserBuilder()
                    .setSigningKey(key)
                    .build()
                    .parseClaimsJws(token);
            Claims claims = jws.getBody();
            String email = claims.getSubject();
            String roleStr = claims.get("role", String.class);
            return new JwtPrincipal(email, UserRole.valueOf(roleStr));
        } catch (JwtException | IllegalArgumentException | NullPointerException e) {
            throw new IllegalArgumentException("invalid token", e);
        }
    }
}
