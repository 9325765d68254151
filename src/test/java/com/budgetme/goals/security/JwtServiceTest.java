package com.budgetme.goals.security;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertNotNull;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

import java.util.Date;
import java.util.UUID;

import org.junit.jupiter.api.Test;
import org.springframework.test.util.ReflectionTestUtils;

import com.budgetme.goals.enums.Role;

import io.jsonwebtoken.JwtException;

class JwtServiceTest {

    private JwtService jwtService(String secret) {
        JwtService jwtService = new JwtService();
        // HS256 exige chave de 32+ bytes
        ReflectionTestUtils.setField(jwtService, "secret", secret);
        ReflectionTestUtils.setField(jwtService, "expirationMillis", 3_600_000L);
        return jwtService;
    }

    @Test
    void generateToken_subjectIsUserIdAndCarriesRole() {
        JwtService jwtService = jwtService("01234567890123456789012345678901");
        UUID userId = UUID.randomUUID();

        String token = jwtService.generateToken(userId, Role.ADMIN);

        assertNotNull(token);
        assertEquals(userId, jwtService.extractUserId(token));
        assertEquals(Role.ADMIN, jwtService.extractRole(token));
        assertTrue(jwtService.isTokenValid(token));
    }

    @Test
    void generateToken_usesConfiguredExpiration() {
        JwtService jwtService = jwtService("01234567890123456789012345678901");

        String token = jwtService.generateToken(UUID.randomUUID(), Role.USER);

        Date issuedAt = jwtService.extractClaim(token, c -> c.getIssuedAt());
        Date expiration = jwtService.extractClaim(token, c -> c.getExpiration());
        long deltaMs = expiration.getTime() - issuedAt.getTime();
        assertTrue(Math.abs(deltaMs - 3_600_000L) < 2_000L, "token deveria expirar em ~1h");
    }

    @Test
    void extractUserId_tokenSignedWithOtherKey_isRejected() {
        String foreign = jwtService("abcdefghijabcdefghijabcdefghijab").generateToken(UUID.randomUUID(), Role.USER);

        JwtService jwtService = jwtService("01234567890123456789012345678901");

        assertThrows(JwtException.class, () -> jwtService.extractUserId(foreign));
    }
}
