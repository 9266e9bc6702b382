package com.workledger.api.security;

import io.jsonwebtoken.Claims;
import io.jsonwebtoken.JwtException;
import io.jsonwebtoken.Jwts;
import io.jsonwebtoken.security.Keys;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Component;

import javax.crypto.SecretKey;
import java.nio.charset.StandardCharsets;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.stream.Collectors;

@Component
public class JwtTokenProvider {

    private final SecretKey secretKey;

    public JwtTokenProvider(@Value("${workledger.jwt.secret}") String jwtSecret) {
        this.secretKey = Keys.hmacShaKeyFor(jwtSecret.getBytes(StandardCharsets.UTF_8));
    }

    /**
     * Verifies the token and resolves the caller it was issued to.
     *
     * @throws JwtException bad signature, expired, or no subject to key extraction jobs by
     */
    public AuthenticatedUser authenticate(String token) {
        Claims claims = getClaims(token);

        String userId = claims.getSubject();
        if (userId == null || userId.isBlank()) {
            throw new JwtException("Token has no subject");
        }

        return new AuthenticatedUser(userId, claims.get("email", String.class), getDisplayName(claims), getRoles(claims));
    }

    // Verifies the HS256 signature and expiry, then returns the claims
    Claims getClaims(String token) {
        return Jwts.parserBuilder()
                .setSigningKey(secretKey)
                .build()
                .parseClaimsJws(token)
                .getBody();
    }

    /**
     * Roles from the {@code roles} list claim, else the single {@code role} claim.
     * Tokens carrying neither are treated as plain employees.
     */
    @SuppressWarnings("unchecked")
    List<String> getRoles(Claims claims) {
        List<String> roles = claims.get("roles", List.class);
        if (roles != null && !roles.isEmpty()) {
            return roles.stream().map(role -> role.toUpperCase(Locale.ROOT)).collect(Collectors.toList());
        }

        String role = claims.get("role", String.class);
        if (role != null && !role.isBlank()) {
            return List.of(role.toUpperCase(Locale.ROOT));
        }

        return List.of("EMPLOYEE");
    }

    // "name", else the auth provider's user_metadata.full_name
    @SuppressWarnings("unchecked")
    private String getDisplayName(Claims claims) {
        String name = claims.get("name", String.class);
        if (name != null && !name.isBlank()) {
            return name;
        }
        Map<String, Object> metadata = claims.get("user_metadata", Map.class);
        Object fullName = metadata != null ? metadata.get("full_name") : null;
        return fullName instanceof String && !((String) fullName).isBlank() ? (String) fullName : null;
    }
}
