package com.atrium.auth.security;

import com.atrium.auth.config.AtriumAuthProperties;
import io.jsonwebtoken.Claims;
import io.jsonwebtoken.JwtException;
import io.jsonwebtoken.JwtParser;
import io.jsonwebtoken.Jwts;
import io.jsonwebtoken.SignatureAlgorithm;
import io.jsonwebtoken.security.Keys;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.nio.charset.StandardCharsets;
import java.security.Key;
import java.time.Clock;
import java.time.Instant;
import java.time.temporal.ChronoUnit;
import java.util.Date;
import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Optional;
import java.util.UUID;

/**
 * CredentialCodec - mints and verifies signed access tokens.
 *
 * Access tokens are HS256 JSON Web Tokens (RFC 7519):
 * - Header: algorithm (HS256) and token type (JWT)
 * - Payload: subject (user id), email, username, is_admin, permissions,
 *   purpose discriminator (type=access), issued at, expiration
 * - Signature: HMAC-SHA256 using the configured secret
 *
 * Security Configuration (from application.yml):
 * - atrium.auth.jwt.secret: HMAC signing key, at least 256 bits
 * - atrium.auth.jwt.access-token-minutes: token lifetime
 *
 * The signing key is derived once at construction. A secret that is too
 * short for HS256 throws {@link io.jsonwebtoken.security.WeakKeyException}
 * and the application refuses to start; there is no per-call failure mode
 * for minting.
 *
 * Verification is deliberately opaque: bad signature, corrupted structure,
 * expiry and a foreign purpose all produce the same empty result so callers
 * cannot be used as an oracle.
 *
 * @see com.atrium.auth.service.SessionCoordinator for token issuance context
 */
@Slf4j
@Component
public class CredentialCodec {

    static final String TYPE_CLAIM = "type";
    static final String ACCESS_PURPOSE = "access";
    static final String EMAIL_CLAIM = "email";
    static final String USERNAME_CLAIM = "username";
    static final String ADMIN_CLAIM = "is_admin";
    static final String PERMISSIONS_CLAIM = "permissions";

    private final Key signingKey;
    private final JwtParser parser;
    private final Clock clock;
    private final long accessTokenMinutes;

    public CredentialCodec(AtriumAuthProperties properties, Clock clock) {
        this.clock = clock;
        this.accessTokenMinutes = properties.getJwt().getAccessTokenMinutes();
        this.signingKey = Keys.hmacShaKeyFor(properties.getJwt().getSecret().getBytes(StandardCharsets.UTF_8));
        this.parser = Jwts.parserBuilder()
                .setSigningKey(signingKey)
                .setClock(() -> Date.from(clock.instant()))
                .require(TYPE_CLAIM, ACCESS_PURPOSE)
                .build();
    }

    /**
     * Mint a signed access token for the given claims.
     *
     * The token expires {@code access-token-minutes} after the current clock
     * instant and carries the "access" purpose discriminator.
     *
     * @param claims identity snapshot to embed
     * @return compact serialized JWT (header.payload.signature)
     */
    public String mint(AccessClaims claims) {
        Instant now = clock.instant();
        Map<String, Object> payload = new HashMap<>();
        payload.put(TYPE_CLAIM, ACCESS_PURPOSE);
        payload.put(EMAIL_CLAIM, claims.getEmail());
        payload.put(USERNAME_CLAIM, claims.getUsername());
        payload.put(ADMIN_CLAIM, claims.isAdmin());
        payload.put(PERMISSIONS_CLAIM, claims.getPermissions() == null ? Map.of() : claims.getPermissions());

        return Jwts.builder()
                .setClaims(payload)
                .setSubject(claims.getUserId().toString())
                .setIssuedAt(Date.from(now))
                .setExpiration(Date.from(now.plus(accessTokenMinutes, ChronoUnit.MINUTES)))
                .signWith(signingKey, SignatureAlgorithm.HS256)
                .compact();
    }

    /**
     * Verify a token's signature, expiry and purpose.
     *
     * @param token compact JWT without the "Bearer " prefix
     * @return decoded claims, or empty for any kind of invalid token
     */
    public Optional<AccessClaims> verify(String token) {
        if (token == null || token.isBlank()) {
            return Optional.empty();
        }
        try {
            Claims body = parser.parseClaimsJws(token).getBody();
            return Optional.of(toAccessClaims(body));
        } catch (JwtException | IllegalArgumentException | ClassCastException e) {
            log.debug("Rejected access token: {}", e.getClass().getSimpleName());
            return Optional.empty();
        }
    }

    /**
     * @return configured access-token lifetime, as reported in {@code expires_in}
     */
    public long accessTokenLifetimeSeconds() {
        return accessTokenMinutes * 60;
    }

    private static AccessClaims toAccessClaims(Claims body) {
        Boolean admin = body.get(ADMIN_CLAIM, Boolean.class);
        return AccessClaims.builder()
                .userId(UUID.fromString(body.getSubject()))
                .email(body.get(EMAIL_CLAIM, String.class))
                .username(body.get(USERNAME_CLAIM, String.class))
                .admin(Boolean.TRUE.equals(admin))
                .permissions(permissionsOf(body.get(PERMISSIONS_CLAIM)))
                .build();
    }

    /**
     * Copy the permissions claim into a string-keyed map; anything that is not
     * a JSON object reads as no permissions.
     */
    private static Map<String, Object> permissionsOf(Object claim) {
        Map<String, Object> permissions = new LinkedHashMap<>();
        if (claim instanceof Map<?, ?> raw) {
            raw.forEach((key, value) -> permissions.put(String.valueOf(key), value));
        }
        return permissions;
    }
}
