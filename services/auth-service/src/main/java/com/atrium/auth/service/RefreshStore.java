package com.atrium.auth.service;

import com.atrium.auth.config.AtriumAuthProperties;
import com.atrium.auth.entity.RefreshToken;
import com.atrium.auth.repository.RefreshTokenRepository;
import com.atrium.auth.security.Digests;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.security.SecureRandom;
import java.time.Clock;
import java.time.Instant;
import java.time.temporal.ChronoUnit;
import java.util.Base64;
import java.util.Optional;
import java.util.UUID;

/**
 * RefreshStore - database-backed opaque renewal secrets.
 *
 * Secret Handling:
 * - 256 bits from {@link SecureRandom}, base64url encoded for transport
 * - Only the SHA-256 hex digest is persisted; the raw value is returned to
 *   the caller once by {@link #issue(UUID)} and never again
 * - Raw secrets are never logged
 *
 * Concurrency:
 * - {@link #resolve(String)} is one SELECT filtering on revoked and expiry
 * - {@link #revoke(String)} is one conditional UPDATE
 * so a renewal racing a logout observes either the live or the revoked row,
 * never a partially applied change.
 *
 * Absent, revoked and expired credentials are indistinguishable to callers.
 */
@Slf4j
@Service
public class RefreshStore {

    private static final int SECRET_BYTES = 32;
    private static final Base64.Encoder ENCODER = Base64.getUrlEncoder().withoutPadding();

    private final RefreshTokenRepository refreshTokenRepository;
    private final Clock clock;
    private final long refreshTokenDays;
    private final SecureRandom random = new SecureRandom();

    public RefreshStore(RefreshTokenRepository refreshTokenRepository,
                        AtriumAuthProperties properties,
                        Clock clock) {
        this.refreshTokenRepository = refreshTokenRepository;
        this.clock = clock;
        this.refreshTokenDays = properties.getJwt().getRefreshTokenDays();
    }

    /**
     * Mint and persist a new refresh credential for a user.
     *
     * @param userId owning user
     * @return the raw secret; this is the only time it is available
     */
    @Transactional
    public String issue(UUID userId) {
        byte[] bytes = new byte[SECRET_BYTES];
        random.nextBytes(bytes);
        String secret = ENCODER.encodeToString(bytes);

        Instant now = clock.instant();
        RefreshToken token = RefreshToken.builder()
                .userId(userId)
                .tokenHash(Digests.sha256Hex(secret))
                .expiresAt(now.plus(refreshTokenDays, ChronoUnit.DAYS))
                .build();
        refreshTokenRepository.save(token);
        log.debug("Issued refresh credential {} for user {}", token.getId(), userId);
        return secret;
    }

    /**
     * @return owner of the credential, or empty when it is unknown, revoked or expired
     */
    @Transactional(readOnly = true)
    public Optional<UUID> resolve(String rawSecret) {
        if (rawSecret == null || rawSecret.isEmpty()) {
            return Optional.empty();
        }
        return refreshTokenRepository.findLiveOwner(Digests.sha256Hex(rawSecret), clock.instant());
    }

    /**
     * Revoke a credential. Revoking an already revoked credential succeeds
     * again without changing anything.
     *
     * @return false only when no credential with this secret was ever issued
     */
    @Transactional
    public boolean revoke(String rawSecret) {
        if (rawSecret == null || rawSecret.isEmpty()) {
            return false;
        }
        return refreshTokenRepository.revokeByHash(Digests.sha256Hex(rawSecret)) > 0;
    }

    /**
     * Revoke every live credential of a user.
     *
     * @return number of credentials revoked by this call
     */
    @Transactional
    public int revokeAll(UUID userId) {
        int revoked = refreshTokenRepository.revokeAllByUserId(userId);
        if (revoked > 0) {
            log.info("Revoked {} refresh credential(s) for user {}", revoked, userId);
        }
        return revoked;
    }
}
