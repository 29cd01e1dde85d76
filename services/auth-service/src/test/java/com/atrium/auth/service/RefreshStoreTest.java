package com.atrium.auth.service;

import com.atrium.auth.entity.RefreshToken;
import com.atrium.auth.entity.User;
import com.atrium.auth.repository.RefreshTokenRepository;
import com.atrium.auth.repository.UserRepository;
import com.atrium.auth.security.Digests;
import com.atrium.auth.support.MutableClock;
import com.atrium.auth.support.TestClockConfig;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.context.SpringBootTest;
import org.springframework.context.annotation.Import;
import org.springframework.test.context.ActiveProfiles;

import java.time.Duration;
import java.time.Instant;
import java.util.List;
import java.util.UUID;

import static org.assertj.core.api.Assertions.assertThat;

@SpringBootTest
@ActiveProfiles("test")
@Import(TestClockConfig.class)
class RefreshStoreTest {

    @Autowired
    private RefreshStore refreshStore;

    @Autowired
    private RefreshTokenRepository refreshTokenRepository;

    @Autowired
    private UserRepository userRepository;

    @Autowired
    private MutableClock clock;

    private UUID userId;

    @BeforeEach
    void setUp() {
        refreshTokenRepository.deleteAll();
        userRepository.deleteAll();
        clock.set(Instant.now());
        userId = userRepository.save(User.builder()
                .email("store@example.com")
                .username("store")
                .provider("github")
                .providerId("1")
                .build()).getId();
    }

    @Test
    void issuedSecretResolvesToItsOwner() {
        String secret = refreshStore.issue(userId);

        assertThat(secret).matches("[A-Za-z0-9_-]{43}");
        assertThat(refreshStore.resolve(secret)).contains(userId);
    }

    @Test
    void onlyTheDigestIsStored() {
        String secret = refreshStore.issue(userId);

        List<RefreshToken> rows = refreshTokenRepository.findAll();
        assertThat(rows).hasSize(1);
        assertThat(rows.get(0).getTokenHash()).isEqualTo(Digests.sha256Hex(secret)).isNotEqualTo(secret);
        assertThat(rows.get(0).isRevoked()).isFalse();
    }

    @Test
    void eachIssueProducesADistinctSecret() {
        String first = refreshStore.issue(userId);
        String second = refreshStore.issue(userId);

        assertThat(first).isNotEqualTo(second);
        assertThat(refreshTokenRepository.countByUserId(userId)).isEqualTo(2);
    }

    @Test
    void unknownSecretsDoNotResolve() {
        refreshStore.issue(userId);

        assertThat(refreshStore.resolve("not-a-secret")).isEmpty();
        assertThat(refreshStore.resolve("")).isEmpty();
        assertThat(refreshStore.resolve(null)).isEmpty();
    }

    @Test
    void revokedSecretStopsResolvingAndRevokeIsIdempotent() {
        String secret = refreshStore.issue(userId);

        assertThat(refreshStore.revoke(secret)).isTrue();
        assertThat(refreshStore.resolve(secret)).isEmpty();
        assertThat(refreshStore.revoke(secret)).isTrue();
        assertThat(refreshStore.resolve(secret)).isEmpty();
    }

    @Test
    void revokingAnUnknownSecretReportsFalse() {
        assertThat(refreshStore.revoke("never-issued")).isFalse();
        assertThat(refreshStore.revoke(null)).isFalse();
    }

    @Test
    void revokingOneSecretLeavesOthersLive() {
        String first = refreshStore.issue(userId);
        String second = refreshStore.issue(userId);

        refreshStore.revoke(first);

        assertThat(refreshStore.resolve(second)).contains(userId);
    }

    @Test
    void secretExpiresAfterConfiguredLifetime() {
        String secret = refreshStore.issue(userId);

        clock.advance(Duration.ofDays(6));
        assertThat(refreshStore.resolve(secret)).contains(userId);

        clock.advance(Duration.ofDays(2));
        assertThat(refreshStore.resolve(secret)).isEmpty();
    }

    @Test
    void revokeAllRevokesEveryLiveSecretOfTheUser() {
        String first = refreshStore.issue(userId);
        String second = refreshStore.issue(userId);
        refreshStore.revoke(first);

        assertThat(refreshStore.revokeAll(userId)).isEqualTo(1);
        assertThat(refreshStore.resolve(second)).isEmpty();
        assertThat(refreshStore.revokeAll(userId)).isZero();
    }
}
