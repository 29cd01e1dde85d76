package com.atrium.auth.service;

import com.atrium.auth.entity.User;
import com.atrium.auth.exception.AuthenticationFailedException;
import com.atrium.auth.repository.RefreshTokenRepository;
import com.atrium.auth.repository.UserRepository;
import com.atrium.auth.security.AccessClaims;
import com.atrium.auth.security.CredentialCodec;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.context.SpringBootTest;
import org.springframework.test.context.ActiveProfiles;

import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

@SpringBootTest
@ActiveProfiles("test")
class LocalCredentialAuthenticatorTest {

    private static final String PASSWORD = "test12345";

    @Autowired
    private LocalCredentialAuthenticator authenticator;

    @Autowired
    private CredentialCodec credentialCodec;

    @Autowired
    private UserRepository userRepository;

    @Autowired
    private RefreshTokenRepository refreshTokenRepository;

    @BeforeEach
    void cleanDatabase() {
        refreshTokenRepository.deleteAll();
        userRepository.deleteAll();
    }

    @Test
    void validCredentialsCreateLocalUserAndSession() {
        LoginResult result = authenticator.authenticate("admin", PASSWORD, null, null);

        User user = result.getUser();
        assertThat(user.getUsername()).isEqualTo("backup_admin");
        assertThat(user.getProvider()).isEqualTo(User.LOCAL_PROVIDER);
        assertThat(user.getProviderId()).isEqualTo("admin");
        assertThat(user.getEmail()).isEqualTo("backup_admin@atrium.local");
        assertThat(user.getFullName()).isEqualTo("Backup User: admin");
        assertThat(user.isAdmin()).isTrue();
        assertThat(user.getPermissions()).containsEntry("services", List.of("*"));

        AccessClaims claims = credentialCodec.verify(result.getTokens().getAccessToken()).orElseThrow();
        assertThat(claims.getUserId()).isEqualTo(user.getId());
        assertThat(claims.isAdmin()).isTrue();
        assertThat(result.getTokens().getRefreshToken()).isNotBlank();
    }

    @Test
    void configuredEmailAndNameAreUsed() {
        User user = authenticator.authenticate("operator", PASSWORD, null, null).getUser();

        assertThat(user.getEmail()).isEqualTo("ops@atrium.test");
        assertThat(user.getFullName()).isEqualTo("On-call Operator");
        assertThat(user.isAdmin()).isFalse();
    }

    @Test
    void requestOverridesWinOnFirstLogin() {
        User user = authenticator.authenticate("operator", PASSWORD, "pager@atrium.test", "Pager Duty").getUser();

        assertThat(user.getEmail()).isEqualTo("pager@atrium.test");
        assertThat(user.getFullName()).isEqualTo("Pager Duty");
    }

    @Test
    void repeatLoginReusesTheSameUser() {
        User first = authenticator.authenticate("admin", PASSWORD, null, null).getUser();
        User second = authenticator.authenticate("admin", PASSWORD, null, null).getUser();

        assertThat(second.getId()).isEqualTo(first.getId());
        assertThat(userRepository.count()).isEqualTo(1);
        assertThat(refreshTokenRepository.countByUserId(first.getId())).isEqualTo(2);
    }

    @Test
    void wrongPasswordIsRejectedWithoutSideEffects() {
        assertThatThrownBy(() -> authenticator.authenticate("admin", "wrong-password", null, null))
                .isInstanceOf(AuthenticationFailedException.class);

        assertThat(userRepository.count()).isZero();
        assertThat(refreshTokenRepository.count()).isZero();
    }

    @Test
    void unknownUsernameIsRejectedLikeAWrongPassword() {
        assertThatThrownBy(() -> authenticator.authenticate("nobody", PASSWORD, null, null))
                .isInstanceOf(AuthenticationFailedException.class)
                .hasMessage("Invalid backup credentials");

        assertThat(userRepository.count()).isZero();
    }
}
