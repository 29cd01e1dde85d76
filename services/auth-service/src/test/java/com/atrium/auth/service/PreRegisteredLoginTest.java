package com.atrium.auth.service;

import com.atrium.auth.entity.User;
import com.atrium.auth.exception.UserNotRegisteredException;
import com.atrium.auth.oauth.OAuthProvider;
import com.atrium.auth.oauth.ProviderProfile;
import com.atrium.auth.repository.RefreshTokenRepository;
import com.atrium.auth.repository.UserRepository;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.context.SpringBootTest;
import org.springframework.test.context.ActiveProfiles;

import java.util.List;
import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

/**
 * Logins under the default pre-registration policy.
 */
@SpringBootTest
@ActiveProfiles("test")
class PreRegisteredLoginTest {

    @Autowired
    private SessionCoordinator sessionCoordinator;

    @Autowired
    private UserAdministrationService userAdministrationService;

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
    void unknownAccountIsRejectedWithoutCreatingAUser() {
        assertThatThrownBy(() -> sessionCoordinator.completeLogin(profile(OAuthProvider.GITHUB, "55", "dev@example.com")))
                .isInstanceOf(UserNotRegisteredException.class);

        assertThat(userRepository.count()).isZero();
        assertThat(refreshTokenRepository.count()).isZero();
    }

    @Test
    void firstLoginBindsThePreRegisteredUser() {
        User registered = userAdministrationService.preRegister(
                "Dev@Example.com", "github", null, "Dev Eloper", true, Map.of("services", List.of("deploy")));
        assertThat(registered.getProviderId()).isNull();
        assertThat(registered.getUsername()).isEqualTo("dev");

        LoginResult result = sessionCoordinator.completeLogin(profile(OAuthProvider.GITHUB, "55", "dev@example.com"));

        assertThat(result.getUser().getId()).isEqualTo(registered.getId());
        assertThat(result.getUser().getProviderId()).isEqualTo("55");
        assertThat(result.getUser().getUsername()).isEqualTo("dev");
        assertThat(result.getUser().isAdmin()).isTrue();
        assertThat(result.getUser().getPermissions()).containsEntry("services", List.of("deploy"));

        LoginResult again = sessionCoordinator.completeLogin(profile(OAuthProvider.GITHUB, "55", "dev@example.com"));
        assertThat(again.getUser().getId()).isEqualTo(registered.getId());
        assertThat(userRepository.count()).isEqualTo(1);
    }

    @Test
    void preRegistrationIsScopedToItsProvider() {
        userAdministrationService.preRegister("dev@example.com", "google", null, null, false, null);

        assertThatThrownBy(() -> sessionCoordinator.completeLogin(profile(OAuthProvider.GITHUB, "55", "dev@example.com")))
                .isInstanceOf(UserNotRegisteredException.class);
    }

    @Test
    void boundUserIsNotRebindableByAnotherAccount() {
        userAdministrationService.preRegister("dev@example.com", "github", null, null, false, null);
        sessionCoordinator.completeLogin(profile(OAuthProvider.GITHUB, "55", "dev@example.com"));

        assertThatThrownBy(() -> sessionCoordinator.completeLogin(profile(OAuthProvider.GITHUB, "56", "dev@example.com")))
                .isInstanceOf(UserNotRegisteredException.class);
    }

    private static ProviderProfile profile(OAuthProvider provider, String id, String email) {
        return ProviderProfile.builder()
                .provider(provider)
                .providerId(id)
                .email(email)
                .username("dev-" + id)
                .fullName("Dev Eloper")
                .rawProfile(Map.of("id", id))
                .build();
    }
}
