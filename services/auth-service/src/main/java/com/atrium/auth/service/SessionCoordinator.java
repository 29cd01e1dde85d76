package com.atrium.auth.service;

import com.atrium.auth.config.AtriumAuthProperties;
import com.atrium.auth.config.AtriumAuthProperties.RegistrationPolicy;
import com.atrium.auth.entity.User;
import com.atrium.auth.exception.UserAlreadyExistsException;
import com.atrium.auth.exception.UserInactiveException;
import com.atrium.auth.exception.UserNotRegisteredException;
import com.atrium.auth.oauth.ProviderProfile;
import com.atrium.auth.repository.UserRepository;
import com.atrium.auth.security.AccessClaims;
import com.atrium.auth.security.CredentialCodec;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.time.Clock;
import java.util.ArrayList;
import java.util.HashMap;
import java.util.Map;
import java.util.Optional;

/**
 * SessionCoordinator - identity resolution and credential issuance.
 *
 * This service is the only place where logins create or update users and
 * where session credentials are minted. Both login paths (OAuth callback and
 * break-glass local credentials) end in {@link #establishSession(User)}, so
 * downstream verifiers cannot tell their tokens apart.
 *
 * Registration Policy ({@code atrium.auth.registration-policy}):
 * - PRE_REGISTERED (default): an unknown provider account is accepted only
 *   when an admin pre-registered its email for that provider; the first
 *   login binds the provider id
 * - OPEN: an unknown provider account creates a new, non-admin user
 * Local accounts are always created on first login, since operators define
 * them in configuration.
 *
 * Transaction Management:
 * - Login paths run in one transaction: identity update, refresh-token row
 *   and access token stand or fall together
 * - Renewal is read-only and does not rotate the refresh secret, so
 *   concurrent renewals with the same secret all succeed
 *
 * @see CredentialCodec for access tokens
 * @see RefreshStore for refresh secrets
 */
@Slf4j
@Service
public class SessionCoordinator {

    private static final String SERVICES_PERMISSION = "services";

    private final UserRepository userRepository;
    private final CredentialCodec credentialCodec;
    private final RefreshStore refreshStore;
    private final RegistrationPolicy registrationPolicy;
    private final Clock clock;

    public SessionCoordinator(UserRepository userRepository,
                              CredentialCodec credentialCodec,
                              RefreshStore refreshStore,
                              AtriumAuthProperties properties,
                              Clock clock) {
        this.userRepository = userRepository;
        this.credentialCodec = credentialCodec;
        this.refreshStore = refreshStore;
        this.registrationPolicy = properties.getRegistrationPolicy();
        this.clock = clock;
    }

    /**
     * Complete an OAuth login: resolve the identity and open a session.
     *
     * @throws UserNotRegisteredException if the policy forbids creating the user
     * @throws UserInactiveException if an operator deactivated the user
     */
    @Transactional
    public LoginResult completeLogin(ProviderProfile profile) {
        User user = resolveOrCreate(profile);
        return new LoginResult(user, establishSession(user));
    }

    /**
     * Complete a break-glass login for an account whose password is verified.
     */
    @Transactional
    public LoginResult completeLocalLogin(LocalAccount account) {
        User user = userRepository.findByProviderAndProviderId(User.LOCAL_PROVIDER, account.getLoginName())
                .map(existing -> {
                    existing.setAdmin(account.isAdmin());
                    existing.setPermissions(copyOf(account.getPermissions()));
                    existing.setLastLogin(clock.instant());
                    return existing;
                })
                .orElseGet(() -> {
                    log.info("Creating local user {} for backup login {}", account.getUsername(), account.getLoginName());
                    return User.builder()
                            .email(account.getEmail())
                            .username(account.getUsername())
                            .fullName(account.getFullName())
                            .provider(User.LOCAL_PROVIDER)
                            .providerId(account.getLoginName())
                            .active(true)
                            .admin(account.isAdmin())
                            .permissions(copyOf(account.getPermissions()))
                            .lastLogin(clock.instant())
                            .build();
                });
        user = userRepository.save(user);
        return new LoginResult(user, establishSession(user));
    }

    /**
     * Find the user bound to a provider account, or create/bind one.
     *
     * An existing user gets email, full name, avatar, provider data and last
     * login overwritten from the profile. Username, admin flag and
     * permissions are operator-controlled and stay untouched.
     */
    @Transactional
    public User resolveOrCreate(ProviderProfile profile) {
        String provider = profile.getProvider().tag();
        User user = userRepository.findByProviderAndProviderId(provider, profile.getProviderId())
                .or(() -> bindPreRegistered(profile))
                .orElseGet(() -> createFromProfile(profile));

        user.setEmail(profile.getEmail());
        user.setFullName(profile.getFullName());
        user.setAvatarUrl(profile.getAvatarUrl());
        user.setProviderData(copyOf(profile.getRawProfile()));
        user.setLastLogin(clock.instant());
        return userRepository.save(user);
    }

    /**
     * Issue an access token and a refresh secret for a user.
     *
     * Both login paths call this within their own transaction. The refresh
     * row is written first; if that fails the whole call fails and no access
     * token leaves this method.
     *
     * @throws UserInactiveException if an operator deactivated the user
     */
    @Transactional
    public SessionTokens establishSession(User user) {
        if (!user.isActive()) {
            throw new UserInactiveException(user.getId());
        }
        String refreshSecret = refreshStore.issue(user.getId());
        String accessToken = credentialCodec.mint(claimsOf(user));
        log.info("Session established for user {} via {}", user.getId(), user.getProvider());
        return SessionTokens.builder()
                .accessToken(accessToken)
                .refreshToken(refreshSecret)
                .expiresIn(credentialCodec.accessTokenLifetimeSeconds())
                .build();
    }

    /**
     * Mint a new access token from a refresh secret.
     *
     * The token reflects the user's admin flag and permissions as they are
     * now, not as they were at login. The refresh secret stays valid.
     *
     * @return new access token, or empty if the secret is unknown, revoked or
     *         expired, or its user is missing or inactive
     */
    @Transactional(readOnly = true)
    public Optional<SessionTokens> renew(String rawRefreshSecret) {
        return refreshStore.resolve(rawRefreshSecret)
                .flatMap(userRepository::findById)
                .filter(User::isActive)
                .map(user -> SessionTokens.builder()
                        .accessToken(credentialCodec.mint(claimsOf(user)))
                        .expiresIn(credentialCodec.accessTokenLifetimeSeconds())
                        .build());
    }

    /**
     * @return false if the secret was never issued
     */
    @Transactional
    public boolean endSession(String rawRefreshSecret) {
        return refreshStore.revoke(rawRefreshSecret);
    }

    /**
     * @return the active user an access token was minted for
     */
    @Transactional(readOnly = true)
    public Optional<User> currentUser(AccessClaims claims) {
        return userRepository.findById(claims.getUserId()).filter(User::isActive);
    }

    private Optional<User> bindPreRegistered(ProviderProfile profile) {
        return userRepository
                .findByProviderAndEmailIgnoreCaseAndProviderIdIsNull(profile.getProvider().tag(), profile.getEmail())
                .map(user -> {
                    log.info("Binding pre-registered user {} to {} account {}",
                            user.getId(), profile.getProvider().tag(), profile.getProviderId());
                    user.setProviderId(profile.getProviderId());
                    return user;
                });
    }

    private User createFromProfile(ProviderProfile profile) {
        String provider = profile.getProvider().tag();
        if (registrationPolicy != RegistrationPolicy.OPEN) {
            log.warn("Rejected unregistered {} account {}", provider, profile.getProviderId());
            throw new UserNotRegisteredException(provider, profile.getProviderId());
        }
        if (userRepository.existsByEmail(profile.getEmail())) {
            throw new UserAlreadyExistsException("Email already belongs to another account");
        }
        Map<String, Object> permissions = new HashMap<>();
        permissions.put(SERVICES_PERMISSION, new ArrayList<>());

        User user = User.builder()
                .username(availableUsername(profile.getUsername(), provider))
                .provider(provider)
                .providerId(profile.getProviderId())
                .active(true)
                .admin(false)
                .permissions(permissions)
                .build();
        log.info("Creating new user for {} account {}", provider, profile.getProviderId());
        return user;
    }

    private String availableUsername(String preferred, String provider) {
        if (!userRepository.existsByUsername(preferred)) {
            return preferred;
        }
        String candidate = preferred + "_" + provider;
        for (int n = 2; userRepository.existsByUsername(candidate); n++) {
            candidate = preferred + "_" + provider + n;
        }
        return candidate;
    }

    private static AccessClaims claimsOf(User user) {
        return AccessClaims.builder()
                .userId(user.getId())
                .email(user.getEmail())
                .username(user.getUsername())
                .admin(user.isAdmin())
                .permissions(user.getPermissions() == null ? Map.of() : user.getPermissions())
                .build();
    }

    private static Map<String, Object> copyOf(Map<String, Object> source) {
        return source == null ? null : new HashMap<>(source);
    }
}
