package com.atrium.auth.service;

import com.atrium.auth.entity.User;
import com.atrium.auth.exception.UnsupportedProviderException;
import com.atrium.auth.exception.UserAlreadyExistsException;
import com.atrium.auth.exception.UserNotFoundException;
import com.atrium.auth.oauth.OAuthProvider;
import com.atrium.auth.repository.RefreshTokenRepository;
import com.atrium.auth.repository.UserRepository;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.data.domain.Sort;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.UUID;

/**
 * Operator-side user management behind the admin API token.
 *
 * Pre-registration creates a user with no provider id; the user's first
 * login through that provider with the same email binds it
 * (see {@link SessionCoordinator#resolveOrCreate}).
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class UserAdministrationService {

    private final UserRepository userRepository;
    private final RefreshTokenRepository refreshTokenRepository;
    private final RefreshStore refreshStore;

    /**
     * Create a not-yet-bound user for a provider.
     *
     * The email is trimmed and lower-cased; a missing username defaults to
     * the email's local part. Permissions always carry a {@code services}
     * list, empty unless given.
     *
     * @throws UnsupportedProviderException if {@code providerTag} is not a known provider
     * @throws UserAlreadyExistsException if the email or username is taken
     */
    @Transactional
    public User preRegister(String email, String providerTag, String username, String fullName,
                            boolean admin, Map<String, Object> permissions) {
        OAuthProvider provider = OAuthProvider.fromTag(providerTag)
                .orElseThrow(() -> new UnsupportedProviderException(providerTag));
        String normalizedEmail = email.trim().toLowerCase();
        String resolvedUsername = username != null && !username.isBlank()
                ? username
                : normalizedEmail.substring(0, normalizedEmail.indexOf('@'));

        if (userRepository.existsByEmail(normalizedEmail)) {
            throw new UserAlreadyExistsException("A user with this email already exists");
        }
        if (userRepository.existsByUsername(resolvedUsername)) {
            throw new UserAlreadyExistsException("A user with this username already exists");
        }

        Map<String, Object> resolvedPermissions = permissions != null ? new HashMap<>(permissions) : new HashMap<>();
        resolvedPermissions.putIfAbsent("services", new ArrayList<>());

        User user = userRepository.save(User.builder()
                .email(normalizedEmail)
                .username(resolvedUsername)
                .fullName(fullName)
                .provider(provider.tag())
                .active(true)
                .admin(admin)
                .permissions(resolvedPermissions)
                .build());
        log.info("Pre-registered user {} for {} login", user.getId(), provider.tag());
        return user;
    }

    /** Ordered by creation time. */
    @Transactional(readOnly = true)
    public List<User> listUsers() {
        return userRepository.findAll(Sort.by("createdAt"));
    }

    /**
     * @throws UserNotFoundException if there is no user with this id
     */
    @Transactional(readOnly = true)
    public User getUser(UUID id) {
        return userRepository.findById(id).orElseThrow(() -> new UserNotFoundException(id));
    }

    /**
     * Change operator-controlled flags. Deactivating a user revokes all of
     * their refresh credentials; access tokens already issued run out on
     * their own.
     */
    @Transactional
    public User updateUser(UUID id, Boolean active, Boolean admin, Map<String, Object> permissions) {
        User user = getUser(id);
        if (active != null) {
            user.setActive(active);
        }
        if (admin != null) {
            user.setAdmin(admin);
        }
        if (permissions != null) {
            user.setPermissions(new HashMap<>(permissions));
        }
        User saved = userRepository.save(user);
        if (Boolean.FALSE.equals(active)) {
            refreshStore.revokeAll(id);
        }
        log.info("Updated user {} (active={}, admin={})", id, saved.isActive(), saved.isAdmin());
        return saved;
    }

    /**
     * Remove a user. Refresh rows go first; access tokens already issued
     * stay valid until they expire.
     *
     * @throws UserNotFoundException if there is no user with this id
     */
    @Transactional
    public void deleteUser(UUID id) {
        User user = getUser(id);
        int removed = refreshTokenRepository.deleteAllByUserId(id);
        userRepository.delete(user);
        log.info("Deleted user {} and {} refresh credential(s)", id, removed);
    }
}
