package com.atrium.auth.service;

import com.atrium.auth.config.AtriumAuthProperties;
import com.atrium.auth.exception.AuthenticationFailedException;
import com.atrium.auth.exception.LocalLoginUnavailableException;
import com.atrium.auth.security.Digests;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.regex.Pattern;

/**
 * LocalCredentialAuthenticator - break-glass username/password login.
 *
 * Accounts come exclusively from {@code atrium.auth.local-users}; nothing is
 * hardcoded. Each entry holds the SHA-256 hex of its password, the admin flag,
 * the permission set and optional email / full-name overrides. The map is
 * validated once here at startup; a malformed entry stops the boot.
 *
 * A successful login is handed to {@link SessionCoordinator#completeLocalLogin}
 * and ends in the same session establishment as an OAuth login.
 *
 * Identity mapping for a configured login name {@code <name>}:
 * - provider "local", provider id {@code <name>}
 * - username {@code backup_<name>}
 * - email: request override, else configured, else {@code backup_<name>@<local-email-domain>}
 * - full name: request override, else configured, else "Backup User: <name>"
 *
 * Failed attempts are logged with the attempted username only.
 */
@Slf4j
@Service
public class LocalCredentialAuthenticator {

    static final String USERNAME_PREFIX = "backup_";
    private static final Pattern LOGIN_NAME = Pattern.compile("[A-Za-z0-9_.-]{1,50}");
    private static final Pattern SHA256_HEX = Pattern.compile("[0-9a-f]{64}");
    private static final String UNKNOWN_USER_HASH = "0".repeat(64);

    private final Map<String, AtriumAuthProperties.LocalUser> users;
    private final String emailDomain;
    private final SessionCoordinator sessionCoordinator;

    public LocalCredentialAuthenticator(AtriumAuthProperties properties, SessionCoordinator sessionCoordinator) {
        this.users = validated(properties.getLocalUsers());
        this.emailDomain = properties.getLocalEmailDomain();
        this.sessionCoordinator = sessionCoordinator;
        if (!users.isEmpty()) {
            log.info("Backup login enabled for {} local user(s)", users.size());
        }
    }

    public boolean isConfigured() {
        return !users.isEmpty();
    }

    /**
     * Check a break-glass credential and open a session for it.
     *
     * @param username configured login name
     * @param password plain password; compared by hash in constant time
     * @param email optional email used if the identity is created now
     * @param fullName optional display name used if the identity is created now
     * @throws LocalLoginUnavailableException if no local users are configured
     * @throws AuthenticationFailedException if the name is unknown or the password wrong
     */
    public LoginResult authenticate(String username, String password, String email, String fullName) {
        if (users.isEmpty()) {
            throw new LocalLoginUnavailableException();
        }
        AtriumAuthProperties.LocalUser user = users.get(username);
        String expectedHash = user != null ? user.getPasswordHash() : UNKNOWN_USER_HASH;
        boolean matches = Digests.constantTimeEquals(expectedHash, Digests.sha256Hex(password));
        if (user == null || !matches) {
            log.warn("Failed backup login attempt for username '{}'", username);
            throw new AuthenticationFailedException("Invalid backup credentials");
        }

        log.info("Backup login succeeded for username '{}'", username);
        LocalAccount account = LocalAccount.builder()
                .loginName(username)
                .username(USERNAME_PREFIX + username)
                .email(firstNonBlank(email, user.getEmail(), USERNAME_PREFIX + username + "@" + emailDomain))
                .fullName(firstNonBlank(fullName, user.getFullName(), "Backup User: " + username))
                .admin(user.isAdmin())
                .permissions(user.getPermissions() == null ? new HashMap<>() : new HashMap<String, Object>(user.getPermissions()))
                .build();
        return sessionCoordinator.completeLocalLogin(account);
    }

    private static Map<String, AtriumAuthProperties.LocalUser> validated(Map<String, AtriumAuthProperties.LocalUser> configured) {
        Map<String, AtriumAuthProperties.LocalUser> result = new LinkedHashMap<>();
        if (configured == null) {
            return result;
        }
        configured.forEach((name, user) -> {
            if (!LOGIN_NAME.matcher(name).matches()) {
                throw new IllegalStateException("atrium.auth.local-users: invalid username '" + name + "'");
            }
            if (user == null || user.getPasswordHash() == null) {
                throw new IllegalStateException("atrium.auth.local-users." + name + ".password-hash is required");
            }
            String hash = user.getPasswordHash().trim().toLowerCase();
            if (!SHA256_HEX.matcher(hash).matches()) {
                throw new IllegalStateException(
                        "atrium.auth.local-users." + name + ".password-hash must be a 64-character SHA-256 hex digest");
            }
            user.setPasswordHash(hash);
            result.put(name, user);
        });
        return result;
    }

    private static String firstNonBlank(String... candidates) {
        for (String candidate : candidates) {
            if (candidate != null && !candidate.isBlank()) {
                return candidate;
            }
        }
        return null;
    }
}
