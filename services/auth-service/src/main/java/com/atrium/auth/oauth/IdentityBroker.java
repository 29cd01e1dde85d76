package com.atrium.auth.oauth;

import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.util.EnumMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * IdentityBroker - performs the authorization-code-for-profile exchange.
 *
 * The exchange is two sequential provider calls (code for token, then token
 * for profile); the second depends on the first and they are never run in
 * parallel.
 *
 * Failure Handling:
 * - Transport errors, non-2xx answers, missing token fields and missing
 *   profile fields all collapse to {@link Optional#empty()}
 * - The cause is logged for operators; no provider exception crosses this
 *   boundary
 *
 * @see GithubProviderClient
 * @see GoogleProviderClient
 */
@Slf4j
@Service
public class IdentityBroker {

    private final Map<OAuthProvider, IdentityProviderClient> clients = new EnumMap<>(OAuthProvider.class);

    public IdentityBroker(List<IdentityProviderClient> providerClients) {
        for (IdentityProviderClient client : providerClients) {
            clients.put(client.provider(), client);
        }
    }

    /**
     * @return whether logins through {@code provider} can be started
     */
    public boolean isAvailable(OAuthProvider provider) {
        IdentityProviderClient client = clients.get(provider);
        return client != null && client.isConfigured();
    }

    public String authorizationUrl(OAuthProvider provider, String redirectUri, String state) {
        return client(provider).authorizationUrl(redirectUri, state);
    }

    /**
     * Exchange an authorization code for the provider account's profile.
     *
     * @param provider provider the code was issued by
     * @param code authorization code from the callback
     * @param redirectUri callback URL the code was bound to
     * @return normalized profile, or empty on any failure
     */
    public Optional<ProviderProfile> exchangeCode(OAuthProvider provider, String code, String redirectUri) {
        IdentityProviderClient client = clients.get(provider);
        if (client == null || !client.isConfigured()) {
            log.error("OAuth exchange attempted for unconfigured provider {}", provider.tag());
            return Optional.empty();
        }
        try {
            Optional<String> accessToken = client.exchangeCode(code, redirectUri);
            if (accessToken.isEmpty()) {
                return Optional.empty();
            }
            return client.fetchProfile(accessToken.get());
        } catch (RuntimeException e) {
            log.error("{} OAuth exchange failed", provider.tag(), e);
            return Optional.empty();
        }
    }

    private IdentityProviderClient client(OAuthProvider provider) {
        IdentityProviderClient client = clients.get(provider);
        if (client == null) {
            throw new IllegalStateException("No client registered for provider " + provider.tag());
        }
        return client;
    }
}
