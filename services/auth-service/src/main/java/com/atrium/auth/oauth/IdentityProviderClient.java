package com.atrium.auth.oauth;

import java.util.Optional;

/**
 * The provider-specific half of an OAuth authorization-code login.
 *
 * Implementations may throw {@link org.springframework.web.client.RestClientException}
 * or other runtime exceptions on transport and parsing failures;
 * {@link IdentityBroker} collapses all of them into an empty result.
 */
public interface IdentityProviderClient {

    OAuthProvider provider();

    /**
     * @return whether client id and secret are configured for this provider
     */
    boolean isConfigured();

    /**
     * Build the consent URL the end user is sent to.
     */
    String authorizationUrl(String redirectUri, String state);

    /**
     * Exchange an authorization code for a provider access token.
     *
     * @return the access token, or empty if the response carries none
     */
    Optional<String> exchangeCode(String code, String redirectUri);

    /**
     * Fetch and normalize the profile of the account the token belongs to.
     *
     * @return the profile, or empty if a required field is missing
     */
    Optional<ProviderProfile> fetchProfile(String accessToken);
}
