package com.atrium.auth.service;

import com.atrium.auth.config.AllowedOrigins;
import com.atrium.auth.config.AtriumAuthProperties;
import com.atrium.auth.dto.LoginInitiationResponse;
import com.atrium.auth.exception.InvalidRedirectException;
import com.atrium.auth.exception.UnsupportedProviderException;
import com.atrium.auth.exception.UserInactiveException;
import com.atrium.auth.exception.UserNotRegisteredException;
import com.atrium.auth.oauth.HandshakeState;
import com.atrium.auth.oauth.HandshakeStateCodec;
import com.atrium.auth.oauth.IdentityBroker;
import com.atrium.auth.oauth.OAuthProvider;
import com.atrium.auth.oauth.ProviderProfile;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;
import org.springframework.web.util.UriComponentsBuilder;

import java.net.URI;
import java.util.Optional;

/**
 * OAuthLoginFlow - the two HTTP legs of an OAuth login.
 *
 * Flow:
 * 1. {@link #initiate}: pack a fresh nonce, the provider callback URL and the
 *    client redirect URL into the state; return the provider consent URL
 * 2. Provider consent (outside this service)
 * 3. {@link #handleCallback}: unpack the state, exchange the code through
 *    {@link IdentityBroker}, open a session through {@link SessionCoordinator}
 *    and compute where to send the browser
 *
 * The callback never throws for anything the provider or the state carries.
 * Every failure ends in a redirect with a generic {@code error} code:
 * - invalid_state: state missing, malformed, or naming another provider or
 *   a redirect outside the allowed origins (sent to the frontend error page)
 * - access_denied: the provider reported that the user declined
 * - oauth_failed: code exchange or profile lookup failed
 * - user_not_registered: pre-registration policy rejected the account
 * - user_inactive: an operator deactivated the account
 *
 * On success the tokens travel in the URL fragment, which browsers do not
 * send to servers.
 */
@Slf4j
@Service
public class OAuthLoginFlow {

    public static final String ERROR_INVALID_STATE = "invalid_state";
    public static final String ERROR_ACCESS_DENIED = "access_denied";
    public static final String ERROR_OAUTH_FAILED = "oauth_failed";
    public static final String ERROR_NOT_REGISTERED = "user_not_registered";
    public static final String ERROR_INACTIVE = "user_inactive";

    private final HandshakeStateCodec stateCodec;
    private final IdentityBroker identityBroker;
    private final SessionCoordinator sessionCoordinator;
    private final String frontendUrl;
    private final String backendUrl;
    private final AllowedOrigins allowedOrigins;

    public OAuthLoginFlow(HandshakeStateCodec stateCodec,
                          IdentityBroker identityBroker,
                          SessionCoordinator sessionCoordinator,
                          AtriumAuthProperties properties,
                          AllowedOrigins allowedOrigins) {
        this.stateCodec = stateCodec;
        this.identityBroker = identityBroker;
        this.sessionCoordinator = sessionCoordinator;
        this.allowedOrigins = allowedOrigins;
        this.frontendUrl = stripTrailingSlash(properties.getFrontendUrl().trim());
        this.backendUrl = stripTrailingSlash(properties.getBackendUrl().trim());
    }

    /**
     * Start a login.
     *
     * @param providerTag "github" or "google"
     * @param redirectUri provider-facing callback URL; defaults to this service's callback
     * @param clientRedirectUri where to send the browser afterwards; defaults to the frontend
     * @throws UnsupportedProviderException for an unknown or unconfigured provider
     * @throws InvalidRedirectException for a client redirect outside the allowed origins
     */
    public LoginInitiationResponse initiate(String providerTag, String redirectUri, String clientRedirectUri) {
        OAuthProvider provider = supportedProvider(providerTag);
        String callbackUrl = isBlank(redirectUri) ? backendUrl + "/callback/" + provider.tag() : redirectUri.trim();
        String clientRedirect = isBlank(clientRedirectUri) ? frontendUrl + "/auth/callback" : clientRedirectUri.trim();
        if (!isAllowedRedirect(clientRedirect)) {
            throw new InvalidRedirectException("client_redirect_uri is not an allowed origin");
        }

        String state = stateCodec.pack(new HandshakeState(
                stateCodec.newNonce(), callbackUrl, clientRedirect, provider.tag()));
        return new LoginInitiationResponse(identityBroker.authorizationUrl(provider, callbackUrl, state), state);
    }

    /**
     * Finish a login from the provider's callback.
     *
     * @param providerTag provider named in the callback path
     * @param code authorization code, absent when the provider reports an error
     * @param state state value as returned by the provider
     * @param providerError error reported by the provider, if any
     * @return where to redirect the browser
     * @throws UnsupportedProviderException for an unknown provider in the path
     */
    public URI handleCallback(String providerTag, String code, String state, String providerError) {
        OAuthProvider provider = OAuthProvider.fromTag(providerTag)
                .orElseThrow(() -> new UnsupportedProviderException(providerTag));

        Optional<HandshakeState> decoded = stateCodec.unpack(state);
        if (decoded.isEmpty()
                || !provider.tag().equals(decoded.get().getProviderTag())
                || !isAllowedRedirect(decoded.get().getClientRedirectUrl())) {
            log.warn("Rejected {} callback with invalid state", provider.tag());
            return errorRedirect(frontendUrl + "/auth/error", ERROR_INVALID_STATE);
        }
        HandshakeState handshake = decoded.get();
        String target = handshake.getClientRedirectUrl();

        if (!isBlank(providerError)) {
            log.info("{} reported login error: {}", provider.tag(), providerError);
            return errorRedirect(target, ERROR_ACCESS_DENIED);
        }
        if (isBlank(code)) {
            log.warn("{} callback without authorization code", provider.tag());
            return errorRedirect(target, ERROR_OAUTH_FAILED);
        }

        Optional<ProviderProfile> profile = identityBroker.exchangeCode(
                provider, code, handshake.getProviderCallbackUrl());
        if (profile.isEmpty()) {
            return errorRedirect(target, ERROR_OAUTH_FAILED);
        }

        try {
            LoginResult result = sessionCoordinator.completeLogin(profile.get());
            log.info("{} login completed for user {}", provider.tag(), result.getUser().getId());
            return successRedirect(target, result.getTokens());
        } catch (UserNotRegisteredException e) {
            return errorRedirect(target, ERROR_NOT_REGISTERED);
        } catch (UserInactiveException e) {
            log.warn("{} login refused: {}", provider.tag(), e.getMessage());
            return errorRedirect(target, ERROR_INACTIVE);
        } catch (RuntimeException e) {
            log.error("{} login failed while establishing the session", provider.tag(), e);
            return errorRedirect(target, ERROR_OAUTH_FAILED);
        }
    }

    private OAuthProvider supportedProvider(String providerTag) {
        return OAuthProvider.fromTag(providerTag)
                .filter(identityBroker::isAvailable)
                .orElseThrow(() -> new UnsupportedProviderException(providerTag));
    }

    /**
     * A client redirect must parse as a URI exactly as given and sit on an
     * allowed origin; only such targets are ever packed into a state or
     * redirected to.
     */
    boolean isAllowedRedirect(String url) {
        return allowedOrigins.permits(url);
    }

    private static URI errorRedirect(String target, String error) {
        return URI.create(UriComponentsBuilder.fromUriString(target)
                .replaceQueryParam("error", error)
                .build()
                .toUriString());
    }

    private static URI successRedirect(String target, SessionTokens tokens) {
        String fragment = "access_token=" + tokens.getAccessToken()
                + "&refresh_token=" + tokens.getRefreshToken()
                + "&token_type=" + tokens.getTokenType()
                + "&expires_in=" + tokens.getExpiresIn();
        return URI.create(UriComponentsBuilder.fromUriString(target)
                .fragment(fragment)
                .build()
                .toUriString());
    }

    private static String stripTrailingSlash(String url) {
        return url.endsWith("/") ? url.substring(0, url.length() - 1) : url;
    }

    private static boolean isBlank(String value) {
        return value == null || value.isBlank();
    }
}
