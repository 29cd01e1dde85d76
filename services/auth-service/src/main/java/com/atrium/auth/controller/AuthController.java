package com.atrium.auth.controller;

import com.atrium.auth.dto.BackupLoginRequest;
import com.atrium.auth.dto.LoginInitiationResponse;
import com.atrium.auth.dto.MessageResponse;
import com.atrium.auth.dto.RefreshTokenRequest;
import com.atrium.auth.dto.TokenResponse;
import com.atrium.auth.dto.UserResponse;
import com.atrium.auth.exception.AuthenticationFailedException;
import com.atrium.auth.security.AccessClaims;
import com.atrium.auth.service.LocalCredentialAuthenticator;
import com.atrium.auth.service.LoginResult;
import com.atrium.auth.service.OAuthLoginFlow;
import com.atrium.auth.service.SessionCoordinator;
import jakarta.validation.Valid;
import lombok.RequiredArgsConstructor;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.security.core.annotation.AuthenticationPrincipal;
import org.springframework.web.bind.annotation.*;

import java.net.URI;

/**
 * AuthController - REST API endpoints for authentication operations.
 *
 * Endpoints:
 * - GET  /login/{provider}     - Start an OAuth login (github, google)
 * - GET  /callback/{provider}  - OAuth callback; always answers with a redirect
 * - POST /backup-login         - Break-glass username/password login
 * - POST /refresh              - New access token from a refresh token
 * - POST /logout               - Revoke a refresh token
 * - GET  /me                   - Current user (requires bearer access token)
 *
 * Security Model:
 * - Stateless: access tokens are self-contained JWTs, refresh tokens are
 *   opaque secrets checked against their stored hash
 * - Refresh, logout and backup-login authenticate through the request body
 * - Failures of any kind answer 401 with the same generic message
 *
 * Error Handling:
 * - 400 Bad Request: unsupported provider, invalid redirect, invalid body
 * - 401 Unauthorized: invalid credentials, unknown/expired/revoked refresh token
 * - 503 Service Unavailable: backup login not configured
 *
 * @see OAuthLoginFlow for the OAuth legs
 * @see SessionCoordinator for session issuance
 */
@RestController
@RequiredArgsConstructor
public class AuthController {

    private final OAuthLoginFlow oauthLoginFlow;
    private final SessionCoordinator sessionCoordinator;
    private final LocalCredentialAuthenticator localCredentialAuthenticator;

    /**
     * Start an OAuth login.
     *
     * The returned state must come back unchanged on the callback; clients
     * should compare it with the state the provider echoes.
     *
     * @param provider "github" or "google"
     * @param redirectUri provider-facing callback URL (optional)
     * @param clientRedirectUri where the browser goes after the callback (optional)
     * @return consent URL and state
     */
    @GetMapping("/login/{provider}")
    public ResponseEntity<LoginInitiationResponse> login(
            @PathVariable String provider,
            @RequestParam(name = "redirect_uri", required = false) String redirectUri,
            @RequestParam(name = "client_redirect_uri", required = false) String clientRedirectUri) {
        return ResponseEntity.ok(oauthLoginFlow.initiate(provider, redirectUri, clientRedirectUri));
    }

    /**
     * Finish an OAuth login.
     *
     * Answers 302 in every case except an unknown provider in the path:
     * to the client redirect with tokens in the fragment on success, or with
     * an {@code error} query parameter on failure.
     */
    @GetMapping("/callback/{provider}")
    public ResponseEntity<Void> callback(
            @PathVariable String provider,
            @RequestParam(required = false) String code,
            @RequestParam(required = false) String state,
            @RequestParam(required = false) String error) {
        URI target = oauthLoginFlow.handleCallback(provider, code, state, error);
        return ResponseEntity.status(HttpStatus.FOUND).location(target).build();
    }

    /**
     * Break-glass login with a locally configured username and password.
     *
     * @return the same token envelope as an OAuth login, plus the user
     */
    @PostMapping("/backup-login")
    public ResponseEntity<TokenResponse> backupLogin(@Valid @RequestBody BackupLoginRequest request) {
        LoginResult result = localCredentialAuthenticator.authenticate(
                request.getUsername(), request.getPassword(), request.getEmail(), request.getFullName());
        TokenResponse response = TokenResponse.of(result.getTokens());
        response.setUser(UserResponse.from(result.getUser()));
        return ResponseEntity.ok(response);
    }

    /**
     * Renew an access token. The refresh token stays valid.
     */
    @PostMapping("/refresh")
    public ResponseEntity<TokenResponse> refresh(@Valid @RequestBody RefreshTokenRequest request) {
        return sessionCoordinator.renew(request.getRefreshToken())
                .map(TokenResponse::of)
                .map(ResponseEntity::ok)
                .orElseThrow(() -> new AuthenticationFailedException("Invalid refresh token"));
    }

    /**
     * Revoke a refresh token. Repeating the call for the same token succeeds.
     */
    @PostMapping("/logout")
    public ResponseEntity<MessageResponse> logout(@Valid @RequestBody RefreshTokenRequest request) {
        if (!sessionCoordinator.endSession(request.getRefreshToken())) {
            throw new AuthenticationFailedException("Invalid refresh token");
        }
        return ResponseEntity.ok(new MessageResponse("Logged out successfully"));
    }

    /**
     * Current user, loaded fresh from the database.
     *
     * @param claims verified access-token claims (populated by Spring Security)
     */
    @GetMapping("/me")
    public ResponseEntity<UserResponse> me(@AuthenticationPrincipal AccessClaims claims) {
        return sessionCoordinator.currentUser(claims)
                .map(UserResponse::from)
                .map(ResponseEntity::ok)
                .orElseThrow(() -> new AuthenticationFailedException("Invalid or expired token"));
    }
}
