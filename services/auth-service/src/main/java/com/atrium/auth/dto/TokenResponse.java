package com.atrium.auth.dto;

import com.atrium.auth.service.SessionTokens;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * TokenResponse - the token envelope returned by every credential-issuing endpoint.
 *
 * Example Response (login):
 * <pre>
 * {
 *   "access_token": "eyJhbGciOiJIUzI1NiJ9...",
 *   "refresh_token": "Qm9n...",
 *   "token_type": "bearer",
 *   "expires_in": 1800,
 *   "user": { ... }
 * }
 * </pre>
 *
 * {@code refresh_token} and {@code user} are omitted on renewal.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class TokenResponse {

    private String accessToken;

    /** Raw refresh secret; only present when a session is established. */
    private String refreshToken;

    private String tokenType;

    /** Access-token lifetime in seconds. */
    private long expiresIn;

    private UserResponse user;

    public static TokenResponse of(SessionTokens tokens) {
        return TokenResponse.builder()
                .accessToken(tokens.getAccessToken())
                .refreshToken(tokens.getRefreshToken())
                .tokenType(tokens.getTokenType())
                .expiresIn(tokens.getExpiresIn())
                .build();
    }
}
