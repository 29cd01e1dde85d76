package com.atrium.auth.service;

import lombok.Builder;
import lombok.Value;

/**
 * Credentials handed to a client. {@code refreshToken} is null on renewal,
 * which never issues a new refresh secret.
 */
@Value
@Builder
public class SessionTokens {
    public static final String TOKEN_TYPE = "bearer";

    String accessToken;
    String refreshToken;
    @Builder.Default
    String tokenType = TOKEN_TYPE;
    long expiresIn;
}
