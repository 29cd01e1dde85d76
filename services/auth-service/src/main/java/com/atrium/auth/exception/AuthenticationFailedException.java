package com.atrium.auth.exception;

/**
 * A presented credential was rejected.
 *
 * Covers unknown, expired and revoked refresh secrets, bad break-glass
 * passwords and inactive users alike; callers always answer 401 with the
 * same generic message.
 */
public class AuthenticationFailedException extends RuntimeException {

    public AuthenticationFailedException(String message) {
        super(message);
    }
}
