package com.atrium.auth.exception;

/**
 * Backup login was attempted but no local users are configured. Mapped to 503.
 */
public class LocalLoginUnavailableException extends RuntimeException {

    public LocalLoginUnavailableException() {
        super("Backup authentication is not configured");
    }
}
