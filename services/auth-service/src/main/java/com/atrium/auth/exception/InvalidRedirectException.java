package com.atrium.auth.exception;

/**
 * A client redirect target points outside the configured origins.
 */
public class InvalidRedirectException extends RuntimeException {

    public InvalidRedirectException(String message) {
        super(message);
    }
}
