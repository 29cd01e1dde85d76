package com.atrium.auth.exception;

/**
 * A provider login succeeded but no identity may be resolved for it under
 * the pre-registration policy. Only ever surfaces as a callback redirect.
 */
public class UserNotRegisteredException extends RuntimeException {

    public UserNotRegisteredException(String provider, String providerId) {
        super("No registered user for " + provider + " account " + providerId);
    }
}
