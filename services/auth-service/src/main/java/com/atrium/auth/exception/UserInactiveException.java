package com.atrium.auth.exception;

import java.util.UUID;

/**
 * Login was attempted for an identity an operator has deactivated.
 */
public class UserInactiveException extends RuntimeException {

    public UserInactiveException(UUID userId) {
        super("User is inactive: " + userId);
    }
}
