package com.atrium.auth.exception;

import java.util.UUID;

/** No user with the given id (404). */
public class UserNotFoundException extends RuntimeException {

    public UserNotFoundException(UUID id) {
        super("User not found: " + id);
    }
}
