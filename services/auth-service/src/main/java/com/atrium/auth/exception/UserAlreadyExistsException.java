package com.atrium.auth.exception;

/**
 * Email or username is already taken by another user. Mapped to 409.
 */
public class UserAlreadyExistsException extends RuntimeException {

    public UserAlreadyExistsException(String message) {
        super(message);
    }
}
