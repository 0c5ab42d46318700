package com.example.factcheck.user.exception;

import org.springframework.http.HttpStatus;
import org.springframework.web.bind.annotation.ResponseStatus;

/**
 * Exception thrown when a user ID does not resolve to a registered user.
 */
@ResponseStatus(HttpStatus.NOT_FOUND)
public class UserNotFoundException extends RuntimeException {

    private final long userId;

    public UserNotFoundException(long userId) {
        super(String.format("User %d not found", userId));
        this.userId = userId;
    }

    public long getUserId() {
        return userId;
    }
}
