package com.example.factcheck.user;

import com.example.factcheck.user.model.User;
import org.springframework.lang.NonNull;
import reactor.core.publisher.Mono;

/**
 * Resolves a user ID to the fields needed for permission checks.
 * Implementations fail with {@link com.example.factcheck.user.exception.UserNotFoundException}
 * when no such user exists.
 */
public interface UserLoader {

    @NonNull
    Mono<User> loadById(long userId);
}
