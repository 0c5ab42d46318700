package com.example.factcheck.user.client;

import com.example.factcheck.config.properties.UserServiceProperties;
import com.example.factcheck.exception.ApiException;
import com.example.factcheck.user.UserLoader;
import com.example.factcheck.user.exception.UserNotFoundException;
import com.example.factcheck.user.model.User;
import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.github.benmanes.caffeine.cache.Cache;
import com.github.benmanes.caffeine.cache.Caffeine;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.http.HttpStatus;
import org.springframework.http.MediaType;
import org.springframework.lang.NonNull;
import org.springframework.stereotype.Component;
import org.springframework.web.reactive.function.client.WebClient;
import org.springframework.web.reactive.function.client.WebClientRequestException;
import reactor.core.publisher.Mono;

/**
 * Loads users from the accounts service, keeping them for a short time so that
 * bursts of actions by the same user don't hit the service each time.
 */
@Slf4j
@Component
public class UserServiceClient implements UserLoader {

    private static final String SERVICE_NAME = "UserService";

    private final WebClient webClient;
    private final Cache<Long, User> cache;

    public UserServiceClient(
            @Qualifier("userServiceWebClient") WebClient webClient,
            UserServiceProperties properties) {
        this.webClient = webClient;
        this.cache = properties.cacheEnabled()
                ? Caffeine.newBuilder()
                        .expireAfterWrite(properties.cacheTtl())
                        .maximumSize(properties.cacheMaxEntries())
                        .build()
                : null;
    }

    @Override
    @NonNull
    public Mono<User> loadById(long userId) {
        if (cache == null) {
            return fetchUser(userId);
        }
        User cached = cache.getIfPresent(userId);
        if (cached != null) {
            log.debug("User cache hit for id: {}", userId);
            return Mono.just(cached);
        }
        return fetchUser(userId).doOnNext(user -> cache.put(userId, user));
    }

    /**
     * Drop a cached user, e.g. after its reputation changed.
     */
    public void evict(long userId) {
        if (cache != null) {
            cache.invalidate(userId);
        }
    }

    private Mono<User> fetchUser(long userId) {
        log.debug("Fetching user {}", userId);

        return webClient.get()
                .uri("/users/{id}", userId)
                .accept(MediaType.APPLICATION_JSON)
                .retrieve()
                .onStatus(status -> status.value() == HttpStatus.NOT_FOUND.value(),
                        response -> Mono.error(new UserNotFoundException(userId)))
                .onStatus(status -> !status.is2xxSuccessful(),
                        response -> Mono.error(new ApiException(
                                SERVICE_NAME,
                                response.statusCode(),
                                "User service error")))
                .bodyToMono(UserResponse.class)
                .switchIfEmpty(Mono.error(() -> new UserNotFoundException(userId)))
                .flatMap(body -> toUser(userId, body))
                .onErrorMap(WebClientRequestException.class,
                        e -> new ApiException(SERVICE_NAME, "User service unreachable", e))
                .doOnError(ApiException.class, e -> log.warn("Failed to load user {}: {}", userId, e.getMessage()));
    }

    private static Mono<User> toUser(long userId, UserResponse body) {
        // absent reputation is an error, never 0
        if (body.reputation() == null) {
            return Mono.error(new ApiException(SERVICE_NAME, HttpStatus.BAD_GATEWAY,
                    "User service returned no reputation for user " + userId));
        }
        return Mono.just(new User(body.id() != null ? body.id() : userId, body.reputation()));
    }

    /**
     * Subset of the accounts service user representation.
     */
    @JsonIgnoreProperties(ignoreUnknown = true)
    record UserResponse(Long id, Integer reputation) {}
}
