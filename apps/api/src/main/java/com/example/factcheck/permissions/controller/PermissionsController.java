package com.example.factcheck.permissions.controller;

import com.example.factcheck.permissions.dto.QuotaStatusResponse;
import com.example.factcheck.permissions.model.ActionKind;
import com.example.factcheck.permissions.service.UserPermissionsService;
import com.example.factcheck.user.UserLoader;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;
import reactor.core.publisher.Mono;

import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Read-only view of the permission policy and of users' daily quotas, for display.
 * Maps are keyed by action wire key (e.g. {@code vote_up}).
 */
@Slf4j
@RestController
@RequestMapping("/api/v1/permissions")
@RequiredArgsConstructor
public class PermissionsController {

    private final UserPermissionsService permissionsService;
    private final UserLoader userLoader;

    @GetMapping("/limitations")
    public Mono<Map<String, Object>> getLimitations() {
        return Mono.just(byKey(permissionsService.limitations()));
    }

    @GetMapping("/min-reputations")
    public Mono<Map<String, Object>> getMinReputations() {
        return Mono.just(byKey(permissionsService.minReputations()));
    }

    @GetMapping("/users/{userId}/quota")
    public Mono<QuotaStatusResponse> getUserQuota(@PathVariable long userId) {
        if (userId <= 0) {
            return Mono.error(new IllegalArgumentException("userId must be positive"));
        }
        log.debug("GET /users/{}/quota", userId);
        return userLoader.loadById(userId)
                .map(user -> QuotaStatusResponse.of(
                        user.id(),
                        user.reputation(),
                        permissionsService.policy().tierOf(user.reputation()),
                        permissionsService.quotaStatus(user)));
    }

    private static Map<String, Object> byKey(Map<ActionKind, ?> source) {
        Map<String, Object> result = new LinkedHashMap<>();
        source.forEach((action, value) -> result.put(action.key(), value));
        return result;
    }
}
