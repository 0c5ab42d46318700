package com.example.factcheck.permissions.service;

import com.example.factcheck.observability.metrics.PermissionsMetrics;
import com.example.factcheck.permissions.audit.PermissionsAuditService;
import com.example.factcheck.permissions.exception.PermissionsException;
import com.example.factcheck.permissions.model.ActionKind;
import com.example.factcheck.permissions.model.ActionQuota;
import com.example.factcheck.permissions.model.PermissionDecision;
import com.example.factcheck.permissions.model.PermissionDecision.Outcome;
import com.example.factcheck.permissions.model.QuotaLimits;
import com.example.factcheck.permissions.policy.PermissionsPolicy;
import com.example.factcheck.user.UserLoader;
import com.example.factcheck.user.model.User;
import lombok.extern.slf4j.Slf4j;
import org.springframework.lang.NonNull;
import org.springframework.stereotype.Service;
import reactor.core.publisher.Mono;
import reactor.core.scheduler.Schedulers;

import java.util.Collections;
import java.util.EnumMap;
import java.util.HashMap;
import java.util.Map;
import java.util.Optional;
import java.util.OptionalInt;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.concurrent.locks.ReentrantLock;
import java.util.function.Function;

/**
 * Checks and records user actions against reputation floors and daily quotas.
 *
 * <p>State is the number of occurrences of each action per user since the last
 * {@link #reset()}. It lives in memory only: the service is created once at startup,
 * reset once a day by {@code QuotaResetScheduler}, and discarded on shutdown. A restart
 * therefore clears every quota.
 *
 * <p>All operations on the state are serialized by a single lock. {@link #lock} holds it
 * while the caller's effect runs, so a slow or stuck effect blocks every other quota
 * operation in the process. Effects must be short and must not wait on other threads
 * that use this service. The lock is reentrant, so an effect may call back into this
 * service on the same thread.
 */
@Slf4j
@Service
public class UserPermissionsService {

    private final PermissionsPolicy policy;
    private final UserLoader userLoader;
    private final PermissionsMetrics metrics;
    private final Optional<PermissionsAuditService> auditService;

    private final ReentrantLock stateLock = new ReentrantLock();

    // user id -> action -> occurrences in the current period. Guarded by stateLock.
    private Map<Long, Map<ActionKind, Integer>> occurrences = new HashMap<>();

    // Size of occurrences, written under stateLock and read without it by the metrics gauge.
    private final AtomicInteger trackedUsers = new AtomicInteger();

    public UserPermissionsService(
            PermissionsPolicy policy,
            UserLoader userLoader,
            PermissionsMetrics metrics,
            Optional<PermissionsAuditService> auditService) {
        this.policy = policy;
        this.userLoader = userLoader;
        this.metrics = metrics;
        this.auditService = auditService;
        metrics.registerTrackedUsersGauge(trackedUsers::get);
        log.info("User permissions / limitations watcher started (confirmed-user-threshold={})",
                policy.confirmedUserThreshold());
    }

    // --- Checks ---

    /**
     * Check whether the user may perform the action now. Never modifies usage.
     */
    @NonNull
    public PermissionDecision check(@NonNull User user, @NonNull ActionKind action) {
        PermissionDecision decision;
        int used;
        stateLock.lock();
        try {
            used = usedLocked(user.id(), action);
            decision = decide(user, action, used);
        } finally {
            stateLock.unlock();
        }
        report(user, decision, used);
        return decision;
    }

    /**
     * Check an action given by its wire key. Keys that name no action are denied
     * with {@link Outcome#UNKNOWN_ACTION}.
     */
    @NonNull
    public PermissionDecision check(@NonNull User user, String actionKey) {
        return ActionKind.fromKey(actionKey)
                .map(action -> check(user, action))
                .orElseGet(() -> {
                    PermissionDecision decision = PermissionDecision.denied(Outcome.UNKNOWN_ACTION, user.id(), null);
                    report(user, decision, 0);
                    return decision;
                });
    }

    /**
     * Load the user, then check. Fails with {@code UserNotFoundException} if the user does not exist.
     */
    @NonNull
    public Mono<PermissionDecision> check(long userId, @NonNull ActionKind action) {
        return userLoader.loadById(userId)
                .publishOn(Schedulers.boundedElastic())
                .map(user -> check(user, action));
    }

    /**
     * Same as {@link #check(User, ActionKind)} but throws when the action is not allowed.
     *
     * @throws PermissionsException if the decision is a denial
     */
    public void checkOrThrow(@NonNull User user, @NonNull ActionKind action) {
        PermissionDecision decision = check(user, action);
        if (decision.isDenied()) {
            throw new PermissionsException(decision);
        }
    }

    /**
     * Load the user and check, emitting the user when allowed and a
     * {@link PermissionsException} when denied.
     */
    @NonNull
    public Mono<User> checkOrThrow(long userId, @NonNull ActionKind action) {
        return userLoader.loadById(userId)
                .publishOn(Schedulers.boundedElastic())
                .map(user -> {
                    checkOrThrow(user, action);
                    return user;
                });
    }

    // --- Recording ---

    /**
     * Count one occurrence of the action for the user.
     *
     * <p>Doesn't verify the user's limitation nor reputation. Use {@link #lock} where the
     * quota must hold strictly, or call {@link #check} first.
     */
    public void record(@NonNull User user, @NonNull ActionKind action) {
        record(user.id(), action);
    }

    /**
     * Count one occurrence for a user known only by ID. The user is not loaded.
     */
    public void record(long userId, @NonNull ActionKind action) {
        stateLock.lock();
        try {
            incrementLocked(userId, action);
        } finally {
            stateLock.unlock();
        }
        metrics.recordUsage(action);
        log.debug("Recorded {} for user {}", action.key(), userId);
    }

    /**
     * Check, run {@code effect}, and record the action as one atomic step.
     *
     * <p>The state stays locked while {@code effect} runs, so two concurrent calls can never
     * both take the last remaining slot. The action is recorded only if {@code effect} returns
     * normally. An exception thrown by {@code effect} reaches the caller unchanged and leaves
     * usage untouched.
     *
     * <p>Use it for sensitive actions. Where the limit is high or unimportant, prefer
     * {@link #check} plus {@link #record} to avoid serializing the effect.
     *
     * @param effect the guarded action, given the checked user; may return null
     * @return whatever {@code effect} returned
     * @throws PermissionsException if the user is not allowed to perform the action
     */
    public <T> T lock(@NonNull User user, @NonNull ActionKind action, @NonNull Function<User, T> effect) {
        PermissionDecision decision;
        int used;
        T result = null;
        stateLock.lock();
        try {
            used = usedLocked(user.id(), action);
            decision = decide(user, action, used);
            if (decision.isAllowed()) {
                try {
                    result = effect.apply(user);
                } catch (RuntimeException | Error e) {
                    metrics.recordEffectFailure(action);
                    log.debug("Guarded {} failed for user {}, nothing recorded", action.key(), user.id());
                    throw e;
                }
                incrementLocked(user.id(), action);
            }
        } finally {
            stateLock.unlock();
        }

        report(user, decision, used);
        if (decision.isDenied()) {
            throw new PermissionsException(decision);
        }
        metrics.recordUsage(action);
        return result;
    }

    /**
     * Load the user, then {@link #lock(User, ActionKind, Function)} on a worker thread.
     * Completes empty if {@code effect} returns null.
     */
    @NonNull
    public <T> Mono<T> lock(long userId, @NonNull ActionKind action, @NonNull Function<User, T> effect) {
        return userLoader.loadById(userId)
                .publishOn(Schedulers.boundedElastic())
                .flatMap(user -> Mono.justOrEmpty(lock(user, action, effect)));
    }

    // --- Introspection ---

    public int occurrences(@NonNull User user, @NonNull ActionKind action) {
        stateLock.lock();
        try {
            return usedLocked(user.id(), action);
        } finally {
            stateLock.unlock();
        }
    }

    /**
     * Daily limit of the action for the user's current tier.
     *
     * @throws IllegalArgumentException if the action is not part of the policy
     */
    public int limitation(@NonNull User user, @NonNull ActionKind action) {
        return policy.limitation(user, action);
    }

    /**
     * Occurrences the user may still perform today; zero if the action is unknown
     * or the user's reputation is too low.
     */
    public int remaining(@NonNull User user, @NonNull ActionKind action) {
        OptionalInt min = policy.minReputation(action);
        if (min.isEmpty() || user.reputation() < min.getAsInt()) {
            return 0;
        }
        return Math.max(0, policy.limitation(user, action) - occurrences(user, action));
    }

    /**
     * Standing of the user for every action of the policy, read from one consistent snapshot.
     */
    @NonNull
    public Map<ActionKind, ActionQuota> quotaStatus(@NonNull User user) {
        Map<ActionKind, Integer> usage;
        stateLock.lock();
        try {
            Map<ActionKind, Integer> current = occurrences.get(user.id());
            usage = current != null ? new EnumMap<>(current) : new EnumMap<>(ActionKind.class);
        } finally {
            stateLock.unlock();
        }

        Map<ActionKind, ActionQuota> status = new EnumMap<>(ActionKind.class);
        for (Map.Entry<ActionKind, Integer> entry : policy.minReputations().entrySet()) {
            ActionKind action = entry.getKey();
            int minReputation = entry.getValue();
            int limit = policy.limitation(user, action);
            int used = usage.getOrDefault(action, 0);
            boolean allowed = user.reputation() >= minReputation && used < limit;
            int remaining = user.reputation() >= minReputation ? Math.max(0, limit - used) : 0;
            status.put(action, new ActionQuota(action, minReputation, limit, used, remaining, allowed));
        }
        return Collections.unmodifiableMap(status);
    }

    @NonNull
    public Map<ActionKind, QuotaLimits> limitations() {
        return policy.limitations();
    }

    @NonNull
    public Map<ActionKind, Integer> minReputations() {
        return policy.minReputations();
    }

    @NonNull
    public PermissionsPolicy policy() {
        return policy;
    }

    // --- Reset ---

    /**
     * Forget all recorded actions. Only meant to be called by the daily scheduler.
     */
    public void reset() {
        int users;
        stateLock.lock();
        try {
            users = occurrences.size();
            occurrences = new HashMap<>();
            trackedUsers.set(0);
        } finally {
            stateLock.unlock();
        }
        metrics.recordReset();
        log.info("Reset today's quotas ({} users had recorded actions)", users);
    }

    // --- Internals, callers hold the lock ---

    private PermissionDecision decide(User user, ActionKind action, int used) {
        OptionalInt minReputation = policy.minReputation(action);
        if (minReputation.isEmpty()) {
            return PermissionDecision.denied(Outcome.UNKNOWN_ACTION, user.id(), action);
        }
        if (user.reputation() < minReputation.getAsInt()) {
            return PermissionDecision.denied(Outcome.INSUFFICIENT_REPUTATION, user.id(), action);
        }
        if (used >= policy.limitation(user, action)) {
            return PermissionDecision.denied(Outcome.LIMIT_REACHED, user.id(), action);
        }
        return PermissionDecision.allowed(user.id(), action);
    }

    private int usedLocked(long userId, ActionKind action) {
        Map<ActionKind, Integer> userActions = occurrences.get(userId);
        return userActions != null ? userActions.getOrDefault(action, 0) : 0;
    }

    private void incrementLocked(long userId, ActionKind action) {
        occurrences.computeIfAbsent(userId, id -> {
                    trackedUsers.incrementAndGet();
                    return new EnumMap<>(ActionKind.class);
                })
                .merge(action, 1, Integer::sum);
    }

    private void report(User user, PermissionDecision decision, int used) {
        metrics.recordDecision(decision);
        if (decision.isDenied()) {
            log.debug("Denied {} for user {}: {}",
                    decision.action() != null ? decision.action().key() : "unknown", user.id(), decision.reason());
        }
        auditService.ifPresent(audit -> {
            int limit = decision.action() != null && policy.isKnown(decision.action())
                    ? policy.limitation(user, decision.action())
                    : -1;
            audit.logDecision(user, policy.tierOf(user.reputation()), decision, used, limit);
        });
    }
}
