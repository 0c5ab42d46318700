package com.example.factcheck.permissions.policy;

import com.example.factcheck.permissions.model.ActionKind;
import com.example.factcheck.permissions.model.QuotaLimits;
import com.example.factcheck.permissions.model.QuotaTier;
import com.example.factcheck.user.model.User;
import org.springframework.lang.NonNull;

import java.util.Collections;
import java.util.EnumMap;
import java.util.Map;
import java.util.OptionalInt;

/**
 * Immutable reputation floors and tiered daily limits for every gated action.
 *
 * <p>An action is valid only if it has a minimum reputation entry. Callers must check
 * {@link #minReputation(ActionKind)} before asking for a limit.
 */
public final class PermissionsPolicy {

    public static final int DEFAULT_CONFIRMED_USER_THRESHOLD = 50;

    // Reasonable limit that users should never exceed
    public static final int MAX_LIMIT = 100;

    private final Map<ActionKind, Integer> minReputations;
    private final Map<ActionKind, QuotaLimits> limitations;
    private final int confirmedUserThreshold;

    public PermissionsPolicy(
            @NonNull Map<ActionKind, Integer> minReputations,
            @NonNull Map<ActionKind, QuotaLimits> limitations,
            int confirmedUserThreshold) {
        for (ActionKind action : minReputations.keySet()) {
            if (!limitations.containsKey(action)) {
                throw new IllegalArgumentException("No quota limits configured for action " + action.key());
            }
        }
        this.minReputations = Collections.unmodifiableMap(copy(minReputations));
        this.limitations = Collections.unmodifiableMap(copy(limitations));
        this.confirmedUserThreshold = confirmedUserThreshold;
    }

    /**
     * Policy used in production, with the given confirmed-user threshold.
     */
    @NonNull
    public static PermissionsPolicy defaults(int confirmedUserThreshold) {
        Map<ActionKind, Integer> minReputations = new EnumMap<>(ActionKind.class);
        minReputations.put(ActionKind.ADD_COMMENT, -25);
        minReputations.put(ActionKind.ADD_VIDEO, 15);
        minReputations.put(ActionKind.ADD_SPEAKER, 15);
        minReputations.put(ActionKind.EDIT_SPEAKER, 30);
        minReputations.put(ActionKind.ADD_STATEMENT, 15);
        minReputations.put(ActionKind.VOTE_UP, 15);
        minReputations.put(ActionKind.APPROVE_HISTORY_ACTION, 0);
        minReputations.put(ActionKind.FLAG_COMMENT, 40);
        minReputations.put(ActionKind.FLAG_HISTORY_ACTION, 40);
        minReputations.put(ActionKind.VOTE_DOWN, 80);
        minReputations.put(ActionKind.EDIT_OTHER_STATEMENT, 0);
        minReputations.put(ActionKind.REMOVE_STATEMENT, 0);
        minReputations.put(ActionKind.RESTORE_STATEMENT, 0);
        minReputations.put(ActionKind.REMOVE_SPEAKER, 0);
        minReputations.put(ActionKind.RESTORE_SPEAKER, 0);

        Map<ActionKind, QuotaLimits> limitations = new EnumMap<>(ActionKind.class);
        limitations.put(ActionKind.ADD_COMMENT, QuotaLimits.of(3, 10, MAX_LIMIT));
        limitations.put(ActionKind.ADD_VIDEO, QuotaLimits.of(0, 3, 10));
        // Vote
        limitations.put(ActionKind.VOTE_UP, QuotaLimits.of(0, 10, MAX_LIMIT));
        limitations.put(ActionKind.VOTE_DOWN, QuotaLimits.of(0, 10, MAX_LIMIT));
        // Flag / approve
        limitations.put(ActionKind.APPROVE_HISTORY_ACTION, QuotaLimits.of(0, 10, MAX_LIMIT));
        limitations.put(ActionKind.FLAG_HISTORY_ACTION, QuotaLimits.of(0, 5, MAX_LIMIT));
        limitations.put(ActionKind.FLAG_COMMENT, QuotaLimits.of(0, 1, MAX_LIMIT));
        // Statements
        limitations.put(ActionKind.ADD_STATEMENT, QuotaLimits.of(0, 10, MAX_LIMIT));
        limitations.put(ActionKind.EDIT_OTHER_STATEMENT, QuotaLimits.of(0, 3, MAX_LIMIT));
        limitations.put(ActionKind.REMOVE_STATEMENT, QuotaLimits.of(0, 1, MAX_LIMIT));
        limitations.put(ActionKind.RESTORE_STATEMENT, QuotaLimits.of(0, 2, MAX_LIMIT));
        // Speakers
        limitations.put(ActionKind.ADD_SPEAKER, QuotaLimits.of(0, 10, 50));
        limitations.put(ActionKind.REMOVE_SPEAKER, QuotaLimits.of(0, 0, MAX_LIMIT));
        limitations.put(ActionKind.EDIT_SPEAKER, QuotaLimits.of(0, 5, MAX_LIMIT));
        limitations.put(ActionKind.RESTORE_SPEAKER, QuotaLimits.of(0, 2, MAX_LIMIT));

        return new PermissionsPolicy(minReputations, limitations, confirmedUserThreshold);
    }

    /**
     * Minimum reputation required to perform the action at all.
     *
     * @return the floor, or empty if the action is not part of this policy
     */
    @NonNull
    public OptionalInt minReputation(@NonNull ActionKind action) {
        Integer min = minReputations.get(action);
        return min != null ? OptionalInt.of(min) : OptionalInt.empty();
    }

    public boolean isKnown(@NonNull ActionKind action) {
        return minReputations.containsKey(action);
    }

    @NonNull
    public QuotaTier tierOf(int reputation) {
        return QuotaTier.forReputation(reputation, confirmedUserThreshold);
    }

    /**
     * Daily limit of {@code action} for the user's current tier.
     *
     * @throws IllegalArgumentException if the action is not part of this policy
     */
    public int limitation(@NonNull User user, @NonNull ActionKind action) {
        QuotaLimits limits = limitations.get(action);
        if (limits == null) {
            throw new IllegalArgumentException("Unknown action: " + action.key());
        }
        return limits.forTier(tierOf(user.reputation()));
    }

    @NonNull
    public Map<ActionKind, QuotaLimits> limitations() {
        return limitations;
    }

    @NonNull
    public Map<ActionKind, Integer> minReputations() {
        return minReputations;
    }

    public int confirmedUserThreshold() {
        return confirmedUserThreshold;
    }

    private static <V> Map<ActionKind, V> copy(Map<ActionKind, V> source) {
        Map<ActionKind, V> target = new EnumMap<>(ActionKind.class);
        target.putAll(source);
        return target;
    }
}
