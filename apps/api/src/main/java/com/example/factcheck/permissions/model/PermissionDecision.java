package com.example.factcheck.permissions.model;

import com.fasterxml.jackson.annotation.JsonIgnore;

/**
 * Result of checking whether a user may perform an action right now.
 *
 * @param outcome  the decision
 * @param userId   the user the decision applies to
 * @param action   the action, null when the requested action key was not recognized
 * @param reason   human-readable reason, surfaced to API clients on denial
 */
public record PermissionDecision(
        Outcome outcome,
        long userId,
        ActionKind action,
        String reason
) {
    public enum Outcome {
        ALLOWED("ok"),
        UNKNOWN_ACTION("unknown action"),
        INSUFFICIENT_REPUTATION("not enough reputation"),
        LIMIT_REACHED("limit reached");

        private final String reason;

        Outcome(String reason) {
            this.reason = reason;
        }

        public String reason() {
            return reason;
        }
    }

    public static PermissionDecision allowed(long userId, ActionKind action) {
        return new PermissionDecision(Outcome.ALLOWED, userId, action, Outcome.ALLOWED.reason());
    }

    public static PermissionDecision denied(Outcome outcome, long userId, ActionKind action) {
        if (outcome == Outcome.ALLOWED) {
            throw new IllegalArgumentException("A denial needs a denial outcome");
        }
        return new PermissionDecision(outcome, userId, action, outcome.reason());
    }

    @JsonIgnore
    public boolean isAllowed() {
        return outcome == Outcome.ALLOWED;
    }

    @JsonIgnore
    public boolean isDenied() {
        return outcome != Outcome.ALLOWED;
    }
}
