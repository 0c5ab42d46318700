package com.example.factcheck.permissions.model;

/**
 * Snapshot of one user's standing for one action in the current period.
 *
 * @param action        the action
 * @param minReputation reputation floor of the action
 * @param limit         daily limit for the user's tier
 * @param used          occurrences recorded so far
 * @param remaining     occurrences left, zero when the action is not allowed at all
 * @param allowed       whether a check would currently succeed
 */
public record ActionQuota(
        ActionKind action,
        int minReputation,
        int limit,
        int used,
        int remaining,
        boolean allowed
) {}
