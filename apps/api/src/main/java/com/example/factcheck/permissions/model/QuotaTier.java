package com.example.factcheck.permissions.model;

/**
 * Reputation bands, each with its own per-action daily limit.
 */
public enum QuotaTier {
    /**
     * Reputation below zero. Most actions are closed.
     */
    NEGATIVE,

    /**
     * Reputation between zero and the confirmed-user threshold, inclusive.
     */
    NEW_USER,

    /**
     * Reputation strictly above the confirmed-user threshold.
     */
    CONFIRMED;

    /**
     * Select the tier for a reputation score. Pure and total.
     *
     * @param reputation         the user's reputation
     * @param confirmedThreshold reputation above which a user is confirmed
     */
    public static QuotaTier forReputation(int reputation, int confirmedThreshold) {
        if (reputation > confirmedThreshold) {
            return CONFIRMED;
        }
        if (reputation >= 0) {
            return NEW_USER;
        }
        return NEGATIVE;
    }
}
