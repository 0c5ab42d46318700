package com.example.factcheck.permissions.model;

/**
 * Daily occurrence limits of one action, per quota tier.
 *
 * @param negative  limit for users with negative reputation
 * @param newUser   limit for new users
 * @param confirmed limit for confirmed users
 */
public record QuotaLimits(int negative, int newUser, int confirmed) {

    public QuotaLimits {
        if (negative < 0 || newUser < 0 || confirmed < 0) {
            throw new IllegalArgumentException("Quota limits must not be negative");
        }
    }

    public static QuotaLimits of(int negative, int newUser, int confirmed) {
        return new QuotaLimits(negative, newUser, confirmed);
    }

    public int forTier(QuotaTier tier) {
        return switch (tier) {
            case NEGATIVE -> negative;
            case NEW_USER -> newUser;
            case CONFIRMED -> confirmed;
        };
    }
}
