package com.example.factcheck.user.model;

/**
 * Read-only view of a registered user as seen by the permissions layer.
 *
 * @param id         Unique user ID
 * @param reputation Signed reputation score, maintained by the accounts service
 */
public record User(long id, int reputation) {

    public User withReputation(int newReputation) {
        return new User(id, newReputation);
    }
}
