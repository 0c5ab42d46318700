package com.example.factcheck.permissions.exception;

import com.example.factcheck.permissions.model.PermissionDecision;
import org.springframework.http.HttpStatus;
import org.springframework.web.bind.annotation.ResponseStatus;

/**
 * Thrown when a user is not allowed to perform an action: unknown action,
 * not enough reputation, or daily limit reached.
 */
@ResponseStatus(HttpStatus.FORBIDDEN)
public class PermissionsException extends RuntimeException {

    private final PermissionDecision decision;

    public PermissionsException(PermissionDecision decision) {
        super(decision.reason());
        this.decision = decision;
    }

    public PermissionDecision getDecision() {
        return decision;
    }

    public PermissionDecision.Outcome getOutcome() {
        return decision.outcome();
    }
}
