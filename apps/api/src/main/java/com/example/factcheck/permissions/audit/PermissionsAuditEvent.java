package com.example.factcheck.permissions.audit;

import com.example.factcheck.permissions.model.PermissionDecision;
import com.example.factcheck.permissions.model.QuotaTier;
import com.example.factcheck.user.model.User;

import java.time.Instant;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.UUID;

/**
 * Structured audit event for a permission decision.
 */
public record PermissionsAuditEvent(
        String eventId,
        Instant timestamp,
        PermissionDecision.Outcome outcome,
        String reason,
        long userId,
        int reputation,
        QuotaTier tier,
        String action,
        int used,
        int limit
) {
    public static PermissionsAuditEvent from(
            User user,
            QuotaTier tier,
            PermissionDecision decision,
            int used,
            int limit) {
        return new PermissionsAuditEvent(
                UUID.randomUUID().toString(),
                Instant.now(),
                decision.outcome(),
                decision.reason(),
                user.id(),
                user.reputation(),
                tier,
                decision.action() != null ? decision.action().key() : null,
                used,
                limit
        );
    }

    /**
     * Flattened representation for JSON logging. Null values are omitted.
     */
    public Map<String, Object> toStructuredLog() {
        Map<String, Object> log = new LinkedHashMap<>();
        log.put("event_type", "PERMISSION_DECISION");
        log.put("event_id", eventId);
        log.put("timestamp", timestamp.toString());
        log.put("outcome", outcome.name());
        log.put("reason", reason);
        log.put("user_id", userId);
        log.put("reputation", reputation);
        log.put("tier", tier.name());
        if (action != null) {
            log.put("action", action);
        }
        if (limit >= 0) {
            log.put("used", used);
            log.put("limit", limit);
        }
        return log;
    }
}
