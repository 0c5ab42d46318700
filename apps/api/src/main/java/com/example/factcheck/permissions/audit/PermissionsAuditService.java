package com.example.factcheck.permissions.audit;

import com.example.factcheck.permissions.model.PermissionDecision;
import com.example.factcheck.permissions.model.QuotaTier;
import com.example.factcheck.user.model.User;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import lombok.RequiredArgsConstructor;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.lang.NonNull;
import org.springframework.stereotype.Service;

/**
 * Writes permission decisions as JSON lines to the {@code PERMISSIONS_AUDIT} logger.
 * Denials are logged at WARN, allowed decisions at DEBUG.
 */
@Service
@RequiredArgsConstructor
@ConditionalOnProperty(name = "app.permissions.audit.enabled", havingValue = "true", matchIfMissing = true)
public class PermissionsAuditService {

    private static final Logger AUDIT_LOG = LoggerFactory.getLogger("PERMISSIONS_AUDIT");

    private final ObjectMapper objectMapper;

    /**
     * @param used  occurrences of the action in the current period
     * @param limit the user's limit for the action, or -1 when the action is unknown
     */
    public void logDecision(
            @NonNull User user,
            @NonNull QuotaTier tier,
            @NonNull PermissionDecision decision,
            int used,
            int limit) {

        if (decision.isAllowed() && !AUDIT_LOG.isDebugEnabled()) {
            return;
        }
        PermissionsAuditEvent event = PermissionsAuditEvent.from(user, tier, decision, used, limit);
        try {
            String json = objectMapper.writeValueAsString(event.toStructuredLog());
            if (decision.isAllowed()) {
                AUDIT_LOG.debug(json);
            } else {
                AUDIT_LOG.warn(json);
            }
        } catch (JsonProcessingException e) {
            AUDIT_LOG.error("Failed to serialize audit event: {}", e.getOriginalMessage());
            AUDIT_LOG.warn("Permission {} - user={}, action={}, reason={}",
                    event.outcome(), event.userId(), event.action(), event.reason());
        }
    }
}
