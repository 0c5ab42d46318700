package com.example.factcheck.observability.metrics;

import com.example.factcheck.permissions.model.ActionKind;
import com.example.factcheck.permissions.model.PermissionDecision;
import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.Gauge;
import io.micrometer.core.instrument.MeterRegistry;
import org.springframework.lang.NonNull;
import org.springframework.lang.Nullable;
import org.springframework.stereotype.Component;

import java.util.function.Supplier;

/**
 * Metrics for permission decisions and quota usage.
 * Tag values come from enums only, so cardinality stays bounded.
 */
@Component
public class PermissionsMetrics {

    private static final String TAG_ACTION = "action";
    private static final String TAG_OUTCOME = "outcome";
    private static final String TAG_UNKNOWN = "unknown";

    private final MeterRegistry registry;
    private final Counter resetCounter;

    public PermissionsMetrics(@NonNull MeterRegistry registry) {
        this.registry = registry;
        this.resetCounter = Counter.builder("permissions.reset")
                .description("Daily quota resets")
                .register(registry);
    }

    public void recordDecision(@NonNull PermissionDecision decision) {
        Counter.builder("permissions.decision")
                .tag(TAG_ACTION, actionTag(decision.action()))
                .tag(TAG_OUTCOME, decision.outcome().name().toLowerCase())
                .description("Permission decisions by action and outcome")
                .register(registry)
                .increment();
    }

    public void recordUsage(@NonNull ActionKind action) {
        Counter.builder("permissions.recorded")
                .tag(TAG_ACTION, action.key())
                .description("Actions counted against a user's daily quota")
                .register(registry)
                .increment();
    }

    public void recordEffectFailure(@NonNull ActionKind action) {
        Counter.builder("permissions.effect.failure")
                .tag(TAG_ACTION, action.key())
                .description("Guarded actions that failed and were not counted")
                .register(registry)
                .increment();
    }

    public void recordReset() {
        resetCounter.increment();
    }

    public void registerTrackedUsersGauge(@NonNull Supplier<Number> trackedUsers) {
        Gauge.builder("permissions.tracked.users", trackedUsers)
                .description("Users with recorded actions in the current period")
                .register(registry);
    }

    private static String actionTag(@Nullable ActionKind action) {
        return action != null ? action.key() : TAG_UNKNOWN;
    }
}
