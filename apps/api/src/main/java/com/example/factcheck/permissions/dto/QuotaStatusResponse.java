package com.example.factcheck.permissions.dto;

import com.example.factcheck.permissions.model.ActionKind;
import com.example.factcheck.permissions.model.ActionQuota;
import com.example.factcheck.permissions.model.QuotaTier;

import java.util.List;
import java.util.Map;

/**
 * A user's remaining daily quota for every action.
 */
public record QuotaStatusResponse(
        long userId,
        int reputation,
        QuotaTier tier,
        List<ActionQuota> actions
) {
    public static QuotaStatusResponse of(long userId, int reputation, QuotaTier tier,
                                         Map<ActionKind, ActionQuota> status) {
        return new QuotaStatusResponse(userId, reputation, tier, List.copyOf(status.values()));
    }
}
