package com.autobudget.domain.model;

import com.autobudget.domain.enums.ActionKind;
import java.math.BigDecimal;
import lombok.Builder;
import lombok.Value;

/**
 * A decision produced by a budget policy and consumed once by the action executor.
 * Never persisted itself; only its effects on the campaign and the action log are.
 */
@Value
@Builder
public class BudgetAction {

    String campaignId;
    ActionKind kind;

    /** Target daily budget; set for SET_BUDGET and INCREASE_BUDGET only. */
    BigDecimal newBudget;

    String reason;
    String channel;

    /** Idempotency key for scheduled actions, null otherwise. */
    String scheduleKey;
}
