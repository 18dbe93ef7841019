package com.autobudget.engine;

import com.autobudget.domain.enums.CampaignType;
import com.autobudget.domain.model.BudgetAction;
import com.autobudget.domain.model.Campaign;
import java.util.Optional;

/**
 * Maps the current state of one campaign to at most one action.
 * Implementations are selected by {@link CampaignType}.
 */
public interface BudgetPolicy {

    CampaignType getCampaignType();

    Optional<BudgetAction> evaluate(Campaign campaign);
}
