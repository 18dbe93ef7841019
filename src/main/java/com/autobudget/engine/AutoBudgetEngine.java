package com.autobudget.engine;

import com.autobudget.domain.enums.CampaignType;
import com.autobudget.domain.model.BudgetAction;
import com.autobudget.domain.model.Campaign;
import java.util.ArrayList;
import java.util.EnumMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

/**
 * Runs the policy matching each campaign's type and collects the resulting actions.
 *
 * <p>Campaigns with automation disabled are skipped. A failure while evaluating one
 * campaign (typically a snapshot read) yields no action for that campaign only.
 */
@Service
public class AutoBudgetEngine {

    private static final Logger log = LoggerFactory.getLogger(AutoBudgetEngine.class);

    private final Map<CampaignType, BudgetPolicy> policies = new EnumMap<>(CampaignType.class);

    public AutoBudgetEngine(List<BudgetPolicy> budgetPolicies) {
        for (BudgetPolicy policy : budgetPolicies) {
            policies.put(policy.getCampaignType(), policy);
        }
    }

    public List<BudgetAction> evaluateAll(List<Campaign> campaigns) {
        List<BudgetAction> actions = new ArrayList<>();
        for (Campaign campaign : campaigns) {
            if (!campaign.isAutoEnabled()) {
                continue;
            }
            BudgetPolicy policy = policies.get(campaign.getCampaignType());
            if (policy == null) {
                log.warn("No budget policy for type {}, skipping campaign {}", campaign.getCampaignType(), campaign.getCampaignId());
                continue;
            }
            try {
                Optional<BudgetAction> action = policy.evaluate(campaign);
                action.ifPresent(actions::add);
            } catch (RuntimeException e) {
                log.warn("Evaluation failed for campaign {}: {}", campaign.getCampaignId(), e.getMessage());
            }
        }
        return actions;
    }
}
