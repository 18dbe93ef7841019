package com.autobudget.engine;

import com.autobudget.budget.BudgetCalculator;
import com.autobudget.domain.enums.ActionKind;
import com.autobudget.domain.enums.CampaignStatus;
import com.autobudget.domain.enums.CampaignType;
import com.autobudget.domain.model.BudgetAction;
import com.autobudget.domain.model.Campaign;
import com.autobudget.snapshot.SnapshotService;
import java.time.Clock;
import java.time.LocalTime;
import java.util.Optional;
import org.springframework.stereotype.Component;

/**
 * Policy for high-contention campaigns.
 *
 * <p>Outside the blackout window, a campaign whose budget is full grows on a fixed cadence
 * ({@code competitionInterval} minutes since the last automated action). The 15-minute cart
 * verdict only sizes the step: {@code competitionAmount} when good, the default increment
 * otherwise.
 */
@Component
public class CompetitionBudgetPolicy implements BudgetPolicy {

    static final double FULL_RATIO = 0.99;
    static final int CART_WINDOW_MINUTES = 15;

    private final SnapshotService snapshotService;
    private final Clock clock;

    public CompetitionBudgetPolicy(SnapshotService snapshotService, Clock clock) {
        this.snapshotService = snapshotService;
        this.clock = clock;
    }

    @Override
    public CampaignType getCampaignType() {
        return CampaignType.COMPETITION;
    }

    @Override
    public Optional<BudgetAction> evaluate(Campaign campaign) {
        if (DailyTimeWindow.contains(campaign.getNoIncreaseStart(), campaign.getNoIncreaseEnd(), LocalTime.now(clock))) {
            return Optional.empty();
        }
        boolean full = campaign.getBudgetUsedRatio() >= FULL_RATIO || campaign.getStatus() == CampaignStatus.BUDGET_FULL;
        if (!full || elapsedMinutes(campaign) < campaign.getCompetitionInterval()) {
            return Optional.empty();
        }

        BudgetAction.BudgetActionBuilder action = BudgetAction.builder()
                .campaignId(campaign.getCampaignId())
                .channel(campaign.getDisplayName())
                .kind(ActionKind.INCREASE_BUDGET);

        if (CartPerformanceEvaluator.isCartGood(
                snapshotService.window(campaign.getCampaignId(), CART_WINDOW_MINUTES), campaign.getCartValue())) {
            return Optional.of(action.newBudget(
                            BudgetCalculator.calcIncrement(campaign.getDailyBudget(), campaign.getCompetitionAmount()))
                    .reason("Competition: cart good over 15 min, +" + campaign.getCompetitionAmount())
                    .build());
        }
        return Optional.of(action.newBudget(BudgetCalculator.calcIncrement(campaign.getDailyBudget()))
                .reason("Competition: every " + campaign.getCompetitionInterval() + " min, +"
                        + BudgetCalculator.DEFAULT_INCREMENT + " regardless of cart")
                .build());
    }

    /** Minutes since the last automated action; never acted means always due. */
    private double elapsedMinutes(Campaign campaign) {
        if (campaign.getLastAutoAction() <= 0) {
            return Double.MAX_VALUE;
        }
        return (clock.millis() - campaign.getLastAutoAction()) / 60_000.0;
    }
}
