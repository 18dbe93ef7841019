package com.autobudget.engine;

import com.autobudget.budget.BudgetCalculator;
import com.autobudget.domain.enums.ActionKind;
import com.autobudget.domain.enums.CampaignStatus;
import com.autobudget.domain.enums.CampaignType;
import com.autobudget.domain.model.BudgetAction;
import com.autobudget.domain.model.Campaign;
import com.autobudget.repository.redis.CampaignMapper;
import com.autobudget.snapshot.SnapshotService;
import java.math.BigDecimal;
import java.time.Clock;
import java.time.LocalDate;
import java.time.LocalTime;
import java.time.temporal.ChronoUnit;
import java.util.Locale;
import java.util.Optional;
import org.springframework.stereotype.Component;

/**
 * Policy for regular campaigns. Rules are checked in order and the first match wins:
 * <ol>
 *   <li>ROAS below {@code roasTarget * roasMinPct}: freeze the budget at the rounded spend,
 *       or pause when spend is still at or under the minimum budget. Ends evaluation.</li>
 *   <li>Budget used at or above the threshold: grow by one increment when ROAS meets the
 *       target, else when the first enabled window (180, 60, 15 min) shows good cart cost.</li>
 *   <li>Paused or budget-full campaigns: reactivate at a configured schedule time, once per
 *       day and time.</li>
 * </ol>
 */
@Component
public class NormalBudgetPolicy implements BudgetPolicy {

    private final SnapshotService snapshotService;
    private final Clock clock;

    public NormalBudgetPolicy(SnapshotService snapshotService, Clock clock) {
        this.snapshotService = snapshotService;
        this.clock = clock;
    }

    @Override
    public CampaignType getCampaignType() {
        return CampaignType.NORMAL;
    }

    @Override
    public Optional<BudgetAction> evaluate(Campaign campaign) {
        BigDecimal spent = campaign.getSpentToday();
        BigDecimal budget = campaign.getDailyBudget();
        double roas = campaign.getRoas();
        double roasFloor = campaign.getRoasTarget() * campaign.getRoasMinPct();

        if (roas > 0 && roas < roasFloor) {
            return lowRoas(campaign, spent, budget, roas, roasFloor);
        }

        double used = campaign.getBudgetUsedRatio();
        if (used >= campaign.getBudgetThreshold()) {
            if (roas >= campaign.getRoasTarget()) {
                return Optional.of(action(campaign, ActionKind.INCREASE_BUDGET)
                        .newBudget(BudgetCalculator.calcIncrement(budget))
                        .reason(String.format(
                                Locale.ROOT,
                                "ROAS good (%.1f >= %.1f), budget used %.0f%%",
                                roas,
                                campaign.getRoasTarget(),
                                used * 100))
                        .build());
            }
            for (int minutes : campaign.getEnabledWindows()) {
                if (CartPerformanceEvaluator.isCartGood(
                        snapshotService.window(campaign.getCampaignId(), minutes), campaign.getCartValue())) {
                    return Optional.of(action(campaign, ActionKind.INCREASE_BUDGET)
                            .newBudget(BudgetCalculator.calcIncrement(budget))
                            .reason(String.format(
                                    Locale.ROOT, "Cart good over %d min, budget used %.0f%%", minutes, used * 100))
                            .build());
                }
            }
        }

        if (campaign.getStatus() == CampaignStatus.BUDGET_FULL || campaign.getStatus() == CampaignStatus.PAUSED) {
            return scheduled(campaign);
        }
        return Optional.empty();
    }

    private Optional<BudgetAction> lowRoas(
            Campaign campaign, BigDecimal spent, BigDecimal budget, double roas, double roasFloor) {
        if (spent.compareTo(BudgetCalculator.MIN_BUDGET) > 0) {
            BigDecimal freeze = BudgetCalculator.roundUp(spent);
            if (freeze.compareTo(budget) == 0) {
                return Optional.empty();
            }
            return Optional.of(action(campaign, ActionKind.SET_BUDGET)
                    .newBudget(freeze)
                    .reason(String.format(Locale.ROOT, "ROAS low (%.1f < %.1f), freeze budget", roas, roasFloor))
                    .build());
        }
        if (campaign.getStatus() == CampaignStatus.PAUSED) {
            return Optional.empty();
        }
        return Optional.of(action(campaign, ActionKind.PAUSE)
                .reason(String.format(Locale.ROOT, "ROAS low (%.1f), spend under %s, stop", roas, BudgetCalculator.MIN_BUDGET))
                .build());
    }

    private Optional<BudgetAction> scheduled(Campaign campaign) {
        LocalTime now = LocalTime.now(clock).truncatedTo(ChronoUnit.MINUTES);
        if (!campaign.getScheduleTimes().contains(now)) {
            return Optional.empty();
        }
        String time = now.format(CampaignMapper.HH_MM);
        String scheduleKey = LocalDate.now(clock) + "_" + time;
        if (scheduleKey.equals(campaign.getLastScheduleAction())) {
            return Optional.empty();
        }

        if (campaign.getStatus() == CampaignStatus.BUDGET_FULL) {
            return Optional.of(action(campaign, ActionKind.INCREASE_BUDGET)
                    .newBudget(BudgetCalculator.calcIncrement(campaign.getDailyBudget()))
                    .reason("Scheduled " + time + ": budget full, +" + BudgetCalculator.DEFAULT_INCREMENT)
                    .scheduleKey(scheduleKey)
                    .build());
        }
        return Optional.of(action(campaign, ActionKind.RESUME)
                .reason("Scheduled " + time + ": resume")
                .scheduleKey(scheduleKey)
                .build());
    }

    private static BudgetAction.BudgetActionBuilder action(Campaign campaign, ActionKind kind) {
        return BudgetAction.builder()
                .campaignId(campaign.getCampaignId())
                .channel(campaign.getDisplayName())
                .kind(kind);
    }
}
