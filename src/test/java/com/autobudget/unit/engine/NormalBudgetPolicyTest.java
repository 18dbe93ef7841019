package com.autobudget.unit.engine;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.ArgumentMatchers.anyInt;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

import com.autobudget.domain.enums.ActionKind;
import com.autobudget.domain.enums.CampaignStatus;
import com.autobudget.domain.model.BudgetAction;
import com.autobudget.domain.model.Campaign;
import com.autobudget.domain.model.Snapshot;
import com.autobudget.engine.NormalBudgetPolicy;
import com.autobudget.snapshot.SnapshotService;
import java.math.BigDecimal;
import java.time.Clock;
import java.time.ZoneId;
import java.time.ZonedDateTime;
import java.util.List;
import java.util.Optional;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

/**
 * Unit tests for NormalBudgetPolicy covering the ROAS floor, threshold growth and scheduled
 * reactivation, in rule order.
 */
@ExtendWith(MockitoExtension.class)
class NormalBudgetPolicyTest {

    private static final ZoneId ZONE = ZoneId.of("Asia/Bangkok");

    @Mock
    private SnapshotService snapshotService;

    private NormalBudgetPolicy policy;

    @BeforeEach
    void setUp() {
        policy = new NormalBudgetPolicy(snapshotService, clockAt(14, 7));
    }

    private static Clock clockAt(int hour, int minute) {
        return Clock.fixed(ZonedDateTime.of(2026, 3, 10, hour, minute, 20, 0, ZONE).toInstant(), ZONE);
    }

    private static Campaign.CampaignBuilder campaign() {
        return Campaign.builder()
                .campaignId("c1")
                .channel("ShopA")
                .roasTarget(30)
                .roasMinPct(0.5)
                .budgetThreshold(0.9);
    }

    private static List<Snapshot> goodWindow() {
        return List.of(
                new Snapshot(0, new BigDecimal("10"), 2, 0, 0, BigDecimal.ZERO),
                new Snapshot(600_000, new BigDecimal("20"), 4, 0, 0, BigDecimal.ZERO));
    }

    // ==============================
    // ROAS FLOOR
    // ==============================

    @Nested
    @DisplayName("ROAS below floor")
    class LowRoas {

        @Test
        @DisplayName("Spend above minimum freezes the budget at the rounded spend")
        void highSpend_freezes() {
            Campaign c = campaign()
                    .roas(10)
                    .spentToday(new BigDecimal("500"))
                    .dailyBudget(new BigDecimal("600"))
                    .build();

            Optional<BudgetAction> action = policy.evaluate(c);

            assertThat(action).isPresent();
            assertThat(action.get().getKind()).isEqualTo(ActionKind.SET_BUDGET);
            assertThat(action.get().getNewBudget()).isEqualByComparingTo("500");
            assertThat(action.get().getChannel()).isEqualTo("ShopA");
        }

        @Test
        @DisplayName("Freeze equal to the current budget yields nothing")
        void freezeUnchanged_noAction() {
            Campaign c = campaign()
                    .roas(10)
                    .spentToday(new BigDecimal("480"))
                    .dailyBudget(new BigDecimal("500"))
                    .build();

            assertThat(policy.evaluate(c)).isEmpty();
        }

        @Test
        @DisplayName("Spend under the minimum pauses an active campaign")
        void lowSpend_pauses() {
            Campaign c = campaign()
                    .roas(10)
                    .spentToday(new BigDecimal("150"))
                    .dailyBudget(new BigDecimal("200"))
                    .status(CampaignStatus.ACTIVE)
                    .build();

            Optional<BudgetAction> action = policy.evaluate(c);

            assertThat(action).isPresent();
            assertThat(action.get().getKind()).isEqualTo(ActionKind.PAUSE);
            assertThat(action.get().getNewBudget()).isNull();
        }

        @Test
        @DisplayName("Spend of exactly the minimum pauses")
        void spendAtMinimum_pauses() {
            Campaign c = campaign()
                    .roas(10)
                    .spentToday(new BigDecimal("200"))
                    .dailyBudget(new BigDecimal("300"))
                    .build();

            assertThat(policy.evaluate(c)).map(BudgetAction::getKind).contains(ActionKind.PAUSE);
        }

        @Test
        @DisplayName("Already paused campaign is left alone, even at a schedule time")
        void alreadyPaused_noAction() {
            policy = new NormalBudgetPolicy(snapshotService, clockAt(11, 30));
            Campaign c = campaign()
                    .roas(10)
                    .spentToday(new BigDecimal("150"))
                    .status(CampaignStatus.PAUSED)
                    .build();

            assertThat(policy.evaluate(c)).isEmpty();
        }

        @Test
        @DisplayName("Low ROAS pre-empts threshold growth")
        void preemptsGrowth() {
            Campaign c = campaign()
                    .roas(10)
                    .spentToday(new BigDecimal("195"))
                    .dailyBudget(new BigDecimal("200"))
                    .build();

            assertThat(policy.evaluate(c)).map(BudgetAction::getKind).contains(ActionKind.PAUSE);
            verify(snapshotService, never()).window(anyString(), anyInt());
        }

        @Test
        @DisplayName("Zero ROAS means no data and skips the floor")
        void zeroRoas_skipsFloor() {
            Campaign c = campaign()
                    .roas(0)
                    .spentToday(new BigDecimal("50"))
                    .dailyBudget(new BigDecimal("200"))
                    .build();

            assertThat(policy.evaluate(c)).isEmpty();
        }
    }

    // ==============================
    // THRESHOLD GROWTH
    // ==============================

    @Nested
    @DisplayName("Budget threshold reached")
    class Threshold {

        @Test
        @DisplayName("ROAS at target grows by one increment")
        void roasGood_increases() {
            Campaign c = campaign()
                    .roas(35)
                    .spentToday(new BigDecimal("190"))
                    .dailyBudget(new BigDecimal("200"))
                    .build();

            Optional<BudgetAction> action = policy.evaluate(c);

            assertThat(action).isPresent();
            assertThat(action.get().getKind()).isEqualTo(ActionKind.INCREASE_BUDGET);
            assertThat(action.get().getNewBudget()).isEqualByComparingTo("225");
            verify(snapshotService, never()).window(anyString(), anyInt());
        }

        @Test
        @DisplayName("First good window in 180, 60, 15 order wins")
        void cartGoodIn60_increases() {
            when(snapshotService.window("c1", 180)).thenReturn(List.of());
            when(snapshotService.window("c1", 60)).thenReturn(goodWindow());
            Campaign c = campaign()
                    .roas(20)
                    .spentToday(new BigDecimal("280"))
                    .dailyBudget(new BigDecimal("300"))
                    .build();

            Optional<BudgetAction> action = policy.evaluate(c);

            assertThat(action).isPresent();
            assertThat(action.get().getNewBudget()).isEqualByComparingTo("325");
            assertThat(action.get().getReason()).contains("60 min");
            verify(snapshotService, never()).window("c1", 15);
        }

        @Test
        @DisplayName("Disabled windows are not consulted")
        void disabledWindows_skipped() {
            when(snapshotService.window("c1", 15)).thenReturn(goodWindow());
            Campaign c = campaign()
                    .roas(20)
                    .eval180(false)
                    .eval60(false)
                    .spentToday(new BigDecimal("280"))
                    .dailyBudget(new BigDecimal("300"))
                    .build();

            assertThat(policy.evaluate(c)).map(BudgetAction::getReason).hasValueSatisfying(r -> assertThat(r)
                    .contains("15 min"));
            verify(snapshotService, never()).window(eq("c1"), eq(180));
        }

        @Test
        @DisplayName("No good window and ROAS under target yields nothing")
        void nothingGood_noAction() {
            when(snapshotService.window(eq("c1"), anyInt())).thenReturn(List.of());
            Campaign c = campaign()
                    .roas(20)
                    .spentToday(new BigDecimal("280"))
                    .dailyBudget(new BigDecimal("300"))
                    .build();

            assertThat(policy.evaluate(c)).isEmpty();
        }

        @Test
        @DisplayName("Below threshold nothing is evaluated")
        void belowThreshold_noAction() {
            Campaign c = campaign()
                    .roas(40)
                    .spentToday(new BigDecimal("100"))
                    .dailyBudget(new BigDecimal("300"))
                    .build();

            assertThat(policy.evaluate(c)).isEmpty();
        }
    }

    // ==============================
    // SCHEDULED REACTIVATION
    // ==============================

    @Nested
    @DisplayName("Scheduled reactivation")
    class Schedule {

        @BeforeEach
        void atScheduleTime() {
            policy = new NormalBudgetPolicy(snapshotService, clockAt(11, 30));
        }

        @Test
        @DisplayName("Budget-full campaign grows by one increment with a schedule key")
        void budgetFull_increases() {
            Campaign c = campaign()
                    .status(CampaignStatus.BUDGET_FULL)
                    .spentToday(new BigDecimal("100"))
                    .dailyBudget(new BigDecimal("300"))
                    .build();

            Optional<BudgetAction> action = policy.evaluate(c);

            assertThat(action).isPresent();
            assertThat(action.get().getKind()).isEqualTo(ActionKind.INCREASE_BUDGET);
            assertThat(action.get().getNewBudget()).isEqualByComparingTo("325");
            assertThat(action.get().getScheduleKey()).isEqualTo("2026-03-10_11:30");
        }

        @Test
        @DisplayName("Paused campaign resumes")
        void paused_resumes() {
            Campaign c = campaign().status(CampaignStatus.PAUSED).build();

            assertThat(policy.evaluate(c)).map(BudgetAction::getKind).contains(ActionKind.RESUME);
        }

        @Test
        @DisplayName("Fires at most once per day and time")
        void idempotent() {
            Campaign c = campaign().status(CampaignStatus.PAUSED).build();

            Optional<BudgetAction> first = policy.evaluate(c);
            c.setLastScheduleAction(first.orElseThrow().getScheduleKey());

            assertThat(policy.evaluate(c)).isEmpty();
        }

        @Test
        @DisplayName("Yesterday's key does not block today's occurrence")
        void previousDayKey_fires() {
            Campaign c = campaign()
                    .status(CampaignStatus.PAUSED)
                    .lastScheduleAction("2026-03-09_11:30")
                    .build();

            assertThat(policy.evaluate(c)).isPresent();
        }

        @Test
        @DisplayName("Active campaigns are never rescheduled")
        void active_noAction() {
            assertThat(policy.evaluate(campaign().status(CampaignStatus.ACTIVE).build()))
                    .isEmpty();
        }

        @Test
        @DisplayName("Off-schedule minute yields nothing")
        void offSchedule_noAction() {
            policy = new NormalBudgetPolicy(snapshotService, clockAt(11, 31));

            assertThat(policy.evaluate(campaign().status(CampaignStatus.PAUSED).build()))
                    .isEmpty();
        }
    }
}
