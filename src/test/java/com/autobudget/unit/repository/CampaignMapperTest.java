package com.autobudget.unit.repository;

import static org.assertj.core.api.Assertions.assertThat;

import com.autobudget.domain.enums.CampaignStatus;
import com.autobudget.domain.enums.CampaignType;
import com.autobudget.domain.model.Campaign;
import com.autobudget.repository.redis.CampaignMapper;
import java.time.LocalTime;
import java.util.HashMap;
import java.util.Map;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

/**
 * Unit tests for CampaignMapper normalization of hand-edited campaign hashes.
 */
class CampaignMapperTest {

    @Nested
    @DisplayName("Defaults")
    class Defaults {

        @Test
        @DisplayName("Empty hash gets every documented default")
        void emptyHash() {
            Campaign c = CampaignMapper.fromHash("c1", Map.of());

            assertThat(c.getCampaignId()).isEqualTo("c1");
            assertThat(c.getCampaignType()).isEqualTo(CampaignType.NORMAL);
            assertThat(c.isAutoEnabled()).isTrue();
            assertThat(c.getDailyBudget()).isEqualByComparingTo("200");
            assertThat(c.getRoasTarget()).isEqualTo(30);
            assertThat(c.getRoasMinPct()).isEqualTo(0.5);
            assertThat(c.getCartValue()).isEqualByComparingTo("5");
            assertThat(c.getBudgetThreshold()).isEqualTo(0.9);
            assertThat(c.getStatus()).isEqualTo(CampaignStatus.ACTIVE);
            assertThat(c.getScheduleTimes()).containsExactlyElementsOf(Campaign.DEFAULT_SCHEDULE_TIMES);
            assertThat(c.getNoIncreaseStart()).isEqualTo(LocalTime.of(3, 0));
            assertThat(c.getNoIncreaseEnd()).isEqualTo(LocalTime.of(5, 0));
            assertThat(c.getCompetitionInterval()).isEqualTo(30);
            assertThat(c.getEnabledWindows()).containsExactly(180, 60, 15);
            assertThat(c.getDisplayName()).isEqualTo("c1");
        }

        @Test
        @DisplayName("Unknown status and type fall back to active and normal")
        void unknownEnums() {
            Campaign c = CampaignMapper.fromHash("c1", Map.of("status", "archived", "campaign_type", "turbo"));

            assertThat(c.getStatus()).isEqualTo(CampaignStatus.ACTIVE);
            assertThat(c.getCampaignType()).isEqualTo(CampaignType.NORMAL);
        }

        @Test
        @DisplayName("Malformed number falls back to the default")
        void malformedNumber() {
            Campaign c = CampaignMapper.fromHash("c1", Map.of("daily_budget", "lots", "roas", "n/a"));

            assertThat(c.getDailyBudget()).isEqualByComparingTo("200");
            assertThat(c.getRoas()).isZero();
        }
    }

    @Nested
    @DisplayName("Normalization")
    class Normalization {

        @Test
        @DisplayName("Whole-number percentages become fractions")
        void percentages() {
            Campaign c = CampaignMapper.fromHash("c1", Map.of("roas_min_pct", "50", "budget_threshold", "85"));

            assertThat(c.getRoasMinPct()).isEqualTo(0.5);
            assertThat(c.getBudgetThreshold()).isEqualTo(0.85);
        }

        @Test
        @DisplayName("Single-digit percentages are percentages, not whole fractions")
        void smallPercentages() {
            Campaign c = CampaignMapper.fromHash("c1", Map.of("roas_min_pct", "1", "budget_threshold", "1"));

            assertThat(c.getRoasMinPct()).isEqualTo(0.01);
            assertThat(c.getBudgetThreshold()).isEqualTo(0.01);
        }

        @Test
        @DisplayName("Only an explicit false disables a flag")
        void flags() {
            Campaign c = CampaignMapper.fromHash(
                    "c1", Map.of("auto_enabled", "False", "eval_180", "0", "eval_60", "yes", "eval_15", ""));

            assertThat(c.isAutoEnabled()).isFalse();
            assertThat(c.getEnabledWindows()).containsExactly(60, 15);
        }

        @Test
        @DisplayName("Schedule keeps order, drops duplicates and malformed entries")
        void scheduleTimes() {
            Campaign c = CampaignMapper.fromHash("c1", Map.of("schedule_times", "18:00, 06:00,bad,18:00,25:00"));

            assertThat(c.getScheduleTimes()).containsExactly(LocalTime.of(18, 0), LocalTime.of(6, 0));
        }

        @Test
        @DisplayName("Blank blackout bound disables the window, missing one takes the default")
        void blackoutBounds() {
            Map<String, String> hash = new HashMap<>();
            hash.put("no_increase_start", "");

            Campaign c = CampaignMapper.fromHash("c1", hash);

            assertThat(c.getNoIncreaseStart()).isNull();
            assertThat(c.getNoIncreaseEnd()).isEqualTo(LocalTime.of(5, 0));
        }

        @Test
        @DisplayName("Typed fields are parsed from their store values")
        void typedFields() {
            Campaign c = CampaignMapper.fromHash(
                    "c1",
                    Map.of(
                            "channel", " ShopA ",
                            "campaign_type", "competition",
                            "status", "budget_full",
                            "spent_today", "412.5",
                            "last_auto_action", "1700000000000",
                            "last_schedule_action", "2026-03-10_11:30"));

            assertThat(c.getChannel()).isEqualTo("ShopA");
            assertThat(c.getCampaignType()).isEqualTo(CampaignType.COMPETITION);
            assertThat(c.getStatus()).isEqualTo(CampaignStatus.BUDGET_FULL);
            assertThat(c.getSpentToday()).isEqualByComparingTo("412.5");
            assertThat(c.getLastAutoAction()).isEqualTo(1_700_000_000_000L);
            assertThat(c.getLastScheduleAction()).isEqualTo("2026-03-10_11:30");
        }
    }
}
