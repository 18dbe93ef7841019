package com.autobudget.domain.model;

import com.autobudget.domain.enums.CampaignStatus;
import com.autobudget.domain.enums.CampaignType;
import java.math.BigDecimal;
import java.time.LocalTime;
import java.util.ArrayList;
import java.util.List;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * One advertising campaign under automated budget management.
 *
 * <p>Primary storage is a Redis hash keyed by campaign id. The hash is loosely typed
 * (operators edit it directly), so every field is normalized once by
 * {@code CampaignMapper} on read and the rest of the system only sees this typed form
 * with the defaults below applied.
 *
 * <p>Fractions ({@link #roasMinPct}, {@link #budgetThreshold}) are held as 0..1 values even
 * though the store keeps them as whole percentages.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class Campaign {

    public static final BigDecimal DEFAULT_DAILY_BUDGET = BigDecimal.valueOf(200);
    public static final double DEFAULT_ROAS_TARGET = 30;
    public static final double DEFAULT_ROAS_MIN_PCT = 0.5;
    public static final BigDecimal DEFAULT_CART_VALUE = BigDecimal.valueOf(5);
    public static final double DEFAULT_BUDGET_THRESHOLD = 0.9;
    public static final List<LocalTime> DEFAULT_SCHEDULE_TIMES =
            List.of(LocalTime.of(6, 0), LocalTime.of(11, 30), LocalTime.of(18, 0), LocalTime.of(22, 0));
    public static final LocalTime DEFAULT_NO_INCREASE_START = LocalTime.of(3, 0);
    public static final LocalTime DEFAULT_NO_INCREASE_END = LocalTime.of(5, 0);
    public static final int DEFAULT_COMPETITION_INTERVAL_MINUTES = 30;
    public static final BigDecimal DEFAULT_COMPETITION_AMOUNT = BigDecimal.valueOf(25);

    private String campaignId;

    /** Human-readable channel name; case-insensitive join key to live metrics and credentials. */
    private String channel;

    @Builder.Default
    private CampaignType campaignType = CampaignType.NORMAL;

    @Builder.Default
    private boolean autoEnabled = true;

    @Builder.Default
    private BigDecimal dailyBudget = DEFAULT_DAILY_BUDGET;

    @Builder.Default
    private BigDecimal spentToday = BigDecimal.ZERO;

    private double roas;

    @Builder.Default
    private double roasTarget = DEFAULT_ROAS_TARGET;

    @Builder.Default
    private double roasMinPct = DEFAULT_ROAS_MIN_PCT;

    /** Target cost per add-to-cart used by the window evaluator. */
    @Builder.Default
    private BigDecimal cartValue = DEFAULT_CART_VALUE;

    @Builder.Default
    private double budgetThreshold = DEFAULT_BUDGET_THRESHOLD;

    @Builder.Default
    private CampaignStatus status = CampaignStatus.ACTIVE;

    @Builder.Default
    private List<LocalTime> scheduleTimes = new ArrayList<>(DEFAULT_SCHEDULE_TIMES);

    /** Idempotency key of the last scheduled action, {@code yyyy-MM-dd_HH:mm}. */
    private String lastScheduleAction;

    /** Competition blackout window; null start or end disables it. */
    @Builder.Default
    private LocalTime noIncreaseStart = DEFAULT_NO_INCREASE_START;

    @Builder.Default
    private LocalTime noIncreaseEnd = DEFAULT_NO_INCREASE_END;

    @Builder.Default
    private int competitionInterval = DEFAULT_COMPETITION_INTERVAL_MINUTES;

    @Builder.Default
    private BigDecimal competitionAmount = DEFAULT_COMPETITION_AMOUNT;

    /** Epoch millis of the last automated mutation, 0 if never. */
    private long lastAutoAction;

    @Builder.Default
    private boolean eval180 = true;

    @Builder.Default
    private boolean eval60 = true;

    @Builder.Default
    private boolean eval15 = true;

    // Merged from live metrics and the remote campaign list
    private long clicks;
    private long cart;
    private long orders;

    @Builder.Default
    private BigDecimal sales = BigDecimal.ZERO;

    @Builder.Default
    private BigDecimal adCredit = BigDecimal.ZERO;

    private long visits;
    private double conversionRate;

    /** Channel name when present, otherwise the campaign id. */
    public String getDisplayName() {
        return channel == null || channel.isBlank() ? campaignId : channel;
    }

    /** Fraction of the daily budget already spent; 0 when the budget is not positive. */
    public double getBudgetUsedRatio() {
        if (dailyBudget == null || dailyBudget.signum() <= 0 || spentToday == null) {
            return 0;
        }
        return spentToday.doubleValue() / dailyBudget.doubleValue();
    }

    /** Enabled evaluation windows in minutes, in fixed priority order 180, 60, 15. */
    public List<Integer> getEnabledWindows() {
        List<Integer> windows = new ArrayList<>(3);
        if (eval180) {
            windows.add(180);
        }
        if (eval60) {
            windows.add(60);
        }
        if (eval15) {
            windows.add(15);
        }
        return windows;
    }
}
