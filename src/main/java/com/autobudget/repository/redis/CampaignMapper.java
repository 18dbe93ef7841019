package com.autobudget.repository.redis;

import static com.autobudget.repository.redis.CampaignFields.*;

import com.autobudget.domain.enums.CampaignStatus;
import com.autobudget.domain.enums.CampaignType;
import com.autobudget.domain.model.Campaign;
import java.math.BigDecimal;
import java.time.LocalTime;
import java.time.format.DateTimeFormatter;
import java.time.format.DateTimeParseException;
import java.util.ArrayList;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Normalizes a loosely-typed campaign hash into a {@link Campaign}.
 *
 * <p>Operators edit campaign hashes by hand, so any field may be missing, blank or
 * malformed. Missing fields take the defaults declared on {@link Campaign}; malformed
 * numbers fall back to the same defaults with a warning. Percentages are stored as whole
 * numbers ({@code 50} for 50%) and always divided by 100.
 *
 * <p>Blackout window bounds: a missing field takes the default, a blank or malformed one
 * disables the window.
 */
public final class CampaignMapper {

    private static final Logger log = LoggerFactory.getLogger(CampaignMapper.class);

    public static final DateTimeFormatter HH_MM = DateTimeFormatter.ofPattern("HH:mm");

    private CampaignMapper() {}

    public static Campaign fromHash(String campaignId, Map<String, String> hash) {
        return Campaign.builder()
                .campaignId(campaignId)
                .channel(text(hash, CHANNEL))
                .campaignType(CampaignType.fromStoreValue(hash.get(CAMPAIGN_TYPE)))
                .autoEnabled(flag(hash, AUTO_ENABLED))
                .dailyBudget(decimal(campaignId, hash, DAILY_BUDGET, Campaign.DEFAULT_DAILY_BUDGET))
                .spentToday(decimal(campaignId, hash, SPENT_TODAY, BigDecimal.ZERO))
                .roas(number(campaignId, hash, ROAS, 0))
                .roasTarget(number(campaignId, hash, ROAS_TARGET, Campaign.DEFAULT_ROAS_TARGET))
                .roasMinPct(fraction(campaignId, hash, ROAS_MIN_PCT, Campaign.DEFAULT_ROAS_MIN_PCT))
                .cartValue(decimal(campaignId, hash, CART_VALUE, Campaign.DEFAULT_CART_VALUE))
                .budgetThreshold(fraction(campaignId, hash, BUDGET_THRESHOLD, Campaign.DEFAULT_BUDGET_THRESHOLD))
                .status(CampaignStatus.fromStoreValue(hash.get(STATUS)))
                .scheduleTimes(scheduleTimes(campaignId, hash.get(SCHEDULE_TIMES)))
                .lastScheduleAction(text(hash, LAST_SCHEDULE_ACTION))
                .noIncreaseStart(time(campaignId, hash, NO_INCREASE_START, Campaign.DEFAULT_NO_INCREASE_START))
                .noIncreaseEnd(time(campaignId, hash, NO_INCREASE_END, Campaign.DEFAULT_NO_INCREASE_END))
                .competitionInterval((int) whole(
                        campaignId, hash, COMPETITION_INTERVAL, Campaign.DEFAULT_COMPETITION_INTERVAL_MINUTES))
                .competitionAmount(decimal(campaignId, hash, COMPETITION_AMOUNT, Campaign.DEFAULT_COMPETITION_AMOUNT))
                .lastAutoAction(whole(campaignId, hash, LAST_AUTO_ACTION, 0))
                .eval180(flag(hash, EVAL_180))
                .eval60(flag(hash, EVAL_60))
                .eval15(flag(hash, EVAL_15))
                .clicks(whole(campaignId, hash, CLICKS, 0))
                .cart(whole(campaignId, hash, CART, 0))
                .orders(whole(campaignId, hash, ORDERS, 0))
                .sales(decimal(campaignId, hash, SALES, BigDecimal.ZERO))
                .adCredit(decimal(campaignId, hash, AD_CREDIT, BigDecimal.ZERO))
                .visits(whole(campaignId, hash, VISITS, 0))
                .conversionRate(number(campaignId, hash, CONVERSION_RATE, 0))
                .build();
    }

    /** Parses a comma-separated HH:mm list, keeping order and dropping duplicates and malformed entries. */
    static List<LocalTime> scheduleTimes(String campaignId, String raw) {
        if (raw == null) {
            return new ArrayList<>(Campaign.DEFAULT_SCHEDULE_TIMES);
        }
        Set<LocalTime> times = new LinkedHashSet<>();
        for (String part : raw.split(",")) {
            String value = part.trim();
            if (value.isEmpty()) {
                continue;
            }
            try {
                times.add(LocalTime.parse(value, HH_MM));
            } catch (DateTimeParseException e) {
                log.warn("Campaign {}: dropping malformed schedule time '{}'", campaignId, value);
            }
        }
        return new ArrayList<>(times);
    }

    private static String text(Map<String, String> hash, String field) {
        String value = hash.get(field);
        return value == null || value.isBlank() ? null : value.trim();
    }

    /** Only an explicit "false" (or "0") disables a flag; flags default to true. */
    private static boolean flag(Map<String, String> hash, String field) {
        String value = hash.get(field);
        if (value == null) {
            return true;
        }
        String normalized = value.trim();
        return !("false".equalsIgnoreCase(normalized) || "0".equals(normalized));
    }

    private static BigDecimal decimal(String campaignId, Map<String, String> hash, String field, BigDecimal fallback) {
        String value = hash.get(field);
        if (value == null || value.isBlank()) {
            return fallback;
        }
        try {
            return new BigDecimal(value.trim());
        } catch (NumberFormatException e) {
            log.warn("Campaign {}: malformed {} '{}', using {}", campaignId, field, value, fallback);
            return fallback;
        }
    }

    private static double number(String campaignId, Map<String, String> hash, String field, double fallback) {
        return decimal(campaignId, hash, field, BigDecimal.valueOf(fallback)).doubleValue();
    }

    private static long whole(String campaignId, Map<String, String> hash, String field, long fallback) {
        return decimal(campaignId, hash, field, BigDecimal.valueOf(fallback)).longValue();
    }

    /** Stored as a whole percentage; the fallback is already a fraction. */
    private static double fraction(String campaignId, Map<String, String> hash, String field, double fallback) {
        BigDecimal percent = decimal(campaignId, hash, field, null);
        return percent == null ? fallback : percent.doubleValue() / 100;
    }

    private static LocalTime time(String campaignId, Map<String, String> hash, String field, LocalTime fallback) {
        if (!hash.containsKey(field)) {
            return fallback;
        }
        String value = hash.get(field);
        if (value == null || value.isBlank()) {
            return null;
        }
        try {
            return LocalTime.parse(value.trim(), HH_MM);
        } catch (DateTimeParseException e) {
            log.warn("Campaign {}: malformed {} '{}', window disabled", campaignId, field, value);
            return null;
        }
    }
}
