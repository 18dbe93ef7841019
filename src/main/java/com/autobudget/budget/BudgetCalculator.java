package com.autobudget.budget;

import java.math.BigDecimal;
import java.math.RoundingMode;
import java.util.Set;

/**
 * Pure budget arithmetic shared by the policies and the action executor.
 *
 * <p>A valid daily budget is at least {@link #MIN_BUDGET} and its value modulo 100 is one
 * of 0, 25, 50 or 75. {@link #roundUp(BigDecimal)} maps any non-negative amount onto that
 * grid, so every amount it produces passes {@link #validate(BigDecimal)}.
 */
public final class BudgetCalculator {

    public static final BigDecimal MIN_BUDGET = BigDecimal.valueOf(200);
    public static final BigDecimal DEFAULT_INCREMENT = BigDecimal.valueOf(25);

    private static final BigDecimal STEP = BigDecimal.valueOf(25);
    private static final BigDecimal HUNDRED = BigDecimal.valueOf(100);
    private static final Set<Integer> VALID_ENDINGS = Set.of(0, 25, 50, 75);

    private BudgetCalculator() {}

    public static BudgetValidationResult validate(BigDecimal amount) {
        if (amount == null || amount.compareTo(MIN_BUDGET) < 0) {
            return BudgetValidationResult.invalid(
                    BudgetValidationResult.BELOW_MINIMUM, "Budget " + amount + " is below minimum " + MIN_BUDGET);
        }
        BigDecimal remainder = amount.remainder(HUNDRED);
        if (remainder.stripTrailingZeros().scale() > 0 || !VALID_ENDINGS.contains(remainder.intValue())) {
            return BudgetValidationResult.invalid(
                    BudgetValidationResult.INVALID_ENDING, "Budget " + amount + " must end in 00, 25, 50 or 75");
        }
        return BudgetValidationResult.valid();
    }

    /** {@code max(MIN_BUDGET, ceil(amount / 25) * 25)}. */
    public static BigDecimal roundUp(BigDecimal amount) {
        BigDecimal rounded = amount.divide(STEP, 0, RoundingMode.CEILING).multiply(STEP);
        return rounded.max(MIN_BUDGET);
    }

    public static BigDecimal calcIncrement(BigDecimal current) {
        return calcIncrement(current, DEFAULT_INCREMENT);
    }

    /** Next budget after adding {@code delta}; a missing or non-positive delta uses the default increment. */
    public static BigDecimal calcIncrement(BigDecimal current, BigDecimal delta) {
        BigDecimal step = delta == null || delta.signum() <= 0 ? DEFAULT_INCREMENT : delta;
        return roundUp(current.add(step));
    }
}
