package com.autobudget.budget;

import lombok.Getter;

/**
 * Result of validating a daily budget amount.
 *
 * <p>Either VALID (no code) or INVALID with a machine-readable code
 * ({@code BELOW_MINIMUM}, {@code INVALID_ENDING}) and a human-readable reason.
 * The action executor checks this before any store write.
 */
@Getter
public class BudgetValidationResult {

    public static final String BELOW_MINIMUM = "BELOW_MINIMUM";
    public static final String INVALID_ENDING = "INVALID_ENDING";

    private static final BudgetValidationResult VALID = new BudgetValidationResult(true, null, "OK");

    private final boolean valid;
    private final String code;
    private final String reason;

    private BudgetValidationResult(boolean valid, String code, String reason) {
        this.valid = valid;
        this.code = code;
        this.reason = reason;
    }

    public static BudgetValidationResult valid() {
        return VALID;
    }

    public static BudgetValidationResult invalid(String code, String reason) {
        return new BudgetValidationResult(false, code, reason);
    }

    @Override
    public String toString() {
        return valid ? "VALID" : code + ": " + reason;
    }
}
