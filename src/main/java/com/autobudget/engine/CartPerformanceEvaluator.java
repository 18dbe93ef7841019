package com.autobudget.engine;

import com.autobudget.domain.model.Snapshot;
import java.math.BigDecimal;
import java.math.MathContext;
import java.util.Comparator;
import java.util.List;

/**
 * Cost-efficiency verdict over a snapshot window.
 *
 * <p>Compares the chronologically first and last snapshot. The verdict is false when the
 * window has fewer than two points, when less than {@code cartValue} was spent between them,
 * or when no add-to-cart happened. Otherwise the window is good iff the cost per cart is at
 * most {@code cartValue * 1.5}.
 */
public final class CartPerformanceEvaluator {

    static final BigDecimal SLACK = new BigDecimal("1.5");

    private CartPerformanceEvaluator() {}

    public static boolean isCartGood(List<Snapshot> window, BigDecimal cartValue) {
        if (window == null || window.size() < 2 || cartValue == null) {
            return false;
        }
        Snapshot first = window.stream().min(Comparator.comparingLong(Snapshot::timestamp)).orElseThrow();
        Snapshot last = window.stream().max(Comparator.comparingLong(Snapshot::timestamp)).orElseThrow();

        BigDecimal spentDiff = amount(last.spent()).subtract(amount(first.spent()));
        long cartDiff = last.cart() - first.cart();

        if (spentDiff.compareTo(cartValue) < 0 || cartDiff <= 0) {
            return false;
        }
        BigDecimal costPerCart = spentDiff.divide(BigDecimal.valueOf(cartDiff), MathContext.DECIMAL64);
        return costPerCart.compareTo(cartValue.multiply(SLACK)) <= 0;
    }

    private static BigDecimal amount(BigDecimal value) {
        return value != null ? value : BigDecimal.ZERO;
    }
}
