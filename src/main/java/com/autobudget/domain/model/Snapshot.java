package com.autobudget.domain.model;

import java.math.BigDecimal;

/**
 * Point-in-time reading for one campaign. Immutable once written; cart, clicks and
 * orders are cumulative daily counters, so a window's trend is last minus first.
 *
 * @param timestamp epoch millisecond the reading was taken
 * @param spent     spend so far today
 * @param cart      cumulative add-to-cart count
 * @param clicks    cumulative clicks
 * @param orders    cumulative orders
 * @param sales     cumulative sales value
 */
public record Snapshot(long timestamp, BigDecimal spent, long cart, long clicks, long orders, BigDecimal sales) {}
