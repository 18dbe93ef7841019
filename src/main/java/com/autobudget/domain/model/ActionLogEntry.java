package com.autobudget.domain.model;

/**
 * Audit record appended for every applied action.
 *
 * @param time      wall-clock HH:mm in the configured zone
 * @param kind      action kind store value (e.g. "increase_budget")
 * @param channel   campaign channel
 * @param reason    human-readable reason produced by the policy
 * @param timestamp epoch millis
 */
public record ActionLogEntry(String time, String kind, String channel, String reason, long timestamp) {}
