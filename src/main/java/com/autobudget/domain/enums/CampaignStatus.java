package com.autobudget.domain.enums;

import lombok.Getter;
import lombok.RequiredArgsConstructor;

/**
 * Lifecycle status of a managed campaign.
 *
 * <p>Written by the action executor (and by the remote merge, which flips a campaign to
 * BUDGET_FULL once spend reaches 99% of its daily budget). The store value is the
 * snake_case string kept in the campaign hash.
 */
@Getter
@RequiredArgsConstructor
public enum CampaignStatus {
    ACTIVE("active"),
    PAUSED("paused"),
    BUDGET_FULL("budget_full");

    private final String storeValue;

    /** Resolves a stored value, falling back to ACTIVE for missing or unknown values. */
    public static CampaignStatus fromStoreValue(String value) {
        if (value != null) {
            for (CampaignStatus status : values()) {
                if (status.storeValue.equalsIgnoreCase(value.trim())) {
                    return status;
                }
            }
        }
        return ACTIVE;
    }
}
