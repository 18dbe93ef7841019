package com.autobudget.domain.enums;

import lombok.Getter;
import lombok.RequiredArgsConstructor;

/**
 * Selects the budget policy applied to a campaign.
 * <ul>
 *   <li>NORMAL -- ROAS floor, threshold growth on ROAS or cart performance, scheduled reactivation</li>
 *   <li>COMPETITION -- fixed-cadence growth once the budget is full, cart verdict only sizes the step</li>
 * </ul>
 */
@Getter
@RequiredArgsConstructor
public enum CampaignType {
    NORMAL("normal"),
    COMPETITION("competition");

    private final String storeValue;

    public static CampaignType fromStoreValue(String value) {
        if (value != null && COMPETITION.storeValue.equalsIgnoreCase(value.trim())) {
            return COMPETITION;
        }
        return NORMAL;
    }
}
