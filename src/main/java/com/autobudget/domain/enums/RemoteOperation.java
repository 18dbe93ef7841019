package com.autobudget.domain.enums;

/**
 * Operations of the remote ads API. Each one is individually available depending on
 * whether its endpoint path is configured.
 */
public enum RemoteOperation {
    VERIFY_AUTH,
    BALANCE,
    CAMPAIGN_LIST,
    SET_BUDGET,
    PAUSE,
    RESUME
}
