package com.autobudget.repository.redis;

/** Field names of the campaign hash, shared by the mapper and every partial update. */
public final class CampaignFields {

    public static final String CHANNEL = "channel";
    public static final String CAMPAIGN_TYPE = "campaign_type";
    public static final String AUTO_ENABLED = "auto_enabled";
    public static final String DAILY_BUDGET = "daily_budget";
    public static final String SPENT_TODAY = "spent_today";
    public static final String ROAS = "roas";
    public static final String ROAS_TARGET = "roas_target";
    public static final String ROAS_MIN_PCT = "roas_min_pct";
    public static final String CART_VALUE = "cart_value";
    public static final String BUDGET_THRESHOLD = "budget_threshold";
    public static final String STATUS = "status";
    public static final String SCHEDULE_TIMES = "schedule_times";
    public static final String LAST_SCHEDULE_ACTION = "last_schedule_action";
    public static final String NO_INCREASE_START = "no_increase_start";
    public static final String NO_INCREASE_END = "no_increase_end";
    public static final String COMPETITION_INTERVAL = "competition_interval";
    public static final String COMPETITION_AMOUNT = "competition_amount";
    public static final String LAST_AUTO_ACTION = "last_auto_action";
    public static final String EVAL_180 = "eval_180";
    public static final String EVAL_60 = "eval_60";
    public static final String EVAL_15 = "eval_15";
    public static final String CLICKS = "clicks";
    public static final String CART = "cart";
    public static final String ORDERS = "orders";
    public static final String SALES = "sales";
    public static final String AD_CREDIT = "ad_credit";
    public static final String VISITS = "visits";
    public static final String CONVERSION_RATE = "conversion_rate";
    public static final String LAST_UPDATE = "last_update";

    private CampaignFields() {}
}
