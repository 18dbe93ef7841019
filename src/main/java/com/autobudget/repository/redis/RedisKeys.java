package com.autobudget.repository.redis;

/**
 * Key schema of the shared state store.
 *
 * <p>All keys owned by this service are prefixed with "autobudget:" because the Redis server
 * is shared with the channel monitor, whose live-metrics hash is configured separately.
 * <pre>
 *   autobudget:campaign:{id}     → hash of snake_case campaign fields
 *   autobudget:snapshots:{id}    → sorted set, score = epoch ms, member = snapshot JSON
 *   autobudget:action-log        → list of action log JSON entries (append at tail)
 *   autobudget:metadata          → hash of run metadata
 * </pre>
 */
public final class RedisKeys {

    public static final String KEY_PREFIX = "autobudget:";

    public static final String KEY_PREFIX_CAMPAIGN = KEY_PREFIX + "campaign:";
    public static final String KEY_PREFIX_SNAPSHOTS = KEY_PREFIX + "snapshots:";
    public static final String KEY_ACTION_LOG = KEY_PREFIX + "action-log";
    public static final String KEY_METADATA = KEY_PREFIX + "metadata";

    private RedisKeys() {}

    public static String campaign(String campaignId) {
        return KEY_PREFIX_CAMPAIGN + campaignId;
    }

    public static String snapshots(String campaignId) {
        return KEY_PREFIX_SNAPSHOTS + campaignId;
    }
}
