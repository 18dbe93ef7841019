package com.autobudget.snapshot;

import com.autobudget.config.AutoBudgetConfig;
import com.autobudget.domain.model.Campaign;
import com.autobudget.domain.model.LiveChannelMetrics;
import com.autobudget.domain.model.Snapshot;
import com.autobudget.engine.ChannelIndex;
import com.autobudget.observability.AutoBudgetMetrics;
import com.autobudget.repository.redis.SnapshotRedisRepository;
import java.math.BigDecimal;
import java.time.Clock;
import java.util.List;
import java.util.Optional;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

/**
 * Metric snapshot store: per-campaign time series used for short-horizon trend detection.
 *
 * <p>Snapshots are taken on their own cadence ({@code autobudget.snapshot-interval}),
 * independent of the cycle interval. The time of the last snapshot is kept in memory, so
 * the first cycle after a restart always takes one. Windows are recomputed from the store
 * on every call.
 */
@Service
public class SnapshotService {

    private static final Logger log = LoggerFactory.getLogger(SnapshotService.class);

    private final SnapshotRedisRepository snapshotRedisRepository;
    private final AutoBudgetConfig autoBudgetConfig;
    private final AutoBudgetMetrics autoBudgetMetrics;
    private final Clock clock;

    private volatile long lastSnapshotEpochMs;

    public SnapshotService(
            SnapshotRedisRepository snapshotRedisRepository,
            AutoBudgetConfig autoBudgetConfig,
            AutoBudgetMetrics autoBudgetMetrics,
            Clock clock) {
        this.snapshotRedisRepository = snapshotRedisRepository;
        this.autoBudgetConfig = autoBudgetConfig;
        this.autoBudgetMetrics = autoBudgetMetrics;
        this.clock = clock;
    }

    public boolean shouldTakeSnapshot() {
        return clock.millis() - lastSnapshotEpochMs >= autoBudgetConfig.getSnapshotInterval().toMillis();
    }

    /**
     * Appends one reading per campaign under the current timestamp. Live counters are
     * preferred when the campaign's channel has a live record; otherwise the last-known
     * campaign fields are used. A failed write affects only that campaign.
     *
     * @return number of snapshots written
     */
    public int takeSnapshot(List<Campaign> campaigns, ChannelIndex<LiveChannelMetrics> liveIndex) {
        long now = clock.millis();
        int written = 0;
        for (Campaign campaign : campaigns) {
            Snapshot snapshot = reading(campaign, liveIndex.lookup(campaign.getChannel()), now);
            try {
                snapshotRedisRepository.append(campaign.getCampaignId(), snapshot);
                written++;
            } catch (RuntimeException e) {
                log.warn("Snapshot write failed for campaign {}: {}", campaign.getCampaignId(), e.getMessage());
            }
        }
        lastSnapshotEpochMs = now;
        autoBudgetMetrics.recordSnapshotsWritten(written);
        log.info("Snapshot taken for {}/{} campaigns", written, campaigns.size());
        return written;
    }

    /** Snapshots in {@code [now - minutes, now]}, ascending by timestamp. */
    public List<Snapshot> window(String campaignId, int minutes) {
        long now = clock.millis();
        return snapshotRedisRepository.findBetween(campaignId, now - minutes * 60_000L, now);
    }

    /**
     * Deletes snapshots older than the retention period for the given campaigns.
     *
     * @return number of snapshots removed
     */
    public long cleanup(List<Campaign> campaigns) {
        long cutoff = clock.millis() - autoBudgetConfig.getSnapshotRetention().toMillis();
        long removed = 0;
        for (Campaign campaign : campaigns) {
            try {
                removed += snapshotRedisRepository.deleteOlderThan(campaign.getCampaignId(), cutoff);
            } catch (RuntimeException e) {
                log.warn("Snapshot cleanup failed for campaign {}: {}", campaign.getCampaignId(), e.getMessage());
            }
        }
        log.info("Snapshot cleanup removed {} entries older than {}", removed, cutoff);
        return removed;
    }

    static Snapshot reading(Campaign campaign, Optional<LiveChannelMetrics> live, long timestamp) {
        BigDecimal spent = campaign.getSpentToday() != null ? campaign.getSpentToday() : BigDecimal.ZERO;
        if (live.isPresent()) {
            LiveChannelMetrics metrics = live.get();
            return new Snapshot(
                    timestamp,
                    spent,
                    metrics.getCart(),
                    metrics.getClicks(),
                    metrics.getOrders(),
                    metrics.getSales() != null ? metrics.getSales() : BigDecimal.ZERO);
        }
        return new Snapshot(
                timestamp,
                spent,
                campaign.getCart(),
                campaign.getClicks(),
                campaign.getOrders(),
                campaign.getSales() != null ? campaign.getSales() : BigDecimal.ZERO);
    }
}
