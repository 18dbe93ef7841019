package com.autobudget.loop;

import com.autobudget.config.AutoBudgetConfig;
import com.autobudget.directory.ChannelDirectory;
import com.autobudget.domain.model.BudgetAction;
import com.autobudget.domain.model.Campaign;
import com.autobudget.domain.model.LiveChannelMetrics;
import com.autobudget.domain.model.RunMetadata;
import com.autobudget.engine.AutoBudgetEngine;
import com.autobudget.engine.ChannelIndex;
import com.autobudget.execution.BudgetActionExecutor;
import com.autobudget.execution.ExecutionResult;
import com.autobudget.observability.AutoBudgetMetrics;
import com.autobudget.repository.redis.CampaignFields;
import com.autobudget.repository.redis.CampaignRedisRepository;
import com.autobudget.repository.redis.LiveMetricsRedisRepository;
import com.autobudget.repository.redis.RunMetadataRedisRepository;
import com.autobudget.snapshot.SnapshotService;
import java.math.BigDecimal;
import java.time.Clock;
import java.time.Duration;
import java.time.LocalDateTime;
import java.util.Collections;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.atomic.AtomicLong;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.scheduling.annotation.Scheduled;
import org.springframework.stereotype.Service;

/**
 * One auto-budget cycle every {@code autobudget.fetch-interval}.
 *
 * <p>Cycle steps:
 * <ol>
 *   <li>Refresh the channel directory if stale, read campaigns and live channel metrics.</li>
 *   <li>Merge the remote campaign list when the remote API supports it.</li>
 *   <li>Merge live counters into campaigns by channel.</li>
 *   <li>Take a snapshot when the snapshot cadence is due.</li>
 *   <li>Evaluate all campaigns and execute the resulting actions.</li>
 *   <li>Write run metadata; every Nth cycle, sweep old snapshots.</li>
 * </ol>
 *
 * <p>Remote and live-metric failures only skip their own step. Anything else thrown by a
 * cycle is caught at {@link #runScheduledCycle()}, so the schedule keeps running. The
 * scheduler is single-threaded and uses a fixed delay, so cycles never overlap.
 */
@Service
public class AutoBudgetControlLoop {

    private static final Logger log = LoggerFactory.getLogger(AutoBudgetControlLoop.class);

    private final AutoBudgetConfig autoBudgetConfig;
    private final CampaignRedisRepository campaignRedisRepository;
    private final LiveMetricsRedisRepository liveMetricsRedisRepository;
    private final RunMetadataRedisRepository runMetadataRedisRepository;
    private final ChannelDirectory channelDirectory;
    private final RemoteCampaignSync remoteCampaignSync;
    private final SnapshotService snapshotService;
    private final AutoBudgetEngine autoBudgetEngine;
    private final BudgetActionExecutor budgetActionExecutor;
    private final AutoBudgetMetrics autoBudgetMetrics;
    private final Clock clock;

    private final AtomicLong cycleCount = new AtomicLong();

    public AutoBudgetControlLoop(
            AutoBudgetConfig autoBudgetConfig,
            CampaignRedisRepository campaignRedisRepository,
            LiveMetricsRedisRepository liveMetricsRedisRepository,
            RunMetadataRedisRepository runMetadataRedisRepository,
            ChannelDirectory channelDirectory,
            RemoteCampaignSync remoteCampaignSync,
            SnapshotService snapshotService,
            AutoBudgetEngine autoBudgetEngine,
            BudgetActionExecutor budgetActionExecutor,
            AutoBudgetMetrics autoBudgetMetrics,
            Clock clock) {
        this.autoBudgetConfig = autoBudgetConfig;
        this.campaignRedisRepository = campaignRedisRepository;
        this.liveMetricsRedisRepository = liveMetricsRedisRepository;
        this.runMetadataRedisRepository = runMetadataRedisRepository;
        this.channelDirectory = channelDirectory;
        this.remoteCampaignSync = remoteCampaignSync;
        this.snapshotService = snapshotService;
        this.autoBudgetEngine = autoBudgetEngine;
        this.budgetActionExecutor = budgetActionExecutor;
        this.autoBudgetMetrics = autoBudgetMetrics;
        this.clock = clock;
    }

    @Scheduled(
            fixedDelayString = "${autobudget.fetch-interval:PT3M}",
            initialDelayString = "${autobudget.startup-delay:PT10S}")
    public void runScheduledCycle() {
        try {
            runCycle();
        } catch (RuntimeException e) {
            autoBudgetMetrics.recordCycleFailed();
            log.error("Cycle #{} failed: {}", cycleCount.get(), e.getMessage(), e);
        }
    }

    public CycleReport runCycle() {
        long cycle = cycleCount.incrementAndGet();
        long start = clock.millis();
        log.info("--- Cycle #{} ---", cycle);

        channelDirectory.refreshIfStale();

        List<Campaign> campaigns = campaignRedisRepository.findAll();
        List<LiveChannelMetrics> live = readLiveMetrics();
        log.info("Campaigns: {}, live channels: {}", campaigns.size(), live.size());
        ChannelIndex<LiveChannelMetrics> liveIndex = ChannelIndex.of(live, LiveChannelMetrics::getChannel);

        int remoteMerged = 0;
        try {
            remoteMerged = remoteCampaignSync.sync(campaigns);
        } catch (RuntimeException e) {
            log.warn("Remote campaign sync failed, continuing with store data: {}", e.getMessage());
        }

        int liveMerged = mergeLiveMetrics(campaigns, liveIndex);

        boolean snapshotTaken = false;
        if (snapshotService.shouldTakeSnapshot()) {
            snapshotService.takeSnapshot(campaigns, liveIndex);
            snapshotTaken = true;
        }

        List<BudgetAction> actions = autoBudgetEngine.evaluateAll(campaigns);
        int applied = 0;
        if (!actions.isEmpty()) {
            log.info("Auto-budget: {} actions to execute", actions.size());
            for (BudgetAction action : actions) {
                Optional<String> credential = channelDirectory.credentialFor(action.getChannel());
                ExecutionResult result = budgetActionExecutor.execute(action, credential);
                if (result.isApplied()) {
                    applied++;
                }
            }
        }

        runMetadataRedisRepository.save(RunMetadata.builder()
                .lastUpdate(LocalDateTime.now(clock))
                .updateTimestamp(clock.millis())
                .totalCampaigns(campaigns.size())
                .cycleCount(cycle)
                .build());

        boolean cleanupRun = cycle % autoBudgetConfig.getCleanupEveryCycles() == 0;
        if (cleanupRun) {
            snapshotService.cleanup(campaigns);
        }

        long durationMs = clock.millis() - start;
        autoBudgetMetrics.recordCycleCompleted(Duration.ofMillis(durationMs), campaigns.size());
        CycleReport report = CycleReport.builder()
                .cycleNumber(cycle)
                .campaigns(campaigns.size())
                .remoteMerged(remoteMerged)
                .liveMerged(liveMerged)
                .snapshotTaken(snapshotTaken)
                .actionsProduced(actions.size())
                .actionsApplied(applied)
                .cleanupRun(cleanupRun)
                .durationMs(durationMs)
                .build();
        log.info("Cycle #{} completed in {} ms: {}", cycle, durationMs, report);
        return report;
    }

    public long getCycleCount() {
        return cycleCount.get();
    }

    private List<LiveChannelMetrics> readLiveMetrics() {
        try {
            return liveMetricsRedisRepository.findAll();
        } catch (RuntimeException e) {
            log.warn("Live metrics unavailable this cycle: {}", e.getMessage());
            return Collections.emptyList();
        }
    }

    private int mergeLiveMetrics(List<Campaign> campaigns, ChannelIndex<LiveChannelMetrics> liveIndex) {
        int merged = 0;
        for (Campaign campaign : campaigns) {
            Optional<LiveChannelMetrics> match = liveIndex.lookup(campaign.getChannel());
            if (match.isEmpty()) {
                continue;
            }
            LiveChannelMetrics live = match.get();
            BigDecimal sales = live.getSales() != null ? live.getSales() : BigDecimal.ZERO;
            campaign.setClicks(live.getClicks());
            campaign.setCart(live.getCart());
            campaign.setOrders(live.getOrders());
            campaign.setSales(sales);
            try {
                campaignRedisRepository.update(
                        campaign.getCampaignId(),
                        Map.of(
                                CampaignFields.CLICKS, String.valueOf(live.getClicks()),
                                CampaignFields.CART, String.valueOf(live.getCart()),
                                CampaignFields.ORDERS, String.valueOf(live.getOrders()),
                                CampaignFields.SALES, sales.toPlainString()));
                merged++;
            } catch (RuntimeException e) {
                log.warn("Live merge failed for campaign {}: {}", campaign.getCampaignId(), e.getMessage());
            }
        }
        return merged;
    }
}
