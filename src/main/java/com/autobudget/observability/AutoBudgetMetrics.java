package com.autobudget.observability;

import com.autobudget.domain.enums.ActionKind;
import com.autobudget.domain.enums.RemoteOperation;
import com.autobudget.domain.enums.RemoteOutcome;
import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.Timer;
import java.time.Duration;
import java.util.Locale;
import java.util.concurrent.atomic.AtomicInteger;
import org.springframework.stereotype.Service;

/**
 * Custom Micrometer meters for the auto-budget control loop.
 * <ul>
 *   <li><b>autobudget.cycles</b> (counter, tag result=completed|failed)</li>
 *   <li><b>autobudget.cycle.duration</b> (timer)</li>
 *   <li><b>autobudget.actions</b> (counter, tags kind and result=applied|rejected|store_failed)</li>
 *   <li><b>autobudget.remote.writes</b> (counter, tags operation and outcome)</li>
 *   <li><b>autobudget.snapshots.written</b> (counter)</li>
 *   <li><b>autobudget.campaigns</b> (gauge, campaigns seen by the last cycle)</li>
 * </ul>
 *
 * <p>Counters with dynamic tags are looked up per call; Micrometer caches registered meters,
 * so repeated lookups return the same instance.
 */
@Service
public class AutoBudgetMetrics {

    public static final String RESULT_APPLIED = "applied";
    public static final String RESULT_REJECTED = "rejected";
    public static final String RESULT_STORE_FAILED = "store_failed";

    private final MeterRegistry meterRegistry;
    private final Counter cyclesCompleted;
    private final Counter cyclesFailed;
    private final Counter snapshotsWritten;
    private final Timer cycleDuration;
    private final AtomicInteger campaignCount = new AtomicInteger();

    public AutoBudgetMetrics(MeterRegistry meterRegistry) {
        this.meterRegistry = meterRegistry;

        this.cyclesCompleted = Counter.builder("autobudget.cycles")
                .description("Control loop cycles by result")
                .tag("result", "completed")
                .register(meterRegistry);

        this.cyclesFailed = Counter.builder("autobudget.cycles")
                .description("Control loop cycles by result")
                .tag("result", "failed")
                .register(meterRegistry);

        this.snapshotsWritten = Counter.builder("autobudget.snapshots.written")
                .description("Campaign snapshots appended to the store")
                .register(meterRegistry);

        this.cycleDuration = Timer.builder("autobudget.cycle.duration")
                .description("Wall time of one control loop cycle")
                .publishPercentiles(0.5, 0.95)
                .maximumExpectedValue(Duration.ofMinutes(2))
                .register(meterRegistry);

        meterRegistry.gauge("autobudget.campaigns", campaignCount);
    }

    public void recordCycleCompleted(Duration duration, int campaigns) {
        cyclesCompleted.increment();
        cycleDuration.record(duration);
        campaignCount.set(campaigns);
    }

    public void recordCycleFailed() {
        cyclesFailed.increment();
    }

    public void recordSnapshotsWritten(int count) {
        snapshotsWritten.increment(count);
    }

    public void recordAction(ActionKind kind, String result) {
        Counter.builder("autobudget.actions")
                .description("Actions handled by the executor")
                .tag("kind", kind.getStoreValue())
                .tag("result", result)
                .register(meterRegistry)
                .increment();
    }

    public void recordRemoteWrite(RemoteOperation operation, RemoteOutcome outcome) {
        Counter.builder("autobudget.remote.writes")
                .description("Best-effort remote mirrors of applied actions")
                .tag("operation", operation.name().toLowerCase(Locale.ROOT))
                .tag("outcome", outcome.name().toLowerCase(Locale.ROOT))
                .register(meterRegistry)
                .increment();
    }
}
