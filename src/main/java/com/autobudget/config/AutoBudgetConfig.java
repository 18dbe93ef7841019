package com.autobudget.config;

import jakarta.validation.Valid;
import jakarta.validation.constraints.Min;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotNull;
import java.time.Duration;
import java.time.ZoneId;
import lombok.Getter;
import lombok.Setter;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.validation.annotation.Validated;

/**
 * Configuration properties for the auto-budget service.
 *
 * <p>Binds to the {@code autobudget.*} prefix in application.properties. This is the single
 * explicit configuration value of the service: the control loop and every component that
 * needs an interval, key or endpoint receive it by injection, so tests can build alternate
 * configurations with plain setters.
 *
 * <p>The remote ads API is considered absent when {@code remote.base-url} is blank; each of
 * its operations is individually absent when its path is blank.
 */
@ConfigurationProperties(prefix = "autobudget")
@Validated
@Getter
@Setter
public class AutoBudgetConfig {

    /** Fixed delay between the end of one cycle and the start of the next. */
    @NotNull
    private Duration fetchInterval = Duration.ofMinutes(3);

    /** Delay before the first cycle after startup. */
    @NotNull
    private Duration startupDelay = Duration.ofSeconds(10);

    /** Minimum spacing between two snapshots, independent of the cycle interval. */
    @NotNull
    private Duration snapshotInterval = Duration.ofMinutes(5);

    /** Snapshots older than this are removed by the retention sweep. */
    @NotNull
    private Duration snapshotRetention = Duration.ofHours(4);

    /** The retention sweep runs on every Nth cycle. */
    @Min(1)
    private int cleanupEveryCycles = 10;

    /** Wall-clock zone for schedule times, blackout windows and action-log times. */
    @NotBlank
    private String zoneId = "Asia/Bangkok";

    /** The action log is trimmed from the oldest end beyond this many entries. */
    @Min(1)
    private int actionLogMaxEntries = 5000;

    @Valid
    private Store store = new Store();

    @Valid
    private Remote remote = new Remote();

    @Valid
    private Directory directory = new Directory();

    public ZoneId getZone() {
        return ZoneId.of(zoneId);
    }

    @Getter
    @Setter
    public static class Store {

        /** Redis hash owned by the channel monitor, holding live counters per channel. */
        @NotBlank
        private String liveMetricsKey = "monitor:live";
    }

    @Getter
    @Setter
    public static class Remote {

        /** Base URL of the ads platform; blank means the remote API is absent. */
        private String baseUrl = "";

        /** Connect and read timeout of every remote call. */
        @NotNull
        private Duration timeout = Duration.ofSeconds(10);

        private String verifyAuthPath = "";
        private String balancePath = "";
        private String campaignListPath = "";
        private String setBudgetPath = "";
        private String pausePath = "";
        private String resumePath = "";

        public boolean isConfigured() {
            return baseUrl != null && !baseUrl.isBlank();
        }
    }

    @Getter
    @Setter
    public static class Directory {

        /** CSV export URL of the channel spreadsheet; blank leaves the directory empty. */
        private String sheetUrl = "";

        @NotNull
        private Duration refreshInterval = Duration.ofHours(1);

        @NotNull
        private Duration timeout = Duration.ofSeconds(10);
    }
}
