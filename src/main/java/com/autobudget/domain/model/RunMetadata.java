package com.autobudget.domain.model;

import java.time.LocalDateTime;
import lombok.Builder;
import lombok.Value;

/** Heartbeat of the control loop; a stale {@code lastUpdate} is the only failure signal. */
@Value
@Builder
public class RunMetadata {

    LocalDateTime lastUpdate;
    long updateTimestamp;
    int totalCampaigns;
    long cycleCount;
}
