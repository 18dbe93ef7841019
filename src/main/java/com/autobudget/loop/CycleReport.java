package com.autobudget.loop;

import lombok.Builder;
import lombok.Value;

/** Summary of one control loop cycle, logged at the end of the cycle. */
@Value
@Builder
public class CycleReport {

    long cycleNumber;
    int campaigns;
    int remoteMerged;
    int liveMerged;
    boolean snapshotTaken;
    int actionsProduced;
    int actionsApplied;
    boolean cleanupRun;
    long durationMs;
}
