package com.autobudget.execution;

import com.autobudget.domain.enums.RemoteOutcome;
import lombok.Value;

/**
 * Outcome of executing one action. {@code remoteOutcome} is reported for observability
 * only; an applied action stays applied whatever the remote platform answered.
 */
@Value
public class ExecutionResult {

    boolean applied;
    RemoteOutcome remoteOutcome;
    String rejectionReason;

    public static ExecutionResult applied(RemoteOutcome remoteOutcome) {
        return new ExecutionResult(true, remoteOutcome, null);
    }

    public static ExecutionResult rejected(String reason) {
        return new ExecutionResult(false, RemoteOutcome.NOT_ATTEMPTED, reason);
    }
}
