package com.autobudget.domain.enums;

/**
 * Result of mirroring an applied action to the remote ads API.
 *
 * <p>NOT_ATTEMPTED covers every configuration gap: no remote API, unsupported
 * operation, or no credential for the campaign's channel.
 */
public enum RemoteOutcome {
    NOT_ATTEMPTED,
    SUCCEEDED,
    FAILED
}
