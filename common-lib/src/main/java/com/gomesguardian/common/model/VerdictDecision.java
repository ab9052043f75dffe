package com.gomesguardian.common.model;

/**
 * Final gatekeeper decision. BLOCKED is a compliance hard stop; AVOID means
 * the rules or the sizing left no room for a position.
 */
public enum VerdictDecision {
    ALLOW,
    AVOID,
    BLOCKED
}
