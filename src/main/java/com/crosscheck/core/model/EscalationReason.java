package com.crosscheck.core.model;

/**
 * Classification of an exhausted validation loop.
 * <p>
 * Advisory only: both classifications are offered the same resolutions.
 */
public enum EscalationReason {
    /** Every counted failure had the same normalized feedback (a deadlock). */
    REPEATED_SAME_FAILURE,
    /** Failures disagreed, which points at unclear criteria rather than the producer. */
    DIVERGENT_FAILURE;

    public String wireName() {
        return name().toLowerCase();
    }
}
