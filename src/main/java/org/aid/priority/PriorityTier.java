package org.aid.priority;

/**
 * Aid priority bucket of a record or cluster.
 */
public enum PriorityTier {
    HIGH,
    MEDIUM,
    LOW,
    /** Density noise: not tiered automatically, needs individual review. */
    REVIEW
}
