package com.questrail.gatesim.observability;

/**
 * Record representing the outcome of a settle run.
 */
public record SettleEvent(
    long finalTick,
    int ticksUsed,
    boolean settled
) {
}
