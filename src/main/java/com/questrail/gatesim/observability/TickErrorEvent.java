package com.questrail.gatesim.observability;

/**
 * Record representing a probe evaluation that failed during a tick.
 */
public record TickErrorEvent(
    long tick,
    String probe,
    String message,
    Throwable cause
) {
}
