package com.questrail.gatesim.observability;

import com.questrail.gatesim.api.SignalState;

import java.util.Optional;

/**
 * Record representing a probe whose observed value changed between ticks.
 * An empty value means the probe had no valid output on that tick.
 */
public record ProbeChangeEvent(
    long tick,
    String probe,
    Optional<SignalState> oldValue,
    Optional<SignalState> newValue
) {
}
