package com.questrail.gatesim.sim;

import com.questrail.gatesim.api.SignalState;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;

/**
 * Immutable record of every probe's value after one tick.
 *
 * A probe whose evaluation failed appears in {@code failures} instead of
 * {@code values}; it had no valid output on that tick.
 */
public record TickSnapshot(
    long tick,
    Map<String, SignalState> values,
    Map<String, RuntimeException> failures
) {
    public TickSnapshot {
        values = Collections.unmodifiableMap(new LinkedHashMap<>(Objects.requireNonNull(values, "values")));
        failures = Collections.unmodifiableMap(new LinkedHashMap<>(Objects.requireNonNull(failures, "failures")));
    }

    /**
     * Returns the probe's value, or empty if the probe failed or is unknown.
     */
    public Optional<SignalState> value(String probe) {
        return Optional.ofNullable(values.get(probe));
    }

    public boolean failed(String probe) {
        return failures.containsKey(probe);
    }

    /**
     * Returns {@code true} if both snapshots observed the same values and the
     * same set of failed probes. Tick numbers and failure details are ignored.
     */
    public boolean sameOutputs(TickSnapshot other) {
        Objects.requireNonNull(other, "other");
        return values.equals(other.values) && failures.keySet().equals(other.failures.keySet());
    }
}
