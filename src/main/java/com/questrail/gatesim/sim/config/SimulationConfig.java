package com.questrail.gatesim.sim.config;

import com.questrail.gatesim.observability.NullObservabilitySink;
import com.questrail.gatesim.observability.SimulationObservabilitySink;

import java.util.Objects;

/**
 * Configuration for the circuit simulator.
 *
 * <ul>
 *   <li><b>maxSettleTicks</b>: upper bound on the ticks a single settle run may
 *       use. Settling needs two consecutive equal snapshots, so the minimum is 2.</li>
 *   <li><b>observabilitySink</b>: receives probe changes, tick errors and settle
 *       outcomes.</li>
 * </ul>
 */
public record SimulationConfig(
    int maxSettleTicks,
    SimulationObservabilitySink observabilitySink
) {
    public static final int DEFAULT_MAX_SETTLE_TICKS = 32;

    public SimulationConfig {
        Objects.requireNonNull(observabilitySink, "observabilitySink");
        if (maxSettleTicks < 2) {
            throw new IllegalArgumentException("maxSettleTicks must be at least 2");
        }
    }

    public static SimulationConfig defaults() {
        return builder().build();
    }

    public static Builder builder() {
        return new Builder();
    }

    public static final class Builder {
        private int maxSettleTicks = DEFAULT_MAX_SETTLE_TICKS;
        private SimulationObservabilitySink observabilitySink = NullObservabilitySink.INSTANCE;

        public Builder withMaxSettleTicks(int maxSettleTicks) {
            this.maxSettleTicks = maxSettleTicks;
            return this;
        }

        public Builder withObservabilitySink(SimulationObservabilitySink observabilitySink) {
            this.observabilitySink = observabilitySink;
            return this;
        }

        public SimulationConfig build() {
            return new SimulationConfig(maxSettleTicks, observabilitySink);
        }
    }
}
