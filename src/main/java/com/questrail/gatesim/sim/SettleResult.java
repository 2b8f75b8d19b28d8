package com.questrail.gatesim.sim;

import java.util.Objects;

/**
 * Outcome of {@link CircuitSimulator#settle()}.
 *
 * @param settled   {@code true} if the last two snapshots matched
 * @param ticksUsed number of ticks this settle run performed
 * @param snapshot  the last snapshot taken
 */
public record SettleResult(
    boolean settled,
    int ticksUsed,
    TickSnapshot snapshot
) {
    public SettleResult {
        Objects.requireNonNull(snapshot, "snapshot");
    }
}
