package com.questrail.gatesim.observability;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Production implementation of SimulationObservabilitySink that emits logs via SLF4J.
 */
public final class Slf4jSimulationObservabilitySink implements SimulationObservabilitySink {
    private static final Logger log = LoggerFactory.getLogger(Slf4jSimulationObservabilitySink.class);

    @Override
    public void onProbeChange(ProbeChangeEvent event) {
        log.info("Tick {}: probe {} {} -> {}",
            event.tick(),
            event.probe(),
            event.oldValue().map(Enum::name).orElse("NO_OUTPUT"),
            event.newValue().map(Enum::name).orElse("NO_OUTPUT"));
    }

    @Override
    public void onTickError(TickErrorEvent event) {
        log.warn("Tick {}: probe {} has no valid output: {}", event.tick(), event.probe(), event.message(), event.cause());
    }

    @Override
    public void onSettle(SettleEvent event) {
        if (event.settled()) {
            log.debug("Settled at tick {} after {} tick(s)", event.finalTick(), event.ticksUsed());
        } else {
            log.warn("Not settled after {} tick(s) (tick {})", event.ticksUsed(), event.finalTick());
        }
    }
}
