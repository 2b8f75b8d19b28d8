package com.questrail.gatesim.observability;

/**
 * No-op implementation of SimulationObservabilitySink.
 */
public final class NullObservabilitySink implements SimulationObservabilitySink {
    public static final NullObservabilitySink INSTANCE = new NullObservabilitySink();

    private NullObservabilitySink() {}

    @Override
    public void onProbeChange(ProbeChangeEvent event) {}

    @Override
    public void onTickError(TickErrorEvent event) {}

    @Override
    public void onSettle(SettleEvent event) {}
}
