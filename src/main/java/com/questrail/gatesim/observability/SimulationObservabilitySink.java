package com.questrail.gatesim.observability;

/**
 * Main interface for receiving simulation observability events.
 * Implementations can provide logging, metrics, or recording for tests.
 */
public interface SimulationObservabilitySink {
    /**
     * Called when a probe reports a different value than on the previous tick.
     * @param event the change details
     */
    void onProbeChange(ProbeChangeEvent event);

    /**
     * Called when evaluating a probe failed during a tick.
     * @param event the failure details
     */
    void onTickError(TickErrorEvent event);

    /**
     * Called when a settle run finishes, settled or not.
     * @param event the settle outcome
     */
    void onSettle(SettleEvent event);
}
