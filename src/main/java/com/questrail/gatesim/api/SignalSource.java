package com.questrail.gatesim.api;

/**
 * SignalSource
 * -----------------------------------------------------------------------------
 * Anything that can be pulled for a {@link SignalState}: a constant, a device,
 * a named output accessor of a composite device, or an external widget such as
 * a toggle switch.
 *
 * <h2>Ownership</h2>
 * A device holds its input sources by plain reference and never owns them.
 * The same source may feed several devices, including (through a feedback
 * path) the device that is currently evaluating it.
 *
 * <h2>Contract</h2>
 * <ul>
 *   <li>{@link #evaluate()} must never return {@code null}</li>
 *   <li>{@link #evaluate()} may fail with a runtime exception (for example a
 *       conflicting-input error further upstream); such failures propagate to
 *       the caller unchanged</li>
 * </ul>
 */
@FunctionalInterface
public interface SignalSource
{
    /**
     * Pulls the current value of this source.
     *
     * @return the current state, never {@code null}
     */
    SignalState evaluate();
}
