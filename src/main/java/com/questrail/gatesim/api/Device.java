package com.questrail.gatesim.api;

import java.util.List;
import java.util.Optional;
import java.util.Set;

/**
 * Device
 * -----------------------------------------------------------------------------
 * The evaluation capability shared by every simulated logic device, from a
 * single NOT gate up to a flip-flop built out of cross-wired gates.
 *
 * A device is itself a {@link SignalSource}: wiring a device into another
 * device's input is simply handing over the device reference. Evaluation is
 * pull-based; calling {@link #evaluate()} walks the upstream sources on demand.
 *
 * <h2>Inputs</h2>
 * <ul>
 *   <li><b>Positional inputs</b> – an ordered list whose length is never below
 *       the device's minimum arity.</li>
 *   <li><b>Named inputs</b> – pins with semantic names (for example
 *       {@code "R"}/{@code "S"} or {@code "J"}/{@code "K"}/{@code "CLK"}).
 *       The set of names is fixed at construction.</li>
 * </ul>
 *
 * <h2>Enable</h2>
 * When the enable source does not resolve to {@link SignalState#TRUE} the
 * device outputs {@link SignalState#FLOATING} without evaluating its inputs.
 */
public interface Device extends SignalSource
{
    /**
     * Returns the positional input sources, in order.
     */
    List<SignalSource> getIn();

    /**
     * Replaces every positional input with a single source.
     */
    void setIn(SignalSource source);

    /**
     * Replaces the positional inputs with the given ordered sources.
     */
    void setIn(SignalSource... sources);

    /**
     * Replaces the positional inputs with the given ordered sources.
     */
    void setIn(List<? extends SignalSource> sources);

    SignalSource getEnable();

    void setEnable(SignalSource enable);

    void setEnable(boolean enable);

    /**
     * Resolves the current value of a named input.
     *
     * @throws IllegalArgumentException if the device has no input of that name
     */
    SignalState getInput(String name);

    /**
     * Rebinds a named input. Several sources are combined into one wired input.
     *
     * @throws IllegalArgumentException if the device has no input of that name
     */
    void setInput(String name, SignalSource... sources);

    /**
     * Returns the names of this device's named inputs.
     */
    Set<String> inputNames();

    /**
     * Minimum number of positional inputs this device accepts.
     */
    int minimumArity();

    /**
     * Optional human-readable label, for diagnostics only.
     */
    Optional<String> label();
}
