package com.questrail.gatesim.api;

/**
 * SignalState
 * -----------------------------------------------------------------------------
 * {@code SignalState} is the value carried by a single logical wire in the
 * simulated circuit at the moment it is pulled.
 *
 * This enum is intentionally TERNARY rather than boolean. An undriven wire is
 * a legitimate, observable condition in a gate network (an open input, a
 * disabled device, a composite whose inputs are not connected yet) and must
 * not be confused with a driven-low wire.
 *
 * <h2>The Three States</h2>
 * <ul>
 *   <li>{@link #TRUE}     – a driver asserts the wire high</li>
 *   <li>{@link #FALSE}    – a driver asserts the wire low</li>
 *   <li>{@link #FLOATING} – no driver asserts a value</li>
 * </ul>
 *
 * <h2>FLOATING Is Not FALSE</h2>
 * Gates decide for themselves how to read a floating input. AND, NAND and NOR
 * treat it as "not asserted high"; NOT treats it as an open input and outputs
 * {@link #TRUE}. Nothing in the resolution layer silently converts
 * {@code FLOATING} into {@code FALSE}.
 */
public enum SignalState
{
    /**
     * A driver asserts the wire high.
     */
    TRUE,

    /**
     * A driver asserts the wire low.
     */
    FALSE,

    /**
     * No driver asserts a value.
     */
    FLOATING;

    /**
     * Returns {@code true} if this state is {@link #TRUE} or {@link #FALSE}.
     */
    public boolean isDriven()
    {
        return this != FLOATING;
    }

    /**
     * Returns {@code true} only for {@link #TRUE}.
     */
    public boolean isTrue()
    {
        return this == TRUE;
    }

    /**
     * Logical complement of a driven state. {@link #FLOATING} stays floating.
     */
    public SignalState complement()
    {
        return switch (this) {
            case TRUE -> FALSE;
            case FALSE -> TRUE;
            case FLOATING -> FLOATING;
        };
    }

    /**
     * Maps a primitive boolean onto a driven state.
     */
    public static SignalState of(boolean value)
    {
        return value ? TRUE : FALSE;
    }

    /**
     * Maps a nullable boolean onto a state; {@code null} means {@link #FLOATING}.
     */
    public static SignalState ofNullable(Boolean value)
    {
        if (value == null) {
            return FLOATING;
        }
        return of(value);
    }
}
