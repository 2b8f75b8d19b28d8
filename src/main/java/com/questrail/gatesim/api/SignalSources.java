package com.questrail.gatesim.api;

import com.questrail.gatesim.core.InputResolver;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collections;
import java.util.List;
import java.util.Objects;
import java.util.function.BooleanSupplier;
import java.util.function.Supplier;

/**
 * SignalSources
 * -----------------------------------------------------------------------------
 * Factory and coercion helpers that turn the value shapes accepted at the edge
 * of the simulation into {@link SignalSource}s.
 *
 * <h2>Accepted Shapes</h2>
 * <ul>
 *   <li>{@code null} → {@link SignalState#FLOATING}</li>
 *   <li>{@link SignalSource} (including devices) → used as is</li>
 *   <li>{@link SignalState} → constant</li>
 *   <li>{@link Boolean} → constant TRUE / FALSE</li>
 *   <li>{@link Number} 0 / 1 → constant FALSE / TRUE</li>
 *   <li>{@link BooleanSupplier} → pulled on every evaluation</li>
 *   <li>{@link Supplier} of any of the constant shapes above → pulled and
 *       coerced on every evaluation</li>
 * </ul>
 *
 * Every other shape is rejected with {@link IllegalArgumentException}.
 */
public final class SignalSources
{
    private static final SignalSource HIGH = new Constant(SignalState.TRUE);
    private static final SignalSource LOW = new Constant(SignalState.FALSE);
    private static final SignalSource OPEN = new Constant(SignalState.FLOATING);

    private SignalSources() {}

    public static SignalSource high()
    {
        return HIGH;
    }

    public static SignalSource low()
    {
        return LOW;
    }

    public static SignalSource floating()
    {
        return OPEN;
    }

    public static SignalSource constant(SignalState state)
    {
        Objects.requireNonNull(state, "state");
        return switch (state) {
            case TRUE -> HIGH;
            case FALSE -> LOW;
            case FLOATING -> OPEN;
        };
    }

    public static SignalSource constant(boolean value)
    {
        return value ? HIGH : LOW;
    }

    public static SignalSource of(BooleanSupplier supplier)
    {
        Objects.requireNonNull(supplier, "supplier");
        return () -> SignalState.of(supplier.getAsBoolean());
    }

    /**
     * Combines several drivers into one input position. The combined value is
     * resolved with the usual conflict rules every time it is pulled.
     */
    public static SignalSource wired(SignalSource... drivers)
    {
        Objects.requireNonNull(drivers, "drivers");
        return wired(Arrays.asList(drivers));
    }

    public static SignalSource wired(List<? extends SignalSource> drivers)
    {
        Objects.requireNonNull(drivers, "drivers");
        if (drivers.size() == 1) {
            return Objects.requireNonNull(drivers.get(0), "driver");
        }
        List<SignalSource> copy = new ArrayList<>(drivers.size());
        for (SignalSource d : drivers) {
            copy.add(Objects.requireNonNull(d, "driver"));
        }
        return new Wired(Collections.unmodifiableList(copy));
    }

    /**
     * Converts any accepted external shape into a {@link SignalSource}.
     *
     * @throws IllegalArgumentException if the value has an unsupported shape
     */
    public static SignalSource coerce(Object value)
    {
        if (value == null) {
            return OPEN;
        }
        if (value instanceof SignalSource source) {
            return source;
        }
        if (value instanceof BooleanSupplier supplier) {
            return of(supplier);
        }
        if (value instanceof Supplier<?> supplier) {
            return () -> toState(supplier.get());
        }
        return constant(toState(value));
    }

    /**
     * Converts a constant-shaped value into a {@link SignalState}.
     *
     * @throws IllegalArgumentException if the value is not a constant shape
     */
    public static SignalState toState(Object value)
    {
        if (value == null) {
            return SignalState.FLOATING;
        }
        if (value instanceof SignalState state) {
            return state;
        }
        if (value instanceof Boolean b) {
            return SignalState.of(b);
        }
        if (value instanceof Number n) {
            double d = n.doubleValue();
            if (d == 1.0) {
                return SignalState.TRUE;
            }
            if (d == 0.0) {
                return SignalState.FALSE;
            }
            throw new IllegalArgumentException("Numeric signal must be 0 or 1: " + value);
        }
        throw new IllegalArgumentException("Unsupported signal value: " + value.getClass().getName());
    }

    private record Constant(SignalState state) implements SignalSource
    {
        @Override
        public SignalState evaluate()
        {
            return state;
        }

        @Override
        public String toString()
        {
            return state.name();
        }
    }

    private record Wired(List<SignalSource> drivers) implements SignalSource
    {
        @Override
        public SignalState evaluate()
        {
            return InputResolver.resolve(drivers);
        }

        @Override
        public String toString()
        {
            return "wired" + drivers;
        }
    }
}
