package com.questrail.gatesim.core;

import com.questrail.gatesim.api.SignalSource;
import com.questrail.gatesim.api.SignalState;

import java.util.Arrays;
import java.util.Collection;
import java.util.Objects;

/**
 * InputResolver
 * -----------------------------------------------------------------------------
 * Combines one or more drivers of a single logical input into one
 * {@link SignalState}.
 *
 * <h2>Resolution Rule</h2>
 * Every driver is pulled exactly once, then:
 * <pre>
 * TRUE drivers &gt; 0 and FALSE drivers &gt; 0 → ConflictingInputsException
 * TRUE drivers &gt; 0                       → TRUE
 * FALSE drivers &gt; 0                      → FALSE
 * otherwise                              → FLOATING
 * </pre>
 *
 * Floating drivers never contribute; a bus with one asserting driver and any
 * number of floating drivers resolves to the asserted value.
 */
public final class InputResolver
{
    private InputResolver() {}

    public static SignalState resolve(SignalSource source)
    {
        Objects.requireNonNull(source, "source");
        return Objects.requireNonNull(source.evaluate(), "source returned null");
    }

    public static SignalState resolve(SignalSource... sources)
    {
        Objects.requireNonNull(sources, "sources");
        return resolve(Arrays.asList(sources));
    }

    public static SignalState resolve(Collection<? extends SignalSource> sources)
    {
        Objects.requireNonNull(sources, "sources");

        int ones = 0;
        int zeros = 0;
        // All drivers are pulled, even once the answer looks decided, so that a
        // conflict anywhere on the bus is always detected.
        for (SignalSource source : sources) {
            switch (resolve(source)) {
                case TRUE -> ones++;
                case FALSE -> zeros++;
                case FLOATING -> { }
            }
        }

        if (ones > 0 && zeros > 0) {
            throw new ConflictingInputsException(ones, zeros);
        }
        if (ones > 0) {
            return SignalState.TRUE;
        }
        if (zeros > 0) {
            return SignalState.FALSE;
        }
        return SignalState.FLOATING;
    }
}
