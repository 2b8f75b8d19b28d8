package com.questrail.gatesim.composite;

import com.questrail.gatesim.api.SignalState;
import com.questrail.gatesim.core.AbstractDevice;
import com.questrail.gatesim.core.AbstractOneInputDevice;

import java.util.Objects;

/**
 * AbstractFlipFlop
 * -----------------------------------------------------------------------------
 * Base for composite devices built around a pair of cross-coupled gates.
 *
 * <h2>Structure</h2>
 * <ul>
 *   <li>{@code ic1} drives {@link #q()}, which is also the device's own value</li>
 *   <li>{@code ic2} drives {@link #qComplement()}</li>
 * </ul>
 *
 * The composite owns its internal gates: they are created once at construction
 * and only ever rewired afterwards. Gates reference each other freely; none of
 * them owns another.
 *
 * <h2>Enable</h2>
 * A disabled flip-flop reports FLOATING on both outputs.
 */
public abstract class AbstractFlipFlop extends AbstractOneInputDevice
{
    protected final AbstractDevice ic1;
    protected final AbstractDevice ic2;

    protected AbstractFlipFlop(AbstractDevice ic1, AbstractDevice ic2, String... inputNames)
    {
        super(inputNames);
        this.ic1 = Objects.requireNonNull(ic1, "ic1");
        this.ic2 = Objects.requireNonNull(ic2, "ic2");
        ic1.setLabel(this + ".IC1");
        ic2.setLabel(this + ".IC2");
    }

    @Override
    protected SignalState computeValue()
    {
        return ic1.evaluate();
    }

    /**
     * Primary output.
     */
    public final SignalState q()
    {
        return evaluate();
    }

    /**
     * Complementary output.
     */
    public final SignalState qComplement()
    {
        if (!isEnabled()) {
            return SignalState.FLOATING;
        }
        return ic2.evaluate();
    }

    /**
     * Evaluates both outputs and classifies the pair.
     */
    public final LatchState latchState()
    {
        SignalState q = q();
        SignalState qComplement = qComplement();
        return LatchState.classify(q, qComplement);
    }
}
