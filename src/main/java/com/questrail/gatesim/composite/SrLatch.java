package com.questrail.gatesim.composite;

import com.questrail.gatesim.api.SignalSource;
import com.questrail.gatesim.api.SignalSources;
import com.questrail.gatesim.core.AbstractDevice;
import com.questrail.gatesim.gates.GateKind;

import java.util.Objects;

/**
 * SrLatch
 * -----------------------------------------------------------------------------
 * Set/reset latch made of two cross-coupled NOR or NAND gates.
 *
 * <h2>Wiring</h2>
 * <pre>
 * IC1.in = (R, IC2)    → Q
 * IC2.in = (S, IC1)    → Q_
 * </pre>
 *
 * <h2>Active Levels</h2>
 * <ul>
 *   <li>NOR family (default): inputs are active-high. S=1,R=0 sets;
 *       S=0,R=1 resets; S=0,R=0 holds; S=1,R=1 drives both outputs FALSE.</li>
 *   <li>NAND family: inputs are active-low and the outputs swap roles, so
 *       R=0 drives Q TRUE and S=0 drives Q_ TRUE; S=1,R=1 holds;
 *       S=0,R=0 drives both outputs TRUE.</li>
 * </ul>
 *
 * The both-active combination is reported by {@link #latchState()} as
 * {@link LatchState#INVALID}.
 */
public final class SrLatch extends AbstractFlipFlop
{
    public static final String R = "R";
    public static final String S = "S";

    private final GateKind gateKind;

    public SrLatch()
    {
        this(GateKind.NOR);
    }

    public SrLatch(GateKind gateKind)
    {
        super(latchGate(gateKind), latchGate(gateKind), R, S);
        this.gateKind = gateKind;
        ic1.setIn(SignalSources.floating(), ic2);
        ic2.setIn(SignalSources.floating(), ic1);
    }

    private static AbstractDevice latchGate(GateKind gateKind)
    {
        Objects.requireNonNull(gateKind, "gateKind");
        if (!gateKind.formsLatch()) {
            throw new IllegalArgumentException("SR latch requires NAND or NOR gates, got " + gateKind);
        }
        return gateKind.create();
    }

    @Override
    protected void onNamedInputChanged(String name, SignalSource source)
    {
        if (R.equals(name)) {
            ic1.setIn(source, ic2);
        } else if (S.equals(name)) {
            ic2.setIn(source, ic1);
        }
    }

    public GateKind gateKind()
    {
        return gateKind;
    }
}
