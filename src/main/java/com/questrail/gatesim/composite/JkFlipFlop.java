package com.questrail.gatesim.composite;

import com.questrail.gatesim.api.SignalSource;
import com.questrail.gatesim.api.SignalSources;
import com.questrail.gatesim.gates.NandGate;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * JkFlipFlop
 * -----------------------------------------------------------------------------
 * Gated JK flip-flop built from four NAND gates.
 *
 * <h2>Wiring</h2>
 * <pre>
 * ICJ.in = (IC2, J, CLK)
 * ICK.in = (IC1, K, CLK)
 * IC1.in = (ICJ, IC2)     → Q
 * IC2.in = (ICK, IC1)     → Q_
 * </pre>
 *
 * <h2>Behaviour</h2>
 * The gating stage is level-sensitive. While CLK is TRUE:
 * <ul>
 *   <li>J=1,K=0 sets</li>
 *   <li>J=0,K=1 resets</li>
 *   <li>J=0,K=0 holds</li>
 *   <li>J=1,K=1 has no stable fixed point under pull evaluation and is
 *       reported by {@link #latchState()} as {@link LatchState#INVALID}</li>
 * </ul>
 * While CLK is FALSE the latch holds.
 *
 * <h2>Deferred Wiring</h2>
 * ICJ and ICK stay on their unconnected placeholder inputs until J, K and CLK
 * all resolve to a driven value at the time one of them is set. Whenever a
 * later rebinding leaves any of them floating, the gating stage is
 * disconnected again. Unconnected NAND gates output TRUE, so an unwired
 * flip-flop simply holds.
 */
public final class JkFlipFlop extends AbstractFlipFlop
{
    private static final Logger log = LoggerFactory.getLogger(JkFlipFlop.class);

    public static final String J = "J";
    public static final String K = "K";
    public static final String CLK = "CLK";

    private final NandGate icj = new NandGate();
    private final NandGate ick = new NandGate();

    private boolean wired;

    public JkFlipFlop()
    {
        super(new NandGate(), new NandGate(), J, K, CLK);
        icj.setLabel(this + ".ICJ");
        ick.setLabel(this + ".ICK");
        ic1.setIn(icj, ic2);
        ic2.setIn(ick, ic1);
    }

    @Override
    protected void onNamedInputChanged(String name, SignalSource source)
    {
        for (String input : inputNames()) {
            if (!getInput(input).isDriven()) {
                if (wired) {
                    icj.setIn(SignalSources.floating(), SignalSources.floating());
                    ick.setIn(SignalSources.floating(), SignalSources.floating());
                    wired = false;
                }
                log.debug("{}: input {} is floating, gating stage left unconnected", this, input);
                return;
            }
        }

        icj.setIn(ic2, namedSource(J), namedSource(CLK));
        ick.setIn(ic1, namedSource(K), namedSource(CLK));
        wired = true;
        log.debug("{}: gating stage connected", this);
    }

    /**
     * Returns {@code true} once the gating stage has been connected to J, K
     * and CLK.
     */
    public boolean isWired()
    {
        return wired;
    }
}
