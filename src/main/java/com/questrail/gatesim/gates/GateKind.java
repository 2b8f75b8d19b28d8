package com.questrail.gatesim.gates;

import com.questrail.gatesim.core.AbstractDevice;

/**
 * GateKind
 * -----------------------------------------------------------------------------
 * The closed set of primitive gate behaviours. Composite devices use it to
 * choose the gate family their internal stages are built from.
 */
public enum GateKind
{
    NOT,
    AND,
    NAND,
    NOR;

    /**
     * Creates a new, unconnected gate of this kind.
     */
    public AbstractDevice create()
    {
        return switch (this) {
            case NOT -> new NotGate();
            case AND -> new AndGate();
            case NAND -> new NandGate();
            case NOR -> new NorGate();
        };
    }

    /**
     * Returns {@code true} if two cross-coupled gates of this kind form a latch.
     */
    public boolean formsLatch()
    {
        return this == NAND || this == NOR;
    }
}
