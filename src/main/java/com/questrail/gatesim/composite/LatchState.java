package com.questrail.gatesim.composite;

import com.questrail.gatesim.api.SignalState;

/**
 * Classification of a flip-flop's output pair at one evaluation.
 */
public enum LatchState
{
    /** Q = TRUE, Q_ = FALSE. */
    SET,

    /** Q = FALSE, Q_ = TRUE. */
    RESET,

    /**
     * Both outputs driven to the same value. Reached when both latch inputs are
     * active at once (or, for the JK flip-flop, while J, K and CLK are all TRUE).
     */
    INVALID,

    /** At least one output is floating, for example while disabled. */
    FLOATING;

    public static LatchState classify(SignalState q, SignalState qComplement)
    {
        if (!q.isDriven() || !qComplement.isDriven()) {
            return FLOATING;
        }
        if (q == qComplement) {
            return INVALID;
        }
        return q.isTrue() ? SET : RESET;
    }
}
