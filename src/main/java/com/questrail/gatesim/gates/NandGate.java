package com.questrail.gatesim.gates;

import com.questrail.gatesim.api.SignalSource;
import com.questrail.gatesim.api.SignalState;
import com.questrail.gatesim.core.AbstractMultiInputDevice;

/**
 * N-input NAND. FALSE only when every input resolves TRUE.
 */
public final class NandGate extends AbstractMultiInputDevice
{
    public NandGate(SignalSource... inputs)
    {
        if (inputs.length > 0) {
            setIn(inputs);
        }
    }

    @Override
    protected SignalState computeValue()
    {
        for (int i = 0; i < inputCount(); i++) {
            if (!resolveInput(i).isTrue()) {
                return SignalState.TRUE;
            }
        }
        return SignalState.FALSE;
    }
}
