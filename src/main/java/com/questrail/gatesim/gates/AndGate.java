package com.questrail.gatesim.gates;

import com.questrail.gatesim.api.SignalSource;
import com.questrail.gatesim.api.SignalState;
import com.questrail.gatesim.core.AbstractMultiInputDevice;

/**
 * N-input AND. TRUE only when every input resolves TRUE; a FALSE or floating
 * input forces FALSE.
 */
public final class AndGate extends AbstractMultiInputDevice
{
    public AndGate(SignalSource... inputs)
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
                return SignalState.FALSE;
            }
        }
        return SignalState.TRUE;
    }
}
