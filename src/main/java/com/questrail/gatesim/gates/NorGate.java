package com.questrail.gatesim.gates;

import com.questrail.gatesim.api.SignalSource;
import com.questrail.gatesim.api.SignalState;
import com.questrail.gatesim.core.AbstractMultiInputDevice;

/**
 * N-input NOR. FALSE as soon as any input resolves TRUE, otherwise TRUE.
 */
public final class NorGate extends AbstractMultiInputDevice
{
    public NorGate(SignalSource... inputs)
    {
        if (inputs.length > 0) {
            setIn(inputs);
        }
    }

    @Override
    protected SignalState computeValue()
    {
        for (int i = 0; i < inputCount(); i++) {
            if (resolveInput(i).isTrue()) {
                return SignalState.FALSE;
            }
        }
        return SignalState.TRUE;
    }
}
