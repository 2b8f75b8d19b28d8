package com.questrail.gatesim.gates;

import com.questrail.gatesim.api.SignalSource;
import com.questrail.gatesim.api.SignalState;
import com.questrail.gatesim.core.AbstractOneInputDevice;

/**
 * Inverter. A floating input is read as an open input and produces
 * {@link SignalState#TRUE}.
 */
public final class NotGate extends AbstractOneInputDevice
{
    public NotGate(SignalSource... inputs)
    {
        if (inputs.length > 0) {
            setIn(inputs);
        }
    }

    @Override
    protected SignalState computeValue()
    {
        SignalState in = resolveInput(0);
        if (in == SignalState.FLOATING) {
            return SignalState.TRUE;
        }
        return in.complement();
    }
}
