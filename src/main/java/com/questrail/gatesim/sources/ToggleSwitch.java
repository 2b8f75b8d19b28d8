package com.questrail.gatesim.sources;

import com.questrail.gatesim.api.SignalSource;
import com.questrail.gatesim.api.SignalState;

/**
 * A latching on/off switch. Always drives its output: TRUE when on, FALSE
 * when off.
 */
public final class ToggleSwitch implements SignalSource
{
    private boolean on;

    public ToggleSwitch()
    {
        this(false);
    }

    public ToggleSwitch(boolean initiallyOn)
    {
        this.on = initiallyOn;
    }

    public void set(boolean on)
    {
        this.on = on;
    }

    public void toggle()
    {
        on = !on;
    }

    public boolean isOn()
    {
        return on;
    }

    @Override
    public SignalState evaluate()
    {
        return SignalState.of(on);
    }

    @Override
    public String toString()
    {
        return "ToggleSwitch[" + (on ? "on" : "off") + "]";
    }
}
