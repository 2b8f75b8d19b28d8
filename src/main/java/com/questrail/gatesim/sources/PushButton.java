package com.questrail.gatesim.sources;

import com.questrail.gatesim.api.SignalSource;
import com.questrail.gatesim.api.SignalState;

import java.util.Objects;

/**
 * A momentary push-button. Drives TRUE while pressed and its idle state
 * otherwise. The default idle state is {@link SignalState#FLOATING}: a released
 * button is an open contact.
 */
public final class PushButton implements SignalSource
{
    private final SignalState idle;
    private boolean pressed;

    public PushButton()
    {
        this(SignalState.FLOATING);
    }

    public PushButton(SignalState idle)
    {
        this.idle = Objects.requireNonNull(idle, "idle");
        if (idle == SignalState.TRUE) {
            throw new IllegalArgumentException("Idle state must differ from the pressed state");
        }
    }

    public void press()
    {
        pressed = true;
    }

    public void release()
    {
        pressed = false;
    }

    public boolean isPressed()
    {
        return pressed;
    }

    @Override
    public SignalState evaluate()
    {
        return pressed ? SignalState.TRUE : idle;
    }

    @Override
    public String toString()
    {
        return "PushButton[" + (pressed ? "pressed" : "released") + "]";
    }
}
