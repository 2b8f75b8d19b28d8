package com.questrail.gatesim.core;

/**
 * Base for devices that take two or more positional inputs.
 */
public abstract class AbstractMultiInputDevice extends AbstractDevice
{
    protected AbstractMultiInputDevice(String... inputNames)
    {
        super(2, inputNames);
    }
}
