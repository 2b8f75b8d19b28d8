package com.questrail.gatesim.core;

/**
 * Base for devices with a single positional input.
 */
public abstract class AbstractOneInputDevice extends AbstractDevice
{
    protected AbstractOneInputDevice(String... inputNames)
    {
        super(1, inputNames);
    }
}
