package com.questrail.gatesim.core;

/**
 * Indicates that a device was declared or wired with fewer positional inputs
 * than its minimum arity.
 */
public final class ArityViolationException extends IllegalArgumentException
{
    private final int minimumArity;
    private final int actual;

    public ArityViolationException(int minimumArity, int actual)
    {
        super("Device requires at least " + minimumArity + " input(s), got " + actual);
        this.minimumArity = minimumArity;
        this.actual = actual;
    }

    public int minimumArity()
    {
        return minimumArity;
    }

    public int actual()
    {
        return actual;
    }
}
