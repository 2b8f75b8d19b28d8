package com.questrail.gatesim.core;

/**
 * Raised when the drivers feeding one logical input disagree: at least one
 * asserts {@code TRUE} while at least one other asserts {@code FALSE}.
 *
 * The error is not recovered inside the device graph. It propagates out of the
 * {@code evaluate()} call that pulled the conflicting input, failing that whole
 * evaluation.
 */
public final class ConflictingInputsException extends RuntimeException
{
    private final int trueDrivers;
    private final int falseDrivers;

    public ConflictingInputsException(int trueDrivers, int falseDrivers)
    {
        super("Conflicting inputs (" + trueDrivers + " driving TRUE, " + falseDrivers + " driving FALSE)");
        this.trueDrivers = trueDrivers;
        this.falseDrivers = falseDrivers;
    }

    public int trueDrivers()
    {
        return trueDrivers;
    }

    public int falseDrivers()
    {
        return falseDrivers;
    }
}
