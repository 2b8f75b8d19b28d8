package com.questrail.gatesim.core;

import com.questrail.gatesim.api.SignalState;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Objects;
import java.util.function.Supplier;

/**
 * EvaluationGuard
 * -----------------------------------------------------------------------------
 * Per-device re-entrancy guard that turns recursive pulls around a feedback
 * loop into a bounded walk.
 *
 * <h2>Contract</h2>
 * <ul>
 *   <li>A call arriving while the guard is idle marks it in-evaluation, runs the
 *       computation, stores the result as {@link #lastValue()}, clears the
 *       mark and returns the result.</li>
 *   <li>A call arriving while the guard is already in-evaluation (the pull came
 *       back around a cycle) returns {@link #lastValue()} immediately without
 *       running the computation.</li>
 *   <li>The mark is held until the call that set it unwinds, and is cleared on
 *       that unwind even if the computation throws. A failed computation
 *       leaves {@link #lastValue()} untouched.</li>
 * </ul>
 *
 * Before the first completed computation {@link #lastValue()} is
 * {@link SignalState#FLOATING}.
 *
 * <h2>Settling</h2>
 * Values returned on re-entry may be stale by one pass. Feedback circuits
 * reach their fixed point after the surrounding driver evaluates them on
 * successive ticks; the guard itself never loops.
 *
 * <h2>Thread Safety</h2>
 * None. Evaluation is single-threaded by design.
 */
public final class EvaluationGuard
{
    private static final Logger log = LoggerFactory.getLogger(EvaluationGuard.class);

    private final Supplier<String> owner;

    private boolean inEvaluation;
    private SignalState lastValue = SignalState.FLOATING;
    private long evaluationCount;

    /**
     * @param owner supplies the owning device's name for log output
     */
    public EvaluationGuard(Supplier<String> owner)
    {
        this.owner = Objects.requireNonNull(owner, "owner");
    }

    /**
     * Runs {@code computation} under the guard contract.
     */
    public SignalState evaluate(Supplier<SignalState> computation)
    {
        Objects.requireNonNull(computation, "computation");

        if (inEvaluation) {
            if (log.isTraceEnabled()) {
                log.trace("Re-entered {} during its own evaluation, returning {}", owner.get(), lastValue);
            }
            return lastValue;
        }

        inEvaluation = true;
        try {
            SignalState value = Objects.requireNonNull(computation.get(), "computation returned null");
            evaluationCount++;
            lastValue = value;
            return value;
        } finally {
            inEvaluation = false;
        }
    }

    public boolean inEvaluation()
    {
        return inEvaluation;
    }

    public SignalState lastValue()
    {
        return lastValue;
    }

    /**
     * Number of computations that ran to completion through this guard.
     */
    public long evaluationCount()
    {
        return evaluationCount;
    }
}
