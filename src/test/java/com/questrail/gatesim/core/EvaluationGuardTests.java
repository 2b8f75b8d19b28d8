package com.questrail.gatesim.core;

import com.questrail.gatesim.api.SignalState;
import org.junit.jupiter.api.Test;

import java.util.concurrent.atomic.AtomicInteger;
import java.util.concurrent.atomic.AtomicReference;
import java.util.function.Supplier;

import static org.junit.jupiter.api.Assertions.*;

class EvaluationGuardTests
{
    @Test
    void startsIdleAndFloating() {
        EvaluationGuard guard = new EvaluationGuard(() -> "idle");

        assertFalse(guard.inEvaluation());
        assertEquals(SignalState.FLOATING, guard.lastValue());
        assertEquals(0, guard.evaluationCount());
    }

    @Test
    void storesComputedValue() {
        EvaluationGuard guard = new EvaluationGuard(() -> "store");

        assertEquals(SignalState.TRUE, guard.evaluate(() -> SignalState.TRUE));
        assertEquals(SignalState.TRUE, guard.lastValue());
        assertEquals(1, guard.evaluationCount());
        assertFalse(guard.inEvaluation());
    }

    @Test
    void reentrantCallReturnsLastValueWithoutComputing() {
        EvaluationGuard guard = new EvaluationGuard(() -> "loop");
        AtomicInteger runs = new AtomicInteger();
        AtomicReference<SignalState> seenOnReentry = new AtomicReference<>();
        AtomicReference<Boolean> markedDuringRun = new AtomicReference<>();

        Supplier<SignalState> body = new Supplier<>() {
            @Override
            public SignalState get() {
                runs.incrementAndGet();
                markedDuringRun.set(guard.inEvaluation());
                seenOnReentry.set(guard.evaluate(this));
                return SignalState.TRUE;
            }
        };

        assertEquals(SignalState.TRUE, guard.evaluate(body));
        assertEquals(SignalState.FLOATING, seenOnReentry.get());
        assertTrue(markedDuringRun.get());
        assertEquals(1, runs.get());

        guard.evaluate(body);
        assertEquals(SignalState.TRUE, seenOnReentry.get());
        assertEquals(2, runs.get());
        assertFalse(guard.inEvaluation());
    }

    @Test
    void markIsHeldAcrossSeveralReentries() {
        EvaluationGuard guard = new EvaluationGuard(() -> "multi");
        AtomicInteger runs = new AtomicInteger();

        Supplier<SignalState> body = new Supplier<>() {
            @Override
            public SignalState get() {
                runs.incrementAndGet();
                guard.evaluate(this);
                guard.evaluate(this);
                guard.evaluate(this);
                return SignalState.FALSE;
            }
        };

        guard.evaluate(body);

        assertEquals(1, runs.get());
    }

    @Test
    void failureClearsMarkAndKeepsLastValue() {
        EvaluationGuard guard = new EvaluationGuard(() -> "fail");
        guard.evaluate(() -> SignalState.FALSE);

        assertThrows(ConflictingInputsException.class, () -> guard.evaluate(() -> {
            throw new ConflictingInputsException(1, 1);
        }));

        assertFalse(guard.inEvaluation());
        assertEquals(SignalState.FALSE, guard.lastValue());
        assertEquals(1, guard.evaluationCount());
    }
}
