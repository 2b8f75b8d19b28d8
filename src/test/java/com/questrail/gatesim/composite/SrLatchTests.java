package com.questrail.gatesim.composite;

import com.questrail.gatesim.api.SignalSources;
import com.questrail.gatesim.api.SignalState;
import com.questrail.gatesim.core.ConflictingInputsException;
import com.questrail.gatesim.gates.GateKind;
import com.questrail.gatesim.sources.ToggleSwitch;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.*;

class SrLatchTests
{
    private ToggleSwitch s;
    private ToggleSwitch r;

    @BeforeEach
    void setUp() {
        s = new ToggleSwitch(false);
        r = new ToggleSwitch(false);
    }

    private SrLatch connected(GateKind kind) {
        SrLatch latch = new SrLatch(kind);
        latch.setInput(SrLatch.S, s);
        latch.setInput(SrLatch.R, r);
        return latch;
    }

    private static void assertOutputs(SrLatch latch, SignalState q, SignalState qComplement) {
        for (int tick = 0; tick < 3; tick++) {
            assertEquals(q, latch.q(), "Q at tick " + tick);
            assertEquals(qComplement, latch.qComplement(), "Q_ at tick " + tick);
        }
    }

    // ---------- NOR family ----------

    @Test
    void setWithConstants() {
        SrLatch latch = new SrLatch(GateKind.NOR);
        latch.setInput(SrLatch.S, SignalSources.high());
        latch.setInput(SrLatch.R, SignalSources.low());

        assertEquals(SignalState.TRUE, latch.q());
        assertEquals(SignalState.FALSE, latch.qComplement());
        assertEquals(LatchState.SET, latch.latchState());
    }

    @Test
    void norSetResetAndHold() {
        SrLatch latch = connected(GateKind.NOR);

        s.set(true);
        assertOutputs(latch, SignalState.TRUE, SignalState.FALSE);

        s.set(false);
        assertOutputs(latch, SignalState.TRUE, SignalState.FALSE);

        r.set(true);
        assertOutputs(latch, SignalState.FALSE, SignalState.TRUE);

        r.set(false);
        assertOutputs(latch, SignalState.FALSE, SignalState.TRUE);
        assertEquals(LatchState.RESET, latch.latchState());
    }

    @Test
    void norBothActiveIsReportedInvalid() {
        SrLatch latch = connected(GateKind.NOR);
        s.set(true);
        r.set(true);

        assertOutputs(latch, SignalState.FALSE, SignalState.FALSE);
        assertEquals(LatchState.INVALID, latch.latchState());
    }

    @Test
    void defaultFamilyIsNor() {
        assertEquals(GateKind.NOR, new SrLatch().gateKind());
    }

    // ---------- NAND family ----------

    @Test
    void nandInputsAreActiveLow() {
        s.set(true);
        r.set(true);
        SrLatch latch = connected(GateKind.NAND);

        s.set(false);
        assertOutputs(latch, SignalState.FALSE, SignalState.TRUE);

        s.set(true);
        assertOutputs(latch, SignalState.FALSE, SignalState.TRUE);

        r.set(false);
        assertOutputs(latch, SignalState.TRUE, SignalState.FALSE);

        r.set(true);
        assertOutputs(latch, SignalState.TRUE, SignalState.FALSE);
    }

    @Test
    void nandBothActiveIsReportedInvalid() {
        SrLatch latch = connected(GateKind.NAND);

        assertOutputs(latch, SignalState.TRUE, SignalState.TRUE);
        assertEquals(LatchState.INVALID, latch.latchState());
    }

    @Test
    void nonLatchingGateFamilyIsRejected() {
        assertThrows(IllegalArgumentException.class, () -> new SrLatch(GateKind.AND));
        assertThrows(IllegalArgumentException.class, () -> new SrLatch(GateKind.NOT));
    }

    // ---------- wiring and evaluation ----------

    @Test
    void partialWiringDoesNotThrow() {
        SrLatch latch = new SrLatch();

        assertDoesNotThrow(() -> latch.setInput(SrLatch.S, SignalSources.high()));
        assertEquals(SignalState.TRUE, latch.getInput(SrLatch.S));
        assertEquals(SignalState.FLOATING, latch.getInput(SrLatch.R));
    }

    @Test
    void eachOutputCallEvaluatesEachGateAtMostOnce() {
        SrLatch latch = connected(GateKind.NOR);
        s.set(true);
        latch.q();
        s.set(false);

        for (int tick = 0; tick < 10; tick++) {
            long before = latch.ic1.guard().evaluationCount() + latch.ic2.guard().evaluationCount();
            latch.q();
            long after = latch.ic1.guard().evaluationCount() + latch.ic2.guard().evaluationCount();
            assertTrue(after - before <= 2, "gate evaluations per call: " + (after - before));
        }
    }

    @Test
    void conflictingDriversFailEvaluationUntilResolved() {
        SrLatch latch = new SrLatch();
        latch.setInput(SrLatch.R, SignalSources.low());
        latch.setInput(SrLatch.S, SignalSources.high(), SignalSources.low());

        assertThrows(ConflictingInputsException.class, latch::q);

        latch.setInput(SrLatch.S, SignalSources.high());
        assertEquals(SignalState.TRUE, latch.q());
        assertEquals(SignalState.FALSE, latch.qComplement());
    }

    @Test
    void disabledLatchFloatsOnBothOutputs() {
        SrLatch latch = connected(GateKind.NOR);
        s.set(true);
        latch.setEnable(false);

        assertEquals(SignalState.FLOATING, latch.q());
        assertEquals(SignalState.FLOATING, latch.qComplement());
        assertEquals(LatchState.FLOATING, latch.latchState());
    }

    @Test
    void complementOutputCanDriveOtherDevices() {
        SrLatch latch = connected(GateKind.NOR);
        SrLatch follower = new SrLatch();
        follower.setInput(SrLatch.S, latch::qComplement);
        follower.setInput(SrLatch.R, latch);

        r.set(true);
        assertEquals(SignalState.TRUE, follower.q());
    }
}
