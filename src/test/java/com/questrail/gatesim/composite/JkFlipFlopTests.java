package com.questrail.gatesim.composite;

import com.questrail.gatesim.api.SignalSources;
import com.questrail.gatesim.api.SignalState;
import com.questrail.gatesim.sources.ToggleSwitch;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.*;

class JkFlipFlopTests
{
    private ToggleSwitch j;
    private ToggleSwitch k;
    private ToggleSwitch clk;

    @BeforeEach
    void setUp() {
        j = new ToggleSwitch(false);
        k = new ToggleSwitch(false);
        clk = new ToggleSwitch(false);
    }

    private JkFlipFlop connected() {
        JkFlipFlop ff = new JkFlipFlop();
        ff.setInput(JkFlipFlop.J, j);
        ff.setInput(JkFlipFlop.K, k);
        ff.setInput(JkFlipFlop.CLK, clk);
        return ff;
    }

    private static void assertOutputs(JkFlipFlop ff, SignalState q, SignalState qComplement) {
        for (int tick = 0; tick < 4; tick++) {
            assertEquals(q, ff.q(), "Q at tick " + tick);
            assertEquals(qComplement, ff.qComplement(), "Q_ at tick " + tick);
        }
    }

    @Test
    void unwiredFlipFlopHoldsReset() {
        JkFlipFlop ff = new JkFlipFlop();

        assertFalse(ff.isWired());
        assertOutputs(ff, SignalState.FALSE, SignalState.TRUE);
    }

    @Test
    void wiringIsDeferredUntilAllInputsAreDriven() {
        JkFlipFlop ff = new JkFlipFlop();

        assertDoesNotThrow(() -> ff.setInput(JkFlipFlop.J, SignalSources.high()));
        assertFalse(ff.isWired());
        ff.setInput(JkFlipFlop.K, SignalSources.low());
        assertFalse(ff.isWired());
        assertOutputs(ff, SignalState.FALSE, SignalState.TRUE);

        ff.setInput(JkFlipFlop.CLK, SignalSources.low());
        assertTrue(ff.isWired());
    }

    @Test
    void floatingRebindDisconnectsGatingStage() {
        JkFlipFlop ff = connected();
        assertTrue(ff.isWired());

        ff.setInput(JkFlipFlop.J, SignalSources.floating());
        assertFalse(ff.isWired());

        ff.setInput(JkFlipFlop.J, j);
        assertTrue(ff.isWired());
    }

    @Test
    void setWhileClockHigh() {
        j.set(true);
        clk.set(true);
        JkFlipFlop ff = connected();

        assertOutputs(ff, SignalState.TRUE, SignalState.FALSE);
        assertEquals(LatchState.SET, ff.latchState());
    }

    @Test
    void resetWhileClockHigh() {
        k.set(true);
        clk.set(true);
        JkFlipFlop ff = connected();

        assertOutputs(ff, SignalState.FALSE, SignalState.TRUE);
        assertEquals(LatchState.RESET, ff.latchState());
    }

    @Test
    void clockLowIgnoresJAndK() {
        j.set(true);
        clk.set(true);
        JkFlipFlop ff = connected();
        assertOutputs(ff, SignalState.TRUE, SignalState.FALSE);

        clk.set(false);
        j.set(false);
        k.set(true);
        assertOutputs(ff, SignalState.TRUE, SignalState.FALSE);
    }

    @Test
    void fullSequence() {
        JkFlipFlop ff = connected();
        assertOutputs(ff, SignalState.FALSE, SignalState.TRUE);

        j.set(true);
        clk.set(true);
        assertOutputs(ff, SignalState.TRUE, SignalState.FALSE);

        clk.set(false);
        assertOutputs(ff, SignalState.TRUE, SignalState.FALSE);

        j.set(false);
        k.set(true);
        clk.set(true);
        assertOutputs(ff, SignalState.FALSE, SignalState.TRUE);

        clk.set(false);
        k.set(false);
        assertOutputs(ff, SignalState.FALSE, SignalState.TRUE);
    }

    @Test
    void allInputsHighIsReportedInvalidAndTerminates() {
        j.set(true);
        k.set(true);
        clk.set(true);
        JkFlipFlop ff = connected();

        for (int tick = 0; tick < 8; tick++) {
            assertEquals(LatchState.INVALID, assertDoesNotThrow(ff::latchState));
        }
    }

    @Test
    void disabledFlipFlopFloats() {
        JkFlipFlop ff = connected();
        ff.setEnable(false);

        assertEquals(LatchState.FLOATING, ff.latchState());
    }
}
