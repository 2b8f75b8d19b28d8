/**
 * Tick driver for device graphs.
 *
 * <p>The core never loops on its own. Circuits with feedback reach their fixed
 * point only when something outside them evaluates their outputs once per
 * simulated step; {@link com.questrail.gatesim.sim.CircuitSimulator} is that
 * something, minus any rendering.</p>
 */
package com.questrail.gatesim.sim;
