/**
 * Device Evaluation Core
 * =============================================================================
 *
 * <p>This package holds the machinery every simulated device is built on:</p>
 *
 * <ul>
 *   <li>{@link com.questrail.gatesim.core.InputResolver} – combines the drivers
 *       of one logical input into a single tri-state value and rejects
 *       conflicting drivers</li>
 *   <li>{@link com.questrail.gatesim.core.EvaluationGuard} – the per-device
 *       re-entrancy guard that bounds recursive pulls around feedback loops</li>
 *   <li>{@link com.questrail.gatesim.core.AbstractDevice} – arity, enable and
 *       named-input handling shared by gates and composites</li>
 * </ul>
 *
 * <h2>Evaluation Model</h2>
 * <p>Evaluation is pull-based, synchronous and single-threaded. Calling
 * {@code evaluate()} on a device walks its upstream sources depth-first. The
 * guard is the only thing bounding that walk on a cyclic graph, which is why
 * every device evaluates through one, including stateless gates.</p>
 *
 * <pre>
 *   caller
 *     → device.evaluate()
 *         → enable resolved (FLOATING if not TRUE)
 *         → guard.evaluate(computeValue)
 *             → InputResolver.resolve(upstream sources)
 *                 → upstream device.evaluate() ...
 * </pre>
 *
 * <p>Rewiring and evaluation must not be interleaved across threads without
 * external synchronization.</p>
 */
package com.questrail.gatesim.core;
