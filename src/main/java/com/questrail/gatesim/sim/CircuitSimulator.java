package com.questrail.gatesim.sim;

import com.questrail.gatesim.api.SignalSource;
import com.questrail.gatesim.api.SignalState;
import com.questrail.gatesim.observability.ProbeChangeEvent;
import com.questrail.gatesim.observability.SettleEvent;
import com.questrail.gatesim.observability.SimulationObservabilitySink;
import com.questrail.gatesim.observability.TickErrorEvent;
import com.questrail.gatesim.sim.config.SimulationConfig;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.Set;

/**
 * CircuitSimulator
 * -----------------------------------------------------------------------------
 * The outer driver of a device graph. It owns no devices; it only pulls a set
 * of named probes (the equivalent of indicator lamps) once per tick.
 *
 * <h2>Tick</h2>
 * {@link #tick()} evaluates every probe once, in registration order. A probe
 * whose evaluation throws has "no valid output this tick": the failure is
 * recorded in the snapshot, reported to the observability sink, and the tick
 * carries on with the remaining probes.
 *
 * <h2>Settling</h2>
 * Feedback circuits settle over successive ticks. {@link #settle()} ticks until
 * two consecutive snapshots match or {@link SimulationConfig#maxSettleTicks()}
 * is reached.
 *
 * <h2>Threading</h2>
 * Not thread-safe. Rewiring devices and ticking must happen on one thread.
 */
public final class CircuitSimulator
{
    private final SimulationConfig config;
    private final SimulationObservabilitySink sink;
    private final Map<String, SignalSource> probes = new LinkedHashMap<>();

    private long tickCount;
    private TickSnapshot last;

    public CircuitSimulator()
    {
        this(SimulationConfig.defaults());
    }

    public CircuitSimulator(SimulationConfig config)
    {
        this.config = Objects.requireNonNull(config, "config");
        this.sink = config.observabilitySink();
    }

    /**
     * Registers a probe.
     *
     * @throws IllegalArgumentException if a probe with that name exists
     */
    public CircuitSimulator addProbe(String name, SignalSource source)
    {
        Objects.requireNonNull(name, "name");
        Objects.requireNonNull(source, "source");
        if (probes.containsKey(name)) {
            throw new IllegalArgumentException("Duplicate probe: " + name);
        }
        probes.put(name, source);
        return this;
    }

    public boolean removeProbe(String name)
    {
        return probes.remove(name) != null;
    }

    public Set<String> probeNames()
    {
        return Collections.unmodifiableSet(probes.keySet());
    }

    /**
     * Evaluates every probe once.
     */
    public TickSnapshot tick()
    {
        long tick = ++tickCount;
        Map<String, SignalState> values = new LinkedHashMap<>();
        Map<String, RuntimeException> failures = new LinkedHashMap<>();

        for (Map.Entry<String, SignalSource> probe : probes.entrySet()) {
            String name = probe.getKey();
            try {
                values.put(name, Objects.requireNonNull(probe.getValue().evaluate(), "probe returned null"));
            } catch (RuntimeException e) {
                failures.put(name, e);
                sink.onTickError(new TickErrorEvent(tick, name, e.getMessage(), e));
            }
        }

        TickSnapshot snapshot = new TickSnapshot(tick, values, failures);
        reportChanges(snapshot);
        last = snapshot;
        return snapshot;
    }

    /**
     * Ticks until the outputs stop changing or the tick budget is spent.
     */
    public SettleResult settle()
    {
        TickSnapshot previous = null;
        TickSnapshot current = null;
        int used = 0;
        boolean settled = false;

        while (used < config.maxSettleTicks()) {
            current = tick();
            used++;
            if (previous != null && current.sameOutputs(previous)) {
                settled = true;
                break;
            }
            previous = current;
        }

        sink.onSettle(new SettleEvent(current.tick(), used, settled));
        return new SettleResult(settled, used, current);
    }

    public Optional<TickSnapshot> lastSnapshot()
    {
        return Optional.ofNullable(last);
    }

    public long tickCount()
    {
        return tickCount;
    }

    private void reportChanges(TickSnapshot snapshot)
    {
        for (String name : probes.keySet()) {
            Optional<SignalState> now = snapshot.value(name);
            Optional<SignalState> before = last == null ? Optional.empty() : last.value(name);
            if (!before.equals(now)) {
                sink.onProbeChange(new ProbeChangeEvent(snapshot.tick(), name, before, now));
            }
        }
    }
}
