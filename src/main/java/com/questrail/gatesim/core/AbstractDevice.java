package com.questrail.gatesim.core;

import com.questrail.gatesim.api.Device;
import com.questrail.gatesim.api.SignalSource;
import com.questrail.gatesim.api.SignalSources;
import com.questrail.gatesim.api.SignalState;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.Set;

/**
 * AbstractDevice
 * -----------------------------------------------------------------------------
 * Base implementation of {@link Device} shared by every gate and composite.
 *
 * <h2>Responsibilities</h2>
 * <ul>
 *   <li>Holds the positional inputs and enforces the minimum arity</li>
 *   <li>Holds the fixed set of named inputs</li>
 *   <li>Applies the enable rule</li>
 *   <li>Runs every computation through the device's {@link EvaluationGuard}</li>
 * </ul>
 *
 * Subclasses provide only the logic function in {@link #computeValue()}, and
 * may react to named-input rebinding in {@link #onNamedInputChanged}.
 *
 * <h2>Initial State</h2>
 * Positional inputs start as {@code minimumArity} floating placeholders, named
 * inputs start floating and the device starts enabled.
 */
public abstract class AbstractDevice implements Device
{
    private final int minimumArity;
    private final EvaluationGuard guard;
    private final Map<String, SignalSource> namedInputs;

    private List<SignalSource> inputs;
    private SignalSource enable = SignalSources.high();
    private String label;

    protected AbstractDevice(int minimumArity, String... inputNames)
    {
        if (minimumArity < 1) {
            throw new ArityViolationException(1, minimumArity);
        }
        Objects.requireNonNull(inputNames, "inputNames");

        this.minimumArity = minimumArity;
        this.inputs = Collections.nCopies(minimumArity, SignalSources.floating());
        this.guard = new EvaluationGuard(this::toString);

        Map<String, SignalSource> named = new LinkedHashMap<>();
        for (String name : inputNames) {
            Objects.requireNonNull(name, "input name");
            if (named.put(name, SignalSources.floating()) != null) {
                throw new IllegalArgumentException("Duplicate input name: " + name);
            }
        }
        this.namedInputs = named;
    }

    /**
     * The device's logic function. Always invoked through the guard, so an
     * implementation may freely pull inputs that lead back to this device.
     */
    protected abstract SignalState computeValue();

    /**
     * Hook invoked after a named input has been rebound.
     */
    protected void onNamedInputChanged(String name, SignalSource source) {
    }

    @Override
    public final SignalState evaluate()
    {
        if (!isEnabled()) {
            return SignalState.FLOATING;
        }
        return guard.evaluate(this::computeValue);
    }

    /**
     * Returns {@code true} if the enable source currently resolves to TRUE.
     */
    public final boolean isEnabled()
    {
        return InputResolver.resolve(enable).isTrue();
    }

    // ---------- positional inputs ----------

    @Override
    public final List<SignalSource> getIn()
    {
        return inputs;
    }

    @Override
    public final void setIn(SignalSource source)
    {
        setIn(Collections.singletonList(Objects.requireNonNull(source, "source")));
    }

    @Override
    public final void setIn(SignalSource... sources)
    {
        Objects.requireNonNull(sources, "sources");
        setIn(Arrays.asList(sources));
    }

    @Override
    public final void setIn(List<? extends SignalSource> sources)
    {
        Objects.requireNonNull(sources, "sources");
        if (sources.size() < minimumArity) {
            throw new ArityViolationException(minimumArity, sources.size());
        }
        List<SignalSource> copy = new ArrayList<>(sources.size());
        for (SignalSource s : sources) {
            copy.add(Objects.requireNonNull(s, "input source"));
        }
        this.inputs = Collections.unmodifiableList(copy);
    }

    /**
     * Resolves the positional input at {@code index}.
     */
    protected final SignalState resolveInput(int index)
    {
        return InputResolver.resolve(inputs.get(index));
    }

    protected final int inputCount()
    {
        return inputs.size();
    }

    // ---------- enable ----------

    @Override
    public final SignalSource getEnable()
    {
        return enable;
    }

    @Override
    public final void setEnable(SignalSource enable)
    {
        this.enable = Objects.requireNonNull(enable, "enable");
    }

    @Override
    public final void setEnable(boolean enable)
    {
        this.enable = SignalSources.constant(enable);
    }

    // ---------- named inputs ----------

    @Override
    public final SignalState getInput(String name)
    {
        return InputResolver.resolve(namedSource(name));
    }

    @Override
    public final void setInput(String name, SignalSource... sources)
    {
        Objects.requireNonNull(sources, "sources");
        requireInputName(name);

        SignalSource source = sources.length == 0
                ? SignalSources.floating()
                : SignalSources.wired(sources);
        namedInputs.put(name, source);
        onNamedInputChanged(name, source);
    }

    @Override
    public final Set<String> inputNames()
    {
        return Collections.unmodifiableSet(namedInputs.keySet());
    }

    /**
     * Returns the source currently bound to a named input.
     */
    protected final SignalSource namedSource(String name)
    {
        requireInputName(name);
        return namedInputs.get(name);
    }

    private void requireInputName(String name)
    {
        Objects.requireNonNull(name, "name");
        if (!namedInputs.containsKey(name)) {
            throw new IllegalArgumentException("Unknown input '" + name + "' on " + this);
        }
    }

    // ---------- metadata ----------

    @Override
    public final int minimumArity()
    {
        return minimumArity;
    }

    /**
     * Diagnostic access to this device's re-entrancy guard.
     */
    public final EvaluationGuard guard()
    {
        return guard;
    }

    @Override
    public final Optional<String> label()
    {
        return Optional.ofNullable(label);
    }

    public final void setLabel(String label)
    {
        this.label = label;
    }

    @Override
    public String toString()
    {
        if (label != null) {
            return label;
        }
        return getClass().getSimpleName() + "@" + Integer.toHexString(System.identityHashCode(this));
    }
}
