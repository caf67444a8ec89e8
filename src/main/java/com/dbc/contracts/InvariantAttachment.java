package com.dbc.contracts;

import com.dbc.contracts.analysis.DerivedType;
import com.dbc.contracts.analysis.InvariantPropagator;
import com.dbc.contracts.model.Condition;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/**
 * One or more class invariants waiting to be propagated onto a type.
 *
 * <pre>
 * {@code
 * DerivedType<Counter> counters = Contracts.<CounterImpl>invariant("counter >= 0", self -> self.counter >= 0)
 *         .derive(Counter.class, CounterImpl.class);
 * Counter counter = counters.newInstance(10);
 * }
 * </pre>
 *
 * @param <C> implementation type the invariants inspect
 */
public final class InvariantAttachment<C> {

    private final List<Condition> invariants;
    private final boolean enabled;

    InvariantAttachment(List<Condition> invariants, boolean enabled) {
        this.invariants = Collections.unmodifiableList(new ArrayList<>(invariants));
        this.enabled = enabled;
    }

    /**
     * Stacks another invariant inside this one: this one is checked first on entry
     * and last on exit.
     */
    public InvariantAttachment<C> and(InvariantAttachment<? super C> inner) {
        List<Condition> combined = new ArrayList<>(invariants);
        combined.addAll(inner.invariants);
        return new InvariantAttachment<>(combined, enabled && inner.enabled);
    }

    /**
     * Builds the derived type from a concrete class, exposing instances as that class.
     */
    public <T extends C> DerivedType<T> derive(Class<T> type) {
        return derive(type, type);
    }

    /**
     * Builds the derived type. The implementation class is left untouched; instances come from
     * a generated subclass of it.
     */
    public <I> DerivedType<I> derive(Class<I> type, Class<? extends C> implementation) {
        if (!type.isAssignableFrom(implementation)) {
            throw new ContractAttachmentException(implementation.getName() + " does not implement " + type.getName());
        }
        Class<? extends I> checked = implementation.asSubclass(type);
        if (!enabled) {
            return InvariantPropagator.passThrough(type, checked);
        }
        return InvariantPropagator.propagate(type, checked, invariants);
    }

    public List<Condition> conditions() {
        return invariants;
    }
}
