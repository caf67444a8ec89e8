package com.dbc.contracts.model;

import java.util.*;

/**
 * Immutable name to value record of one invocation, covering every declared parameter.
 * Records are built per call by the argument normalizer and handed to predicates,
 * preservers and transformers.
 */
public final class CallRecord {

    private final Map<String, Object> values;

    public CallRecord(Map<String, ?> values) {
        this.values = Collections.unmodifiableMap(new LinkedHashMap<>(values));
    }

    public Object get(String name) {
        requireDeclared(name);
        return values.get(name);
    }

    public <T> T get(String name, Class<T> type) {
        return type.cast(get(name));
    }

    public int getInt(String name) {
        return ((Number) get(name)).intValue();
    }

    public long getLong(String name) {
        return ((Number) get(name)).longValue();
    }

    public String getString(String name) {
        return (String) get(name);
    }

    /**
     * Values of a catch-all parameter, or any other list-valued parameter.
     */
    public List<?> getList(String name) {
        return (List<?>) get(name);
    }

    /**
     * A list-valued parameter with every element checked against {@code elementType}.
     *
     * @throws ClassCastException if an element is of another type
     */
    public <E> List<E> getList(String name, Class<E> elementType) {
        List<E> typed = new ArrayList<>();
        for (Object element : getList(name)) {
            typed.add(elementType.cast(element));
        }
        return Collections.unmodifiableList(typed);
    }

    public boolean has(String name) {
        return values.containsKey(name);
    }

    public Set<String> names() {
        return values.keySet();
    }

    public Map<String, Object> asMap() {
        return values;
    }

    /**
     * Produces a new record with some values replaced. Parameters can change value
     * (and type) but cannot be added, renamed or dropped.
     */
    public CallRecord rewrite(Map<String, ?> overrides) {
        Map<String, Object> copy = new LinkedHashMap<>(values);
        for (Map.Entry<String, ?> entry : overrides.entrySet()) {
            requireDeclared(entry.getKey());
            copy.put(entry.getKey(), entry.getValue());
        }
        return new CallRecord(copy);
    }

    public CallRecord with(String name, Object value) {
        Map<String, Object> override = new HashMap<>();
        override.put(name, value);
        return rewrite(override);
    }

    private void requireDeclared(String name) {
        if (!values.containsKey(name)) {
            throw new IllegalArgumentException("no parameter named '" + name + "' in " + values.keySet());
        }
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof CallRecord)) return false;
        return values.equals(((CallRecord) o).values);
    }

    @Override
    public int hashCode() {
        return values.hashCode();
    }

    @Override
    public String toString() {
        StringJoiner joiner = new StringJoiner(", ", "Args(", ")");
        values.forEach((name, value) -> joiner.add(name + "=" + value));
        return joiner.toString();
    }
}
