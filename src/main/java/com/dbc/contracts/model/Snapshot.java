package com.dbc.contracts.model;

import java.util.*;

/**
 * Values captured before a call body runs, exposed to three-argument postconditions.
 * Only a shallow copy of the captured map is taken.
 */
public final class Snapshot {

    private static final Snapshot EMPTY = new Snapshot(Collections.emptyMap());

    private final Map<String, Object> values;

    private Snapshot(Map<String, Object> values) {
        this.values = values;
    }

    public static Snapshot empty() {
        return EMPTY;
    }

    public static Snapshot of(Map<String, ?> values) {
        if (values.isEmpty()) {
            return EMPTY;
        }
        return new Snapshot(Collections.unmodifiableMap(new LinkedHashMap<>(values)));
    }

    public Object get(String name) {
        if (!values.containsKey(name)) {
            throw new IllegalArgumentException("nothing preserved under '" + name + "' in " + values.keySet());
        }
        return values.get(name);
    }

    public <T> T get(String name, Class<T> type) {
        return type.cast(get(name));
    }

    public int getInt(String name) {
        return ((Number) get(name)).intValue();
    }

    public boolean has(String name) {
        return values.containsKey(name);
    }

    public Map<String, Object> asMap() {
        return values;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof Snapshot)) return false;
        return values.equals(((Snapshot) o).values);
    }

    @Override
    public int hashCode() {
        return values.hashCode();
    }

    @Override
    public String toString() {
        return "Old" + values;
    }
}
