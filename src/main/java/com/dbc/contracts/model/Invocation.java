package com.dbc.contracts.model;

import java.util.*;

/**
 * The actual arguments of one call: positional values followed by named values.
 * Both may contain nulls.
 */
public final class Invocation {

    private static final Invocation EMPTY = new Invocation(Collections.emptyList(), Collections.emptyMap());

    private final List<Object> positional;
    private final Map<String, Object> named;

    private Invocation(List<Object> positional, Map<String, Object> named) {
        this.positional = positional;
        this.named = named;
    }

    /**
     * Positional values only. A {@code null} array stands for a single {@code null} argument.
     */
    public static Invocation of(Object... positional) {
        if (positional == null) {
            return new Invocation(Collections.singletonList(null), Collections.emptyMap());
        }
        if (positional.length == 0) {
            return EMPTY;
        }
        return new Invocation(Collections.unmodifiableList(new ArrayList<>(Arrays.asList(positional))),
                Collections.emptyMap());
    }

    public static Invocation named(Map<String, ?> named) {
        return new Invocation(Collections.emptyList(), Collections.unmodifiableMap(new LinkedHashMap<>(named)));
    }

    /**
     * Passes every value of a record by name, the way a rewritten record is handed to the next layer.
     */
    public static Invocation fromRecord(CallRecord record) {
        return named(record.asMap());
    }

    public static Builder builder() {
        return new Builder();
    }

    /**
     * Returns a copy with one more named value.
     */
    public Invocation with(String name, Object value) {
        Map<String, Object> copy = new LinkedHashMap<>(named);
        copy.put(name, value);
        return new Invocation(positional, Collections.unmodifiableMap(copy));
    }

    public List<Object> positional() {
        return positional;
    }

    public Map<String, Object> named() {
        return named;
    }

    @Override
    public String toString() {
        StringJoiner joiner = new StringJoiner(", ", "(", ")");
        positional.forEach(value -> joiner.add(String.valueOf(value)));
        named.forEach((name, value) -> joiner.add(name + "=" + value));
        return joiner.toString();
    }

    public static final class Builder {

        private final List<Object> positional = new ArrayList<>();
        private final Map<String, Object> named = new LinkedHashMap<>();

        private Builder() {
        }

        public Builder positional(Object... values) {
            if (values == null) {
                positional.add(null);
                return this;
            }
            positional.addAll(Arrays.asList(values));
            return this;
        }

        public Builder named(String name, Object value) {
            named.put(name, value);
            return this;
        }

        public Invocation build() {
            return new Invocation(Collections.unmodifiableList(new ArrayList<>(positional)),
                    Collections.unmodifiableMap(new LinkedHashMap<>(named)));
        }
    }
}
