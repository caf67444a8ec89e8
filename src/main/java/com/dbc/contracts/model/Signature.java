package com.dbc.contracts.model;

import java.util.*;

/**
 * Declared parameter shape of a contracted function.
 *
 * A signature lists the positional parameters in order (the trailing ones may carry
 * defaults), an optional catch-all parameter collecting overflow positional values,
 * and keyword-only parameters which can only be bound by name.
 *
 * <pre>
 * {@code
 * Signature signature = Signature.builder("func")
 *         .param("a")
 *         .param("b", "Foo")
 *         .catchAll("c")
 *         .build();
 * }
 * </pre>
 */
public final class Signature {

    private final String name;
    private final List<String> positional;
    private final Map<String, Object> defaults;
    private final String catchAll;
    private final List<String> keywordOnly;
    private final Map<String, Object> keywordDefaults;

    private Signature(Builder builder) {
        this.name = builder.name;
        this.positional = Collections.unmodifiableList(new ArrayList<>(builder.positional));
        this.defaults = Collections.unmodifiableMap(new LinkedHashMap<>(builder.defaults));
        this.catchAll = builder.catchAll;
        this.keywordOnly = Collections.unmodifiableList(new ArrayList<>(builder.keywordOnly));
        this.keywordDefaults = Collections.unmodifiableMap(new LinkedHashMap<>(builder.keywordDefaults));
    }

    /**
     * Shorthand for a signature made only of required positional parameters.
     */
    public static Signature of(String name, String... parameters) {
        Builder builder = builder(name);
        for (String parameter : parameters) {
            builder.param(parameter);
        }
        return builder.build();
    }

    public static Builder builder(String name) {
        return new Builder(name);
    }

    public String name() {
        return name;
    }

    public List<String> positional() {
        return positional;
    }

    /**
     * Defaults of positional parameters, keyed by parameter name. Values may be null.
     */
    public Map<String, Object> defaults() {
        return defaults;
    }

    public Optional<String> catchAll() {
        return Optional.ofNullable(catchAll);
    }

    public List<String> keywordOnly() {
        return keywordOnly;
    }

    public Map<String, Object> keywordDefaults() {
        return keywordDefaults;
    }

    /**
     * All declared names: positional parameters, then the catch-all, then keyword-only parameters.
     */
    public List<String> parameterNames() {
        List<String> names = new ArrayList<>(positional);
        if (catchAll != null) {
            names.add(catchAll);
        }
        names.addAll(keywordOnly);
        return names;
    }

    /**
     * Number of declared parameters, counting the catch-all as one.
     */
    public int arity() {
        return positional.size() + keywordOnly.size() + (catchAll != null ? 1 : 0);
    }

    public boolean declares(String parameter) {
        return positional.contains(parameter) || keywordOnly.contains(parameter)
                || parameter.equals(catchAll);
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof Signature)) return false;
        Signature other = (Signature) o;
        return name.equals(other.name)
                && positional.equals(other.positional)
                && defaults.equals(other.defaults)
                && Objects.equals(catchAll, other.catchAll)
                && keywordOnly.equals(other.keywordOnly)
                && keywordDefaults.equals(other.keywordDefaults);
    }

    @Override
    public int hashCode() {
        return Objects.hash(name, positional, defaults, catchAll, keywordOnly, keywordDefaults);
    }

    @Override
    public String toString() {
        StringJoiner joiner = new StringJoiner(", ", name + "(", ")");
        for (String parameter : positional) {
            joiner.add(defaults.containsKey(parameter) ? parameter + "=" + defaults.get(parameter) : parameter);
        }
        if (catchAll != null) {
            joiner.add("*" + catchAll);
        } else if (!keywordOnly.isEmpty()) {
            joiner.add("*");
        }
        for (String parameter : keywordOnly) {
            joiner.add(keywordDefaults.containsKey(parameter)
                    ? parameter + "=" + keywordDefaults.get(parameter) : parameter);
        }
        return joiner.toString();
    }

    /**
     * Builder for {@link Signature}. Parameter names must be unique, and a positional
     * parameter without a default may not follow one that has a default.
     */
    public static final class Builder {

        private final String name;
        private final List<String> positional = new ArrayList<>();
        private final Map<String, Object> defaults = new LinkedHashMap<>();
        private String catchAll;
        private final List<String> keywordOnly = new ArrayList<>();
        private final Map<String, Object> keywordDefaults = new LinkedHashMap<>();
        private final Set<String> seen = new HashSet<>();

        private Builder(String name) {
            this.name = Objects.requireNonNull(name, "name");
        }

        public Builder param(String parameter) {
            claim(parameter);
            if (!defaults.isEmpty()) {
                throw new IllegalArgumentException(
                        "parameter '" + parameter + "' without a default follows a parameter with a default");
            }
            positional.add(parameter);
            return this;
        }

        public Builder param(String parameter, Object defaultValue) {
            claim(parameter);
            positional.add(parameter);
            defaults.put(parameter, defaultValue);
            return this;
        }

        public Builder catchAll(String parameter) {
            if (catchAll != null) {
                throw new IllegalArgumentException("a signature declares at most one catch-all parameter");
            }
            claim(parameter);
            catchAll = parameter;
            return this;
        }

        public Builder keywordOnly(String parameter) {
            claim(parameter);
            keywordOnly.add(parameter);
            return this;
        }

        public Builder keywordOnly(String parameter, Object defaultValue) {
            claim(parameter);
            keywordOnly.add(parameter);
            keywordDefaults.put(parameter, defaultValue);
            return this;
        }

        public Signature build() {
            return new Signature(this);
        }

        private void claim(String parameter) {
            Objects.requireNonNull(parameter, "parameter");
            if (parameter.isEmpty()) {
                throw new IllegalArgumentException("parameter names must be non-empty");
            }
            if (!seen.add(parameter)) {
                throw new IllegalArgumentException("duplicate parameter '" + parameter + "' in " + name);
            }
        }
    }
}
