package com.dbc.contracts.evaluation;

import com.dbc.contracts.MissingArgumentException;
import com.dbc.contracts.model.CallRecord;
import com.dbc.contracts.model.Invocation;
import com.dbc.contracts.model.Signature;

import java.util.*;

/**
 * Binds the actual arguments of a call to a function's declared parameters.
 *
 * Binding precedence, lowest first: keyword-only defaults, positional defaults, explicit
 * positional values, explicit named values. Positional values beyond the declared names go
 * to the catch-all parameter when there is one.
 */
public final class ArgumentNormalizer {

    private static final Object UNBOUND = new Object();

    private ArgumentNormalizer() {
    }

    /**
     * Builds the call record for one invocation.
     *
     * @throws MissingArgumentException if a required parameter stays unbound
     * @throws IllegalArgumentException if there are too many positional values or an unknown name
     */
    public static CallRecord normalize(Signature signature, Invocation invocation) {
        Map<String, Object> actual = new LinkedHashMap<>();
        for (String name : signature.parameterNames()) {
            actual.put(name, UNBOUND);
        }

        actual.putAll(signature.keywordDefaults());
        actual.putAll(signature.defaults());

        List<String> positional = signature.positional();
        List<Object> values = invocation.positional();
        int bound = Math.min(values.size(), positional.size());
        for (int i = 0; i < bound; i++) {
            actual.put(positional.get(i), values.get(i));
        }

        Optional<String> catchAll = signature.catchAll();
        if (catchAll.isPresent()) {
            List<Object> overflow = values.size() > positional.size()
                    ? new ArrayList<>(values.subList(positional.size(), values.size()))
                    : new ArrayList<>();
            actual.put(catchAll.get(), Collections.unmodifiableList(overflow));
        } else if (values.size() > positional.size()) {
            throw new IllegalArgumentException(String.format("%s takes %d positional arguments but %d were given",
                    signature.name(), positional.size(), values.size()));
        }

        for (Map.Entry<String, Object> entry : invocation.named().entrySet()) {
            String name = entry.getKey();
            if (!actual.containsKey(name)) {
                throw new IllegalArgumentException(signature.name() + " got an unexpected argument '" + name + "'");
            }
            Object value = entry.getValue();
            if (catchAll.isPresent() && catchAll.get().equals(name)) {
                value = asCatchAll(signature, name, value);
            }
            actual.put(name, value);
        }

        for (Map.Entry<String, Object> entry : actual.entrySet()) {
            if (entry.getValue() == UNBOUND) {
                throw new MissingArgumentException(signature.name(), entry.getKey());
            }
        }

        return new CallRecord(actual);
    }

    private static List<Object> asCatchAll(Signature signature, String name, Object value) {
        if (value instanceof List) {
            return Collections.unmodifiableList(new ArrayList<>((List<?>) value));
        }
        if (value instanceof Object[]) {
            return Collections.unmodifiableList(new ArrayList<>(Arrays.asList((Object[]) value)));
        }
        throw new IllegalArgumentException(
                signature.name() + " expects a list for catch-all parameter '" + name + "', got " + value);
    }
}
