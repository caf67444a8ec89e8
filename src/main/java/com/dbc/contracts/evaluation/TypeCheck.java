package com.dbc.contracts.evaluation;

import com.dbc.contracts.Attachment;
import com.dbc.contracts.ContractAttachmentException;
import com.dbc.contracts.function.ContractFunction;
import com.dbc.contracts.model.CallRecord;
import com.dbc.contracts.model.Condition;

import java.util.*;

/**
 * Precondition generator checking the runtime type of named parameters.
 *
 * Each parameter must be an instance of at least one of its expected types. {@code Void.class}
 * admits {@code null}; primitive classes match their wrappers.
 *
 * <pre>
 * {@code
 * Contracts.typeCheck()
 *         .expect("a", Integer.class)
 *         .expect("b", String.class)
 *         .expect("c", Void.class, ExampleClass.class);
 * }
 * </pre>
 */
public final class TypeCheck implements Attachment {

    public static final String DESCRIPTION = "the types of arguments must be valid";

    private static final Map<Class<?>, Class<?>> WRAPPERS = Map.of(
            boolean.class, Boolean.class,
            byte.class, Byte.class,
            char.class, Character.class,
            short.class, Short.class,
            int.class, Integer.class,
            long.class, Long.class,
            float.class, Float.class,
            double.class, Double.class);

    private final Map<String, List<Class<?>>> expectations = new TreeMap<>();
    private final boolean enabled;

    public TypeCheck(boolean enabled) {
        this.enabled = enabled;
    }

    public TypeCheck expect(String parameter, Class<?>... types) {
        if (types.length == 0) {
            throw new ContractAttachmentException("parameter '" + parameter + "' needs at least one expected type");
        }
        List<Class<?>> expected = expectations.computeIfAbsent(parameter, k -> new ArrayList<>());
        for (Class<?> type : types) {
            expected.add(WRAPPERS.getOrDefault(type, type));
        }
        return this;
    }

    @Override
    public <R> ContractFunction<R> attachTo(ContractFunction<R> target) {
        if (!enabled) {
            return target;
        }
        for (String parameter : expectations.keySet()) {
            if (!target.signature().declares(parameter)) {
                throw new ContractAttachmentException("missing required argument `" + parameter + "` in "
                        + target.signature());
            }
        }
        Map<String, List<Class<?>>> frozen = new TreeMap<>();
        expectations.forEach((name, types) -> frozen.put(name, List.copyOf(types)));
        return ConditionEvaluator.wrap(Condition.precondition(DESCRIPTION, args -> matches(frozen, args), 0), target);
    }

    private static boolean matches(Map<String, List<Class<?>>> expectations, CallRecord args) {
        for (Map.Entry<String, List<Class<?>>> entry : expectations.entrySet()) {
            Object value = args.get(entry.getKey());
            boolean matched = false;
            for (Class<?> type : entry.getValue()) {
                if (value == null ? type == Void.class : type.isInstance(value)) {
                    matched = true;
                    break;
                }
            }
            if (!matched) {
                return false;
            }
        }
        return true;
    }
}
