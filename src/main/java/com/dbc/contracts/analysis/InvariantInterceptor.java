package com.dbc.contracts.analysis;

import com.dbc.contracts.evaluation.ConditionEvaluator;
import com.dbc.contracts.model.Condition;
import com.dbc.contracts.model.Snapshot;
import net.bytebuddy.implementation.bind.annotation.FieldValue;
import net.bytebuddy.implementation.bind.annotation.Origin;
import net.bytebuddy.implementation.bind.annotation.RuntimeType;
import net.bytebuddy.implementation.bind.annotation.SuperCall;
import net.bytebuddy.implementation.bind.annotation.This;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.lang.reflect.Method;
import java.util.List;
import java.util.concurrent.Callable;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionStage;

/**
 * Installed on every checked override of a derived class. Runs the invariants on entry,
 * calls the overridden method, and runs them again on exit (or when a returned stage resolves).
 *
 * Must stay public: generated classes live in the implementation's package and call it directly.
 */
public final class InvariantInterceptor {

    private static final Logger logger = LoggerFactory.getLogger(InvariantInterceptor.class);

    /**
     * Field added to each derived class, set once the initializer has completed.
     */
    static final String READY_FIELD = "dbc$ready";

    private final String typeName;
    private final List<Condition> invariants;

    InvariantInterceptor(String typeName, List<Condition> invariants) {
        this.typeName = typeName;
        this.invariants = List.copyOf(invariants);
    }

    @RuntimeType
    public Object intercept(@This Object self,
                            @Origin Method method,
                            @FieldValue(READY_FIELD) boolean ready,
                            @SuperCall Callable<?> original) throws Exception {
        // methods the initializer calls run unchecked; the object is validated once it returns
        if (!ready) {
            return original.call();
        }

        logger.trace("Checking invariants around {}.{}", typeName, method.getName());
        checkEntry(self);
        Object result = original.call();
        if (isStage(method) && result != null) {
            return ConditionEvaluator.whenResolved((CompletionStage<?>) result, value -> checkExit(self));
        }
        checkExit(self);
        return result;
    }

    void checkEntry(Object self) {
        for (Condition invariant : invariants) {
            ConditionEvaluator.checkBefore(invariant, self);
        }
    }

    void checkExit(Object self) {
        for (int i = invariants.size() - 1; i >= 0; i--) {
            ConditionEvaluator.checkAfter(invariants.get(i), self, null, Snapshot.empty());
        }
    }

    private static boolean isStage(Method method) {
        Class<?> returnType = method.getReturnType();
        return returnType == CompletionStage.class || returnType == CompletableFuture.class;
    }

    @Override
    public String toString() {
        return "InvariantInterceptor[" + typeName + ", " + invariants.size() + " invariant(s)]";
    }
}
