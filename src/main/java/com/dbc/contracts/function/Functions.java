package com.dbc.contracts.function;

import com.dbc.contracts.evaluation.ArgumentNormalizer;
import com.dbc.contracts.model.CallRecord;
import com.dbc.contracts.model.Invocation;
import com.dbc.contracts.model.Signature;

import java.lang.reflect.UndeclaredThrowableException;
import java.util.Objects;
import java.util.concurrent.CompletionStage;

/**
 * Factory for original (unwrapped) contracted functions.
 *
 * <pre>
 * {@code
 * ContractFunction<Integer> add2 = Functions.of(Signature.of("add2", "i", "j"),
 *         args -> args.getInt("i") + args.getInt("j"));
 * add2.call(1, 2); // 3
 * }
 * </pre>
 */
public final class Functions {

    private Functions() {
    }

    public static <R> ContractFunction<R> of(Signature signature, Body<R> body) {
        return new BodyFunction<>(signature, body, false);
    }

    /**
     * A suspending function: its body hands back a stage, which is the one suspension point
     * a contracted call has.
     */
    public static <T> ContractFunction<CompletionStage<T>> async(Signature signature, Body<CompletionStage<T>> body) {
        return new BodyFunction<>(signature, body, true);
    }

    /**
     * Function with an explicit suspension capability flag, for bodies whose result type is only
     * known at runtime.
     */
    public static <R> ContractFunction<R> of(Signature signature, Body<R> body, boolean suspending) {
        return new BodyFunction<>(signature, body, suspending);
    }

    private static final class BodyFunction<R> extends ContractFunction<R> {

        private final Signature signature;
        private final Body<R> body;
        private final boolean suspending;

        BodyFunction(Signature signature, Body<R> body, boolean suspending) {
            this.signature = Objects.requireNonNull(signature, "signature");
            this.body = Objects.requireNonNull(body, "body");
            this.suspending = suspending;
        }

        @Override
        public Signature signature() {
            return signature;
        }

        @Override
        public boolean isSuspending() {
            return suspending;
        }

        @Override
        public R call(Invocation invocation) {
            CallRecord args = ArgumentNormalizer.normalize(signature, invocation);
            try {
                return body.apply(args);
            } catch (RuntimeException | Error e) {
                throw e;
            } catch (Exception e) {
                throw new UndeclaredThrowableException(e, signature.name() + " failed: " + e.getMessage());
            }
        }
    }
}
