package com.dbc.contracts.evaluation;

import com.dbc.contracts.ContractAttachmentException;
import com.dbc.contracts.PostconditionFailure;
import com.dbc.contracts.PreconditionFailure;
import com.dbc.contracts.function.ContractFunction;
import com.dbc.contracts.function.WrappingFunction;
import com.dbc.contracts.model.CallRecord;
import com.dbc.contracts.model.Condition;
import com.dbc.contracts.model.ConditionKind;
import com.dbc.contracts.model.Invocation;
import com.dbc.contracts.model.Snapshot;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Objects;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionException;
import java.util.concurrent.CompletionStage;
import java.util.concurrent.Future;
import java.util.function.Consumer;

/**
 * Checks conditions around calls.
 *
 * A wrapped call runs the sequence: normalize the arguments, check the precondition,
 * capture the snapshot, invoke the inner function, check the postcondition. Stacked
 * wrappers nest, so preconditions are checked outermost first on the way in and
 * postconditions innermost first on the way out. Failures from inner layers pass
 * through outer layers untouched.
 *
 * Suspending functions take the same sequence, except that the postcondition runs when
 * the returned stage resolves, and a failed precondition is reported through the returned
 * stage. A cancelled or failed stage never reaches the postcondition.
 */
public final class ConditionEvaluator {

    private static final Logger logger = LoggerFactory.getLogger(ConditionEvaluator.class);

    private ConditionEvaluator() {
    }

    /**
     * Wraps a function with a precondition or postcondition.
     */
    public static <R> ContractFunction<R> wrap(Condition condition, ContractFunction<R> target) {
        Objects.requireNonNull(condition, "condition");
        Objects.requireNonNull(target, "target");
        if (condition.kind() == ConditionKind.INVARIANT) {
            throw new ContractAttachmentException("invariants attach to types, not to functions");
        }
        return new ConditionedFunction<>(condition, target);
    }

    /**
     * Entry check: a precondition, or an invariant before a method runs.
     *
     * @param subject the call record, or the receiver for invariants
     */
    public static void checkBefore(Condition condition, Object subject) {
        if (!condition.test(subject, null, Snapshot.empty())) {
            logger.debug("Precondition '{}' failed for {}", condition.description(), subject);
            throw new PreconditionFailure(condition.description(), condition.errno());
        }
    }

    /**
     * Exit check: a postcondition, or an invariant after a method returns. When the predicate
     * does not hold, the cleanup action is attempted first; its failure is appended to the
     * description but never replaces the postcondition failure.
     *
     * @param subject the call record, or the receiver for invariants
     */
    public static void checkAfter(Condition condition, Object subject, Object result, Snapshot old) {
        if (condition.test(subject, result, old)) {
            return;
        }
        String description = condition.description();
        Exception cleanupError = null;
        if (condition.cleanup() != null) {
            try {
                condition.cleanup().run((CallRecord) subject);
            } catch (Exception e) {
                logger.warn("Clean up after '{}' failed", description, e);
                cleanupError = e;
                description = description + ". Clean up failed: " + e.getMessage();
            }
        }
        logger.debug("Postcondition '{}' failed for {} with result {}", condition.description(), subject, result);
        PostconditionFailure failure = new PostconditionFailure(description, condition.errno());
        if (cleanupError != null) {
            failure.addSuppressed(cleanupError);
        }
        throw failure;
    }

    /**
     * Runs an exit check once a stage resolves. The returned stage completes with the original
     * value, or with the stage's own failure, or with the check's failure. Cancelling either
     * stage cancels the other.
     */
    public static CompletableFuture<Object> whenResolved(CompletionStage<?> stage, Consumer<Object> exitCheck) {
        CompletableFuture<Object> outcome = new CompletableFuture<>();
        stage.whenComplete((value, error) -> {
            if (error != null) {
                outcome.completeExceptionally(unwrap(error));
                return;
            }
            try {
                exitCheck.accept(value);
                outcome.complete(value);
            } catch (RuntimeException | Error e) {
                outcome.completeExceptionally(e);
            }
        });
        outcome.whenComplete((value, error) -> {
            if (outcome.isCancelled() && stage instanceof Future) {
                ((Future<?>) stage).cancel(true);
            }
        });
        return outcome;
    }

    private static Throwable unwrap(Throwable error) {
        if (error instanceof CompletionException && error.getCause() != null) {
            return error.getCause();
        }
        return error;
    }

    private static final class ConditionedFunction<R> extends WrappingFunction<R> {

        private final Condition condition;

        ConditionedFunction(Condition condition, ContractFunction<R> inner) {
            super(inner);
            this.condition = condition;
        }

        @Override
        public R call(Invocation invocation) {
            CallRecord args = ArgumentNormalizer.normalize(signature(), invocation);

            if (condition.kind() == ConditionKind.PRECONDITION) {
                if (inner.isSuspending()) {
                    try {
                        checkBefore(condition, args);
                    } catch (PreconditionFailure e) {
                        return (R) CompletableFuture.failedFuture(e);
                    }
                    return inner.call(invocation);
                }
                checkBefore(condition, args);
                return inner.call(invocation);
            }

            Snapshot old = condition.needsSnapshot() ? Preservation.capture(inner, args) : Snapshot.empty();

            if (inner.isSuspending()) {
                CompletionStage<?> stage = (CompletionStage<?>) inner.call(invocation);
                Objects.requireNonNull(stage, () -> signature().name() + " is suspending but returned no stage");
                return (R) whenResolved(stage, value -> checkAfter(condition, args, value, old));
            }

            R result = inner.call(invocation);
            checkAfter(condition, args, result, old);
            return result;
        }

        @Override
        public String toString() {
            return condition + " " + inner;
        }
    }
}
