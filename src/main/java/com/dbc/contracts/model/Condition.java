package com.dbc.contracts.model;

import com.dbc.contracts.ContractAttachmentException;
import com.dbc.contracts.function.Cleanup;
import com.dbc.contracts.function.InvariantPredicate;
import com.dbc.contracts.function.Postcondition;
import com.dbc.contracts.function.Precondition;
import com.dbc.contracts.function.SnapshotPostcondition;

import java.util.Objects;

/**
 * A validated contract condition: what is checked, when, and what is reported on failure.
 *
 * Construction enforces the attachment rules: the description is non-empty, the predicate
 * is present, and its arity fits the kind (unary for preconditions and invariants, binary or
 * ternary for postconditions). Only postconditions may carry a cleanup action.
 */
public final class Condition {

    private final ConditionKind kind;
    private final PredicateArity arity;
    private final String description;
    private final int errno;
    private final Cleanup cleanup;
    private final ConditionPredicate predicate;

    public Condition(ConditionKind kind, PredicateArity arity, String description, int errno,
                     Cleanup cleanup, ConditionPredicate predicate) {
        if (description == null || description.isEmpty()) {
            throw new ContractAttachmentException("contracts must have nonempty descriptions");
        }
        if (predicate == null) {
            throw new ContractAttachmentException("contract predicates must be callable");
        }
        Objects.requireNonNull(kind, "kind");
        Objects.requireNonNull(arity, "arity");
        if (kind == ConditionKind.POSTCONDITION) {
            if (arity == PredicateArity.UNARY) {
                throw new ContractAttachmentException("postcondition predicates must take two or three arguments");
            }
        } else {
            if (arity != PredicateArity.UNARY) {
                throw new ContractAttachmentException(
                        (kind == ConditionKind.INVARIANT ? "invariant" : "precondition")
                                + " predicates must take one argument");
            }
            if (cleanup != null) {
                throw new ContractAttachmentException("only postconditions can carry a cleanup action");
            }
        }
        this.kind = kind;
        this.arity = arity;
        this.description = description;
        this.errno = errno;
        this.cleanup = cleanup;
        this.predicate = predicate;
    }

    public static Condition precondition(String description, Precondition predicate, int errno) {
        ConditionPredicate check = predicate == null ? null
                : (subject, result, old) -> predicate.test((CallRecord) subject);
        return new Condition(ConditionKind.PRECONDITION, PredicateArity.UNARY, description, errno, null, check);
    }

    public static <R> Condition postcondition(String description, Postcondition<R> predicate, int errno,
                                              Cleanup cleanup) {
        ConditionPredicate check = predicate == null ? null
                : (subject, result, old) -> predicate.test((CallRecord) subject, (R) result);
        return new Condition(ConditionKind.POSTCONDITION, PredicateArity.BINARY, description, errno, cleanup, check);
    }

    public static <R> Condition postcondition(String description, SnapshotPostcondition<R> predicate, int errno,
                                              Cleanup cleanup) {
        ConditionPredicate check = predicate == null ? null
                : (subject, result, old) -> predicate.test((CallRecord) subject, (R) result, old);
        return new Condition(ConditionKind.POSTCONDITION, PredicateArity.TERNARY, description, errno, cleanup, check);
    }

    public static <C> Condition invariant(String description, InvariantPredicate<C> predicate) {
        ConditionPredicate check = predicate == null ? null
                : (subject, result, old) -> predicate.test((C) subject);
        return new Condition(ConditionKind.INVARIANT, PredicateArity.UNARY, description, 0, null, check);
    }

    /**
     * Evaluates the predicate. The subject is the call record, or the receiver for invariants.
     */
    public boolean test(Object subject, Object result, Snapshot old) {
        return predicate.test(subject, result, old);
    }

    public ConditionKind kind() {
        return kind;
    }

    public PredicateArity arity() {
        return arity;
    }

    public String description() {
        return description;
    }

    public int errno() {
        return errno;
    }

    /**
     * Cleanup action, or null.
     */
    public Cleanup cleanup() {
        return cleanup;
    }

    public boolean needsSnapshot() {
        return arity == PredicateArity.TERNARY;
    }

    @Override
    public String toString() {
        return kind.combinator() + "(\"" + description + "\")";
    }
}
