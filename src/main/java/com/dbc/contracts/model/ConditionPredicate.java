package com.dbc.contracts.model;

/**
 * Uniform view of a predicate of any arity. Unary predicates ignore the result and snapshot,
 * binary ones ignore the snapshot.
 */
@FunctionalInterface
public interface ConditionPredicate {

    boolean test(Object subject, Object result, Snapshot old);
}
