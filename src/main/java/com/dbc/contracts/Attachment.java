package com.dbc.contracts;

import com.dbc.contracts.function.ContractFunction;

/**
 * A wrapping combinator: takes a function and returns one with added checking behavior and
 * the same visible signature.
 */
public interface Attachment {

    /**
     * Attachment that returns its target unchanged, used when contracts are disabled.
     */
    Attachment NONE = new Attachment() {
        @Override
        public <R> ContractFunction<R> attachTo(ContractFunction<R> target) {
            return target;
        }

        @Override
        public String toString() {
            return "Attachment.NONE";
        }
    };

    <R> ContractFunction<R> attachTo(ContractFunction<R> target);
}
