package com.dbc.contracts.evaluation;

import com.dbc.contracts.ContractAttachmentException;
import com.dbc.contracts.function.ContractFunction;
import com.dbc.contracts.function.Transformer;
import com.dbc.contracts.function.WrappingFunction;
import com.dbc.contracts.model.CallRecord;
import com.dbc.contracts.model.Invocation;

/**
 * Argument rewriting ahead of the wrapped function. The rewritten record is passed on by name,
 * so nested preconditions and the body only ever see the transformed values.
 */
public final class ArgumentTransformation {

    private ArgumentTransformation() {
    }

    public static <R> ContractFunction<R> wrap(Transformer transformer, ContractFunction<R> target) {
        if (transformer == null) {
            throw new ContractAttachmentException("transformers must be callable");
        }
        return new TransformedFunction<>(transformer, target);
    }

    private static final class TransformedFunction<R> extends WrappingFunction<R> {

        private final Transformer transformer;

        TransformedFunction(Transformer transformer, ContractFunction<R> inner) {
            super(inner);
            this.transformer = transformer;
        }

        @Override
        public R call(Invocation invocation) {
            CallRecord args = ArgumentNormalizer.normalize(signature(), invocation);
            CallRecord rewritten = transformer.apply(args);
            if (rewritten == null || !rewritten.names().equals(args.names())) {
                throw new IllegalStateException("transformer for " + signature().name()
                        + " must keep parameters " + args.names() + " but returned "
                        + (rewritten == null ? null : rewritten.names()));
            }
            return inner.call(Invocation.fromRecord(rewritten));
        }
    }
}
