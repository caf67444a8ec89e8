package com.dbc.contracts;

import com.dbc.contracts.analysis.AnnotationContractReader;
import com.dbc.contracts.analysis.DerivedType;
import com.dbc.contracts.analysis.InvariantPropagator;
import com.dbc.contracts.config.ContractsConfiguration;
import com.dbc.contracts.evaluation.ArgumentTransformation;
import com.dbc.contracts.evaluation.ConditionEvaluator;
import com.dbc.contracts.evaluation.Preservation;
import com.dbc.contracts.evaluation.TypeCheck;
import com.dbc.contracts.function.*;
import com.dbc.contracts.model.CallRecord;
import com.dbc.contracts.model.Condition;
import com.dbc.contracts.model.ConditionKind;
import com.dbc.contracts.processor.DescriptionSynthesizer;
import com.dbc.contracts.processor.SourceIndex;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.lang.reflect.Method;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * Creates contract attachments according to a {@link ContractsConfiguration}.
 *
 * When the configuration disables contracts, {@code requires}, {@code ensures},
 * {@code invariant}, {@code transform}, {@code preserve} and {@code typeCheck} hand back
 * no-op attachments: nothing is wrapped and nothing is checked per call.
 */
public class ContractFactory {

    private static final Logger logger = LoggerFactory.getLogger(ContractFactory.class);

    private final ContractsConfiguration configuration;
    private final DescriptionSynthesizer synthesizer;
    private final AnnotationContractReader annotationReader;

    public ContractFactory(ContractsConfiguration configuration) {
        this.configuration = configuration;
        this.synthesizer = new DescriptionSynthesizer(new SourceIndex(configuration.getSourceRoots()),
                Set.of(ContractFactory.class, Contracts.class));
        this.annotationReader = new AnnotationContractReader(synthesizer);
        logger.debug("Created contract factory with {}", configuration);
    }

    public ContractsConfiguration getConfiguration() {
        return configuration;
    }

    public boolean isEnabled() {
        return configuration.isEnabled();
    }

    // Preconditions

    public Attachment requires(String description, Precondition predicate) {
        return requires(description, predicate, 0);
    }

    public Attachment requires(String description, Precondition predicate, int errno) {
        if (!isEnabled()) {
            return Attachment.NONE;
        }
        return attach(Condition.precondition(description, predicate, errno));
    }

    /**
     * Precondition described by its own source text.
     */
    public Attachment requires(Precondition predicate) {
        return requires(predicate, 0);
    }

    public Attachment requires(Precondition predicate, int errno) {
        if (!isEnabled()) {
            return Attachment.NONE;
        }
        return attach(Condition.precondition(describe(ConditionKind.PRECONDITION, predicate), predicate, errno));
    }

    // Postconditions

    public <R> Attachment ensures(String description, Postcondition<R> predicate) {
        return ensures(description, predicate, 0, null);
    }

    /**
     * @param cleanup run when the postcondition fails, may be null
     */
    public <R> Attachment ensures(String description, Postcondition<R> predicate, int errno, Cleanup cleanup) {
        if (!isEnabled()) {
            return Attachment.NONE;
        }
        return attach(Condition.postcondition(description, predicate, errno, cleanup));
    }

    public <R> Attachment ensures(Postcondition<R> predicate) {
        if (!isEnabled()) {
            return Attachment.NONE;
        }
        return attach(Condition.postcondition(describe(ConditionKind.POSTCONDITION, predicate), predicate, 0, null));
    }

    public <R> Attachment ensures(String description, SnapshotPostcondition<R> predicate) {
        return ensures(description, predicate, 0, null);
    }

    public <R> Attachment ensures(String description, SnapshotPostcondition<R> predicate, int errno,
                                  Cleanup cleanup) {
        if (!isEnabled()) {
            return Attachment.NONE;
        }
        return attach(Condition.postcondition(description, predicate, errno, cleanup));
    }

    public <R> Attachment ensures(SnapshotPostcondition<R> predicate) {
        if (!isEnabled()) {
            return Attachment.NONE;
        }
        return attach(Condition.postcondition(describe(ConditionKind.POSTCONDITION, predicate), predicate, 0, null));
    }

    // Invariants

    public <C> InvariantAttachment<C> invariant(String description, InvariantPredicate<C> predicate) {
        if (!isEnabled()) {
            return new InvariantAttachment<>(List.of(), false);
        }
        return new InvariantAttachment<>(List.of(Condition.invariant(description, predicate)), true);
    }

    public <C> InvariantAttachment<C> invariant(InvariantPredicate<C> predicate) {
        if (!isEnabled()) {
            return new InvariantAttachment<>(List.of(), false);
        }
        String description = describe(ConditionKind.INVARIANT, predicate);
        return new InvariantAttachment<>(List.of(Condition.invariant(description, predicate)), true);
    }

    // Argument handling

    public Attachment transform(Transformer transformer) {
        if (!isEnabled()) {
            return Attachment.NONE;
        }
        if (transformer == null) {
            throw new ContractAttachmentException("transformers must be callable");
        }
        return new Attachment() {
            @Override
            public <R> ContractFunction<R> attachTo(ContractFunction<R> target) {
                return ArgumentTransformation.wrap(transformer, target);
            }
        };
    }

    public Attachment preserve(Preserver preserver) {
        if (!isEnabled()) {
            return Attachment.NONE;
        }
        if (preserver == null) {
            throw new ContractAttachmentException("preservers must be callable");
        }
        return new Attachment() {
            @Override
            public <R> ContractFunction<R> attachTo(ContractFunction<R> target) {
                return Preservation.attach(preserver, target);
            }
        };
    }

    public CallRecord rewrite(CallRecord args, Map<String, ?> overrides) {
        return args.rewrite(overrides);
    }

    public TypeCheck typeCheck() {
        return new TypeCheck(isEnabled());
    }

    // Composition

    /**
     * Applies attachments the way stacked declarations read: the first attachment is the
     * outermost layer.
     */
    public <R> ContractFunction<R> apply(ContractFunction<R> function, Attachment... attachments) {
        ContractFunction<R> result = function;
        for (int i = attachments.length - 1; i >= 0; i--) {
            result = attachments[i].attachTo(result);
        }
        return result;
    }

    // Annotation-declared contracts

    /**
     * Contracted function for a static method carrying {@code @Requires}/{@code @Ensures}.
     */
    public ContractFunction<Object> annotated(Class<?> owner, String methodName) {
        Method method = annotationReader.findFunction(owner, methodName);
        ContractFunction<Object> function = annotationReader.functionOf(method);
        if (!isEnabled()) {
            return function;
        }
        List<Condition> conditions = annotationReader.readMethodConditions(method);
        for (int i = conditions.size() - 1; i >= 0; i--) {
            function = ConditionEvaluator.wrap(conditions.get(i), function);
        }
        return function;
    }

    /**
     * Derived type checking every {@code @Invariant} declared on the implementation class.
     * {@code type} may be an interface, a superclass, or the implementation itself.
     */
    public <I> DerivedType<I> annotatedType(Class<I> type, Class<? extends I> implementation) {
        if (!isEnabled()) {
            return InvariantPropagator.passThrough(type, implementation);
        }
        return InvariantPropagator.propagate(type, implementation, annotationReader.readInvariants(implementation));
    }

    private Attachment attach(Condition condition) {
        return new Attachment() {
            @Override
            public <R> ContractFunction<R> attachTo(ContractFunction<R> target) {
                return ConditionEvaluator.wrap(condition, target);
            }

            @Override
            public String toString() {
                return condition.toString();
            }
        };
    }

    private String describe(ConditionKind kind, Object predicate) {
        if (predicate == null) {
            throw new ContractAttachmentException("contract predicates must be callable");
        }
        return synthesizer.describe(kind, predicate);
    }
}
