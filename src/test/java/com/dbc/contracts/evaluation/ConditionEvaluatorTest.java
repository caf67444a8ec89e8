package com.dbc.contracts.evaluation;

import com.dbc.contracts.ContractAttachmentException;
import com.dbc.contracts.ContractFactory;
import com.dbc.contracts.ContractViolation;
import com.dbc.contracts.PostconditionFailure;
import com.dbc.contracts.PreconditionFailure;
import com.dbc.contracts.config.ContractsConfiguration;
import com.dbc.contracts.function.ContractFunction;
import com.dbc.contracts.function.Functions;
import com.dbc.contracts.model.Condition;
import com.dbc.contracts.model.Signature;
import org.junit.jupiter.api.Test;

import java.io.IOException;
import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.atomic.AtomicInteger;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Tests for precondition and postcondition checking around plain functions.
 */
class ConditionEvaluatorTest {

    private final ContractFactory contracts = new ContractFactory(ContractsConfiguration.defaults());

    private static ContractFunction<Integer> add2() {
        return Functions.of(Signature.of("add2", "i", "j"), args -> args.getInt("i") + args.getInt("j"));
    }

    @Test
    void testPreconditionHolds() {
        ContractFunction<Integer> add2 = contracts.apply(add2(),
                contracts.requires("i positive", args -> args.getInt("i") > 0));
        assertEquals(3, add2.call(1, 2));
    }

    @Test
    void testPreconditionFails() {
        ContractFunction<Integer> add2 = contracts.apply(add2(),
                contracts.requires("i positive", args -> args.getInt("i") > 0));

        PreconditionFailure e = assertThrows(PreconditionFailure.class, () -> add2.call(-1, 2));
        assertEquals("i positive", e.getDescription());
        assertEquals("i positive", e.getMessage());
        assertEquals(0, e.getErrno());
    }

    @Test
    void testErrnoIsReported() {
        ContractFunction<Integer> add2 = contracts.apply(add2(),
                contracts.requires("j positive", args -> args.getInt("j") > 0, 22));

        PreconditionFailure e = assertThrows(PreconditionFailure.class, () -> add2.call(1, -2));
        assertEquals(22, e.getErrno());
    }

    @Test
    void testViolationsAreAssertionErrors() {
        ContractFunction<Integer> add2 = contracts.apply(add2(),
                contracts.requires("never", args -> false));

        AssertionError e = assertThrows(AssertionError.class, () -> add2.call(1, 2));
        assertTrue(e instanceof ContractViolation);
    }

    @Test
    void testStackedPreconditionsCheckedOutermostFirst() {
        List<String> checked = new ArrayList<>();
        AtomicInteger bodyRuns = new AtomicInteger();
        ContractFunction<Integer> counted = Functions.of(Signature.of("f", "x"), args -> {
            bodyRuns.incrementAndGet();
            return args.getInt("x");
        });

        ContractFunction<Integer> f = contracts.apply(counted,
                contracts.requires("first", args -> checked.add("first")),
                contracts.requires("second", args -> {
                    checked.add("second");
                    return args.getInt("x") > 0;
                }),
                contracts.requires("third", args -> checked.add("third")));

        PreconditionFailure e = assertThrows(PreconditionFailure.class, () -> f.call(-5));
        assertEquals("second", e.getDescription());
        assertEquals(List.of("first", "second"), checked);
        assertEquals(0, bodyRuns.get());

        checked.clear();
        assertEquals(5, f.call(5));
        assertEquals(List.of("first", "second", "third"), checked);
        assertEquals(1, bodyRuns.get());
    }

    @Test
    void testStackedPostconditionsCheckedInnermostFirst() {
        List<String> checked = new ArrayList<>();
        ContractFunction<Integer> add2 = contracts.apply(add2(),
                contracts.<Integer>ensures("outer", (args, result) -> checked.add("outer")),
                contracts.<Integer>ensures("inner", (args, result) -> checked.add("inner")));

        add2.call(1, 2);
        assertEquals(List.of("inner", "outer"), checked);
    }

    @Test
    void testPostconditionHolds() {
        ContractFunction<Integer> add2 = contracts.apply(add2(),
                contracts.<Integer>ensures("result is the sum",
                        (args, result) -> result == args.getInt("i") + args.getInt("j")));
        assertEquals(7, add2.call(3, 4));
    }

    @Test
    void testPostconditionFails() {
        ContractFunction<Integer> broken = Functions.of(Signature.of("add2", "i", "j"),
                args -> args.getInt("i") - args.getInt("j"));
        ContractFunction<Integer> add2 = contracts.apply(broken,
                contracts.<Integer>ensures("result is the sum",
                        (args, result) -> result == args.getInt("i") + args.getInt("j"), 7, null));

        PostconditionFailure e = assertThrows(PostconditionFailure.class, () -> add2.call(3, 4));
        assertEquals("result is the sum", e.getDescription());
        assertEquals(7, e.getErrno());
    }

    @Test
    void testPreconditionOnlyWrapperAddsNoPostconditionBehavior() {
        ContractFunction<Integer> add2 = contracts.apply(add2(), contracts.requires("always", args -> true));
        assertEquals(3, add2.call(1, 2));
        assertEquals(add2().signature(), add2.signature());
    }

    @Test
    void testCleanupRunsBeforeFailure() {
        List<Object> cleaned = new ArrayList<>();
        ContractFunction<Integer> add2 = contracts.apply(add2(),
                contracts.<Integer>ensures("result is negative", (args, result) -> result < 0, 0,
                        args -> cleaned.add(args.get("i"))));

        assertThrows(PostconditionFailure.class, () -> add2.call(1, 2));
        assertEquals(List.of(1), cleaned);
    }

    @Test
    void testCleanupFailureIsAppended() {
        IOException cleanupError = new IOException("disk full");
        ContractFunction<Integer> add2 = contracts.apply(add2(),
                contracts.<Integer>ensures("result is negative", (args, result) -> result < 0, 0,
                        args -> {
                            throw cleanupError;
                        }));

        PostconditionFailure e = assertThrows(PostconditionFailure.class, () -> add2.call(1, 2));
        assertEquals("result is negative. Clean up failed: disk full", e.getDescription());
        assertSame(cleanupError, e.getSuppressed()[0]);
    }

    @Test
    void testCleanupNotRunWhenPostconditionHolds() {
        List<Object> cleaned = new ArrayList<>();
        ContractFunction<Integer> add2 = contracts.apply(add2(),
                contracts.<Integer>ensures("result is positive", (args, result) -> result > 0, 0,
                        args -> cleaned.add(args.get("i"))));

        add2.call(1, 2);
        assertTrue(cleaned.isEmpty());
    }

    @Test
    void testBodyExceptionPassesThrough() {
        ContractFunction<Integer> failing = Functions.of(Signature.of("f", "x"), args -> {
            throw new IllegalStateException("boom");
        });
        ContractFunction<Integer> f = contracts.apply(failing,
                contracts.<Integer>ensures("never checked", (args, result) -> false));

        IllegalStateException e = assertThrows(IllegalStateException.class, () -> f.call(1));
        assertEquals("boom", e.getMessage());
    }

    @Test
    void testEmptyDescriptionRejected() {
        ContractAttachmentException e = assertThrows(ContractAttachmentException.class,
                () -> contracts.requires("", args -> true));
        assertEquals("contracts must have nonempty descriptions", e.getMessage());
    }

    @Test
    void testMissingPredicateRejected() {
        assertThrows(ContractAttachmentException.class, () -> contracts.requires("x", null));
    }

    @Test
    void testInvariantCannotWrapFunction() {
        Condition invariant = Condition.invariant("never", self -> true);
        assertThrows(ContractAttachmentException.class, () -> ConditionEvaluator.wrap(invariant, add2()));
    }

    @Test
    void testMissingArgumentReportedBeforePredicate() {
        AtomicInteger checks = new AtomicInteger();
        ContractFunction<Integer> add2 = contracts.apply(add2(),
                contracts.requires("counted", args -> checks.incrementAndGet() > 0));

        assertThrows(IllegalArgumentException.class, () -> add2.call(1));
        assertEquals(0, checks.get());
    }
}
