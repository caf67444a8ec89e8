package com.dbc.contracts.evaluation;

import com.dbc.contracts.ContractFactory;
import com.dbc.contracts.PostconditionFailure;
import com.dbc.contracts.PreconditionFailure;
import com.dbc.contracts.config.ContractsConfiguration;
import com.dbc.contracts.function.ContractFunction;
import com.dbc.contracts.function.Functions;
import com.dbc.contracts.model.Signature;
import org.junit.jupiter.api.Test;

import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionException;
import java.util.concurrent.CompletionStage;
import java.util.concurrent.atomic.AtomicInteger;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Tests for contracts on functions that return a stage.
 */
class SuspendingConditionTest {

    private final ContractFactory contracts = new ContractFactory(ContractsConfiguration.defaults());

    private static ContractFunction<CompletionStage<Integer>> asyncAdd2() {
        return Functions.async(Signature.of("add2", "i", "j"),
                args -> CompletableFuture.supplyAsync(() -> args.getInt("i") + args.getInt("j")));
    }

    @Test
    void testWrappedFunctionStaysSuspending() {
        ContractFunction<CompletionStage<Integer>> add2 = contracts.apply(asyncAdd2(),
                contracts.requires("i positive", args -> args.getInt("i") > 0),
                contracts.<Integer>ensures("result positive", (args, result) -> result > 0));

        assertTrue(add2.isSuspending());
        assertEquals(3, add2.call(1, 2).toCompletableFuture().join());
    }

    @Test
    void testPreconditionFailureReportedThroughStage() {
        AtomicInteger bodyRuns = new AtomicInteger();
        ContractFunction<CompletionStage<Integer>> body = Functions.async(Signature.of("f", "x"), args -> {
            bodyRuns.incrementAndGet();
            return CompletableFuture.completedFuture(args.getInt("x"));
        });
        ContractFunction<CompletionStage<Integer>> f = contracts.apply(body,
                contracts.requires("x positive", args -> args.getInt("x") > 0));

        CompletableFuture<Integer> outcome = f.call(-1).toCompletableFuture();
        CompletionException e = assertThrows(CompletionException.class, outcome::join);
        assertTrue(e.getCause() instanceof PreconditionFailure);
        assertEquals(0, bodyRuns.get());
    }

    @Test
    void testPostconditionCheckedOnResolvedValue() {
        ContractFunction<CompletionStage<Integer>> add2 = contracts.apply(asyncAdd2(),
                contracts.<Integer>ensures("result negative", (args, result) -> result < 0));

        CompletableFuture<Integer> outcome = add2.call(1, 2).toCompletableFuture();
        CompletionException e = assertThrows(CompletionException.class, outcome::join);
        PostconditionFailure failure = assertInstanceOf(PostconditionFailure.class, e.getCause());
        assertEquals("result negative", failure.getDescription());
    }

    @Test
    void testPostconditionWaitsForResolution() {
        CompletableFuture<Integer> pending = new CompletableFuture<>();
        List<Object> seen = new ArrayList<>();
        ContractFunction<CompletionStage<Integer>> f = contracts.apply(
                Functions.async(Signature.of("f"), args -> pending),
                contracts.<Integer>ensures("records result", (args, result) -> seen.add(result)));

        CompletableFuture<Integer> outcome = f.call().toCompletableFuture();
        assertTrue(seen.isEmpty());
        assertFalse(outcome.isDone());

        pending.complete(42);
        assertEquals(42, outcome.join());
        assertEquals(List.of(42), seen);
    }

    @Test
    void testSnapshotTakenBeforeSuspension() {
        Map<String, Integer> store = new HashMap<>(Map.of("count", 1));
        CompletableFuture<Integer> pending = new CompletableFuture<>();
        ContractFunction<CompletionStage<Integer>> increment = contracts.apply(
                Functions.async(Signature.of("increment"), args -> pending.thenApply(v -> {
                    store.merge("count", v, Integer::sum);
                    return store.get("count");
                })),
                contracts.preserve(args -> Map.of("count", store.get("count"))),
                contracts.<Integer>ensures("count grew",
                        (args, result, old) -> result > old.getInt("count")));

        CompletableFuture<Integer> outcome = increment.call().toCompletableFuture();
        pending.complete(5);
        assertEquals(6, outcome.join());
    }

    @Test
    void testCancellingOuterStageCancelsInner() {
        CompletableFuture<Integer> pending = new CompletableFuture<>();
        ContractFunction<CompletionStage<Integer>> f = contracts.apply(
                Functions.async(Signature.of("f"), args -> pending),
                contracts.<Integer>ensures("never checked", (args, result) -> false));

        CompletableFuture<Integer> outcome = f.call().toCompletableFuture();
        outcome.cancel(true);

        assertTrue(pending.isCancelled());
    }

    @Test
    void testCancellingInnerStageCancelsOuter() {
        CompletableFuture<Integer> pending = new CompletableFuture<>();
        List<Object> seen = new ArrayList<>();
        ContractFunction<CompletionStage<Integer>> f = contracts.apply(
                Functions.async(Signature.of("f"), args -> pending),
                contracts.<Integer>ensures("records result", (args, result) -> seen.add(result)));

        CompletableFuture<Integer> outcome = f.call().toCompletableFuture();
        pending.cancel(true);

        assertTrue(outcome.isCancelled());
        assertTrue(seen.isEmpty());
    }

    @Test
    void testFailedStageSkipsPostcondition() {
        List<Object> seen = new ArrayList<>();
        ContractFunction<CompletionStage<Integer>> f = contracts.apply(
                Functions.async(Signature.of("f"),
                        args -> CompletableFuture.<Integer>failedFuture(new IllegalStateException("offline"))),
                contracts.<Integer>ensures("records result", (args, result) -> seen.add(result)));

        CompletionException e = assertThrows(CompletionException.class, () -> f.call().toCompletableFuture().join());
        assertTrue(e.getCause() instanceof IllegalStateException);
        assertTrue(seen.isEmpty());
    }
}
