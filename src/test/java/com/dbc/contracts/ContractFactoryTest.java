package com.dbc.contracts;

import com.dbc.contracts.analysis.DerivedType;
import com.dbc.contracts.config.ContractsConfiguration;
import com.dbc.contracts.function.ContractFunction;
import com.dbc.contracts.function.Functions;
import com.dbc.contracts.model.Signature;
import org.junit.jupiter.api.Test;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Tests for {@link ContractFactory} composition and the disabled configuration.
 */
class ContractFactoryTest {

    interface Gauge {

        void set(int level);

        int level();
    }

    static class GaugeImpl implements Gauge {

        private int level;

        @Override
        public void set(int level) {
            this.level = level;
        }

        @Override
        public int level() {
            return level;
        }
    }

    private final ContractFactory enabled = new ContractFactory(ContractsConfiguration.defaults());
    private final ContractFactory disabled = new ContractFactory(ContractsConfiguration.builder()
            .enabled(false)
            .build());

    private static ContractFunction<Integer> add2() {
        return Functions.of(Signature.of("add2", "i", "j"), args -> args.getInt("i") + args.getInt("j"));
    }

    @Test
    void testApplyListsOutermostFirst() {
        List<String> calls = new ArrayList<>();
        ContractFunction<Integer> f = enabled.apply(add2(),
                enabled.requires("a", args -> calls.add("a")),
                enabled.transform(args -> {
                    calls.add("transform");
                    return args;
                }),
                enabled.requires("b", args -> calls.add("b")));

        assertEquals(3, f.call(1, 2));
        assertEquals(List.of("a", "transform", "b"), calls);
    }

    @Test
    void testApplyWithoutAttachments() {
        ContractFunction<Integer> original = add2();
        assertSame(original, enabled.apply(original));
    }

    @Test
    void testWrappedFunctionKeepsSignature() {
        ContractFunction<Integer> original = add2();
        ContractFunction<Integer> f = enabled.apply(original,
                enabled.requires("i positive", args -> args.getInt("i") > 0),
                enabled.<Integer>ensures("positive", (args, result) -> result > 0));

        assertEquals(original.signature(), f.signature());
        assertSame(original, f.unwrap());
        assertEquals("add2(i, j)", f.signature().toString());
    }

    @Test
    void testDisabledAttachesNothing() {
        ContractFunction<Integer> original = add2();
        ContractFunction<Integer> f = disabled.apply(original,
                disabled.requires("never", args -> false),
                disabled.<Integer>ensures("never", (args, result) -> false),
                disabled.preserve(args -> Map.of("x", 1)),
                disabled.transform(args -> null),
                disabled.typeCheck().expect("i", String.class));

        assertSame(original, f);
        assertEquals(3, f.call(1, 2));
        assertTrue(original.preservers().isEmpty());
        assertFalse(disabled.isEnabled());
    }

    @Test
    void testDisabledInvariantHandsOutPlainInstances() {
        DerivedType<Gauge> gauges = disabled.<GaugeImpl>invariant("level >= 0", self -> self.level >= 0)
                .derive(Gauge.class, GaugeImpl.class);
        Gauge gauge = gauges.newInstance();
        gauge.set(-5);

        assertTrue(gauge instanceof GaugeImpl);
        assertEquals(-5, gauge.level());
    }

    @Test
    void testEnabledInvariant() {
        DerivedType<Gauge> gauges = enabled.<GaugeImpl>invariant("level >= 0", self -> self.level >= 0)
                .derive(Gauge.class, GaugeImpl.class);
        Gauge gauge = gauges.newInstance();
        gauge.set(5);

        assertThrows(PostconditionFailure.class, () -> gauge.set(-5));
        assertEquals(List.of("equals", "level", "set"), List.copyOf(gauges.checkedMethodNames()));
    }

    @Test
    void testDeriveRejectsUnrelatedImplementation() {
        InvariantAttachment<Object> anything = enabled.invariant("always", self -> true);
        assertThrows(ContractAttachmentException.class, () -> anything.derive(Gauge.class, String.class));
    }

    @Test
    void testInitializeAfterUseFails() {
        Contracts.factory();
        assertThrows(IllegalStateException.class, () -> Contracts.initialize(ContractsConfiguration.defaults()));
    }
}
