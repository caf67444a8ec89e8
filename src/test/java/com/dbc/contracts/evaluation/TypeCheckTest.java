package com.dbc.contracts.evaluation;

import com.dbc.contracts.ContractAttachmentException;
import com.dbc.contracts.ContractFactory;
import com.dbc.contracts.PreconditionFailure;
import com.dbc.contracts.config.ContractsConfiguration;
import com.dbc.contracts.function.ContractFunction;
import com.dbc.contracts.function.Functions;
import com.dbc.contracts.model.Signature;
import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Tests for {@link TypeCheck}.
 */
class TypeCheckTest {

    private final ContractFactory contracts = new ContractFactory(ContractsConfiguration.defaults());

    private static final class Example {
    }

    private static ContractFunction<String> func() {
        return Functions.of(Signature.of("func", "a", "b", "c"),
                args -> args.get("a") + ":" + args.get("b") + ":" + args.get("c"));
    }

    private ContractFunction<String> checked() {
        return contracts.apply(func(), contracts.typeCheck()
                .expect("a", Integer.class)
                .expect("b", String.class)
                .expect("c", Void.class, Example.class));
    }

    @Test
    void testMatchingTypes() {
        ContractFunction<String> f = checked();
        assertEquals("1:x:null", f.call(1, "x", null));
        assertNotNull(f.call(1, "x", new Example()));
    }

    @Test
    void testMismatchedType() {
        ContractFunction<String> f = checked();
        PreconditionFailure e = assertThrows(PreconditionFailure.class, () -> f.call("1", "x", null));
        assertEquals(TypeCheck.DESCRIPTION, e.getDescription());
    }

    @Test
    void testNullRequiresVoid() {
        ContractFunction<String> f = checked();
        assertThrows(PreconditionFailure.class, () -> f.call(1, null, null));
    }

    @Test
    void testPrimitiveMatchesWrapper() {
        ContractFunction<String> f = contracts.apply(func(), contracts.typeCheck().expect("a", int.class));
        assertEquals("3:b:c", f.call(3, "b", "c"));
    }

    @Test
    void testUnknownParameterRejectedAtAttachment() {
        TypeCheck check = contracts.typeCheck().expect("z", Integer.class);
        ContractAttachmentException e = assertThrows(ContractAttachmentException.class, () -> check.attachTo(func()));
        assertTrue(e.getMessage().startsWith("missing required argument `z`"));
    }

    @Test
    void testExpectedTypesRequired() {
        assertThrows(ContractAttachmentException.class, () -> contracts.typeCheck().expect("a"));
    }

    @Test
    void testDisabledTypeCheckAttachesNothing() {
        ContractFunction<String> original = func();
        ContractFunction<String> f = new TypeCheck(false).expect("a", Integer.class).attachTo(original);
        assertSame(original, f);
    }
}
