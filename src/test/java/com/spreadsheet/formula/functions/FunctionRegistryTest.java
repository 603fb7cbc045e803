package com.spreadsheet.formula.functions;

import com.spreadsheet.formula.value.ErrorKind;
import com.spreadsheet.formula.value.EvalResult;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.time.Clock;
import java.util.Set;

import static com.spreadsheet.formula.functions.FormulaFixture.error;
import static com.spreadsheet.formula.functions.FormulaFixture.number;
import static org.junit.jupiter.api.Assertions.*;

class FunctionRegistryTest {

    private FunctionRegistry registry;

    @BeforeEach
    void setUp() {
        registry = FunctionRegistry.withBuiltins();
    }

    @Test
    void testBuiltins() {
        Set<String> names = registry.names();
        for (String name : new String[]{"SUM", "AVERAGE", "IF", "IFS", "VLOOKUP", "MATCH", "CONCAT",
                "SUBSTITUTE", "TODAY", "DATEDIF", "SUMIF", "COUNTIF", "AVERAGEIF", "ISERROR", "IFERROR"}) {
            assertTrue(names.contains(name), name);
        }
        assertTrue(registry.lookup("vlookup").isPresent());
        assertFalse(registry.lookup("NOSUCH").isPresent());
        assertFalse(registry.lookup(null).isPresent());
    }

    @Test
    void testRegisterCustomFunction() {
        registry.register("double", Arity.exactly(1), false, args -> EvalResult.number(args.number(0) * 2));
        FormulaFixture sheet = new FormulaFixture(registry, Clock.systemDefaultZone()).set("A1", "21");

        assertEquals(number(42), sheet.eval("=DOUBLE(A1)"));
        assertEquals(number(42), sheet.eval("=Double(A1)"));
        assertEquals(error(ErrorKind.TYPE_MISMATCH), sheet.eval("=DOUBLE(\"many\")"));
        assertEquals(error(ErrorKind.TYPE_MISMATCH), sheet.eval("=DOUBLE()"));
    }

    @Test
    void testReRegisteringReplaces() {
        registry.register("ABS", Arity.exactly(1), false, args -> EvalResult.text("replaced"));
        FormulaFixture sheet = new FormulaFixture(registry, Clock.systemDefaultZone());

        assertEquals(EvalResult.text("replaced"), sheet.eval("=ABS(-1)"));
    }

    @Test
    void testVolatilityIsDeclared() {
        registry.register("RAND_ISH", Arity.exactly(0), true, args -> EvalResult.number(4));
        assertTrue(registry.isVolatile("rand_ish"));
        assertFalse(registry.isVolatile("SUM"));
        assertFalse(registry.isVolatile("NOSUCH"));
    }

    @Test
    void testInvalidNamesRejected() {
        assertThrows(IllegalArgumentException.class,
                () -> registry.register("1ABC", Arity.exactly(0), false, args -> EvalResult.BLANK));
        assertThrows(IllegalArgumentException.class,
                () -> registry.register("A B", Arity.exactly(0), false, args -> EvalResult.BLANK));
        assertThrows(IllegalArgumentException.class,
                () -> registry.register(null, Arity.exactly(0), false, args -> EvalResult.BLANK));
    }

    @Test
    void testArity() {
        assertTrue(Arity.exactly(2).accepts(2));
        assertFalse(Arity.exactly(2).accepts(3));
        assertTrue(Arity.atLeast(1).accepts(255));
        assertFalse(Arity.atLeast(1).accepts(0));
        assertTrue(Arity.between(1, 3).accepts(3));
        assertFalse(Arity.between(1, 3).accepts(4));
    }

    @Test
    void testNullResultIsAValueError() {
        registry.register("BROKEN", Arity.exactly(0), false, args -> null);
        FormulaFixture sheet = new FormulaFixture(registry, Clock.systemDefaultZone());
        assertEquals(error(ErrorKind.TYPE_MISMATCH), sheet.eval("=BROKEN()"));
    }

    @Test
    void testFailingFunctionIsAValueError() {
        registry.register("FAILS", Arity.exactly(0), false, args -> {
            throw new IllegalStateException("bug");
        });
        FormulaFixture sheet = new FormulaFixture(registry, Clock.systemDefaultZone());
        assertEquals(error(ErrorKind.TYPE_MISMATCH), sheet.eval("=FAILS()"));
        assertEquals(number(7), sheet.eval("=IFERROR(FAILS(), 7)"));

        sheet.set("A1", "1").set("B1", "=A1+FAILS()");
        assertEquals(error(ErrorKind.TYPE_MISMATCH), sheet.eval("=B1"));
        sheet.set("A1", "2");
        assertEquals(number(3), sheet.eval("=A1+1"));
    }
}
