package com.spreadsheet.formula.functions;

import com.spreadsheet.formula.value.ErrorKind;
import com.spreadsheet.formula.value.EvalResult;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import static com.spreadsheet.formula.functions.FormulaFixture.error;
import static com.spreadsheet.formula.functions.FormulaFixture.number;
import static com.spreadsheet.formula.functions.FormulaFixture.text;
import static org.junit.jupiter.api.Assertions.*;

class LogicalFunctionsTest {

    private FormulaFixture sheet;

    @BeforeEach
    void setUp() {
        sheet = new FormulaFixture()
                .set("A1", "85")
                .set("B1", "hello")
                .set("B2", "TRUE")
                .set("B3", "0");
    }

    @Test
    void testIf() {
        assertEquals(text("Yes"), sheet.eval("=IF(10>5, \"Yes\", \"No\")"));
        assertEquals(text("No"), sheet.eval("=IF(A1>90, \"Yes\", \"No\")"));
        assertEquals(EvalResult.FALSE, sheet.eval("=IF(FALSE, 1)"));
        assertEquals(number(2), sheet.eval("=IF(\"FALSE\", 1, 2)"));
    }

    @Test
    void testIfOnlyEvaluatesChosenBranch() {
        assertEquals(number(1), sheet.eval("=IF(TRUE, 1, 1/0)"));
        assertEquals(number(2), sheet.eval("=IF(FALSE, NOSUCH(), 2)"));
    }

    @Test
    void testIfConditionErrorPropagates() {
        assertEquals(error(ErrorKind.DIVIDE_BY_ZERO), sheet.eval("=IF(1/0, 1, 2)"));
    }

    @Test
    void testIfs() {
        assertEquals(text("B"), sheet.eval("=IFS(A1>90, \"A\", A1>80, \"B\", TRUE, \"C\")"));
        assertEquals(error(ErrorKind.NOT_AVAILABLE), sheet.eval("=IFS(A1>90, \"A\", A1>88, \"B\")"));
        assertEquals(error(ErrorKind.TYPE_MISMATCH), sheet.eval("=IFS(TRUE, 1, FALSE)"));
        assertEquals(error(ErrorKind.TYPE_MISMATCH), sheet.eval("=IFS(TRUE)"));
    }

    @Test
    void testAndOr() {
        assertEquals(EvalResult.TRUE, sheet.eval("=AND(TRUE, 1)"));
        assertEquals(EvalResult.FALSE, sheet.eval("=AND(TRUE, 0)"));
        assertEquals(EvalResult.FALSE, sheet.eval("=OR(FALSE, 0)"));
        assertEquals(EvalResult.TRUE, sheet.eval("=OR(FALSE, A1>80)"));
    }

    /**
     * Inside a range only numbers and booleans take part; text is ignored.
     */
    @Test
    void testAndOrOverRanges() {
        assertEquals(EvalResult.FALSE, sheet.eval("=AND(B1:B3)"));
        assertEquals(EvalResult.TRUE, sheet.eval("=OR(B1:B3)"));
        assertEquals(error(ErrorKind.TYPE_MISMATCH), sheet.eval("=AND(B1:B1)"));
    }

    @Test
    void testAndOrDoNotShortCircuitErrors() {
        assertEquals(error(ErrorKind.DIVIDE_BY_ZERO), sheet.eval("=AND(FALSE, 1/0)"));
        assertEquals(error(ErrorKind.DIVIDE_BY_ZERO), sheet.eval("=OR(TRUE, 1/0)"));
    }

    @Test
    void testNot() {
        assertEquals(EvalResult.TRUE, sheet.eval("=NOT(0)"));
        assertEquals(EvalResult.FALSE, sheet.eval("=NOT(A1)"));
        assertEquals(EvalResult.TRUE, sheet.eval("=NOT(Z99)"));
    }
}
