package com.spreadsheet.formula.parser;

import com.spreadsheet.formula.address.CellAddress;
import com.spreadsheet.formula.ast.BinaryOp;
import com.spreadsheet.formula.ast.BinaryOperator;
import com.spreadsheet.formula.ast.CellRef;
import com.spreadsheet.formula.ast.Expr;
import com.spreadsheet.formula.ast.FunctionCall;
import com.spreadsheet.formula.ast.NameRef;
import com.spreadsheet.formula.ast.NumberLiteral;
import com.spreadsheet.formula.ast.RangeRef;
import com.spreadsheet.formula.ast.UnaryOp;
import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.*;

class FormulaParserTest {

    private static Expr parse(String formula) {
        ParseResult<Expr> result = FormulaParser.parse(formula);
        assertTrue(result.isSuccess(), () -> "parse failed: " + result.getError());
        return result.getValue();
    }

    private static SyntaxError parseError(String formula) {
        ParseResult<Expr> result = FormulaParser.parse(formula);
        assertFalse(result.isSuccess(), () -> "expected a syntax error for " + formula);
        return result.getError();
    }

    @Test
    void testMultiplicationBindsTighterThanAddition() {
        BinaryOp add = (BinaryOp) parse("=1+2*3");
        assertEquals(BinaryOperator.ADD, add.getOperator());
        assertEquals(BinaryOperator.MULTIPLY, ((BinaryOp) add.getRight()).getOperator());
    }

    @Test
    void testSubtractionIsLeftAssociative() {
        BinaryOp outer = (BinaryOp) parse("10-4-3");
        assertTrue(outer.getLeft() instanceof BinaryOp);
        assertEquals(3.0, ((NumberLiteral) outer.getRight()).getValue());
    }

    @Test
    void testPowerIsLeftAssociative() {
        BinaryOp outer = (BinaryOp) parse("2^3^2");
        assertEquals(BinaryOperator.POWER, outer.getOperator());
        assertTrue(outer.getLeft() instanceof BinaryOp);
    }

    @Test
    void testComparisonIsLowestAndConcatAboveIt() {
        BinaryOp comparison = (BinaryOp) parse("A1&\"x\"=B1+1");
        assertEquals(BinaryOperator.EQUAL, comparison.getOperator());
        assertEquals(BinaryOperator.CONCAT, ((BinaryOp) comparison.getLeft()).getOperator());
        assertEquals(BinaryOperator.ADD, ((BinaryOp) comparison.getRight()).getOperator());
    }

    @Test
    void testUnaryMinusBindsTighterThanPower() {
        BinaryOp power = (BinaryOp) parse("-2^2");
        assertTrue(power.getLeft() instanceof UnaryOp);
    }

    @Test
    void testFunctionCalls() {
        FunctionCall call = (FunctionCall) parse("=if(A1>0, SUM(B1:B3), \"none\")");
        assertEquals("IF", call.getName());
        assertEquals(3, call.getArguments().size());
        FunctionCall inner = (FunctionCall) call.getArguments().get(1);
        assertTrue(inner.getArguments().get(0) instanceof RangeRef);

        FunctionCall noArgs = (FunctionCall) parse("TODAY()");
        assertTrue(noArgs.getArguments().isEmpty());
    }

    @Test
    void testReferences() {
        CellRef cell = (CellRef) parse("Sheet2!$A$1");
        assertEquals(new CellAddress("Sheet2", 1, 1, true, true), cell.getAddress());

        assertTrue(parse("A0") instanceof NameRef);
        assertTrue(parse("ABCD1") instanceof NameRef);
        assertTrue(parse("total") instanceof NameRef);
    }

    @Test
    void testParentheses() {
        BinaryOp multiply = (BinaryOp) parse("(1+2)*3");
        assertEquals(BinaryOperator.MULTIPLY, multiply.getOperator());
        assertEquals(BinaryOperator.ADD, ((BinaryOp) multiply.getLeft()).getOperator());
    }

    @Test
    void testEmptyFormula() {
        assertEquals("Empty formula", parseError("=").getMessage());
        assertEquals("Empty formula", parseError("   ").getMessage());
    }

    @Test
    void testUnmatchedParenthesis() {
        SyntaxError error = parseError("=(1+2");
        assertEquals(5, error.getOffset());

        parseError("SUM(1,2");
        parseError("1+2)");
    }

    @Test
    void testTrailingTokens() {
        SyntaxError error = parseError("=1 2");
        assertEquals(3, error.getOffset());
    }

    @Test
    void testUnexpectedToken() {
        parseError("=1+*2");
        parseError("=SUM(,1)");
        parseError("=1+");
    }

    @Test
    void testTokenizerErrorsSurface() {
        SyntaxError error = parseError("=1.2.3");
        assertEquals(4, error.getOffset());
    }
}
