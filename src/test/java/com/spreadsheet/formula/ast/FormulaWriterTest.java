package com.spreadsheet.formula.ast;

import com.spreadsheet.formula.parser.FormulaParser;
import org.junit.jupiter.api.Test;

import java.util.Arrays;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

class FormulaWriterTest {

    private static String rewrite(String formula) {
        return FormulaWriter.write(FormulaParser.parse(formula).getValue());
    }

    @Test
    void testDropsRedundantParentheses() {
        assertEquals("1+2*3", rewrite("=(1)+(2*3)"));
        assertEquals("1-2-3", rewrite("=(1-2)-3"));
    }

    @Test
    void testKeepsNeededParentheses() {
        assertEquals("(1+2)*3", rewrite("=(1+2)*3"));
        assertEquals("1-(2-3)", rewrite("=1-(2-3)"));
        assertEquals("2^(3^2)", rewrite("=2^(3^2)"));
        assertEquals("-(A1+1)", rewrite("=-(A1+1)"));
    }

    @Test
    void testLiteralsAndReferences() {
        assertEquals("\"say \"\"hi\"\"\"&TRUE", rewrite("=\"say \"\"hi\"\"\" & true"));
        assertEquals("SUM(Sheet2!$A$1:B3,0.5)", rewrite("=sum(Sheet2!$A$1:B3, .5)"));
        assertEquals("'My Sheet'!A1", rewrite("='My Sheet'!A1"));
        assertEquals("TODAY()", rewrite("=today()"));
    }

    @Test
    void testNumbersKeepFullPrecision() {
        assertEquals("1.0000000000000002", rewrite("=1.0000000000000002"));
        assertEquals("0.1+0.25", rewrite("=0.10+.25"));
    }

    /**
     * Writing and re-parsing yields a tree that writes the same text again.
     */
    @Test
    void testOutputReparsesToSameTree() {
        List<String> formulas = Arrays.asList(
                "=IF(AND(A1>0,B1<>\"x\"),A1*(B2-C3)/2,-D4^2)",
                "=VLOOKUP(\"k*\",A1:C10,3,FALSE)&\" units\"",
                "=(1=1)=(2>1)",
                "=10-(4-3)-2",
                "=1/(2*3)");
        for (String formula : formulas) {
            String written = rewrite(formula);
            assertEquals(written, rewrite(written), "not stable: " + formula);
        }
    }

    @Test
    void testToStringUsesWriter() {
        Expr expr = FormulaParser.parse("=a1 + 1").getValue();
        assertEquals("A1+1", expr.toString());
    }
}
