package com.spreadsheet.formula.functions;

import com.spreadsheet.formula.value.ErrorKind;
import com.spreadsheet.formula.value.EvalResult;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.time.Clock;
import java.time.Instant;
import java.time.LocalDate;
import java.time.ZoneOffset;

import static com.spreadsheet.formula.functions.FormulaFixture.error;
import static com.spreadsheet.formula.functions.FormulaFixture.number;
import static org.junit.jupiter.api.Assertions.*;

class DateFunctionsTest {

    // 2024-03-15 is serial 45366
    private static final Clock NOON_MARCH_15 = Clock.fixed(Instant.parse("2024-03-15T12:00:00Z"), ZoneOffset.UTC);

    private FormulaFixture sheet;

    @BeforeEach
    void setUp() {
        sheet = new FormulaFixture(NOON_MARCH_15)
                .set("A1", "=DATE(2020,1,15)")
                .set("A2", "=DATE(2024,3,14)");
    }

    @Test
    void testSerials() {
        assertEquals(45292.0, DateSerials.toSerial(LocalDate.of(2024, 1, 1)));
        assertEquals(LocalDate.of(2024, 3, 15), DateSerials.toDate(45366.75));
        assertFalse(DateSerials.parseIsoDate("15/03/2024").isPresent());
    }

    @Test
    void testTodayAndNowReadTheClock() {
        assertEquals(number(45366), sheet.eval("=TODAY()"));
        assertEquals(number(45366.5), sheet.eval("=NOW()"));
        assertEquals(EvalResult.TRUE, sheet.eval("=TODAY()=DATE(2024,3,15)"));
        assertEquals(error(ErrorKind.TYPE_MISMATCH), sheet.eval("=TODAY(1)"));
    }

    @Test
    void testDate() {
        assertEquals(number(45292), sheet.eval("=DATE(2024,1,1)"));
        assertEquals(sheet.eval("=DATE(2025,2,1)"), sheet.eval("=DATE(2024,14,1)"));
        assertEquals(sheet.eval("=DATE(2024,2,29)"), sheet.eval("=DATE(2024,3,0)"));
        assertEquals(sheet.eval("=DATE(1924,1,1)"), sheet.eval("=DATE(24,1,1)"));
        assertEquals(error(ErrorKind.INVALID_NUMBER), sheet.eval("=DATE(10000,1,1)"));
        assertEquals(error(ErrorKind.INVALID_NUMBER), sheet.eval("=DATE(-1,1,1)"));
    }

    @Test
    void testDateOutOfRangeOffsets() {
        assertEquals(error(ErrorKind.INVALID_NUMBER), sheet.eval("=DATE(2020,1,10^300)"));
        assertEquals(error(ErrorKind.INVALID_NUMBER), sheet.eval("=DATE(2020,1,-(10^300))"));
        assertEquals(error(ErrorKind.INVALID_NUMBER), sheet.eval("=DATE(2020,10^300,1)"));
        assertEquals(error(ErrorKind.INVALID_NUMBER), sheet.eval("=DATE(9999,12,32)"));
        assertEquals(number(2958465), sheet.eval("=DATE(9999,12,31)"));

        sheet.set("B1", "=DATE(2020,1,10^300)").set("B2", "=B1+1");
        assertEquals(error(ErrorKind.INVALID_NUMBER), sheet.eval("=B2"));
        sheet.set("B1", "=DATE(2020,1,1)");
        assertEquals(number(43832), sheet.eval("=B2"));
    }

    @Test
    void testDateParts() {
        assertEquals(number(2024), sheet.eval("=YEAR(A2)"));
        assertEquals(number(3), sheet.eval("=MONTH(A2)"));
        assertEquals(number(15), sheet.eval("=DAY(45366)"));
        assertEquals(number(7), sheet.eval("=MONTH(\"2024-07-04\")"));
        assertEquals(error(ErrorKind.INVALID_NUMBER), sheet.eval("=YEAR(-1)"));
        assertEquals(error(ErrorKind.TYPE_MISMATCH), sheet.eval("=YEAR(\"soon\")"));
    }

    @Test
    void testDatedifCountsCompleteUnits() {
        assertEquals(number(4), sheet.eval("=DATEDIF(A1, A2, \"Y\")"));
        assertEquals(number(49), sheet.eval("=DATEDIF(A1, A2, \"m\")"));
        assertEquals(number(60), sheet.eval("=DATEDIF(\"2024-01-01\", \"2024-03-01\", \"D\")"));
        assertEquals(error(ErrorKind.INVALID_NUMBER), sheet.eval("=DATEDIF(A2, A1, \"D\")"));
        assertEquals(error(ErrorKind.TYPE_MISMATCH), sheet.eval("=DATEDIF(A1, A2, \"X\")"));
    }

    @Test
    void testVolatility() {
        FunctionRegistry registry = FunctionRegistry.withBuiltins();
        assertTrue(registry.isVolatile("TODAY"));
        assertTrue(registry.isVolatile("now"));
        assertFalse(registry.isVolatile("DATE"));
    }
}
