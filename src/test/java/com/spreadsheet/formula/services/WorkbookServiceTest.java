package com.spreadsheet.formula.services;

import com.spreadsheet.formula.address.CellAddress;
import com.spreadsheet.formula.config.FormulaProperties;
import com.spreadsheet.formula.engine.CalculationMode;
import com.spreadsheet.formula.exceptions.InvalidReferenceException;
import com.spreadsheet.formula.exceptions.WorkbookNotFoundException;
import com.spreadsheet.formula.functions.FunctionRegistry;
import com.spreadsheet.formula.models.CellState;
import com.spreadsheet.formula.models.CellView;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.time.Clock;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.concurrent.atomic.AtomicReference;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Unit tests for WorkbookService logic, using an in-memory approach
 * (no HTTP or external server).
 */
class WorkbookServiceTest {

    private WorkbookService workbookService;
    private long workbookId;

    @BeforeEach
    void setUp() {
        workbookService = new WorkbookService();
        workbookId = workbookService.createWorkbook(null);
    }

    /**
     * Literals are typed from their text.
     */
    @Test
    void testSetLiteralValues() {
        workbookService.setCellValue(workbookId, "A10", "hello");
        workbookService.setCellValue(workbookId, "B11", "true");
        workbookService.setCellValue(workbookId, "B12", "42");

        Map<String, Object> data = workbookService.getWorkbookData(workbookId);
        assertEquals("hello", data.get("A10"));
        assertEquals(true, data.get("B11"));
        assertEquals(42.0, data.get("B12"));
    }

    @Test
    void testInvalidAddressIsRejected() {
        assertThrows(InvalidReferenceException.class, () ->
                workbookService.setCellValue(workbookId, "A0", "1"));
        assertThrows(InvalidReferenceException.class, () ->
                workbookService.getCell(workbookId, "hello"));
    }

    @Test
    void testUnknownWorkbook() {
        assertThrows(WorkbookNotFoundException.class, () ->
                workbookService.getWorkbookData(workbookId + 1000));
    }

    /**
     * C1 -> A10, then A10 -> C1: both cells show the cycle instead of the write failing.
     */
    @Test
    void testFormulaCycle() {
        workbookService.setCellValue(workbookId, "C1", "=A10");
        workbookService.setCellValue(workbookId, "A10", "someValue");
        workbookService.setCellValue(workbookId, "A10", "=C1");

        Map<String, Object> data = workbookService.getWorkbookData(workbookId);
        assertEquals("#CIRCULAR!", data.get("A10"));
        assertEquals("#CIRCULAR!", data.get("C1"));
    }

    @Test
    void testEvaluateWorkbookData() {
        workbookService.setCellValue(workbookId, "A10", "hello");
        workbookService.setCellValue(workbookId, "C1", "=A10");

        Map<String, Object> data = workbookService.getWorkbookData(workbookId);
        assertEquals("hello", data.get("C1"));
        assertEquals("hello", data.get("A10"));
    }

    /**
     * Single-cell cycle, then a literal write recovers the cell.
     */
    @Test
    void testSingleCellCycle() {
        workbookService.setCellValue(workbookId, "A1", "hello");
        workbookService.setCellValue(workbookId, "A1", "=A1");
        assertEquals("#CIRCULAR!", workbookService.getWorkbookData(workbookId).get("A1"));

        workbookService.setCellValue(workbookId, "A1", "hello");
        assertEquals("hello", workbookService.getWorkbookData(workbookId).get("A1"));
    }

    /**
     * Multi-cell cycle: C -> A, A -> B, B -> C.
     */
    @Test
    void testThreeCellCycle() {
        workbookService.setCellValue(workbookId, "C1", "=A1");
        workbookService.setCellValue(workbookId, "A1", "=B1");
        workbookService.setCellValue(workbookId, "B1", "=C1");

        Map<String, Object> data = workbookService.getWorkbookData(workbookId);
        assertEquals("#CIRCULAR!", data.get("A1"));
        assertEquals("#CIRCULAR!", data.get("B1"));
        assertEquals("#CIRCULAR!", data.get("C1"));
    }

    @Test
    void testChangeFormulaToLiteral() {
        workbookService.setCellValue(workbookId, "A10", "hello");
        workbookService.setCellValue(workbookId, "C1", "=A10");
        assertEquals("hello", workbookService.getWorkbookData(workbookId).get("C1"));

        workbookService.setCellValue(workbookId, "C1", "newLiteral");
        Map<String, Object> data = workbookService.getWorkbookData(workbookId);
        assertEquals("newLiteral", data.get("C1"));
        assertEquals("hello", data.get("A10"));
        assertTrue(workbookService.getForwardDependencies(workbookId).isEmpty());
    }

    @Test
    void testReferenceToUnsetCellIsBlank() {
        workbookService.setCellValue(workbookId, "C1", "=A999");
        Map<String, Object> data = workbookService.getWorkbookData(workbookId);
        assertTrue(data.containsKey("C1"));
        assertNull(data.get("C1"), "Unset cell reference should evaluate to blank");
    }

    /**
     * Partial re-eval: updating A1 should refresh C1 if C1 -> A1.
     */
    @Test
    void testPartialReEvaluation() {
        workbookService.setCellValue(workbookId, "A1", "hi");
        workbookService.setCellValue(workbookId, "C1", "=A1");
        assertEquals("hi", workbookService.getWorkbookData(workbookId).get("C1"));

        workbookService.setCellValue(workbookId, "A1", "hello");
        assertEquals("hello", workbookService.getWorkbookData(workbookId).get("C1"));
    }

    @Test
    void testWorkbookDataInReadingOrder() {
        workbookService.setCellValue(workbookId, "Sheet2!A1", "other");
        workbookService.setCellValue(workbookId, "B2", "4");
        workbookService.setCellValue(workbookId, "A2", "3");
        workbookService.setCellValue(workbookId, "B1", "2");
        workbookService.setCellValue(workbookId, "a1", "1");

        List<String> keys = new ArrayList<>(workbookService.getWorkbookData(workbookId).keySet());
        assertEquals(Arrays.asList("A1", "B1", "A2", "B2", "Sheet2!A1"), keys);
    }

    @Test
    void testNamedDefaultSheet() {
        long budget = workbookService.createWorkbook("Budget");
        assertEquals("Budget", workbookService.getWorkbook(budget).getDefaultSheetName());

        workbookService.setCellValue(budget, "A1", "10");
        workbookService.setCellValue(budget, "A2", "=Budget!A1*2");
        Map<String, Object> data = workbookService.getWorkbookData(budget);
        assertEquals(20.0, data.get("A2"));
    }

    @Test
    void testGetCell() {
        workbookService.setCellValue(workbookId, "A1", "10");
        workbookService.setCellValue(workbookId, "A2", "20");
        workbookService.setCellValue(workbookId, "A3", "30");
        workbookService.setCellValue(workbookId, "A4", "=SUM(A1:A3)");

        CellView cell = workbookService.getCell(workbookId, "A4");
        assertEquals("A4", cell.getAddress());
        assertEquals("=SUM(A1:A3)", cell.getRawInput());
        assertEquals(60.0, cell.getValue());
        assertEquals("60", cell.getDisplayValue());
        assertEquals("NUMBER", cell.getType());
        assertEquals(CellState.CLEAN, cell.getState());

        CellView empty = workbookService.getCell(workbookId, "Z9");
        assertNull(empty.getRawInput());
        assertNull(empty.getValue());
        assertEquals("BLANK", empty.getType());
    }

    @Test
    void testErrorCellView() {
        workbookService.setCellValue(workbookId, "B1", "=1/0");
        CellView cell = workbookService.getCell(workbookId, "B1");
        assertEquals("#DIV/0!", cell.getValue());
        assertEquals("ERROR", cell.getType());
        assertEquals(CellState.ERROR, cell.getState());
    }

    @Test
    void testEvaluateWithoutStoring() {
        workbookService.setCellValue(workbookId, "A1", "10");

        CellView preview = workbookService.evaluate(workbookId, "=A1*2", null);
        assertNull(preview.getAddress());
        assertEquals(20.0, preview.getValue());
        assertEquals(1, workbookService.getWorkbookData(workbookId).size());

        CellView broken = workbookService.evaluate(workbookId, "=SUM(", null);
        assertEquals("#ERROR!", broken.getValue());
        assertEquals(CellState.ERROR, broken.getState());
    }

    @Test
    void testDependencyGraphs() {
        workbookService.setCellValue(workbookId, "B1", "=C2");
        workbookService.setCellValue(workbookId, "A1", "=B1");

        Map<String, Set<String>> forward = workbookService.getForwardDependencies(workbookId);
        assertEquals(Collections.singleton("B1"), forward.get("A1"));
        assertEquals(Collections.singleton("C2"), forward.get("B1"));
        assertFalse(forward.containsKey("C2"));

        Map<String, Set<String>> reverse = workbookService.getReverseDependencies(workbookId);
        assertEquals(Collections.singleton("A1"), reverse.get("B1"));
        assertEquals(Collections.singleton("B1"), reverse.get("C2"));
        assertFalse(reverse.containsKey("A1"));
    }

    @Test
    void testSetCellValuesBatch() {
        Map<String, String> cells = new LinkedHashMap<>();
        cells.put("C1", "=A1+B1");
        cells.put("A1", "1");
        cells.put("B1", "2");
        workbookService.setCellValues(workbookId, cells);

        assertEquals(3.0, workbookService.getWorkbookData(workbookId).get("C1"));
    }

    @Test
    void testClearCell() {
        workbookService.setCellValue(workbookId, "A1", "5");
        workbookService.setCellValue(workbookId, "B1", "=A1");
        workbookService.clearCell(workbookId, "A1");

        Map<String, Object> data = workbookService.getWorkbookData(workbookId);
        assertFalse(data.containsKey("A1"));
        assertEquals("#REF!", data.get("B1"));
    }

    @Test
    void testManualCalculationMode() {
        FormulaProperties properties = new FormulaProperties();
        properties.setCalculationMode(CalculationMode.MANUAL);
        WorkbookService manual = new WorkbookService(FunctionRegistry.withBuiltins(), properties, Clock.systemUTC());
        long id = manual.createWorkbook(null);

        manual.setCellValue(id, "A1", "1");
        manual.setCellValue(id, "B1", "=A1+1");
        assertTrue(manual.getEngine(id).isDirty(CellAddress.parse("B1").orElseThrow()));

        manual.recalculate(id);
        assertFalse(manual.getEngine(id).isDirty(CellAddress.parse("B1").orElseThrow()));
        assertEquals(2.0, manual.getWorkbookData(id).get("B1"));

        // Reads settle whatever is still dirty
        manual.setCellValue(id, "A1", "5");
        assertEquals(6.0, manual.getCell(id, "B1").getValue());
    }

    /**
     * Simple concurrency test: ensures no concurrency errors
     * when two threads set different cells simultaneously.
     */
    @Test
    void testConcurrentCellUpdates() throws InterruptedException {
        Runnable task1 = () -> workbookService.setCellValue(workbookId, "A10", "foo");
        Runnable task2 = () -> workbookService.setCellValue(workbookId, "B10", "true");

        Thread t1 = new Thread(task1);
        Thread t2 = new Thread(task2);

        t1.start();
        t2.start();
        t1.join();
        t2.join();

        Map<String, Object> data = workbookService.getWorkbookData(workbookId);
        assertEquals("foo", data.get("A10"));
        assertEquals(true, data.get("B10"));
    }

    /**
     * Writers and readers share one workbook; readers never see a failure and
     * the formula ends up consistent with every write.
     */
    @Test
    void testConcurrentReadersAndWriters() throws InterruptedException {
        workbookService.setCellValue(workbookId, "C1", "=SUM(A1:B100)");
        AtomicReference<Throwable> failure = new AtomicReference<>();

        Thread writerA = new Thread(() -> {
            for (int row = 1; row <= 100; row++) {
                workbookService.setCellValue(workbookId, "A" + row, "1");
            }
        });
        Thread writerB = new Thread(() -> {
            for (int row = 1; row <= 100; row++) {
                workbookService.setCellValue(workbookId, "B" + row, "2");
            }
        });
        Thread reader = new Thread(() -> {
            try {
                for (int i = 0; i < 100; i++) {
                    workbookService.getWorkbookData(workbookId);
                    workbookService.getCell(workbookId, "C1");
                }
            } catch (Throwable e) {
                failure.set(e);
            }
        });

        writerA.start();
        writerB.start();
        reader.start();
        writerA.join();
        writerB.join();
        reader.join();

        assertNull(failure.get());
        assertEquals(300.0, workbookService.getWorkbookData(workbookId).get("C1"));
    }
}
