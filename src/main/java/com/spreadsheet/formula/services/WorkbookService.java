package com.spreadsheet.formula.services;

import com.spreadsheet.formula.address.CellAddress;
import com.spreadsheet.formula.config.FormulaProperties;
import com.spreadsheet.formula.engine.EngineSettings;
import com.spreadsheet.formula.engine.RecalculationEngine;
import com.spreadsheet.formula.exceptions.InvalidReferenceException;
import com.spreadsheet.formula.exceptions.WorkbookNotFoundException;
import com.spreadsheet.formula.functions.FunctionRegistry;
import com.spreadsheet.formula.models.*;
import com.spreadsheet.formula.value.EvalResult;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.util.*;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.locks.ReentrantReadWriteLock;
import java.util.function.Supplier;

/**
 * Owns the open workbook sessions: one workbook and one recalculation engine per document.
 *
 * Engines are single-writer, so every call goes through the workbook's lock. Writes,
 * recalculation and previews take the write lock; reads take the read lock when every
 * cell they touch is settled, and fall back to the write lock when something must be evaluated first.
 */
@Service
public class WorkbookService {

    private static final Logger LOG = LoggerFactory.getLogger(WorkbookService.class);

    private static final Comparator<CellAddress> READING_ORDER = Comparator
            .comparing((CellAddress a) -> a.getSheet() == null ? "" : a.getSheet())
            .thenComparingInt(CellAddress::getRow)
            .thenComparingInt(CellAddress::getColumn);

    // All workbooks live here in memory; there is no persistence
    private final Map<Long, RecalculationEngine> workbooks = new ConcurrentHashMap<>();

    private final FunctionRegistry functions;
    private final FormulaProperties properties;
    private final Clock clock;

    public WorkbookService() {
        this(FunctionRegistry.withBuiltins(), new FormulaProperties(), Clock.systemDefaultZone());
    }

    @Autowired
    public WorkbookService(FunctionRegistry functions, FormulaProperties properties, Clock clock) {
        this.functions = functions;
        this.properties = properties;
        this.clock = clock;
    }

    /**
     * Opens a new workbook and returns its ID. A null or blank sheet name means the configured default.
     */
    public long createWorkbook(String sheetName) {
        String sheet = sheetName == null || sheetName.trim().isEmpty()
                ? properties.getDefaultSheetName() : sheetName.trim();
        EngineSettings settings = EngineSettings.defaults()
                .setCalculationMode(properties.getCalculationMode())
                .setMaxRangeCells(properties.getMaxRangeCells())
                .setClearedReferencePolicy(properties.getClearedReferencePolicy())
                .setClock(clock);
        RecalculationEngine engine = new RecalculationEngine(new Workbook(sheet), functions, settings);
        workbooks.put(engine.getWorkbook().getId(), engine);
        LOG.info("Created workbook {} with sheet {} ({} mode)",
                engine.getWorkbook().getId(), sheet, settings.getCalculationMode());
        return engine.getWorkbook().getId();
    }

    /**
     * Retrieves a workbook's engine by ID. Throws if not found.
     */
    public RecalculationEngine getEngine(long workbookId) {
        RecalculationEngine engine = workbooks.get(workbookId);
        if (engine == null) {
            throw new WorkbookNotFoundException("Workbook not found: " + workbookId);
        }
        return engine;
    }

    public Workbook getWorkbook(long workbookId) {
        return getEngine(workbookId).getWorkbook();
    }

    /**
     * Writes raw input to a cell; formulas start with '=', empty input clears the cell.
     */
    public void setCellValue(long workbookId, String address, String rawInput) {
        RecalculationEngine engine = getEngine(workbookId);
        CellAddress cell = parseAddress(address);
        withWriteLock(engine, () -> {
            engine.setRawValue(cell, rawInput);
            return null;
        });
    }

    /**
     * Writes several cells and recalculates once.
     */
    public void setCellValues(long workbookId, Map<String, String> rawInputs) {
        RecalculationEngine engine = getEngine(workbookId);
        Map<CellAddress, String> cells = new LinkedHashMap<>();
        for (Map.Entry<String, String> entry : rawInputs.entrySet()) {
            cells.put(parseAddress(entry.getKey()), entry.getValue());
        }
        withWriteLock(engine, () -> {
            engine.setRawValues(cells);
            return null;
        });
    }

    public void clearCell(long workbookId, String address) {
        RecalculationEngine engine = getEngine(workbookId);
        CellAddress cell = parseAddress(address);
        withWriteLock(engine, () -> {
            engine.clear(cell);
            return null;
        });
    }

    public void recalculate(long workbookId) {
        RecalculationEngine engine = getEngine(workbookId);
        withWriteLock(engine, () -> {
            engine.recalculate();
            return null;
        });
    }

    public CellView getCell(long workbookId, String address) {
        RecalculationEngine engine = getEngine(workbookId);
        CellAddress cell = engine.position(parseAddress(address));
        return read(engine, () -> isSettled(engine.getWorkbook().getCell(cell)), () -> {
            CellRecord record = engine.getWorkbook().getCell(cell);
            EvalResult value = engine.getComputedValue(cell);
            return new CellView(label(engine, cell),
                    record == null ? null : record.getRawInput(),
                    value,
                    record == null ? CellState.CLEAN : record.getState());
        });
    }

    /**
     * Returns a map of address -> value for every non-empty cell, in reading order.
     * Addresses on the default sheet are unqualified: { "A1": 10.0, "A4": 60.0, "Sheet2!B1": "x" }.
     */
    public Map<String, Object> getWorkbookData(long workbookId) {
        RecalculationEngine engine = getEngine(workbookId);
        return read(engine, () -> allSettled(engine), () -> {
            List<CellAddress> addresses = new ArrayList<>(engine.getWorkbook().getCells().keySet());
            addresses.sort(READING_ORDER);
            Map<String, Object> data = new LinkedHashMap<>();
            for (CellAddress address : addresses) {
                data.put(label(engine, address), engine.getComputedValue(address).toJavaValue());
            }
            return data;
        });
    }

    /**
     * Evaluates a formula against the workbook without storing it.
     */
    public CellView evaluate(long workbookId, String formula, String sheetName) {
        RecalculationEngine engine = getEngine(workbookId);
        EvalResult value = withWriteLock(engine, () -> engine.evaluateFormula(formula, sheetName));
        return new CellView(null, formula, value, value.isError() ? CellState.ERROR : CellState.CLEAN);
    }

    /**
     * For each formula cell, the cells it references.
     */
    public Map<String, Set<String>> getForwardDependencies(long workbookId) {
        RecalculationEngine engine = getEngine(workbookId);
        return read(engine, () -> true, () -> snapshot(engine, engine.getWorkbook().getForwardGraph()));
    }

    /**
     * For each referenced cell, the formula cells that reference it.
     */
    public Map<String, Set<String>> getReverseDependencies(long workbookId) {
        RecalculationEngine engine = getEngine(workbookId);
        return read(engine, () -> true, () -> snapshot(engine, engine.getWorkbook().getReverseGraph()));
    }

    // ----------------------------------------------------------------
    // Internal Helpers (used within this service only)
    // ----------------------------------------------------------------

    private CellAddress parseAddress(String address) {
        return CellAddress.parse(address)
                .orElseThrow(() -> new InvalidReferenceException("Not a cell address: " + address));
    }

    private String label(RecalculationEngine engine, CellAddress address) {
        if (engine.getWorkbook().getDefaultSheetName().equals(address.getSheet())) {
            return CellAddress.of(address.getColumn(), address.getRow()).format();
        }
        return address.format();
    }

    private Map<String, Set<String>> snapshot(RecalculationEngine engine, Map<CellAddress, Set<CellAddress>> graph) {
        Map<String, Set<String>> result = new TreeMap<>();
        for (Map.Entry<CellAddress, Set<CellAddress>> entry : graph.entrySet()) {
            Set<String> targets = new TreeSet<>();
            for (CellAddress target : entry.getValue()) {
                targets.add(label(engine, target));
            }
            result.put(label(engine, entry.getKey()), targets);
        }
        return result;
    }

    private static boolean isSettled(CellRecord record) {
        return record == null || record.isSettled();
    }

    private static boolean allSettled(RecalculationEngine engine) {
        for (CellRecord record : engine.getWorkbook().getCells().values()) {
            if (!record.isSettled()) {
                return false;
            }
        }
        return true;
    }

    /**
     * Runs a read under the read lock when nothing needs evaluating, otherwise under the write lock.
     */
    private <T> T read(RecalculationEngine engine, Supplier<Boolean> settled, Supplier<T> action) {
        ReentrantReadWriteLock lock = engine.getWorkbook().getLock();
        lock.readLock().lock();
        try {
            if (settled.get()) {
                return action.get();
            }
        } finally {
            lock.readLock().unlock();
        }
        return withWriteLock(engine, action);
    }

    private <T> T withWriteLock(RecalculationEngine engine, Supplier<T> action) {
        ReentrantReadWriteLock lock = engine.getWorkbook().getLock();
        lock.writeLock().lock();
        try {
            return action.get();
        } finally {
            lock.writeLock().unlock();
        }
    }
}
