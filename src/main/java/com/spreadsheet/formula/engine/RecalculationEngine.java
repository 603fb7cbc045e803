package com.spreadsheet.formula.engine;

import com.spreadsheet.formula.address.CellAddress;
import com.spreadsheet.formula.address.CellRange;
import com.spreadsheet.formula.ast.Expr;
import com.spreadsheet.formula.ast.ReferenceCollector;
import com.spreadsheet.formula.evaluator.EvaluationContext;
import com.spreadsheet.formula.evaluator.FormulaEvaluator;
import com.spreadsheet.formula.functions.FunctionRegistry;
import com.spreadsheet.formula.models.CellRecord;
import com.spreadsheet.formula.models.CellState;
import com.spreadsheet.formula.models.Workbook;
import com.spreadsheet.formula.parser.FormulaParser;
import com.spreadsheet.formula.parser.ParseResult;
import com.spreadsheet.formula.value.Coercions;
import com.spreadsheet.formula.value.ErrorKind;
import com.spreadsheet.formula.value.EvalResult;
import com.spreadsheet.formula.value.RangeMatrix;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Clock;
import java.util.ArrayDeque;
import java.util.Collections;
import java.util.Deque;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.OptionalDouble;
import java.util.Set;

/**
 * Keeps a workbook's computed values consistent with its raw inputs.
 *
 * A write replaces the cell's dependency edges, then marks the cell and its direct
 * dependents dirty. Dirty cells are settled with an explicit work stack: a cell's dirty
 * dependencies are settled before the cell itself, and reaching a cell that is still
 * being evaluated means a cycle. When a settled value differs from the cached one,
 * the cell's direct dependents become dirty in turn, so a recalculation pass keeps
 * going until nothing is dirty.
 *
 * Not thread-safe; {@code WorkbookService} serializes access through the workbook's lock.
 */
public class RecalculationEngine implements CellStore {

    private static final Logger LOG = LoggerFactory.getLogger(RecalculationEngine.class);

    public static final String DEFAULT_SHEET_NAME = "Sheet1";

    private final Workbook workbook;
    private final FunctionRegistry functions;
    private final FormulaEvaluator evaluator;
    private final EngineSettings settings;

    // Cells in state DIRTY, in the order they were marked
    private final Set<CellAddress> dirty = new LinkedHashSet<>();

    public RecalculationEngine() {
        this(new Workbook(DEFAULT_SHEET_NAME), FunctionRegistry.withBuiltins(), EngineSettings.defaults());
    }

    public RecalculationEngine(Workbook workbook, FunctionRegistry functions, EngineSettings settings) {
        this.workbook = workbook;
        this.functions = functions;
        this.evaluator = new FormulaEvaluator(functions);
        this.settings = settings;
    }

    public Workbook getWorkbook() {
        return workbook;
    }

    public EngineSettings getSettings() {
        return settings;
    }

    // ------------------------
    // Cell store
    // ------------------------

    @Override
    public Optional<String> getRawValue(CellAddress address) {
        CellRecord record = workbook.getCell(position(address));
        return record == null ? Optional.empty() : Optional.of(record.getRawInput());
    }

    @Override
    public EvalResult getComputedValue(CellAddress address) {
        CellRecord record = workbook.getCell(position(address));
        if (record == null) {
            return EvalResult.BLANK;
        }
        return currentValue(record);
    }

    @Override
    public void setRawValue(CellAddress address, String rawInput) {
        write(position(address), rawInput);
        afterWrite();
    }

    /**
     * Writes every entry, then runs at most one recalculation pass.
     */
    public void setRawValues(Map<CellAddress, String> rawInputs) {
        for (Map.Entry<CellAddress, String> entry : rawInputs.entrySet()) {
            write(position(entry.getKey()), entry.getValue());
        }
        afterWrite();
    }

    public void clear(CellAddress address) {
        CellAddress position = position(address);
        clearCell(position);
        afterWrite();
    }

    /**
     * Marks volatile cells dirty, then settles dirty cells until none remain.
     */
    public void recalculate() {
        for (CellRecord record : workbook.getCells().values()) {
            if (record.isVolatile()) {
                markDirty(record.getAddress());
            }
        }
        int settled = 0;
        while (!dirty.isEmpty()) {
            CellAddress next = dirty.iterator().next();
            CellRecord record = workbook.getCell(next);
            if (record == null || record.isSettled()) {
                dirty.remove(next);
                continue;
            }
            settle(next);
            settled++;
        }
        LOG.debug("Recalculation pass on workbook {} settled {} cell(s)", workbook.getId(), settled);
    }

    /**
     * Evaluates formula text against the workbook without storing it.
     * Unqualified references belong to {@code sheetName}, or to the default sheet when null.
     */
    public EvalResult evaluateFormula(String source, String sheetName) {
        ParseResult<Expr> parsed = FormulaParser.parse(source);
        if (!parsed.isSuccess()) {
            LOG.debug("Preview formula did not parse: {}", parsed.getError());
            return EvalResult.error(ErrorKind.PARSE_ERROR);
        }
        String sheet = sheetName == null ? workbook.getDefaultSheetName() : sheetName;
        return evaluate(parsed.getValue(), sheet);
    }

    /**
     * Cells the given cell's formula references.
     */
    public Set<CellAddress> getDependencies(CellAddress address) {
        return Collections.unmodifiableSet(new LinkedHashSet<>(workbook.getDependencies(position(address))));
    }

    /**
     * Formula cells that reference the given cell.
     */
    public Set<CellAddress> getDependents(CellAddress address) {
        return Collections.unmodifiableSet(new LinkedHashSet<>(workbook.getDependents(position(address))));
    }

    public boolean isDirty(CellAddress address) {
        return dirty.contains(position(address));
    }

    /**
     * Sheet-qualified, anchor-free form of an address, as used for graph keys.
     */
    public CellAddress position(CellAddress address) {
        return address.inSheet(workbook.getDefaultSheetName()).toPosition();
    }

    // ------------------------
    // Writes
    // ------------------------

    private void write(CellAddress position, String rawInput) {
        if (rawInput == null || rawInput.isEmpty()) {
            clearCell(position);
            return;
        }
        pruneCleared(workbook.clearDependencies(position));

        CellRecord record;
        if (rawInput.startsWith("=")) {
            record = compile(position, rawInput);
        } else {
            record = CellRecord.literal(position, rawInput, typeLiteral(rawInput));
        }
        workbook.setCell(record);
        record.setState(CellState.DIRTY);
        dirty.add(position);
        markDependentsDirty(position);
        LOG.debug("Set {} to {}", position, rawInput);
    }

    private CellRecord compile(CellAddress position, String rawInput) {
        ParseResult<Expr> parsed = FormulaParser.parse(rawInput);
        if (!parsed.isSuccess()) {
            LOG.debug("Formula in {} did not parse: {}", position, parsed.getError());
            return CellRecord.unparsable(position, rawInput, parsed.getError());
        }
        Expr formula = parsed.getValue();
        ReferenceCollector collected = ReferenceCollector.collect(formula);
        for (CellRange reference : collected.getReferences()) {
            CellRange range = reference.inSheet(position.getSheet());
            if (range.cellCount() > settings.getMaxRangeCells()) {
                // Evaluates to #REF! anyway, so there is nothing to depend on
                LOG.debug("Range {} in {} exceeds {} cells", range, position, settings.getMaxRangeCells());
                continue;
            }
            for (CellAddress target : range.addresses()) {
                workbook.addDependency(position, target);
            }
        }
        boolean volatileFormula = false;
        for (String name : collected.getFunctionNames()) {
            volatileFormula |= functions.isVolatile(name);
        }
        return CellRecord.formula(position, rawInput, formula, volatileFormula);
    }

    /**
     * Literal input: a leading apostrophe forces text, then number, then TRUE/FALSE, then text.
     */
    static EvalResult typeLiteral(String rawInput) {
        if (rawInput.startsWith("'")) {
            return EvalResult.text(rawInput.substring(1));
        }
        OptionalDouble number = Coercions.parseNumber(rawInput);
        if (number.isPresent()) {
            return EvalResult.number(number.getAsDouble());
        }
        if ("TRUE".equalsIgnoreCase(rawInput.trim())) {
            return EvalResult.TRUE;
        }
        if ("FALSE".equalsIgnoreCase(rawInput.trim())) {
            return EvalResult.FALSE;
        }
        return EvalResult.text(rawInput);
    }

    private void clearCell(CellAddress position) {
        CellRecord removed = workbook.removeCell(position);
        dirty.remove(position);
        pruneCleared(workbook.clearDependencies(position));
        if (removed == null) {
            return;
        }
        if (!workbook.getDependents(position).isEmpty()) {
            workbook.markCleared(position);
        }
        markDependentsDirty(position);
        LOG.debug("Cleared {}", position);
    }

    /**
     * Forgets cleared cells nothing references any more.
     */
    private void pruneCleared(Set<CellAddress> formerTargets) {
        for (CellAddress target : formerTargets) {
            if (workbook.isCleared(target) && workbook.getDependents(target).isEmpty()) {
                workbook.forgetCleared(target);
            }
        }
    }

    private void afterWrite() {
        if (settings.getCalculationMode() == CalculationMode.AUTOMATIC) {
            recalculate();
        }
    }

    // ------------------------
    // Dirty tracking and settling
    // ------------------------

    private void markDirty(CellAddress position) {
        CellRecord record = workbook.getCell(position);
        if (record != null && record.isSettled()) {
            record.setState(CellState.DIRTY);
            dirty.add(position);
        }
    }

    private void markDependentsDirty(CellAddress position) {
        for (CellAddress dependent : workbook.getDependents(position)) {
            markDirty(dependent);
        }
    }

    private EvalResult currentValue(CellRecord record) {
        if (record.getState() == CellState.DIRTY) {
            settle(record.getAddress());
        }
        if (record.getState() == CellState.EVALUATING) {
            // Only reachable through a reference back into a cell whose evaluation is under way
            return EvalResult.error(ErrorKind.CIRCULAR_REFERENCE);
        }
        return record.getCachedValue();
    }

    /**
     * Settles {@code root} and every dirty cell it depends on, without recursion.
     */
    private void settle(CellAddress root) {
        Deque<CellAddress> stack = new ArrayDeque<>();
        stack.push(root);
        while (!stack.isEmpty()) {
            CellAddress current = stack.peek();
            CellRecord record = workbook.getCell(current);
            if (record == null || record.isSettled()) {
                stack.pop();
                continue;
            }
            record.setState(CellState.EVALUATING);

            CellAddress reentered = null;
            boolean waiting = false;
            for (CellAddress dependency : workbook.getDependencies(current)) {
                CellRecord target = workbook.getCell(dependency);
                if (target == null) {
                    continue;
                }
                if (target.getState() == CellState.EVALUATING) {
                    reentered = dependency;
                    break;
                }
                if (target.getState() == CellState.DIRTY) {
                    stack.push(dependency);
                    waiting = true;
                }
            }
            if (reentered != null) {
                markCycle(stack, reentered);
            } else if (!waiting) {
                stack.pop();
                compute(record);
            }
        }
    }

    /**
     * Every cell under evaluation from {@code reentered} up to the top of the stack is on the cycle.
     */
    private void markCycle(Deque<CellAddress> stack, CellAddress reentered) {
        Set<CellAddress> members = new LinkedHashSet<>();
        for (CellAddress frame : stack) {
            CellRecord record = workbook.getCell(frame);
            if (record != null && record.getState() == CellState.EVALUATING) {
                members.add(frame);
            }
            if (frame.equals(reentered)) {
                break;
            }
        }
        LOG.warn("Circular reference in workbook {} through {}", workbook.getId(), members);

        EvalResult circular = EvalResult.error(ErrorKind.CIRCULAR_REFERENCE);
        Set<CellAddress> changed = new LinkedHashSet<>();
        for (CellAddress member : members) {
            CellRecord record = workbook.getCell(member);
            if (!circular.equals(record.getCachedValue())) {
                changed.add(member);
            }
            record.setCachedValue(circular);
            dirty.remove(member);
        }
        for (CellAddress member : changed) {
            for (CellAddress dependent : workbook.getDependents(member)) {
                if (!members.contains(dependent)) {
                    markDirty(dependent);
                }
            }
        }
    }

    private void compute(CellRecord record) {
        EvalResult value;
        if (record.getSyntaxError() != null) {
            value = EvalResult.error(ErrorKind.PARSE_ERROR);
        } else if (!record.isFormula()) {
            value = record.getLiteral();
        } else {
            value = evaluate(record.getFormula(), record.getAddress().getSheet());
        }
        EvalResult previous = record.getCachedValue();
        record.setCachedValue(value);
        dirty.remove(record.getAddress());
        if (!value.equals(previous)) {
            markDependentsDirty(record.getAddress());
        }
    }

    /**
     * Anything thrown past the evaluator becomes #VALUE!, so the cell still settles.
     */
    private EvalResult evaluate(Expr formula, String sheet) {
        try {
            return collapse(evaluator.evaluate(formula, new SheetContext(sheet)));
        } catch (RuntimeException e) {
            LOG.warn("Evaluation failed in workbook {} on sheet {}", workbook.getId(), sheet, e);
            return EvalResult.error(ErrorKind.TYPE_MISMATCH);
        }
    }

    /**
     * A cell holds one value: a 1x1 matrix becomes its element, anything larger is a type mismatch.
     */
    private static EvalResult collapse(EvalResult value) {
        if (!value.isMatrix()) {
            return value;
        }
        RangeMatrix matrix = value.getMatrix();
        return matrix.size() == 1 ? matrix.get(0, 0) : EvalResult.error(ErrorKind.TYPE_MISMATCH);
    }

    /**
     * Resolves references for a formula living on one sheet.
     */
    private final class SheetContext implements EvaluationContext {

        private final String sheetName;

        SheetContext(String sheetName) {
            this.sheetName = sheetName;
        }

        @Override
        public String getSheetName() {
            return sheetName;
        }

        @Override
        public EvalResult resolveCell(CellAddress address) {
            CellAddress position = address.toPosition();
            CellRecord record = workbook.getCell(position);
            if (record == null) {
                if (workbook.isCleared(position)
                        && settings.getClearedReferencePolicy() == ClearedReferencePolicy.INVALID_REFERENCE) {
                    return EvalResult.error(ErrorKind.INVALID_REFERENCE);
                }
                return EvalResult.BLANK;
            }
            return currentValue(record);
        }

        @Override
        public EvalResult resolveRange(CellRange range) {
            if (range.cellCount() > settings.getMaxRangeCells()) {
                return EvalResult.error(ErrorKind.INVALID_REFERENCE);
            }
            List<CellAddress> addresses = range.addresses();
            EvalResult[] values = new EvalResult[addresses.size()];
            for (int i = 0; i < values.length; i++) {
                CellRecord record = workbook.getCell(addresses.get(i));
                values[i] = record == null ? EvalResult.BLANK : currentValue(record);
            }
            return EvalResult.matrix(new RangeMatrix(range.getRowCount(), range.getColumnCount(), values));
        }

        @Override
        public Clock getClock() {
            return settings.getClock();
        }
    }
}
