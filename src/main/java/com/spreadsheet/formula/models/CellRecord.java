package com.spreadsheet.formula.models;

import com.spreadsheet.formula.address.CellAddress;
import com.spreadsheet.formula.ast.Expr;
import com.spreadsheet.formula.parser.SyntaxError;
import com.spreadsheet.formula.value.EvalResult;

/**
 * Represents a single non-empty cell.
 * Stores:
 * - its position and the raw input exactly as written
 * - the compiled formula (null for literals), or the syntax error when the formula didn't parse
 * - the typed literal value for non-formula input
 * - the cached value and the state saying whether that cache can be served
 */
public class CellRecord {
    private final CellAddress address;
    private final String rawInput;
    private final Expr formula;
    private final SyntaxError syntaxError;
    private final EvalResult literal;
    // Contains TODAY(), NOW() or another volatile function
    private final boolean volatileFormula;

    private EvalResult cachedValue;
    private CellState state = CellState.DIRTY;

    private CellRecord(CellAddress address, String rawInput, Expr formula, SyntaxError syntaxError,
                       EvalResult literal, boolean volatileFormula) {
        this.address = address;
        this.rawInput = rawInput;
        this.formula = formula;
        this.syntaxError = syntaxError;
        this.literal = literal;
        this.volatileFormula = volatileFormula;
    }

    public static CellRecord literal(CellAddress address, String rawInput, EvalResult value) {
        return new CellRecord(address, rawInput, null, null, value, false);
    }

    public static CellRecord formula(CellAddress address, String rawInput, Expr formula, boolean volatileFormula) {
        return new CellRecord(address, rawInput, formula, null, null, volatileFormula);
    }

    public static CellRecord unparsable(CellAddress address, String rawInput, SyntaxError syntaxError) {
        return new CellRecord(address, rawInput, null, syntaxError, null, false);
    }

    public CellAddress getAddress() {
        return address;
    }
    public String getRawInput() {
        return rawInput;
    }

    public boolean isFormula() {
        return formula != null || syntaxError != null;
    }
    public Expr getFormula() {
        return formula;
    }
    public SyntaxError getSyntaxError() {
        return syntaxError;
    }
    public EvalResult getLiteral() {
        return literal;
    }
    public boolean isVolatile() {
        return volatileFormula;
    }

    public EvalResult getCachedValue() {
        return cachedValue;
    }

    /**
     * Caches a computed value and settles the cell: ERROR when the value is an error, CLEAN otherwise.
     */
    public void setCachedValue(EvalResult cachedValue) {
        this.cachedValue = cachedValue;
        this.state = cachedValue.isError() ? CellState.ERROR : CellState.CLEAN;
    }

    public CellState getState() {
        return state;
    }
    public void setState(CellState state) {
        this.state = state;
    }

    public boolean isSettled() {
        return state == CellState.CLEAN || state == CellState.ERROR;
    }
}
