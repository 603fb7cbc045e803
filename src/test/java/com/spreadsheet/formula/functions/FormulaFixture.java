package com.spreadsheet.formula.functions;

import com.spreadsheet.formula.address.CellAddress;
import com.spreadsheet.formula.engine.EngineSettings;
import com.spreadsheet.formula.engine.RecalculationEngine;
import com.spreadsheet.formula.models.Workbook;
import com.spreadsheet.formula.value.ErrorKind;
import com.spreadsheet.formula.value.EvalResult;

import java.time.Clock;

/**
 * A one-sheet workbook for exercising functions through real formulas.
 */
class FormulaFixture {

    private final RecalculationEngine engine;

    FormulaFixture() {
        this(Clock.systemDefaultZone());
    }

    FormulaFixture(Clock clock) {
        this(FunctionRegistry.withBuiltins(), clock);
    }

    FormulaFixture(FunctionRegistry functions, Clock clock) {
        this.engine = new RecalculationEngine(new Workbook("Sheet1"), functions,
                EngineSettings.defaults().setClock(clock));
    }

    FormulaFixture set(String address, String rawInput) {
        engine.setRawValue(CellAddress.parse(address).orElseThrow(), rawInput);
        return this;
    }

    EvalResult eval(String formula) {
        return engine.evaluateFormula(formula, null);
    }

    static EvalResult number(double value) {
        return EvalResult.number(value);
    }

    static EvalResult text(String value) {
        return EvalResult.text(value);
    }

    static EvalResult error(ErrorKind kind) {
        return EvalResult.error(kind);
    }
}
