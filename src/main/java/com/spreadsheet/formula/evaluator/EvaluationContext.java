package com.spreadsheet.formula.evaluator;

import com.spreadsheet.formula.address.CellAddress;
import com.spreadsheet.formula.address.CellRange;
import com.spreadsheet.formula.value.EvalResult;

import java.time.Clock;

/**
 * What a formula can see while it is evaluated.
 * References handed to the context are already qualified with a sheet.
 */
public interface EvaluationContext {

    /**
     * Sheet that unqualified references in the formula belong to.
     */
    String getSheetName();

    /**
     * Current value of one cell; Blank for an empty cell.
     */
    EvalResult resolveCell(CellAddress address);

    /**
     * Row-major matrix of the range's values, or an error value when the range cannot be read.
     */
    EvalResult resolveRange(CellRange range);

    Clock getClock();
}
