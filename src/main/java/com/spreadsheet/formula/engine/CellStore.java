package com.spreadsheet.formula.engine;

import com.spreadsheet.formula.address.CellAddress;
import com.spreadsheet.formula.value.EvalResult;

import java.util.Optional;

/**
 * Raw and computed cell values as a host sees them.
 */
public interface CellStore {

    /**
     * The input exactly as written, or empty for an empty cell.
     */
    Optional<String> getRawValue(CellAddress address);

    /**
     * The cell's value, evaluating it first when it is out of date.
     */
    EvalResult getComputedValue(CellAddress address);

    /**
     * Writes raw input; a leading '=' makes it a formula, empty input clears the cell.
     */
    void setRawValue(CellAddress address, String rawInput);
}
