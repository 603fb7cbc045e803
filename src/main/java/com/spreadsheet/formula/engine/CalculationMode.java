package com.spreadsheet.formula.engine;

public enum CalculationMode {
    /** Every write is followed by a recalculation pass. */
    AUTOMATIC,
    /** Writes only mark cells dirty; a pass runs on {@code recalculate()}. */
    MANUAL
}
