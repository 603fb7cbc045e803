package com.spreadsheet.formula.models;

/**
 * Lifecycle of a cell's cached value.
 * DIRTY cells need evaluation; CLEAN and ERROR cells are settled and serve their cached value.
 */
public enum CellState {
    CLEAN,
    DIRTY,
    EVALUATING,
    ERROR
}
