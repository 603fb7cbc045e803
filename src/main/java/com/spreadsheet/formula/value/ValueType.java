package com.spreadsheet.formula.value;

/**
 * The tag of an {@link EvalResult}.
 */
public enum ValueType {
    NUMBER,
    TEXT,
    BOOLEAN,
    BLANK,
    MATRIX,
    ERROR
}
