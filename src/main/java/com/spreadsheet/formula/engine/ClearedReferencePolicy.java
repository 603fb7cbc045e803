package com.spreadsheet.formula.engine;

/**
 * What a formula sees when it references a single cell that has been cleared.
 * Ranges always see cleared cells as blank.
 */
public enum ClearedReferencePolicy {
    INVALID_REFERENCE,
    BLANK
}
