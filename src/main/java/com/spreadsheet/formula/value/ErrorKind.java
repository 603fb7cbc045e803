package com.spreadsheet.formula.value;

/**
 * Formula error values, each with the token a host displays in the cell.
 */
public enum ErrorKind {
    DIVIDE_BY_ZERO("#DIV/0!"),
    NAME_NOT_FOUND("#NAME?"),
    INVALID_REFERENCE("#REF!"),
    CIRCULAR_REFERENCE("#CIRCULAR!"),
    TYPE_MISMATCH("#VALUE!"),
    NOT_AVAILABLE("#N/A"),
    INVALID_NUMBER("#NUM!"),
    PARSE_ERROR("#ERROR!");

    private final String displayToken;

    ErrorKind(String displayToken) {
        this.displayToken = displayToken;
    }

    public String getDisplayToken() {
        return displayToken;
    }
}
