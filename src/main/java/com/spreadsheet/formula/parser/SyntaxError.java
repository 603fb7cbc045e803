package com.spreadsheet.formula.parser;

/**
 * Why a formula could not be tokenized or parsed, and where.
 */
public final class SyntaxError {

    private final String message;
    private final int offset;

    public SyntaxError(String message, int offset) {
        this.message = message;
        this.offset = offset;
    }

    public String getMessage() {
        return message;
    }

    /**
     * 0-based position in the formula text as it was handed to the parser.
     */
    public int getOffset() {
        return offset;
    }

    @Override
    public String toString() {
        return message + " at offset " + offset;
    }
}
