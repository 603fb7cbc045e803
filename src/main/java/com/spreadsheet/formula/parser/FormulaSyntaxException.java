package com.spreadsheet.formula.parser;

/**
 * Unwinds the tokenizer or parser on the first syntax problem.
 * Converted into a {@link SyntaxError} before leaving this package.
 */
class FormulaSyntaxException extends RuntimeException {

    private final int offset;

    FormulaSyntaxException(String message, int offset) {
        super(message, null, false, false);
        this.offset = offset;
    }

    SyntaxError toSyntaxError() {
        return new SyntaxError(getMessage(), offset);
    }
}
