package com.spreadsheet.formula.exceptions;

import com.spreadsheet.formula.value.ErrorKind;

/**
 * Carries a formula error out of coercions and function bodies.
 * Never crosses the evaluator boundary: the function invoker and the evaluator
 * turn it back into an error value.
 */
public class FormulaErrorException extends RuntimeException {

    private final ErrorKind errorKind;

    public FormulaErrorException(ErrorKind errorKind) {
        this(errorKind, errorKind.getDisplayToken());
    }

    public FormulaErrorException(ErrorKind errorKind, String message) {
        // No stack trace: these are raised on ordinary evaluation paths
        super(message, null, false, false);
        this.errorKind = errorKind;
    }

    public ErrorKind getErrorKind() {
        return errorKind;
    }
}
