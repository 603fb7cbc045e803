package com.spreadsheet.formula.exceptions;

/**
 * Thrown when a request names a cell address that can't be parsed, e.g. "A0" or "ABCD1".
 */
public class InvalidReferenceException extends RuntimeException {
    public InvalidReferenceException(String message) {
        super(message);
    }
}
