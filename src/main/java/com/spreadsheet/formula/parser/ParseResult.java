package com.spreadsheet.formula.parser;

import java.util.Objects;

/**
 * Either a parsed value or the syntax error that prevented it.
 */
public final class ParseResult<T> {

    private final T value;
    private final SyntaxError error;

    private ParseResult(T value, SyntaxError error) {
        this.value = value;
        this.error = error;
    }

    public static <T> ParseResult<T> success(T value) {
        return new ParseResult<>(Objects.requireNonNull(value, "value"), null);
    }

    public static <T> ParseResult<T> failure(SyntaxError error) {
        return new ParseResult<>(null, Objects.requireNonNull(error, "error"));
    }

    public boolean isSuccess() {
        return error == null;
    }

    public T getValue() {
        if (error != null) {
            throw new IllegalStateException("Parse failed: " + error);
        }
        return value;
    }

    public SyntaxError getError() {
        if (error == null) {
            throw new IllegalStateException("Parse succeeded");
        }
        return error;
    }

    @Override
    public String toString() {
        return isSuccess() ? "success(" + value + ")" : "failure(" + error + ")";
    }
}
