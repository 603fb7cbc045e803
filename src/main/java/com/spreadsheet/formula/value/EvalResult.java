package com.spreadsheet.formula.value;

import java.util.Objects;

/**
 * The value of an expression or a cell: a number, text, boolean, blank,
 * a matrix of scalars (from a range reference) or an error.
 *
 * Immutable. Use the static factories; the accessors for a tag other than
 * {@link #getType()} throw {@link IllegalStateException}.
 */
public final class EvalResult {

    public static final EvalResult BLANK = new EvalResult(ValueType.BLANK, 0, null, false, null, null);
    public static final EvalResult TRUE = new EvalResult(ValueType.BOOLEAN, 0, null, true, null, null);
    public static final EvalResult FALSE = new EvalResult(ValueType.BOOLEAN, 0, null, false, null, null);
    public static final EvalResult EMPTY_TEXT = new EvalResult(ValueType.TEXT, 0, "", false, null, null);

    private final ValueType type;
    private final double number;
    private final String text;
    private final boolean bool;
    private final ErrorKind error;
    private final RangeMatrix matrix;

    private EvalResult(ValueType type, double number, String text, boolean bool, ErrorKind error, RangeMatrix matrix) {
        this.type = type;
        this.number = number;
        this.text = text;
        this.bool = bool;
        this.error = error;
        this.matrix = matrix;
    }

    public static EvalResult number(double value) {
        return new EvalResult(ValueType.NUMBER, value, null, false, null, null);
    }

    public static EvalResult text(String value) {
        Objects.requireNonNull(value, "text");
        if (value.isEmpty()) {
            return EMPTY_TEXT;
        }
        return new EvalResult(ValueType.TEXT, 0, value, false, null, null);
    }

    public static EvalResult bool(boolean value) {
        return value ? TRUE : FALSE;
    }

    public static EvalResult error(ErrorKind kind) {
        Objects.requireNonNull(kind, "kind");
        return new EvalResult(ValueType.ERROR, 0, null, false, kind, null);
    }

    public static EvalResult matrix(RangeMatrix value) {
        Objects.requireNonNull(value, "matrix");
        return new EvalResult(ValueType.MATRIX, 0, null, false, null, value);
    }

    public ValueType getType() {
        return type;
    }

    public boolean isNumber() {
        return type == ValueType.NUMBER;
    }
    public boolean isText() {
        return type == ValueType.TEXT;
    }
    public boolean isBoolean() {
        return type == ValueType.BOOLEAN;
    }
    public boolean isBlank() {
        return type == ValueType.BLANK;
    }
    public boolean isMatrix() {
        return type == ValueType.MATRIX;
    }
    public boolean isError() {
        return type == ValueType.ERROR;
    }

    public double getNumber() {
        expect(ValueType.NUMBER);
        return number;
    }

    public String getText() {
        expect(ValueType.TEXT);
        return text;
    }

    public boolean getBoolean() {
        expect(ValueType.BOOLEAN);
        return bool;
    }

    public ErrorKind getError() {
        expect(ValueType.ERROR);
        return error;
    }

    public RangeMatrix getMatrix() {
        expect(ValueType.MATRIX);
        return matrix;
    }

    private void expect(ValueType expected) {
        if (type != expected) {
            throw new IllegalStateException("Expected " + expected + " but value is " + type);
        }
    }

    /**
     * The text a host shows in the cell: numbers in the fixed locale-independent form,
     * TRUE/FALSE, the error token, or "" for blank.
     */
    public String toDisplayString() {
        switch (type) {
            case NUMBER:
                return Coercions.formatNumber(number);
            case TEXT:
                return text;
            case BOOLEAN:
                return bool ? "TRUE" : "FALSE";
            case BLANK:
                return "";
            case ERROR:
                return error.getDisplayToken();
            case MATRIX:
                return matrix.toString();
            default:
                throw new IllegalStateException("Unknown value type " + type);
        }
    }

    /**
     * Plain Java form for JSON views: Double, String, Boolean, null for blank,
     * the display token for errors.
     */
    public Object toJavaValue() {
        switch (type) {
            case NUMBER:
                return number;
            case TEXT:
                return text;
            case BOOLEAN:
                return bool;
            case BLANK:
                return null;
            default:
                return toDisplayString();
        }
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) {
            return true;
        }
        if (!(o instanceof EvalResult)) {
            return false;
        }
        EvalResult other = (EvalResult) o;
        if (type != other.type) {
            return false;
        }
        switch (type) {
            case NUMBER:
                return Double.compare(number, other.number) == 0;
            case TEXT:
                return text.equals(other.text);
            case BOOLEAN:
                return bool == other.bool;
            case ERROR:
                return error == other.error;
            case MATRIX:
                return matrix.equals(other.matrix);
            default:
                return true;
        }
    }

    @Override
    public int hashCode() {
        return Objects.hash(type, number, text, bool, error, matrix);
    }

    @Override
    public String toString() {
        if (type == ValueType.TEXT) {
            return "\"" + text + "\"";
        }
        return toDisplayString();
    }
}
