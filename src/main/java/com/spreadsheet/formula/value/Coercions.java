package com.spreadsheet.formula.value;

import com.spreadsheet.formula.exceptions.FormulaErrorException;

import java.math.BigDecimal;
import java.math.MathContext;
import java.util.OptionalDouble;
import java.util.regex.Pattern;

/**
 * Conversions between value types, shared by operators and functions.
 * Coercions that cannot produce a value throw {@link FormulaErrorException};
 * an error value handed to a coercion is re-raised unchanged.
 */
public final class Coercions {

    private static final Pattern NUMERIC_TEXT =
            Pattern.compile("^[+-]?(\\d+(\\.\\d*)?|\\.\\d+)([eE][+-]?\\d+)?$");
    private static final String CURRENCY_SYMBOLS = "$€£¥";
    private static final MathContext DISPLAY_PRECISION = new MathContext(15);

    private Coercions() {
    }

    /**
     * Reads numeric-looking text: " 1,200.50 ", "$42", "-€3", "15%".
     * Anything else is empty.
     */
    public static OptionalDouble parseNumber(String text) {
        if (text == null) {
            return OptionalDouble.empty();
        }
        String s = text.trim();
        boolean percent = s.endsWith("%");
        if (percent) {
            s = s.substring(0, s.length() - 1).trim();
        }
        StringBuilder cleaned = new StringBuilder(s.length());
        for (int i = 0; i < s.length(); i++) {
            char c = s.charAt(i);
            if (c == ',' || CURRENCY_SYMBOLS.indexOf(c) >= 0) {
                continue;
            }
            cleaned.append(c);
        }
        String candidate = cleaned.toString();
        if (!NUMERIC_TEXT.matcher(candidate).matches()) {
            return OptionalDouble.empty();
        }
        double value = Double.parseDouble(candidate);
        return OptionalDouble.of(percent ? value / 100 : value);
    }

    /**
     * Strict numeric coercion for operators and scalar numeric parameters.
     */
    public static double toNumber(EvalResult value) {
        switch (value.getType()) {
            case NUMBER:
                return value.getNumber();
            case BLANK:
                return 0;
            case BOOLEAN:
                return value.getBoolean() ? 1 : 0;
            case TEXT:
                OptionalDouble parsed = parseNumber(value.getText());
                if (parsed.isPresent()) {
                    return parsed.getAsDouble();
                }
                throw new FormulaErrorException(ErrorKind.TYPE_MISMATCH, "Not a number: " + value.getText());
            case ERROR:
                throw new FormulaErrorException(value.getError());
            case MATRIX:
                return toNumber(toScalar(value));
            default:
                throw new FormulaErrorException(ErrorKind.TYPE_MISMATCH);
        }
    }

    public static String toText(EvalResult value) {
        switch (value.getType()) {
            case NUMBER:
                return formatNumber(value.getNumber());
            case TEXT:
                return value.getText();
            case BOOLEAN:
                return value.getBoolean() ? "TRUE" : "FALSE";
            case BLANK:
                return "";
            case ERROR:
                throw new FormulaErrorException(value.getError());
            case MATRIX:
                return toText(toScalar(value));
            default:
                throw new FormulaErrorException(ErrorKind.TYPE_MISMATCH);
        }
    }

    /**
     * Truthiness: nonzero numbers, TRUE, and non-empty text other than "FALSE" or "0".
     */
    public static boolean isTruthy(EvalResult value) {
        switch (value.getType()) {
            case NUMBER:
                return value.getNumber() != 0;
            case BOOLEAN:
                return value.getBoolean();
            case TEXT:
                String text = value.getText().trim();
                return !text.isEmpty() && !"FALSE".equalsIgnoreCase(text) && !"0".equals(text);
            case BLANK:
                return false;
            case ERROR:
                throw new FormulaErrorException(value.getError());
            case MATRIX:
                return isTruthy(toScalar(value));
            default:
                throw new FormulaErrorException(ErrorKind.TYPE_MISMATCH);
        }
    }

    /**
     * A number result; NaN and infinities become InvalidNumber.
     */
    public static EvalResult finiteNumber(double value) {
        if (Double.isNaN(value) || Double.isInfinite(value)) {
            throw new FormulaErrorException(ErrorKind.INVALID_NUMBER, "Not a finite number");
        }
        return EvalResult.number(value);
    }

    /**
     * Unwraps a 1x1 matrix; any larger matrix cannot stand where one value is expected.
     */
    public static EvalResult toScalar(EvalResult value) {
        if (!value.isMatrix()) {
            return value;
        }
        RangeMatrix matrix = value.getMatrix();
        if (matrix.size() == 1) {
            return matrix.get(0, 0);
        }
        throw new FormulaErrorException(ErrorKind.TYPE_MISMATCH, "Range used where a single value is expected");
    }

    /**
     * Fixed, locale-independent number text: integers without a decimal point,
     * everything else rounded to 15 significant digits without trailing zeros or exponent.
     */
    public static String formatNumber(double value) {
        if (value == 0) {
            return "0";
        }
        if (value == Math.rint(value) && Math.abs(value) < 1e15) {
            return Long.toString((long) value);
        }
        return new BigDecimal(value).round(DISPLAY_PRECISION).stripTrailingZeros().toPlainString();
    }

    /**
     * Total order used by comparison operators and lookups:
     * numbers, then text (case-insensitive), then booleans (FALSE before TRUE).
     * A blank takes the type of the other side.
     */
    public static int compare(EvalResult left, EvalResult right) {
        EvalResult a = adaptBlank(left, right);
        EvalResult b = adaptBlank(right, left);
        int rankDiff = rank(a) - rank(b);
        if (rankDiff != 0) {
            return rankDiff;
        }
        switch (a.getType()) {
            case NUMBER:
                return Double.compare(a.getNumber(), b.getNumber());
            case TEXT:
                return a.getText().compareToIgnoreCase(b.getText());
            case BOOLEAN:
                return Boolean.compare(a.getBoolean(), b.getBoolean());
            default:
                return 0;
        }
    }

    /**
     * Whether two scalars are of the same kind once blanks are adapted.
     * Values of different kinds are never equal.
     */
    public static boolean sameKind(EvalResult left, EvalResult right) {
        return rank(adaptBlank(left, right)) == rank(adaptBlank(right, left));
    }

    private static EvalResult adaptBlank(EvalResult value, EvalResult other) {
        if (!value.isBlank()) {
            return value;
        }
        switch (other.getType()) {
            case NUMBER:
                return EvalResult.number(0);
            case TEXT:
                return EvalResult.EMPTY_TEXT;
            case BOOLEAN:
                return EvalResult.FALSE;
            default:
                return value;
        }
    }

    private static int rank(EvalResult value) {
        switch (value.getType()) {
            case NUMBER:
                return 0;
            case TEXT:
                return 1;
            case BOOLEAN:
                return 2;
            case BLANK:
                return -1;
            default:
                throw new FormulaErrorException(ErrorKind.TYPE_MISMATCH, "Cannot compare " + value.getType());
        }
    }
}
