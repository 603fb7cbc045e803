package com.spreadsheet.formula.functions;

import com.spreadsheet.formula.value.Coercions;
import com.spreadsheet.formula.value.EvalResult;

import java.util.OptionalDouble;
import java.util.regex.Pattern;

/**
 * A SUMIF/COUNTIF/AVERAGEIF criterion such as 5, "apple", ">=10", "<>done" or "a*".
 *
 * - a leading =, <>, <, >, <= or >= selects the comparison (default equality)
 * - a numeric operand compares numerically against numeric cells (numeric-looking text included)
 * - a text operand compares case-insensitively; for = and <> it may use * and ? wildcards
 * - an empty operand matches blank cells ("=") or non-blank cells ("<>")
 */
final class Criteria {

    private enum Operator { EQUAL, NOT_EQUAL, LESS, GREATER, LESS_EQUAL, GREATER_EQUAL }

    private final Operator operator;
    private final EvalResult operand;
    private final Pattern wildcard;

    private Criteria(Operator operator, EvalResult operand) {
        this.operator = operator;
        this.operand = operand;
        this.wildcard = operand.isText() && hasWildcards(operand.getText())
                ? globToPattern(operand.getText()) : null;
    }

    static Criteria parse(EvalResult criterion) {
        if (!criterion.isText()) {
            return new Criteria(Operator.EQUAL, criterion);
        }
        String text = criterion.getText();
        Operator operator = Operator.EQUAL;
        String rest = text;
        if (text.startsWith("<=")) {
            operator = Operator.LESS_EQUAL;
            rest = text.substring(2);
        } else if (text.startsWith(">=")) {
            operator = Operator.GREATER_EQUAL;
            rest = text.substring(2);
        } else if (text.startsWith("<>")) {
            operator = Operator.NOT_EQUAL;
            rest = text.substring(2);
        } else if (text.startsWith("<")) {
            operator = Operator.LESS;
            rest = text.substring(1);
        } else if (text.startsWith(">")) {
            operator = Operator.GREATER;
            rest = text.substring(1);
        } else if (text.startsWith("=")) {
            rest = text.substring(1);
        }
        return new Criteria(operator, operandValue(rest));
    }

    private static EvalResult operandValue(String text) {
        if (text.isEmpty()) {
            return EvalResult.BLANK;
        }
        OptionalDouble number = Coercions.parseNumber(text);
        if (number.isPresent()) {
            return EvalResult.number(number.getAsDouble());
        }
        if ("TRUE".equalsIgnoreCase(text) || "FALSE".equalsIgnoreCase(text)) {
            return EvalResult.bool("TRUE".equalsIgnoreCase(text));
        }
        return EvalResult.text(text);
    }

    boolean matches(EvalResult cell) {
        if (cell.isError()) {
            return false;
        }
        if (operand.isBlank()) {
            boolean blank = cell.isBlank() || (cell.isText() && cell.getText().isEmpty());
            return operator == Operator.NOT_EQUAL ? !blank : operator == Operator.EQUAL && blank;
        }
        if (operator == Operator.EQUAL) {
            return equalTo(cell);
        }
        if (operator == Operator.NOT_EQUAL) {
            return !equalTo(cell);
        }
        Integer comparison = compareTo(cell);
        if (comparison == null) {
            return false;
        }
        switch (operator) {
            case LESS:
                return comparison < 0;
            case GREATER:
                return comparison > 0;
            case LESS_EQUAL:
                return comparison <= 0;
            case GREATER_EQUAL:
                return comparison >= 0;
            default:
                return false;
        }
    }

    private boolean equalTo(EvalResult cell) {
        if (wildcard != null) {
            return (cell.isText() || cell.isNumber()) && wildcard.matcher(Coercions.toText(cell)).matches();
        }
        Integer comparison = compareTo(cell);
        return comparison != null && comparison == 0;
    }

    /**
     * cell compared to the operand, or null when they are not comparable.
     */
    private Integer compareTo(EvalResult cell) {
        if (operand.isNumber()) {
            OptionalDouble value = numeric(cell);
            return value.isPresent() ? Double.compare(value.getAsDouble(), operand.getNumber()) : null;
        }
        if (cell.isBlank()) {
            return null;
        }
        if (Coercions.sameKind(cell, operand)) {
            return Coercions.compare(cell, operand);
        }
        return null;
    }

    private static OptionalDouble numeric(EvalResult cell) {
        if (cell.isNumber()) {
            return OptionalDouble.of(cell.getNumber());
        }
        if (cell.isText()) {
            return Coercions.parseNumber(cell.getText());
        }
        return OptionalDouble.empty();
    }

    static boolean hasWildcards(String text) {
        return text.indexOf('*') >= 0 || text.indexOf('?') >= 0;
    }

    /**
     * "a*b?" -> case-insensitive ^a.*b.$ with everything else quoted.
     */
    static Pattern globToPattern(String glob) {
        StringBuilder regex = new StringBuilder();
        StringBuilder literal = new StringBuilder();
        for (char c : glob.toCharArray()) {
            if (c == '*' || c == '?') {
                if (literal.length() > 0) {
                    regex.append(Pattern.quote(literal.toString()));
                    literal.setLength(0);
                }
                regex.append(c == '*' ? ".*" : ".");
            } else {
                literal.append(c);
            }
        }
        if (literal.length() > 0) {
            regex.append(Pattern.quote(literal.toString()));
        }
        return Pattern.compile(regex.toString(), Pattern.CASE_INSENSITIVE | Pattern.UNICODE_CASE | Pattern.DOTALL);
    }
}
