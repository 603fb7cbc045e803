package com.spreadsheet.formula.functions;

import com.spreadsheet.formula.exceptions.FormulaErrorException;
import com.spreadsheet.formula.value.Coercions;
import com.spreadsheet.formula.value.EvalResult;

import java.util.OptionalDouble;
import java.util.stream.DoubleStream;

/**
 * Flattening rules shared by the numeric aggregates.
 *
 * Numbers contribute. Numeric-looking text contributes its parsed value.
 * Booleans contribute only when passed directly, not from inside a range.
 * Blanks and other text are skipped. Any error aborts the aggregate.
 */
final class Aggregates {

    private Aggregates() {
    }

    static double[] numbers(FunctionArguments args) {
        DoubleStream.Builder values = DoubleStream.builder();
        for (int i = 0; i < args.size(); i++) {
            EvalResult arg = args.get(i);
            if (arg.isMatrix()) {
                for (EvalResult cell : arg.getMatrix().flatten()) {
                    addFromRange(cell, values);
                }
            } else if (arg.isBoolean()) {
                values.add(arg.getBoolean() ? 1 : 0);
            } else {
                addFromRange(arg, values);
            }
        }
        return values.build().toArray();
    }

    /**
     * Non-blank values across all arguments, ranges flattened.
     */
    static int countNonBlank(FunctionArguments args) {
        int count = 0;
        for (int i = 0; i < args.size(); i++) {
            EvalResult arg = args.get(i);
            if (arg.isMatrix()) {
                for (EvalResult cell : arg.getMatrix().flatten()) {
                    if (cell.isError()) {
                        throw new FormulaErrorException(cell.getError());
                    }
                    if (!cell.isBlank()) {
                        count++;
                    }
                }
            } else if (!arg.isBlank()) {
                count++;
            }
        }
        return count;
    }

    /**
     * Numeric value of a range cell for conditional aggregates, or empty when it doesn't count.
     */
    static OptionalDouble numericValue(EvalResult cell) {
        switch (cell.getType()) {
            case NUMBER:
                return OptionalDouble.of(cell.getNumber());
            case TEXT:
                return Coercions.parseNumber(cell.getText());
            case ERROR:
                throw new FormulaErrorException(cell.getError());
            default:
                return OptionalDouble.empty();
        }
    }

    private static void addFromRange(EvalResult cell, DoubleStream.Builder values) {
        OptionalDouble value = numericValue(cell);
        if (value.isPresent()) {
            values.add(value.getAsDouble());
        }
    }
}
