package com.spreadsheet.formula.functions;

import com.spreadsheet.formula.exceptions.FormulaErrorException;
import com.spreadsheet.formula.value.Coercions;
import com.spreadsheet.formula.value.ErrorKind;
import com.spreadsheet.formula.value.EvalResult;

import java.math.BigDecimal;
import java.math.RoundingMode;

/**
 * SUM, AVERAGE, COUNT, COUNTA, MAX, MIN, PRODUCT, ROUND, ABS, POWER, SQRT, MOD.
 */
public final class MathFunctions {

    // Past the largest double, so every value rounds to zero
    private static final double MIN_ROUND_DIGITS = -309;

    private MathFunctions() {
    }

    public static void registerAll(FunctionRegistry registry) {
        registry.register(aggregate("SUM", args -> {
            double sum = 0;
            for (double value : Aggregates.numbers(args)) {
                sum += value;
            }
            return Coercions.finiteNumber(sum);
        }));

        registry.register(aggregate("AVERAGE", args -> {
            double[] values = Aggregates.numbers(args);
            if (values.length == 0) {
                return EvalResult.error(ErrorKind.DIVIDE_BY_ZERO);
            }
            double sum = 0;
            for (double value : values) {
                sum += value;
            }
            return Coercions.finiteNumber(sum / values.length);
        }));

        registry.register(aggregate("COUNT", args -> EvalResult.number(Aggregates.numbers(args).length)));
        registry.register(aggregate("COUNTA", args -> EvalResult.number(Aggregates.countNonBlank(args))));

        registry.register(aggregate("MAX", args -> {
            double[] values = Aggregates.numbers(args);
            if (values.length == 0) {
                return EvalResult.number(0);
            }
            double max = Double.NEGATIVE_INFINITY;
            for (double value : values) {
                max = Math.max(max, value);
            }
            return EvalResult.number(max);
        }));

        registry.register(aggregate("MIN", args -> {
            double[] values = Aggregates.numbers(args);
            if (values.length == 0) {
                return EvalResult.number(0);
            }
            double min = Double.POSITIVE_INFINITY;
            for (double value : values) {
                min = Math.min(min, value);
            }
            return EvalResult.number(min);
        }));

        registry.register(aggregate("PRODUCT", args -> {
            double[] values = Aggregates.numbers(args);
            if (values.length == 0) {
                return EvalResult.number(0);
            }
            double product = 1;
            for (double value : values) {
                product *= value;
            }
            return Coercions.finiteNumber(product);
        }));

        registry.register(FunctionDefinition.builder("ROUND")
                .arity(Arity.between(1, 2))
                .params(ArgumentPolicy.NUMBER)
                .implementation(args -> EvalResult.number(round(args.number(0), args.number(1, 0))))
                .build());

        registry.register(FunctionDefinition.builder("ABS")
                .arity(Arity.exactly(1))
                .params(ArgumentPolicy.NUMBER)
                .implementation(args -> EvalResult.number(Math.abs(args.number(0))))
                .build());

        registry.register(FunctionDefinition.builder("POWER")
                .arity(Arity.exactly(2))
                .params(ArgumentPolicy.NUMBER)
                .implementation(args -> Coercions.finiteNumber(Math.pow(args.number(0), args.number(1))))
                .build());

        registry.register(FunctionDefinition.builder("SQRT")
                .arity(Arity.exactly(1))
                .params(ArgumentPolicy.NUMBER)
                .implementation(args -> {
                    double value = args.number(0);
                    if (value < 0) {
                        return EvalResult.error(ErrorKind.INVALID_NUMBER);
                    }
                    return EvalResult.number(Math.sqrt(value));
                })
                .build());

        registry.register(FunctionDefinition.builder("MOD")
                .arity(Arity.exactly(2))
                .params(ArgumentPolicy.NUMBER)
                .implementation(args -> EvalResult.number(mod(args.number(0), args.number(1))))
                .build());
    }

    private static FunctionDefinition aggregate(String name, FormulaFunction body) {
        return FunctionDefinition.builder(name)
                .arity(Arity.atLeast(1))
                .params(ArgumentPolicy.ANY)
                .implementation(body)
                .build();
    }

    /**
     * Half away from zero; negative digits round to the left of the decimal point.
     */
    static double round(double value, double digits) {
        if (Double.isNaN(digits)) {
            throw new FormulaErrorException(ErrorKind.INVALID_NUMBER);
        }
        BigDecimal exact = BigDecimal.valueOf(value);
        if (digits >= exact.scale()) {
            return value;
        }
        if (digits <= MIN_ROUND_DIGITS) {
            return 0;
        }
        return exact.setScale((int) digits, RoundingMode.HALF_UP).doubleValue();
    }

    /**
     * The result takes the sign of the divisor.
     */
    static double mod(double dividend, double divisor) {
        if (divisor == 0) {
            throw new FormulaErrorException(ErrorKind.DIVIDE_BY_ZERO);
        }
        return dividend - divisor * Math.floor(dividend / divisor);
    }
}
