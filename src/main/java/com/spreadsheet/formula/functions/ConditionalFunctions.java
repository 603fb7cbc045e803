package com.spreadsheet.formula.functions;

import com.spreadsheet.formula.exceptions.FormulaErrorException;
import com.spreadsheet.formula.value.Coercions;
import com.spreadsheet.formula.value.ErrorKind;
import com.spreadsheet.formula.value.EvalResult;
import com.spreadsheet.formula.value.RangeMatrix;

import java.util.List;
import java.util.OptionalDouble;
import java.util.stream.DoubleStream;

/**
 * SUMIF, COUNTIF, AVERAGEIF. See {@link Criteria} for what a criterion can express.
 */
public final class ConditionalFunctions {

    private ConditionalFunctions() {
    }

    public static void registerAll(FunctionRegistry registry) {
        registry.register(FunctionDefinition.builder("SUMIF")
                .arity(Arity.between(2, 3))
                .params(ArgumentPolicy.RANGE, ArgumentPolicy.ANY, ArgumentPolicy.RANGE)
                .implementation(args -> {
                    double sum = 0;
                    for (double value : matchingValues(args)) {
                        sum += value;
                    }
                    return Coercions.finiteNumber(sum);
                })
                .build());

        registry.register(FunctionDefinition.builder("COUNTIF")
                .arity(Arity.exactly(2))
                .params(ArgumentPolicy.RANGE, ArgumentPolicy.ANY)
                .implementation(args -> {
                    Criteria criteria = Criteria.parse(Coercions.toScalar(args.get(1)));
                    int count = 0;
                    for (EvalResult cell : args.matrix(0).flatten()) {
                        if (criteria.matches(cell)) {
                            count++;
                        }
                    }
                    return EvalResult.number(count);
                })
                .build());

        registry.register(FunctionDefinition.builder("AVERAGEIF")
                .arity(Arity.between(2, 3))
                .params(ArgumentPolicy.RANGE, ArgumentPolicy.ANY, ArgumentPolicy.RANGE)
                .implementation(args -> {
                    double[] values = matchingValues(args);
                    if (values.length == 0) {
                        return EvalResult.error(ErrorKind.DIVIDE_BY_ZERO);
                    }
                    double sum = 0;
                    for (double value : values) {
                        sum += value;
                    }
                    return Coercions.finiteNumber(sum / values.length);
                })
                .build());
    }

    /**
     * Numeric values of the value range (the criteria range itself when omitted)
     * at the positions whose criteria cell matches.
     */
    private static double[] matchingValues(FunctionArguments args) {
        RangeMatrix criteriaRange = args.matrix(0);
        Criteria criteria = Criteria.parse(Coercions.toScalar(args.get(1)));
        RangeMatrix valueRange = args.has(2) ? args.matrix(2) : criteriaRange;
        if (!valueRange.sameShape(criteriaRange)) {
            throw new FormulaErrorException(ErrorKind.INVALID_REFERENCE,
                    "Value range and criteria range differ in shape");
        }
        List<EvalResult> tested = criteriaRange.flatten();
        List<EvalResult> values = valueRange.flatten();
        DoubleStream.Builder result = DoubleStream.builder();
        for (int i = 0; i < tested.size(); i++) {
            if (!criteria.matches(tested.get(i))) {
                continue;
            }
            OptionalDouble value = Aggregates.numericValue(values.get(i));
            if (value.isPresent()) {
                result.add(value.getAsDouble());
            }
        }
        return result.build().toArray();
    }
}
