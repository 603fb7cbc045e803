package com.spreadsheet.formula.functions;

import com.spreadsheet.formula.exceptions.FormulaErrorException;
import com.spreadsheet.formula.value.Coercions;
import com.spreadsheet.formula.value.ErrorKind;
import com.spreadsheet.formula.value.EvalResult;

import java.util.ArrayList;
import java.util.List;

/**
 * IF, AND, OR, NOT, IFS.
 * IF and IFS are lazy: only the condition(s) read and the chosen branch are evaluated.
 */
public final class LogicalFunctions {

    private LogicalFunctions() {
    }

    public static void registerAll(FunctionRegistry registry) {
        registry.register(FunctionDefinition.builder("IF")
                .arity(Arity.between(2, 3))
                .params(ArgumentPolicy.LOGICAL, ArgumentPolicy.ANY)
                .lazy()
                .implementation(args -> {
                    if (args.get(0).getBoolean()) {
                        return args.get(1);
                    }
                    return args.has(2) ? args.get(2) : EvalResult.FALSE;
                })
                .build());

        registry.register(FunctionDefinition.builder("IFS")
                .arity(Arity.atLeast(2))
                .params(ArgumentPolicy.LOGICAL, ArgumentPolicy.ANY)
                .lazy()
                .implementation(args -> {
                    if (args.size() % 2 != 0) {
                        return EvalResult.error(ErrorKind.TYPE_MISMATCH);
                    }
                    for (int i = 0; i < args.size(); i += 2) {
                        if (Coercions.isTruthy(args.get(i))) {
                            return args.get(i + 1);
                        }
                    }
                    return EvalResult.error(ErrorKind.NOT_AVAILABLE);
                })
                .build());

        registry.register(FunctionDefinition.builder("AND")
                .arity(Arity.atLeast(1))
                .implementation(args -> {
                    List<EvalResult> values = logicalValues(args);
                    if (values.isEmpty()) {
                        return EvalResult.error(ErrorKind.TYPE_MISMATCH);
                    }
                    boolean result = true;
                    for (EvalResult value : values) {
                        result &= Coercions.isTruthy(value);
                    }
                    return EvalResult.bool(result);
                })
                .build());

        registry.register(FunctionDefinition.builder("OR")
                .arity(Arity.atLeast(1))
                .implementation(args -> {
                    List<EvalResult> values = logicalValues(args);
                    if (values.isEmpty()) {
                        return EvalResult.error(ErrorKind.TYPE_MISMATCH);
                    }
                    boolean result = false;
                    for (EvalResult value : values) {
                        result |= Coercions.isTruthy(value);
                    }
                    return EvalResult.bool(result);
                })
                .build());

        registry.register(FunctionDefinition.builder("NOT")
                .arity(Arity.exactly(1))
                .params(ArgumentPolicy.LOGICAL)
                .implementation(args -> EvalResult.bool(!args.get(0).getBoolean()))
                .build());
    }

    /**
     * Values AND/OR look at: direct arguments always, range cells only when numeric or boolean.
     */
    private static List<EvalResult> logicalValues(FunctionArguments args) {
        List<EvalResult> values = new ArrayList<>();
        for (EvalResult arg : args.all()) {
            if (!arg.isMatrix()) {
                values.add(arg);
                continue;
            }
            for (EvalResult cell : arg.getMatrix().flatten()) {
                if (cell.isError()) {
                    throw new FormulaErrorException(cell.getError());
                }
                if (cell.isNumber() || cell.isBoolean()) {
                    values.add(cell);
                }
            }
        }
        return values;
    }
}
