package com.spreadsheet.formula.functions;

import com.spreadsheet.formula.value.Coercions;
import com.spreadsheet.formula.value.EvalResult;

/**
 * ISBLANK, ISNUMBER, ISTEXT, ISERROR, IFERROR.
 * Only ISERROR and IFERROR look at error values; the other predicates propagate them.
 */
public final class InfoFunctions {

    private InfoFunctions() {
    }

    public static void registerAll(FunctionRegistry registry) {
        registry.register(FunctionDefinition.builder("ISBLANK")
                .arity(Arity.exactly(1))
                .implementation(args -> EvalResult.bool(Coercions.toScalar(args.get(0)).isBlank()))
                .build());

        registry.register(FunctionDefinition.builder("ISNUMBER")
                .arity(Arity.exactly(1))
                .implementation(args -> EvalResult.bool(Coercions.toScalar(args.get(0)).isNumber()))
                .build());

        registry.register(FunctionDefinition.builder("ISTEXT")
                .arity(Arity.exactly(1))
                .implementation(args -> EvalResult.bool(Coercions.toScalar(args.get(0)).isText()))
                .build());

        registry.register(FunctionDefinition.builder("ISERROR")
                .arity(Arity.exactly(1))
                .lazy()
                .implementation(args -> EvalResult.bool(args.raw(0).isError()))
                .build());

        registry.register(FunctionDefinition.builder("IFERROR")
                .arity(Arity.exactly(2))
                .lazy()
                .implementation(args -> {
                    EvalResult value = args.raw(0);
                    return value.isError() ? args.get(1) : value;
                })
                .build());
    }
}
