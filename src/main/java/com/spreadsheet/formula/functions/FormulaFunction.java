package com.spreadsheet.formula.functions;

import com.spreadsheet.formula.value.EvalResult;

/**
 * The body of a formula function.
 * Implementations may throw {@link com.spreadsheet.formula.exceptions.FormulaErrorException};
 * the invoker turns it into an error value.
 */
@FunctionalInterface
public interface FormulaFunction {

    EvalResult apply(FunctionArguments args);
}
