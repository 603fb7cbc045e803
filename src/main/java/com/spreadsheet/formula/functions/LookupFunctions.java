package com.spreadsheet.formula.functions;

import com.spreadsheet.formula.exceptions.FormulaErrorException;
import com.spreadsheet.formula.value.Coercions;
import com.spreadsheet.formula.value.ErrorKind;
import com.spreadsheet.formula.value.EvalResult;
import com.spreadsheet.formula.value.RangeMatrix;

import java.util.List;
import java.util.regex.Pattern;

/**
 * VLOOKUP, HLOOKUP, INDEX, MATCH.
 */
public final class LookupFunctions {

    private LookupFunctions() {
    }

    public static void registerAll(FunctionRegistry registry) {
        registry.register(FunctionDefinition.builder("VLOOKUP")
                .arity(Arity.between(3, 4))
                .params(ArgumentPolicy.ANY, ArgumentPolicy.RANGE, ArgumentPolicy.NUMBER, ArgumentPolicy.LOGICAL)
                .implementation(args -> {
                    RangeMatrix table = args.matrix(1);
                    int column = index(args.number(2), table.getColumns());
                    int row = find(Coercions.toScalar(args.get(0)), table.column(0), args.bool(3, true));
                    return table.get(row, column - 1);
                })
                .build());

        registry.register(FunctionDefinition.builder("HLOOKUP")
                .arity(Arity.between(3, 4))
                .params(ArgumentPolicy.ANY, ArgumentPolicy.RANGE, ArgumentPolicy.NUMBER, ArgumentPolicy.LOGICAL)
                .implementation(args -> {
                    RangeMatrix table = args.matrix(1);
                    int row = index(args.number(2), table.getRows());
                    int column = find(Coercions.toScalar(args.get(0)), table.row(0), args.bool(3, true));
                    return table.get(row - 1, column);
                })
                .build());

        registry.register(FunctionDefinition.builder("INDEX")
                .arity(Arity.between(2, 3))
                .params(ArgumentPolicy.RANGE, ArgumentPolicy.NUMBER)
                .implementation(args -> {
                    RangeMatrix array = args.matrix(0);
                    int first = (int) args.number(1);
                    if (!args.has(2)) {
                        if (array.getRows() == 1) {
                            return array.get(0, position(first, array.getColumns()));
                        }
                        if (array.getColumns() == 1) {
                            return array.get(position(first, array.getRows()), 0);
                        }
                    }
                    int second = (int) args.number(2, 1);
                    return array.get(position(first, array.getRows()), position(second, array.getColumns()));
                })
                .build());

        registry.register(FunctionDefinition.builder("MATCH")
                .arity(Arity.between(2, 3))
                .params(ArgumentPolicy.ANY, ArgumentPolicy.RANGE, ArgumentPolicy.NUMBER)
                .implementation(args -> {
                    RangeMatrix array = args.matrix(1);
                    List<EvalResult> values;
                    if (array.getRows() == 1) {
                        values = array.row(0);
                    } else if (array.getColumns() == 1) {
                        values = array.column(0);
                    } else {
                        return EvalResult.error(ErrorKind.NOT_AVAILABLE);
                    }
                    EvalResult key = Coercions.toScalar(args.get(0));
                    int type = (int) Math.signum(args.number(2, 1));
                    int found = type == 0 ? exactMatch(key, values) : approximateMatch(key, values, type);
                    if (found < 0) {
                        return EvalResult.error(ErrorKind.NOT_AVAILABLE);
                    }
                    return EvalResult.number(found + 1);
                })
                .build());
    }

    /**
     * 1-based column/row index for VLOOKUP and HLOOKUP.
     */
    private static int index(double requested, int size) {
        int index = (int) requested;
        if (index < 1) {
            throw new FormulaErrorException(ErrorKind.TYPE_MISMATCH,
                    "Index must be at least 1");
        }
        if (index > size) {
            throw new FormulaErrorException(ErrorKind.INVALID_REFERENCE,
                    "Index " + index + " is outside the table");
        }
        return index;
    }

    /**
     * 0-based position for INDEX; 0 and out-of-bounds are reference errors.
     */
    private static int position(int requested, int size) {
        if (requested < 1 || requested > size) {
            throw new FormulaErrorException(ErrorKind.INVALID_REFERENCE,
                    "Index " + requested + " is outside the range");
        }
        return requested - 1;
    }

    private static int find(EvalResult key, List<EvalResult> keys, boolean approximate) {
        int found = approximate ? approximateMatch(key, keys, 1) : exactMatch(key, keys);
        if (found < 0) {
            throw new FormulaErrorException(ErrorKind.NOT_AVAILABLE);
        }
        return found;
    }

    /**
     * First key equal to the lookup value; text lookups may use * and ? wildcards.
     */
    static int exactMatch(EvalResult key, List<EvalResult> keys) {
        Pattern wildcard = key.isText() && Criteria.hasWildcards(key.getText())
                ? Criteria.globToPattern(key.getText()) : null;
        for (int i = 0; i < keys.size(); i++) {
            EvalResult candidate = keys.get(i);
            if (candidate.isError() || candidate.isBlank()) {
                continue;
            }
            if (wildcard != null) {
                if (candidate.isText() && wildcard.matcher(candidate.getText()).matches()) {
                    return i;
                }
            } else if (Coercions.sameKind(candidate, key) && Coercions.compare(candidate, key) == 0) {
                return i;
            }
        }
        return -1;
    }

    /**
     * Type 1: last key of the same kind that is &lt;= the lookup value.
     * Type -1: last key of the same kind that is &gt;= the lookup value.
     * An equal key wins at once; otherwise keys are scanned in order, so unsorted keys
     * give the last qualifying position.
     */
    static int approximateMatch(EvalResult key, List<EvalResult> keys, int type) {
        int found = -1;
        for (int i = 0; i < keys.size(); i++) {
            EvalResult candidate = keys.get(i);
            if (candidate.isError() || candidate.isBlank() || !Coercions.sameKind(candidate, key)) {
                continue;
            }
            int comparison = Coercions.compare(candidate, key);
            if (comparison == 0) {
                return i;
            }
            if (type > 0 ? comparison < 0 : comparison > 0) {
                found = i;
            }
        }
        return found;
    }
}
