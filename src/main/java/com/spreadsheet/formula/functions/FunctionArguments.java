package com.spreadsheet.formula.functions;

import com.spreadsheet.formula.value.EvalResult;
import com.spreadsheet.formula.value.RangeMatrix;

import java.time.Clock;
import java.util.ArrayList;
import java.util.List;
import java.util.function.Supplier;

/**
 * The arguments of one function call.
 * Each argument is evaluated at most once, on first access, so lazy functions
 * only pay for the branches they read.
 */
public final class FunctionArguments {

    private final FunctionDefinition definition;
    private final List<Supplier<EvalResult>> suppliers;
    private final EvalResult[] evaluated;
    private final Clock clock;

    public FunctionArguments(FunctionDefinition definition, List<Supplier<EvalResult>> suppliers, Clock clock) {
        this.definition = definition;
        this.suppliers = suppliers;
        this.evaluated = new EvalResult[suppliers.size()];
        this.clock = clock;
    }

    public int size() {
        return suppliers.size();
    }

    public boolean has(int index) {
        return index < suppliers.size();
    }

    /**
     * The argument as evaluated, errors included. Only error-handling functions should need this.
     */
    public EvalResult raw(int index) {
        if (evaluated[index] == null) {
            evaluated[index] = suppliers.get(index).get();
        }
        return evaluated[index];
    }

    /**
     * The argument after the parameter's coercion policy; an error argument is re-raised.
     */
    public EvalResult get(int index) {
        return definition.policyFor(index).coerce(raw(index));
    }

    public double number(int index) {
        return ArgumentPolicy.NUMBER.coerce(raw(index)).getNumber();
    }

    public double number(int index, double defaultValue) {
        return has(index) ? number(index) : defaultValue;
    }

    public String text(int index) {
        return ArgumentPolicy.TEXT.coerce(raw(index)).getText();
    }

    public boolean bool(int index, boolean defaultValue) {
        return has(index) ? ArgumentPolicy.LOGICAL.coerce(raw(index)).getBoolean() : defaultValue;
    }

    public RangeMatrix matrix(int index) {
        return ArgumentPolicy.RANGE.coerce(raw(index)).getMatrix();
    }

    /**
     * Every argument after coercion, in order.
     */
    public List<EvalResult> all() {
        List<EvalResult> result = new ArrayList<>(size());
        for (int i = 0; i < size(); i++) {
            result.add(get(i));
        }
        return result;
    }

    public Clock getClock() {
        return clock;
    }
}
