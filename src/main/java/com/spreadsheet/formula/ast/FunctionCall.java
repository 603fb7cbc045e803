package com.spreadsheet.formula.ast;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Locale;

public final class FunctionCall extends Expr {

    private final String name;
    private final List<Expr> arguments;

    /**
     * @param name function name as written; stored upper-cased
     */
    public FunctionCall(String name, List<Expr> arguments, int offset) {
        super(offset);
        this.name = name.toUpperCase(Locale.ROOT);
        this.arguments = Collections.unmodifiableList(new ArrayList<>(arguments));
    }

    public String getName() {
        return name;
    }

    public List<Expr> getArguments() {
        return arguments;
    }

    @Override
    public <R> R accept(ExprVisitor<R> visitor) {
        return visitor.visitFunctionCall(this);
    }
}
