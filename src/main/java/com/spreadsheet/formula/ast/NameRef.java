package com.spreadsheet.formula.ast;

/**
 * A bare identifier that is neither a function call nor a valid cell address.
 * What it refers to is decided when the formula is evaluated.
 */
public final class NameRef extends Expr {

    private final String name;

    public NameRef(String name, int offset) {
        super(offset);
        this.name = name;
    }

    public String getName() {
        return name;
    }

    @Override
    public <R> R accept(ExprVisitor<R> visitor) {
        return visitor.visitName(this);
    }
}
