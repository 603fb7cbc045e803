package com.spreadsheet.formula.ast;

public final class BoolLiteral extends Expr {

    private final boolean value;

    public BoolLiteral(boolean value, int offset) {
        super(offset);
        this.value = value;
    }

    public boolean getValue() {
        return value;
    }

    @Override
    public <R> R accept(ExprVisitor<R> visitor) {
        return visitor.visitBool(this);
    }
}
