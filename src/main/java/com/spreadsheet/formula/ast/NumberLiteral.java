package com.spreadsheet.formula.ast;

public final class NumberLiteral extends Expr {

    private final double value;

    public NumberLiteral(double value, int offset) {
        super(offset);
        this.value = value;
    }

    public double getValue() {
        return value;
    }

    @Override
    public <R> R accept(ExprVisitor<R> visitor) {
        return visitor.visitNumber(this);
    }
}
