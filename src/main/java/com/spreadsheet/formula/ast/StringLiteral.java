package com.spreadsheet.formula.ast;

public final class StringLiteral extends Expr {

    private final String value;

    public StringLiteral(String value, int offset) {
        super(offset);
        this.value = value;
    }

    public String getValue() {
        return value;
    }

    @Override
    public <R> R accept(ExprVisitor<R> visitor) {
        return visitor.visitString(this);
    }
}
