package com.spreadsheet.formula.ast;

public final class BinaryOp extends Expr {

    private final BinaryOperator operator;
    private final Expr left;
    private final Expr right;

    public BinaryOp(BinaryOperator operator, Expr left, Expr right, int offset) {
        super(offset);
        this.operator = operator;
        this.left = left;
        this.right = right;
    }

    public BinaryOperator getOperator() {
        return operator;
    }

    public Expr getLeft() {
        return left;
    }

    public Expr getRight() {
        return right;
    }

    @Override
    public <R> R accept(ExprVisitor<R> visitor) {
        return visitor.visitBinary(this);
    }
}
