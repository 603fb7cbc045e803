package com.spreadsheet.formula.ast;

public final class UnaryOp extends Expr {

    private final UnaryOperator operator;
    private final Expr operand;

    public UnaryOp(UnaryOperator operator, Expr operand, int offset) {
        super(offset);
        this.operator = operator;
        this.operand = operand;
    }

    public UnaryOperator getOperator() {
        return operator;
    }

    public Expr getOperand() {
        return operand;
    }

    @Override
    public <R> R accept(ExprVisitor<R> visitor) {
        return visitor.visitUnary(this);
    }
}
