package com.spreadsheet.formula.ast;

/**
 * A node of a parsed formula.
 * Nodes are immutable and remember the offset in the formula text where they start.
 */
public abstract class Expr {

    private final int offset;

    protected Expr(int offset) {
        this.offset = offset;
    }

    public int getOffset() {
        return offset;
    }

    public abstract <R> R accept(ExprVisitor<R> visitor);

    /**
     * The formula text for this node, without a leading '='.
     */
    @Override
    public String toString() {
        return FormulaWriter.write(this);
    }
}
