package com.spreadsheet.formula.ast;

import com.spreadsheet.formula.address.CellRange;

public final class RangeRef extends Expr {

    private final CellRange range;

    public RangeRef(CellRange range, int offset) {
        super(offset);
        this.range = range;
    }

    public CellRange getRange() {
        return range;
    }

    @Override
    public <R> R accept(ExprVisitor<R> visitor) {
        return visitor.visitRangeRef(this);
    }
}
