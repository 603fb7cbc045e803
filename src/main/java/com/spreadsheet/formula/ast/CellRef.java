package com.spreadsheet.formula.ast;

import com.spreadsheet.formula.address.CellAddress;

/**
 * A reference to one cell, as written (sheet may be null, anchors kept).
 */
public final class CellRef extends Expr {

    private final CellAddress address;

    public CellRef(CellAddress address, int offset) {
        super(offset);
        this.address = address;
    }

    public CellAddress getAddress() {
        return address;
    }

    @Override
    public <R> R accept(ExprVisitor<R> visitor) {
        return visitor.visitCellRef(this);
    }
}
