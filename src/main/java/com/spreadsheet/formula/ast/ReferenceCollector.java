package com.spreadsheet.formula.ast;

import com.spreadsheet.formula.address.CellRange;

import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Set;

/**
 * Dry walk over a formula: gathers every cell and range it references
 * (single cells as 1x1 ranges, in source order) and the names of the functions it calls.
 */
public final class ReferenceCollector implements ExprVisitor<Void> {

    private final List<CellRange> references = new ArrayList<>();
    private final Set<String> functionNames = new LinkedHashSet<>();

    private ReferenceCollector() {
    }

    public static ReferenceCollector collect(Expr expr) {
        ReferenceCollector collector = new ReferenceCollector();
        expr.accept(collector);
        return collector;
    }

    public List<CellRange> getReferences() {
        return Collections.unmodifiableList(references);
    }

    public Set<String> getFunctionNames() {
        return Collections.unmodifiableSet(functionNames);
    }

    @Override
    public Void visitNumber(NumberLiteral expr) {
        return null;
    }

    @Override
    public Void visitString(StringLiteral expr) {
        return null;
    }

    @Override
    public Void visitBool(BoolLiteral expr) {
        return null;
    }

    @Override
    public Void visitCellRef(CellRef expr) {
        references.add(CellRange.of(expr.getAddress()));
        return null;
    }

    @Override
    public Void visitRangeRef(RangeRef expr) {
        references.add(expr.getRange());
        return null;
    }

    @Override
    public Void visitName(NameRef expr) {
        return null;
    }

    @Override
    public Void visitUnary(UnaryOp expr) {
        return expr.getOperand().accept(this);
    }

    @Override
    public Void visitBinary(BinaryOp expr) {
        expr.getLeft().accept(this);
        return expr.getRight().accept(this);
    }

    @Override
    public Void visitFunctionCall(FunctionCall expr) {
        functionNames.add(expr.getName());
        for (Expr argument : expr.getArguments()) {
            argument.accept(this);
        }
        return null;
    }
}
