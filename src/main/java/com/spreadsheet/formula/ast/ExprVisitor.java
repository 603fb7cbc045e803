package com.spreadsheet.formula.ast;

public interface ExprVisitor<R> {

    R visitNumber(NumberLiteral expr);

    R visitString(StringLiteral expr);

    R visitBool(BoolLiteral expr);

    R visitCellRef(CellRef expr);

    R visitRangeRef(RangeRef expr);

    R visitName(NameRef expr);

    R visitUnary(UnaryOp expr);

    R visitBinary(BinaryOp expr);

    R visitFunctionCall(FunctionCall expr);
}
