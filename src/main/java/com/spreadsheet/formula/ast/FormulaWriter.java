package com.spreadsheet.formula.ast;

import java.math.BigDecimal;
import java.util.StringJoiner;

/**
 * Serializes an AST back to formula text (no leading '=').
 * The output re-parses to an equivalent tree; parentheses are only written
 * where precedence or left-associativity needs them.
 */
public final class FormulaWriter implements ExprVisitor<String> {

    private static final FormulaWriter INSTANCE = new FormulaWriter();

    private FormulaWriter() {
    }

    public static String write(Expr expr) {
        return expr.accept(INSTANCE);
    }

    @Override
    public String visitNumber(NumberLiteral expr) {
        String text = BigDecimal.valueOf(expr.getValue()).stripTrailingZeros().toPlainString();
        return expr.getValue() < 0 ? "(" + text + ")" : text;
    }

    @Override
    public String visitString(StringLiteral expr) {
        return "\"" + expr.getValue().replace("\"", "\"\"") + "\"";
    }

    @Override
    public String visitBool(BoolLiteral expr) {
        return expr.getValue() ? "TRUE" : "FALSE";
    }

    @Override
    public String visitCellRef(CellRef expr) {
        return expr.getAddress().format();
    }

    @Override
    public String visitRangeRef(RangeRef expr) {
        return expr.getRange().format();
    }

    @Override
    public String visitName(NameRef expr) {
        return expr.getName();
    }

    @Override
    public String visitUnary(UnaryOp expr) {
        Expr operand = expr.getOperand();
        String inner = operand.accept(this);
        if (operand instanceof BinaryOp) {
            inner = "(" + inner + ")";
        }
        return expr.getOperator().getSymbol() + inner;
    }

    @Override
    public String visitBinary(BinaryOp expr) {
        int precedence = expr.getOperator().getPrecedence();
        String left = expr.getLeft().accept(this);
        String right = expr.getRight().accept(this);
        if (expr.getLeft() instanceof BinaryOp
                && ((BinaryOp) expr.getLeft()).getOperator().getPrecedence() < precedence) {
            left = "(" + left + ")";
        }
        if (expr.getRight() instanceof BinaryOp
                && ((BinaryOp) expr.getRight()).getOperator().getPrecedence() <= precedence) {
            right = "(" + right + ")";
        }
        return left + expr.getOperator().getSymbol() + right;
    }

    @Override
    public String visitFunctionCall(FunctionCall expr) {
        StringJoiner args = new StringJoiner(",", expr.getName() + "(", ")");
        for (Expr argument : expr.getArguments()) {
            args.add(argument.accept(this));
        }
        return args.toString();
    }
}
