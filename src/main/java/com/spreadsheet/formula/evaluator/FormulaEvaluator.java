package com.spreadsheet.formula.evaluator;

import com.spreadsheet.formula.ast.BinaryOp;
import com.spreadsheet.formula.ast.BoolLiteral;
import com.spreadsheet.formula.ast.CellRef;
import com.spreadsheet.formula.ast.Expr;
import com.spreadsheet.formula.ast.ExprVisitor;
import com.spreadsheet.formula.ast.FunctionCall;
import com.spreadsheet.formula.ast.NameRef;
import com.spreadsheet.formula.ast.NumberLiteral;
import com.spreadsheet.formula.ast.RangeRef;
import com.spreadsheet.formula.ast.StringLiteral;
import com.spreadsheet.formula.ast.UnaryOp;
import com.spreadsheet.formula.exceptions.FormulaErrorException;
import com.spreadsheet.formula.functions.FunctionArguments;
import com.spreadsheet.formula.functions.FunctionDefinition;
import com.spreadsheet.formula.functions.FunctionRegistry;
import com.spreadsheet.formula.parser.Tokenizer;
import com.spreadsheet.formula.value.Coercions;
import com.spreadsheet.formula.value.ErrorKind;
import com.spreadsheet.formula.value.EvalResult;

import java.util.ArrayList;
import java.util.List;
import java.util.Optional;
import java.util.function.Supplier;

/**
 * Tree-walking evaluator. Children are evaluated before their parent, except
 * for arguments of lazy functions, which are evaluated when the function asks for them.
 * Never throws: every failure comes back as an error value.
 */
public class FormulaEvaluator {

    private final FunctionRegistry functions;

    public FormulaEvaluator(FunctionRegistry functions) {
        this.functions = functions;
    }

    public EvalResult evaluate(Expr expr, EvaluationContext context) {
        return new Walk(context).evaluateNode(expr);
    }

    private final class Walk implements ExprVisitor<EvalResult> {

        private final EvaluationContext context;

        Walk(EvaluationContext context) {
            this.context = context;
        }

        EvalResult evaluateNode(Expr expr) {
            try {
                return expr.accept(this);
            } catch (FormulaErrorException e) {
                return EvalResult.error(e.getErrorKind());
            }
        }

        @Override
        public EvalResult visitNumber(NumberLiteral expr) {
            return EvalResult.number(expr.getValue());
        }

        @Override
        public EvalResult visitString(StringLiteral expr) {
            return EvalResult.text(expr.getValue());
        }

        @Override
        public EvalResult visitBool(BoolLiteral expr) {
            return EvalResult.bool(expr.getValue());
        }

        @Override
        public EvalResult visitCellRef(CellRef expr) {
            return context.resolveCell(expr.getAddress().inSheet(context.getSheetName()));
        }

        @Override
        public EvalResult visitRangeRef(RangeRef expr) {
            return context.resolveRange(expr.getRange().inSheet(context.getSheetName()));
        }

        @Override
        public EvalResult visitName(NameRef expr) {
            if (Tokenizer.isCellShaped(expr.getName())) {
                return EvalResult.error(ErrorKind.INVALID_REFERENCE);
            }
            return EvalResult.error(ErrorKind.NAME_NOT_FOUND);
        }

        @Override
        public EvalResult visitUnary(UnaryOp expr) {
            double operand = Coercions.toNumber(expr.getOperand().accept(this));
            switch (expr.getOperator()) {
                case MINUS:
                    return EvalResult.number(-operand);
                case PLUS:
                default:
                    return EvalResult.number(operand);
            }
        }

        @Override
        public EvalResult visitBinary(BinaryOp expr) {
            EvalResult left = expr.getLeft().accept(this);
            EvalResult right = expr.getRight().accept(this);
            if (left.isError()) {
                return left;
            }
            if (right.isError()) {
                return right;
            }
            switch (expr.getOperator()) {
                case ADD:
                    return Coercions.finiteNumber(Coercions.toNumber(left) + Coercions.toNumber(right));
                case SUBTRACT:
                    return Coercions.finiteNumber(Coercions.toNumber(left) - Coercions.toNumber(right));
                case MULTIPLY:
                    return Coercions.finiteNumber(Coercions.toNumber(left) * Coercions.toNumber(right));
                case DIVIDE:
                    return divide(Coercions.toNumber(left), Coercions.toNumber(right));
                case POWER:
                    return Coercions.finiteNumber(Math.pow(Coercions.toNumber(left), Coercions.toNumber(right)));
                case CONCAT:
                    return EvalResult.text(Coercions.toText(left) + Coercions.toText(right));
                default:
                    return compare(expr, Coercions.toScalar(left), Coercions.toScalar(right));
            }
        }

        private EvalResult divide(double dividend, double divisor) {
            if (divisor == 0) {
                return EvalResult.error(ErrorKind.DIVIDE_BY_ZERO);
            }
            return Coercions.finiteNumber(dividend / divisor);
        }

        private EvalResult compare(BinaryOp expr, EvalResult left, EvalResult right) {
            if (left.isError()) {
                return left;
            }
            if (right.isError()) {
                return right;
            }
            boolean sameKind = Coercions.sameKind(left, right);
            int comparison = Coercions.compare(left, right);
            switch (expr.getOperator()) {
                case EQUAL:
                    return EvalResult.bool(sameKind && comparison == 0);
                case NOT_EQUAL:
                    return EvalResult.bool(!sameKind || comparison != 0);
                case LESS:
                    return EvalResult.bool(comparison < 0);
                case GREATER:
                    return EvalResult.bool(comparison > 0);
                case LESS_EQUAL:
                    return EvalResult.bool(comparison <= 0);
                case GREATER_EQUAL:
                    return EvalResult.bool(comparison >= 0);
                default:
                    throw new IllegalStateException("Not a comparison: " + expr.getOperator());
            }
        }

        @Override
        public EvalResult visitFunctionCall(FunctionCall expr) {
            Optional<FunctionDefinition> found = functions.lookup(expr.getName());
            if (!found.isPresent()) {
                return EvalResult.error(ErrorKind.NAME_NOT_FOUND);
            }
            FunctionDefinition definition = found.get();
            if (!definition.getArity().accepts(expr.getArguments().size())) {
                return EvalResult.error(ErrorKind.TYPE_MISMATCH);
            }
            List<Supplier<EvalResult>> suppliers = new ArrayList<>(expr.getArguments().size());
            for (Expr argument : expr.getArguments()) {
                suppliers.add(() -> evaluateNode(argument));
            }
            return definition.invoke(new FunctionArguments(definition, suppliers, context.getClock()));
        }
    }
}
