package com.spreadsheet.formula.parser;

import com.spreadsheet.formula.address.CellAddress;
import com.spreadsheet.formula.address.CellRange;
import com.spreadsheet.formula.ast.BinaryOp;
import com.spreadsheet.formula.ast.BinaryOperator;
import com.spreadsheet.formula.ast.BoolLiteral;
import com.spreadsheet.formula.ast.CellRef;
import com.spreadsheet.formula.ast.Expr;
import com.spreadsheet.formula.ast.FunctionCall;
import com.spreadsheet.formula.ast.NameRef;
import com.spreadsheet.formula.ast.NumberLiteral;
import com.spreadsheet.formula.ast.RangeRef;
import com.spreadsheet.formula.ast.StringLiteral;
import com.spreadsheet.formula.ast.UnaryOp;
import com.spreadsheet.formula.ast.UnaryOperator;

import java.util.ArrayList;
import java.util.List;
import java.util.Optional;

/*
 * Grammar, lowest precedence first. Every binary level is left-associative.
 *
 * formula     : expression EOF ;
 * expression  : concat ( ( "=" | "<>" | "<" | ">" | "<=" | ">=" ) concat )* ;
 * concat      : additive ( "&" additive )* ;
 * additive    : term ( ( "+" | "-" ) term )* ;
 * term        : power ( ( "*" | "/" ) power )* ;
 * power       : unary ( "^" unary )* ;
 * unary       : ( "+" | "-" ) unary | primary ;
 * primary     : NUMBER | STRING | BOOL | CELL | RANGE | IDENT
 *             | FUNCTION "(" ( expression ( "," expression )* )? ")"
 *             | "(" expression ")" ;
 *
 * The levels are not separate methods: parseExpression climbs operator precedence.
 */

/**
 * Recursive-descent, precedence-climbing parser for formula text.
 * {@link #parse(String)} never throws; syntax problems come back as a failed {@link ParseResult}.
 */
public final class FormulaParser {

    private final List<Token> tokens;
    private int current;

    private FormulaParser(List<Token> tokens) {
        this.tokens = tokens;
    }

    /**
     * Parses a formula with or without its leading '='.
     * Error offsets are indexes into {@code formula} exactly as given.
     */
    public static ParseResult<Expr> parse(String formula) {
        if (formula == null) {
            return ParseResult.failure(new SyntaxError("Empty formula", 0));
        }
        int start = formula.startsWith("=") ? 1 : 0;
        ParseResult<List<Token>> tokens = Tokenizer.tokenize(formula, start);
        if (!tokens.isSuccess()) {
            return ParseResult.failure(tokens.getError());
        }
        return parse(tokens.getValue());
    }

    /**
     * Parses an already tokenized formula (the list must end with EOF).
     */
    public static ParseResult<Expr> parse(List<Token> tokens) {
        FormulaParser parser = new FormulaParser(tokens);
        try {
            return ParseResult.success(parser.parseFormula());
        } catch (FormulaSyntaxException e) {
            return ParseResult.failure(e.toSyntaxError());
        }
    }

    private Expr parseFormula() {
        if (peek().is(TokenKind.EOF)) {
            throw new FormulaSyntaxException("Empty formula", peek().getOffset());
        }
        Expr expr = parseExpression(0);
        Token trailing = peek();
        if (!trailing.is(TokenKind.EOF)) {
            throw new FormulaSyntaxException("Unexpected '" + trailing.getText() + "' after end of expression",
                    trailing.getOffset());
        }
        return expr;
    }

    private Expr parseExpression(int minPrecedence) {
        Expr left = parseUnary();
        while (true) {
            Token token = peek();
            if (!token.is(TokenKind.OPERATOR)) {
                return left;
            }
            BinaryOperator operator = BinaryOperator.fromSymbol(token.getText());
            if (operator == null || operator.getPrecedence() < minPrecedence) {
                return left;
            }
            advance();
            // +1 keeps equal-precedence operators to the left: a-b-c == (a-b)-c, 2^3^2 == (2^3)^2
            Expr right = parseExpression(operator.getPrecedence() + 1);
            left = new BinaryOp(operator, left, right, left.getOffset());
        }
    }

    private Expr parseUnary() {
        Token token = peek();
        if (token.isOperator("+") || token.isOperator("-")) {
            advance();
            Expr operand = parseUnary();
            return new UnaryOp(UnaryOperator.fromSymbol(token.getText()), operand, token.getOffset());
        }
        return parsePrimary();
    }

    private Expr parsePrimary() {
        Token token = advance();
        switch (token.getKind()) {
            case NUMBER:
                return new NumberLiteral(Double.parseDouble(token.getText()), token.getOffset());
            case STRING:
                return new StringLiteral(token.getText(), token.getOffset());
            case BOOL:
                return new BoolLiteral("TRUE".equalsIgnoreCase(token.getText()), token.getOffset());
            case CELL:
                return cellReference(token);
            case RANGE:
                return rangeReference(token);
            case IDENT:
                return new NameRef(token.getText(), token.getOffset());
            case FUNCTION:
                return functionCall(token);
            case LPAREN:
                Expr inner = parseExpression(0);
                expect(TokenKind.RPAREN, "Expected ')' to close '(' at offset " + token.getOffset());
                return inner;
            case EOF:
                throw new FormulaSyntaxException("Unexpected end of formula", token.getOffset());
            default:
                throw new FormulaSyntaxException("Unexpected '" + token.getText() + "'", token.getOffset());
        }
    }

    private Expr cellReference(Token token) {
        Optional<CellAddress> address = CellAddress.parse(token.getText());
        if (address.isPresent()) {
            return new CellRef(address.get(), token.getOffset());
        }
        // Cell-shaped but not addressable (e.g. "A0", "ABCD1"): resolved at evaluation time
        return new NameRef(token.getText(), token.getOffset());
    }

    private Expr rangeReference(Token token) {
        Optional<CellRange> range = CellRange.parse(token.getText());
        if (range.isPresent()) {
            return new RangeRef(range.get(), token.getOffset());
        }
        return new NameRef(token.getText(), token.getOffset());
    }

    private Expr functionCall(Token name) {
        expect(TokenKind.LPAREN, "Expected '(' after " + name.getText());
        List<Expr> arguments = new ArrayList<>();
        if (!peek().is(TokenKind.RPAREN)) {
            do {
                arguments.add(parseExpression(0));
            } while (match(TokenKind.COMMA));
        }
        expect(TokenKind.RPAREN, "Expected ')' to close " + name.getText() + "(");
        return new FunctionCall(name.getText(), arguments, name.getOffset());
    }

    private Token peek() {
        return tokens.get(current);
    }

    private Token advance() {
        Token token = tokens.get(current);
        if (!token.is(TokenKind.EOF)) {
            current++;
        }
        return token;
    }

    private boolean match(TokenKind kind) {
        if (peek().is(kind)) {
            advance();
            return true;
        }
        return false;
    }

    private void expect(TokenKind kind, String message) {
        Token token = peek();
        if (!token.is(kind)) {
            throw new FormulaSyntaxException(message, token.getOffset());
        }
        advance();
    }
}
