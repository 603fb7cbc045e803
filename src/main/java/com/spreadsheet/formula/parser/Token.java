package com.spreadsheet.formula.parser;

import java.util.Objects;

/**
 * One lexical unit of a formula.
 * For STRING tokens the text is the unquoted literal; for every other kind it is
 * the source text as written.
 */
public final class Token {

    private final TokenKind kind;
    private final String text;
    private final int offset;

    public Token(TokenKind kind, String text, int offset) {
        this.kind = kind;
        this.text = text;
        this.offset = offset;
    }

    public TokenKind getKind() {
        return kind;
    }
    public String getText() {
        return text;
    }
    public int getOffset() {
        return offset;
    }

    public boolean is(TokenKind expected) {
        return kind == expected;
    }

    public boolean isOperator(String symbol) {
        return kind == TokenKind.OPERATOR && text.equals(symbol);
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) {
            return true;
        }
        if (!(o instanceof Token)) {
            return false;
        }
        Token other = (Token) o;
        return kind == other.kind && offset == other.offset && Objects.equals(text, other.text);
    }

    @Override
    public int hashCode() {
        return Objects.hash(kind, text, offset);
    }

    @Override
    public String toString() {
        return kind + "(" + text + ")@" + offset;
    }
}
