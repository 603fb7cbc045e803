package com.spreadsheet.formula.parser;

public enum TokenKind {
    NUMBER,
    STRING,
    BOOL,
    CELL,
    RANGE,
    FUNCTION,
    IDENT,
    OPERATOR,
    LPAREN,
    RPAREN,
    COMMA,
    EOF
}
