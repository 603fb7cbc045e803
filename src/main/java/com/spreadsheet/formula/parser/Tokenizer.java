package com.spreadsheet.formula.parser;

import java.util.ArrayList;
import java.util.List;
import java.util.regex.Pattern;

/**
 * Turns formula text (without the leading '=') into tokens ending with an EOF token.
 *
 * Identifier runs are captured first and classified afterwards:
 * - followed directly by '(' they name a function
 * - TRUE / FALSE are booleans
 * - cell-shaped runs ("B7", "$C$2", "Sheet2!A1") are cells, merged with ":" and
 *   a second cell-shaped run into a range
 * - anything else is an identifier the evaluator resolves later
 */
public final class Tokenizer {

    private static final Pattern CELL_SHAPE = Pattern.compile("^[A-Za-z]+[0-9]+$");
    private static final String SINGLE_CHAR_OPERATORS = "+-*/^&=";

    private final String source;
    private int pos;
    private final List<Token> tokens = new ArrayList<>();

    private Tokenizer(String source, int start) {
        this.source = source;
        this.pos = start;
    }

    public static ParseResult<List<Token>> tokenize(String formula) {
        return tokenize(formula, 0);
    }

    /**
     * Tokenizes {@code source} from index {@code start}; token offsets are indexes into {@code source}.
     */
    public static ParseResult<List<Token>> tokenize(String source, int start) {
        Tokenizer tokenizer = new Tokenizer(source, start);
        try {
            tokenizer.run();
            return ParseResult.success(tokenizer.tokens);
        } catch (FormulaSyntaxException e) {
            return ParseResult.failure(e.toSyntaxError());
        }
    }

    /**
     * Whether an identifier run looks like a single cell reference.
     */
    public static boolean isCellShaped(String run) {
        String bare = run.substring(run.lastIndexOf('!') + 1).replace("$", "");
        return CELL_SHAPE.matcher(bare).matches();
    }

    private void run() {
        while (pos < source.length()) {
            char c = source.charAt(pos);
            if (Character.isWhitespace(c)) {
                pos++;
            } else if (isDigit(c) || (c == '.' && pos + 1 < source.length() && isDigit(source.charAt(pos + 1)))) {
                readNumber();
            } else if (c == '"') {
                readString();
            } else if (isIdentifierStart(c)) {
                readIdentifier();
            } else if (c == '(') {
                add(TokenKind.LPAREN, "(", pos++);
            } else if (c == ')') {
                add(TokenKind.RPAREN, ")", pos++);
            } else if (c == ',') {
                add(TokenKind.COMMA, ",", pos++);
            } else if (c == '<' || c == '>') {
                readComparison(c);
            } else if (SINGLE_CHAR_OPERATORS.indexOf(c) >= 0) {
                add(TokenKind.OPERATOR, String.valueOf(c), pos++);
            } else {
                throw new FormulaSyntaxException("Unexpected character '" + c + "'", pos);
            }
        }
        add(TokenKind.EOF, "", source.length());
    }

    private void readNumber() {
        int start = pos;
        boolean seenPoint = false;
        while (pos < source.length()) {
            char c = source.charAt(pos);
            if (isDigit(c)) {
                pos++;
            } else if (c == '.' && !seenPoint) {
                seenPoint = true;
                pos++;
            } else if (c == '.') {
                throw new FormulaSyntaxException("Malformed number: second decimal point", pos);
            } else {
                break;
            }
        }
        add(TokenKind.NUMBER, source.substring(start, pos), start);
    }

    private void readString() {
        int start = pos;
        pos++; // opening quote
        StringBuilder literal = new StringBuilder();
        while (pos < source.length()) {
            char c = source.charAt(pos);
            if (c == '"') {
                if (pos + 1 < source.length() && source.charAt(pos + 1) == '"') {
                    literal.append('"');
                    pos += 2;
                    continue;
                }
                pos++;
                add(TokenKind.STRING, literal.toString(), start);
                return;
            }
            literal.append(c);
            pos++;
        }
        throw new FormulaSyntaxException("Unterminated string", start);
    }

    private void readIdentifier() {
        int start = pos;
        String run = readRun();

        if (pos < source.length() && source.charAt(pos) == '(') {
            add(TokenKind.FUNCTION, run, start);
            return;
        }
        if ("TRUE".equalsIgnoreCase(run) || "FALSE".equalsIgnoreCase(run)) {
            add(TokenKind.BOOL, run, start);
            return;
        }
        if (isCellShaped(run)) {
            if (pos + 1 < source.length() && source.charAt(pos) == ':' && isIdentifierStart(source.charAt(pos + 1))) {
                int colon = pos;
                pos++;
                String end = readRun();
                if (isCellShaped(end)) {
                    add(TokenKind.RANGE, source.substring(start, pos), start);
                    return;
                }
                // Not a range after all: let ':' be reported where it stands
                pos = colon;
            }
            add(TokenKind.CELL, run, start);
            return;
        }
        add(TokenKind.IDENT, run, start);
    }

    /**
     * Captures [A-Za-z0-9_.$!] characters, allowing a leading 'quoted sheet name'.
     */
    private String readRun() {
        int start = pos;
        if (source.charAt(pos) == '\'') {
            pos++;
            while (true) {
                if (pos >= source.length()) {
                    throw new FormulaSyntaxException("Unterminated sheet name", start);
                }
                if (source.charAt(pos) == '\'') {
                    if (pos + 1 < source.length() && source.charAt(pos + 1) == '\'') {
                        pos += 2;
                        continue;
                    }
                    pos++;
                    break;
                }
                pos++;
            }
            if (pos >= source.length() || source.charAt(pos) != '!') {
                throw new FormulaSyntaxException("Quoted sheet name must be followed by '!'", pos);
            }
        }
        while (pos < source.length() && isIdentifierPart(source.charAt(pos))) {
            pos++;
        }
        return source.substring(start, pos);
    }

    private void readComparison(char first) {
        int start = pos;
        pos++;
        if (pos < source.length()) {
            char next = source.charAt(pos);
            if (next == '=' || (first == '<' && next == '>')) {
                pos++;
                add(TokenKind.OPERATOR, source.substring(start, pos), start);
                return;
            }
        }
        add(TokenKind.OPERATOR, String.valueOf(first), start);
    }

    private void add(TokenKind kind, String text, int offset) {
        tokens.add(new Token(kind, text, offset));
    }

    private static boolean isDigit(char c) {
        return c >= '0' && c <= '9';
    }

    private static boolean isIdentifierStart(char c) {
        return (c >= 'A' && c <= 'Z') || (c >= 'a' && c <= 'z') || c == '_' || c == '$' || c == '\'';
    }

    private static boolean isIdentifierPart(char c) {
        return (c >= 'A' && c <= 'Z') || (c >= 'a' && c <= 'z') || isDigit(c)
                || c == '_' || c == '.' || c == '$' || c == '!';
    }
}
