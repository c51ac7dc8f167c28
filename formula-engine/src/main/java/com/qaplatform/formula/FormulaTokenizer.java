package com.qaplatform.formula;

import java.util.ArrayList;
import java.util.List;

/**
 * Splits formula source into tokens. Whitespace is skipped, line and column are tracked
 * for every token and a trailing EOF token is always appended.
 */
public class FormulaTokenizer {

    private static final List<String> TWO_CHAR_OPERATORS = List.of(">=", "<=", "==", "!=");
    private static final String ONE_CHAR_OPERATORS = "+-*/%^><!";

    private final String expr;
    private int pos = 0;
    private int line = 1;
    private int column = 1;

    public FormulaTokenizer(String expr) {
        this.expr = expr == null ? "" : expr;
    }

    public static List<Token> tokenize(String expr) {
        return new FormulaTokenizer(expr).tokenize();
    }

    public List<Token> tokenize() {
        List<Token> tokens = new ArrayList<>();
        while (true) {
            skipWhitespace();
            if (pos >= expr.length()) {
                tokens.add(new Token(TokenType.EOF, "", null, position()));
                return tokens;
            }
            tokens.add(next());
        }
    }

    private Token next() {
        char c = current();
        SourcePosition start = position();

        if (isDigit(c) || (c == '.' && isDigit(peekChar(1)))) {
            return readNumber(start);
        }
        if (c == '"') {
            return readString(start);
        }
        if (isIdentifierStart(c)) {
            return readIdentifier(start);
        }

        switch (c) {
            case '(':
                advance(1);
                return new Token(TokenType.LPAREN, "(", null, start);
            case ')':
                advance(1);
                return new Token(TokenType.RPAREN, ")", null, start);
            case ',':
                advance(1);
                return new Token(TokenType.COMMA, ",", null, start);
            default:
                break;
        }

        for (String op : TWO_CHAR_OPERATORS) {
            if (peek(op)) {
                advance(2);
                return new Token(TokenType.OPERATOR, op, null, start);
            }
        }

        if (peek("&&")) {
            throw new FormulaException(FormulaErrorType.SYNTAX_ERROR,
                    "Unsupported operator '&&' at " + start, start,
                    "Use and(a, b) instead of '&&'");
        }
        if (peek("||")) {
            throw new FormulaException(FormulaErrorType.SYNTAX_ERROR,
                    "Unsupported operator '||' at " + start, start,
                    "Use or(a, b) instead of '||'");
        }
        if (ONE_CHAR_OPERATORS.indexOf(c) >= 0) {
            advance(1);
            return new Token(TokenType.OPERATOR, String.valueOf(c), null, start);
        }
        if (c == '=') {
            throw new FormulaException(FormulaErrorType.SYNTAX_ERROR,
                    "Unexpected character '=' at " + start, start,
                    "Use '==' to compare values");
        }
        if (c == '\'') {
            throw new FormulaException(FormulaErrorType.SYNTAX_ERROR,
                    "Unexpected character ''' at " + start, start,
                    "Use double quotes for text, e.g. dimension(\"fluency\")");
        }

        throw new FormulaException(FormulaErrorType.SYNTAX_ERROR,
                "Unexpected character '" + c + "' at " + start, start,
                "Remove invalid characters from the expression");
    }

    private Token readNumber(SourcePosition start) {
        int begin = pos;
        while (isDigit(current())) {
            advance(1);
        }
        if (current() == '.') {
            advance(1);
            if (!isDigit(current())) {
                throw malformedNumber(begin, start);
            }
            while (isDigit(current())) {
                advance(1);
            }
        }
        if (current() == 'e' || current() == 'E') {
            advance(1);
            if (current() == '+' || current() == '-') {
                advance(1);
            }
            if (!isDigit(current())) {
                throw malformedNumber(begin, start);
            }
            while (isDigit(current())) {
                advance(1);
            }
        }
        String text = expr.substring(begin, pos);
        return new Token(TokenType.NUMBER, text, Double.parseDouble(text), start);
    }

    private FormulaException malformedNumber(int begin, SourcePosition start) {
        String text = expr.substring(begin, Math.min(pos + 1, expr.length()));
        return new FormulaException(FormulaErrorType.SYNTAX_ERROR,
                "Malformed number '" + text + "' at " + start, start,
                "Write numbers like 12, 0.5 or 1e3");
    }

    private Token readString(SourcePosition start) {
        int begin = pos;
        advance(1);
        StringBuilder value = new StringBuilder();
        while (pos < expr.length()) {
            char c = current();
            if (c == '\\' && peekChar(1) == '"') {
                value.append('"');
                advance(2);
                continue;
            }
            if (c == '"') {
                advance(1);
                return new Token(TokenType.STRING, expr.substring(begin, pos), value.toString(), start);
            }
            value.append(c);
            advance(1);
        }
        throw new FormulaException(FormulaErrorType.SYNTAX_ERROR,
                "Unterminated string literal starting at " + start, start,
                "Add a closing '\"' to the text value");
    }

    private Token readIdentifier(SourcePosition start) {
        int begin = pos;
        while (pos < expr.length() && isIdentifierPart(current())) {
            advance(1);
        }
        return new Token(TokenType.IDENTIFIER, expr.substring(begin, pos), null, start);
    }

    private static boolean isDigit(char c) {
        return c >= '0' && c <= '9';
    }

    private static boolean isIdentifierStart(char c) {
        return (c >= 'a' && c <= 'z') || (c >= 'A' && c <= 'Z') || c == '_';
    }

    private static boolean isIdentifierPart(char c) {
        return (c >= 'a' && c <= 'z') || (c >= 'A' && c <= 'Z') || (c >= '0' && c <= '9') || c == '_';
    }

    private void skipWhitespace() {
        while (pos < expr.length() && Character.isWhitespace(current())) {
            advance(1);
        }
    }

    private void advance(int count) {
        for (int i = 0; i < count && pos < expr.length(); i++) {
            if (expr.charAt(pos) == '\n') {
                line++;
                column = 1;
            } else {
                column++;
            }
            pos++;
        }
    }

    private SourcePosition position() {
        return new SourcePosition(line, column, pos);
    }

    private boolean peek(String s) {
        return expr.startsWith(s, pos);
    }

    private char current() {
        return pos < expr.length() ? expr.charAt(pos) : '\0';
    }

    private char peekChar(int ahead) {
        int index = pos + ahead;
        return index < expr.length() ? expr.charAt(index) : '\0';
    }
}
