package com.bireporting.anomaly.engine.condition;

import com.bireporting.anomaly.exception.ConditionSyntaxException;

import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import java.util.Map;

/**
 * Splits a rule condition into tokens. Keywords are case-insensitive; anything in square
 * brackets is a single identifier, so column names with spaces can be referenced.
 */
final class ConditionLexer {

    enum TokenType {
        LPAREN, RPAREN, COMPARISON, AND, OR, NOT, IS, NULL, TRUE, FALSE,
        IDENTIFIER, NUMBER, STRING, EOF
    }

    record Token(TokenType type, String text, int position) {}

    private static final Map<String, TokenType> KEYWORDS = Map.of(
            "AND", TokenType.AND,
            "OR", TokenType.OR,
            "NOT", TokenType.NOT,
            "IS", TokenType.IS,
            "NULL", TokenType.NULL,
            "TRUE", TokenType.TRUE,
            "FALSE", TokenType.FALSE);

    private final String source;
    private int pos;

    ConditionLexer(String source) {
        this.source = source;
    }

    List<Token> tokenize() {
        List<Token> tokens = new ArrayList<>();
        while (true) {
            skipWhitespace();
            if (pos >= source.length()) {
                tokens.add(new Token(TokenType.EOF, "", pos));
                return tokens;
            }
            tokens.add(next());
        }
    }

    private Token next() {
        int start = pos;
        char c = source.charAt(pos);

        switch (c) {
            case '(':
                pos++;
                return new Token(TokenType.LPAREN, "(", start);
            case ')':
                pos++;
                return new Token(TokenType.RPAREN, ")", start);
            case '<':
                if (peek(1) == '=' || peek(1) == '>') {
                    pos += 2;
                    return new Token(TokenType.COMPARISON, source.substring(start, pos), start);
                }
                pos++;
                return new Token(TokenType.COMPARISON, "<", start);
            case '>':
                if (peek(1) == '=') {
                    pos += 2;
                    return new Token(TokenType.COMPARISON, ">=", start);
                }
                pos++;
                return new Token(TokenType.COMPARISON, ">", start);
            case '=':
                pos += peek(1) == '=' ? 2 : 1;
                return new Token(TokenType.COMPARISON, "=", start);
            case '!':
                if (peek(1) == '=') {
                    pos += 2;
                    return new Token(TokenType.COMPARISON, "!=", start);
                }
                pos++;
                return new Token(TokenType.NOT, "!", start);
            case '&':
                expect(1, '&');
                pos += 2;
                return new Token(TokenType.AND, "&&", start);
            case '|':
                expect(1, '|');
                pos += 2;
                return new Token(TokenType.OR, "||", start);
            case '[':
                return bracketedIdentifier();
            case '\'':
            case '"':
                return string(c);
            default:
                break;
        }

        if (Character.isDigit(c) || c == '.' || (c == '-' && isNumberStart(peek(1)))) {
            return number();
        }
        if (Character.isLetter(c) || c == '_') {
            return word();
        }
        throw new ConditionSyntaxException("Unexpected character '" + c + "'", source, start);
    }

    private Token bracketedIdentifier() {
        int start = pos;
        int close = source.indexOf(']', pos + 1);
        if (close < 0) {
            throw new ConditionSyntaxException("Unterminated [identifier]", source, start);
        }
        String name = source.substring(pos + 1, close).trim();
        if (name.isEmpty()) {
            throw new ConditionSyntaxException("Empty [identifier]", source, start);
        }
        pos = close + 1;
        return new Token(TokenType.IDENTIFIER, name, start);
    }

    private Token string(char quote) {
        int start = pos;
        StringBuilder sb = new StringBuilder();
        pos++;
        while (pos < source.length()) {
            char c = source.charAt(pos);
            if (c == quote) {
                // A doubled quote inside a literal stands for one quote character
                if (peek(1) == quote) {
                    sb.append(quote);
                    pos += 2;
                    continue;
                }
                pos++;
                return new Token(TokenType.STRING, sb.toString(), start);
            }
            sb.append(c);
            pos++;
        }
        throw new ConditionSyntaxException("Unterminated string literal", source, start);
    }

    private Token number() {
        int start = pos;
        if (source.charAt(pos) == '-') pos++;
        while (pos < source.length() && Character.isDigit(source.charAt(pos))) pos++;
        if (pos < source.length() && source.charAt(pos) == '.') {
            pos++;
            while (pos < source.length() && Character.isDigit(source.charAt(pos))) pos++;
        }
        if (pos < source.length() && (source.charAt(pos) == 'e' || source.charAt(pos) == 'E')) {
            int mark = pos;
            pos++;
            if (pos < source.length() && (source.charAt(pos) == '+' || source.charAt(pos) == '-')) pos++;
            if (pos >= source.length() || !Character.isDigit(source.charAt(pos))) {
                pos = mark;
            } else {
                while (pos < source.length() && Character.isDigit(source.charAt(pos))) pos++;
            }
        }

        String text = source.substring(start, pos);
        try {
            Double.parseDouble(text);
        } catch (NumberFormatException e) {
            throw new ConditionSyntaxException("Malformed number '" + text + "'", source, start);
        }
        return new Token(TokenType.NUMBER, text, start);
    }

    private Token word() {
        int start = pos;
        while (pos < source.length()) {
            char c = source.charAt(pos);
            if (!(Character.isLetterOrDigit(c) || c == '_' || c == '.')) break;
            pos++;
        }
        String text = source.substring(start, pos);
        TokenType keyword = KEYWORDS.get(text.toUpperCase(Locale.ROOT));
        return new Token(keyword != null ? keyword : TokenType.IDENTIFIER, text, start);
    }

    private boolean isNumberStart(char c) {
        return Character.isDigit(c) || c == '.';
    }

    private void expect(int offset, char expected) {
        if (peek(offset) != expected) {
            throw new ConditionSyntaxException("Expected '" + expected + "'", source, pos + offset);
        }
    }

    private char peek(int offset) {
        int i = pos + offset;
        return i < source.length() ? source.charAt(i) : '\0';
    }

    private void skipWhitespace() {
        while (pos < source.length() && Character.isWhitespace(source.charAt(pos))) pos++;
    }
}
