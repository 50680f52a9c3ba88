package com.symcalc.calc;

import java.util.ArrayList;
import java.util.List;

import static com.symcalc.calc.TokenType.*;

public class Scanner {
    public static class LexError extends CalcError {
        final String text;

        LexError(String message, String text, int position) {
            super(message, position);
            this.text = text;
        }

        // the offending character or malformed literal
        public String getText() {
            return text;
        }
    }

    private static final String OPERATORS = "+-*/^=<>!%;";

    private final String source;
    private final List<Token> tokens = new ArrayList<>();

    private int start = 0;
    private int current = 0;

    public Scanner(String source) {
        this.source = source;
    }

    public static List<Token> tokenize(String source) {
        return new Scanner(source).scanTokens();
    }

    public List<Token> scanTokens() {
        while (!isAtEnd()) {
            // We are at the beginning of the next lexeme.
            start = current;
            scanToken();
        }
        return tokens;
    }

    private boolean isAtEnd() {
        return current >= source.length();
    }

    private void scanToken() {
        char c = advance();
        switch (c) {
            case '(': addToken(PAREN_OPEN); break;
            case ')': addToken(PAREN_CLOSE); break;
            case ',': addToken(COMMA); break;
            case ' ':
            case '\t':
            case '\n':
                // Ignore whitespace.
                break;
            default:
                if (CalcUtil.isDigit(c) || (c == '.' && CalcUtil.isDigit(peek()))) {
                    number();
                } else if (CalcUtil.isAlpha(c)) {
                    identifier();
                } else if (OPERATORS.indexOf(c) >= 0) {
                    addToken(OPERATOR);
                } else {
                    throw new LexError("Unknown character '" + c + "' at position " + start,
                        String.valueOf(c), start);
                }
                break;
        }
    }

    private char advance() {
        current++;
        return source.charAt(current-1);
    }

    private void identifier() {
        while (CalcUtil.isAlphaNumeric(peek())) advance();
        // 'i' stays a plain identifier until complex literals get a syntax
        addToken(IDENTIFIER);
    }

    private void number() {
        int dots = source.charAt(start) == '.' ? 1 : 0;
        while (CalcUtil.isDigit(peek()) || peek() == '.') {
            if (advance() == '.') dots++;
        }

        String text = source.substring(start, current);
        if (dots > 1 || text.equals(".")) {
            throw new LexError("Invalid number format '" + text + "' at position " + start,
                text, start);
        }
        addToken(NUMBER, Double.parseDouble(text));
    }

    private void addToken(TokenType ttype) {
        addToken(ttype, null);
    }

    private void addToken(TokenType ttype, Object literal) {
        String text = source.substring(start, current);
        tokens.add(new Token(ttype, text, literal, start));
    }

    private char peek() {
        if (isAtEnd()) {
            return '\0';
        } else {
            return source.charAt(current);
        }
    }
}
