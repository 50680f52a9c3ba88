package com.symcalc.calc;

public class Token {
    public final TokenType type;
    public final String lexeme;
    final Object literal;
    public final int position; // zero-based offset into the source

    Token(TokenType type, String lexeme, Object literal, int position) {
        this.type = type;
        this.lexeme = lexeme;
        this.literal = literal;
        this.position = position;
    }

    // offset just past the last character of this token
    int end() {
        return position + lexeme.length();
    }

    boolean isOperator(String op) {
        return type == TokenType.OPERATOR && lexeme.equals(op);
    }

    public String toString() {
        return type + " " + lexeme + " @" + position;
    }
}
