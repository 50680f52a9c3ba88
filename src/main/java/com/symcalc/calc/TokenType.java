package com.symcalc.calc;

public enum TokenType {
    NUMBER,
    IDENTIFIER,
    OPERATOR,
    PAREN_OPEN,
    PAREN_CLOSE,
    COMMA
}
