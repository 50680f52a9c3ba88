package com.symcalc.calc;

import java.util.ArrayList;
import java.util.List;

import static com.symcalc.calc.TokenType.*;

/*
 * Grammar:
 * low prec
 * to
 * high prec
 *
 * batch          : assignment ( ";" assignment )* EOF ;
 * assignment     : addition ( "=" assignment )? ;   target must be IDENTIFIER
 *                                                   or IDENTIFIER "(" IDENTIFIER,* ")"
 * addition       : multiplication ( ( "-" | "+" ) multiplication )* ;
 * multiplication : power ( ( "/" | "*" ) power )* ;
 * power          : unary ( "^" power )? ;
 * unary          : ( "-" | "+" ) unary
 *                | primary ;
 * primary        : NUMBER
 *                | IDENTIFIER ( "(" arguments? ")" )?
 *                | "(" addition ")" ;
 * arguments      : addition ( "," addition )* ;
 *
 * NOTE: unary sits below power, so "-2^2" is (-2)^2.
 */
public class Parser {
    public static class ParseError extends CalcError {
        ParseError(String message, int position) {
            super(message, position);
        }
    }

    private final List<Token> tokens;
    private final int sourceLength;
    private int current = 0;

    Parser(List<Token> tokens, int sourceLength) {
        this.tokens = tokens;
        this.sourceLength = sourceLength;
    }

    public static Parser newFromSource(String source) {
        List<Token> tokens = Scanner.tokenize(source);
        return new Parser(tokens, source.length());
    }

    public Node parse() {
        if (tokens.isEmpty()) {
            throw new ParseError("Cannot parse an empty expression", 0);
        }
        Node node = batch();
        if (!isAtEnd()) {
            Token tok = peekTok();
            throw error(tok, "Unexpected token '" + tok.lexeme + "' at position " +
                tok.position + " after end of expression");
        }
        return node;
    }

    private Node batch() {
        List<Node> expressions = new ArrayList<>();
        do {
            expressions.add(assignment());
        } while (matchOp(";"));

        if (expressions.size() == 1) {
            return expressions.get(0);
        }
        return new Node.Batch(expressions);
    }

    private Node assignment() {
        Node expr = addition();
        if (checkOp("=")) {
            Token equals = advance();
            if (expr instanceof Node.Variable) {
                Node value = assignment();
                return new Node.Assignment(((Node.Variable)expr).name, value);
            } else if (expr instanceof Node.FunctionCall) {
                Node.FunctionCall call = (Node.FunctionCall)expr;
                List<String> params = new ArrayList<>();
                for (Node arg : call.args) {
                    if (!(arg instanceof Node.Variable)) {
                        throw error(equals, "Invalid parameter in definition of '" + call.name +
                            "' at position " + equals.position + ", expected a parameter name");
                    }
                    params.add(((Node.Variable)arg).name);
                }
                Node body = assignment();
                return new Node.FunctionDef(call.name, params, body);
            }
            throw error(equals, "Invalid assignment target at position " + equals.position +
                ", expected a variable or function signature");
        }
        return expr;
    }

    private Node expression() {
        return addition();
    }

    private Node addition() {
        Node expr = multiplication();

        while (checkOp("+") || checkOp("-")) {
            Token operator = advance();
            Node right = multiplication();
            expr = new Node.BinaryOp(Node.Op.fromSymbol(operator.lexeme), expr, right);
        }
        return expr;
    }

    private Node multiplication() {
        Node expr = power();

        while (checkOp("*") || checkOp("/")) {
            Token operator = advance();
            Node right = power();
            expr = new Node.BinaryOp(Node.Op.fromSymbol(operator.lexeme), expr, right);
        }
        return expr;
    }

    private Node power() {
        Node expr = unary();
        if (matchOp("^")) {
            Node right = power(); // right-associative
            expr = new Node.BinaryOp(Node.Op.EXPONENT, expr, right);
        }
        return expr;
    }

    private Node unary() {
        if (matchOp("-")) {
            return new Node.UnaryMinus(unary());
        }
        if (matchOp("+")) {
            return unary();
        }
        return primary();
    }

    private Node primary() {
        if (isAtEnd()) {
            throw errorAtEnd("expected number, variable, or '('");
        }

        if (matchAny(NUMBER)) {
            return new Node.NumberLit((Double)prevTok().literal);
        }

        if (matchAny(IDENTIFIER)) {
            String name = prevTok().lexeme;
            if (matchAny(PAREN_OPEN)) {
                List<Node> args = new ArrayList<>();
                if (!checkTok(PAREN_CLOSE)) {
                    do {
                        args.add(expression());
                    } while (matchAny(COMMA));
                }
                consumeTok(PAREN_CLOSE, "')' at end of argument list");
                return new Node.FunctionCall(name, args);
            }
            return new Node.Variable(name);
        }

        if (matchAny(PAREN_OPEN)) {
            Node expr = expression();
            consumeTok(PAREN_CLOSE, "')' after group expression");
            return expr;
        }

        Token tok = peekTok();
        throw error(tok, "Unexpected token '" + tok.lexeme + "' at position " + tok.position +
            ", expected number, variable, or '('");
    }

    private boolean matchAny(TokenType... ttypes) {
        for (TokenType ttype : ttypes) {
            if (checkTok(ttype)) {
                advance();
                return true;
            }
        }

        return false;
    }

    private boolean matchOp(String op) {
        if (checkOp(op)) {
            advance();
            return true;
        }
        return false;
    }

    private Token consumeTok(TokenType ttype, String expected) {
        if (checkTok(ttype)) {
            return advance();
        }
        if (isAtEnd()) {
            throw errorAtEnd("expected " + expected);
        }
        Token tok = peekTok();
        throw error(tok, "Unexpected token '" + tok.lexeme + "' at position " + tok.position +
            ", expected " + expected);
    }

    private boolean checkTok(TokenType ttype) {
        if (isAtEnd()) return false;
        return peekTok().type == ttype;
    }

    private boolean checkOp(String op) {
        if (isAtEnd()) return false;
        return peekTok().isOperator(op);
    }

    private Token peekTok() {
        return tokens.get(current);
    }

    private Token prevTok() {
        return tokens.get(current-1);
    }

    private Token advance() {
        if (!isAtEnd()) current++;
        return prevTok();
    }

    private boolean isAtEnd() {
        return current >= tokens.size();
    }

    private ParseError error(Token token, String msg) {
        return new ParseError(msg, token.position);
    }

    private ParseError errorAtEnd(String expected) {
        int position = current > 0 ? prevTok().end() : sourceLength;
        return new ParseError("Unexpected end of input at position " + position + ", " + expected,
            position);
    }
}
