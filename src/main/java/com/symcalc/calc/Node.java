package com.symcalc.calc;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/**
 * Expression tree. Nodes are immutable; rewriting passes build new trees
 * and may share unchanged subtrees with their input.
 *
 * Every tree walker implements {@link Visitor}, so adding a node type here
 * breaks the build until the evaluator, simplifier and printers handle it.
 */
public abstract class Node {
    public interface Visitor<R> {
        R visitNumberLit(NumberLit node);
        R visitComplexLit(ComplexLit node);
        R visitVariable(Variable node);
        R visitAssignment(Assignment node);
        R visitFunctionDef(FunctionDef node);
        R visitBatch(Batch node);
        R visitBinaryOp(BinaryOp node);
        R visitFunctionCall(FunctionCall node);
        R visitUnaryMinus(UnaryMinus node);
    }

    public enum Op {
        ADD("+"),
        SUBTRACT("-"),
        MULTIPLY("*"),
        DIVIDE("/"),
        EXPONENT("^");

        public final String symbol;

        Op(String symbol) {
            this.symbol = symbol;
        }

        static Op fromSymbol(String symbol) {
            for (Op op : values()) {
                if (op.symbol.equals(symbol)) return op;
            }
            return null;
        }

        double apply(double left, double right) {
            switch (this) {
                case ADD: return left + right;
                case SUBTRACT: return left - right;
                case MULTIPLY: return left * right;
                case DIVIDE: return left / right;
                case EXPONENT: return Math.pow(left, right);
            }
            throw new IllegalStateException("unreachable: " + this);
        }
    }

    public abstract <R> R accept(Visitor<R> visitor);

    @Override
    public String toString() {
        return AstPrinter.print(this);
    }

    private static <T> List<T> frozen(List<T> list) {
        return Collections.unmodifiableList(new ArrayList<T>(list));
    }

    public static final class NumberLit extends Node {
        public final double value;

        public NumberLit(double value) {
            this.value = value;
        }

        public <R> R accept(Visitor<R> visitor) {
            return visitor.visitNumberLit(this);
        }

        // compares bit patterns, so NaN equals NaN and 0.0 differs from -0.0
        @Override
        public boolean equals(Object o) {
            if (!(o instanceof NumberLit)) return false;
            return Double.compare(value, ((NumberLit)o).value) == 0;
        }

        @Override
        public int hashCode() {
            return Double.valueOf(value).hashCode();
        }
    }

    public static final class ComplexLit extends Node {
        public final double re;
        public final double im;

        public ComplexLit(double re, double im) {
            this.re = re;
            this.im = im;
        }

        public <R> R accept(Visitor<R> visitor) {
            return visitor.visitComplexLit(this);
        }

        @Override
        public boolean equals(Object o) {
            if (!(o instanceof ComplexLit)) return false;
            ComplexLit other = (ComplexLit)o;
            return Double.compare(re, other.re) == 0 && Double.compare(im, other.im) == 0;
        }

        @Override
        public int hashCode() {
            return 31 * Double.valueOf(re).hashCode() + Double.valueOf(im).hashCode();
        }
    }

    public static final class Variable extends Node {
        public final String name;

        public Variable(String name) {
            this.name = name;
        }

        public <R> R accept(Visitor<R> visitor) {
            return visitor.visitVariable(this);
        }

        @Override
        public boolean equals(Object o) {
            return o instanceof Variable && name.equals(((Variable)o).name);
        }

        @Override
        public int hashCode() {
            return name.hashCode();
        }
    }

    public static final class Assignment extends Node {
        public final String name;
        public final Node value;

        public Assignment(String name, Node value) {
            this.name = name;
            this.value = value;
        }

        public <R> R accept(Visitor<R> visitor) {
            return visitor.visitAssignment(this);
        }

        @Override
        public boolean equals(Object o) {
            if (!(o instanceof Assignment)) return false;
            Assignment other = (Assignment)o;
            return name.equals(other.name) && value.equals(other.value);
        }

        @Override
        public int hashCode() {
            return 31 * name.hashCode() + value.hashCode();
        }
    }

    public static final class FunctionDef extends Node {
        public final String name;
        public final List<String> params;
        public final Node body;

        public FunctionDef(String name, List<String> params, Node body) {
            this.name = name;
            this.params = frozen(params);
            this.body = body;
        }

        public <R> R accept(Visitor<R> visitor) {
            return visitor.visitFunctionDef(this);
        }

        @Override
        public boolean equals(Object o) {
            if (!(o instanceof FunctionDef)) return false;
            FunctionDef other = (FunctionDef)o;
            return name.equals(other.name) && params.equals(other.params) &&
                body.equals(other.body);
        }

        @Override
        public int hashCode() {
            return 31 * (31 * name.hashCode() + params.hashCode()) + body.hashCode();
        }
    }

    public static final class Batch extends Node {
        public final List<Node> expressions;

        public Batch(List<Node> expressions) {
            this.expressions = frozen(expressions);
        }

        public <R> R accept(Visitor<R> visitor) {
            return visitor.visitBatch(this);
        }

        @Override
        public boolean equals(Object o) {
            return o instanceof Batch && expressions.equals(((Batch)o).expressions);
        }

        @Override
        public int hashCode() {
            return expressions.hashCode();
        }
    }

    public static final class BinaryOp extends Node {
        public final Op op;
        public final Node left;
        public final Node right;

        public BinaryOp(Op op, Node left, Node right) {
            this.op = op;
            this.left = left;
            this.right = right;
        }

        public <R> R accept(Visitor<R> visitor) {
            return visitor.visitBinaryOp(this);
        }

        @Override
        public boolean equals(Object o) {
            if (!(o instanceof BinaryOp)) return false;
            BinaryOp other = (BinaryOp)o;
            return op == other.op && left.equals(other.left) && right.equals(other.right);
        }

        @Override
        public int hashCode() {
            return 31 * (31 * op.hashCode() + left.hashCode()) + right.hashCode();
        }
    }

    public static final class FunctionCall extends Node {
        public final String name;
        public final List<Node> args;

        public FunctionCall(String name, List<Node> args) {
            this.name = name;
            this.args = frozen(args);
        }

        public <R> R accept(Visitor<R> visitor) {
            return visitor.visitFunctionCall(this);
        }

        @Override
        public boolean equals(Object o) {
            if (!(o instanceof FunctionCall)) return false;
            FunctionCall other = (FunctionCall)o;
            return name.equals(other.name) && args.equals(other.args);
        }

        @Override
        public int hashCode() {
            return 31 * name.hashCode() + args.hashCode();
        }
    }

    public static final class UnaryMinus extends Node {
        public final Node operand;

        public UnaryMinus(Node operand) {
            this.operand = operand;
        }

        public <R> R accept(Visitor<R> visitor) {
            return visitor.visitUnaryMinus(this);
        }

        @Override
        public boolean equals(Object o) {
            return o instanceof UnaryMinus && operand.equals(((UnaryMinus)o).operand);
        }

        @Override
        public int hashCode() {
            return -operand.hashCode();
        }
    }
}
