package com.symcalc.calc;

import java.math.BigDecimal;

/**
 * Renders a tree back to infix source, ex: "(a + b) * c". Binary operators
 * nested in binary operators are always parenthesized, so the output never
 * relies on the reader knowing precedence.
 *
 * Printing then re-parsing gives an equal tree only for finite literals:
 * NaN and Infinity (ex: from folding "1/0") print as "NaN" and "Infinity",
 * which read back as variables.
 */
public class InfixPrinter implements Node.Visitor<String> {
    public static String print(Node node) {
        return node.accept(new InfixPrinter());
    }

    @Override
    public String visitNumberLit(Node.NumberLit node) {
        return formatNumber(node.value);
    }

    @Override
    public String visitComplexLit(Node.ComplexLit node) {
        String sign = node.im >= 0 ? "+" : "";
        return formatNumber(node.re) + sign + formatNumber(node.im) + "i";
    }

    @Override
    public String visitVariable(Node.Variable node) {
        return node.name;
    }

    @Override
    public String visitAssignment(Node.Assignment node) {
        return node.name + " = " + node.value.accept(this);
    }

    @Override
    public String visitFunctionDef(Node.FunctionDef node) {
        StringBuilder builder = new StringBuilder();
        builder.append(node.name).append("(");
        for (int i = 0; i < node.params.size(); i++) {
            if (i > 0) builder.append(", ");
            builder.append(node.params.get(i));
        }
        builder.append(") = ").append(node.body.accept(this));
        return builder.toString();
    }

    @Override
    public String visitBatch(Node.Batch node) {
        StringBuilder builder = new StringBuilder();
        for (int i = 0; i < node.expressions.size(); i++) {
            if (i > 0) builder.append("; ");
            builder.append(node.expressions.get(i).accept(this));
        }
        return builder.toString();
    }

    @Override
    public String visitBinaryOp(Node.BinaryOp node) {
        return operand(node.left, node.op) + " " + node.op.symbol + " " + operand(node.right, node.op);
    }

    @Override
    public String visitFunctionCall(Node.FunctionCall node) {
        StringBuilder builder = new StringBuilder();
        builder.append(node.name).append("(");
        for (int i = 0; i < node.args.size(); i++) {
            if (i > 0) builder.append(", ");
            builder.append(node.args.get(i).accept(this));
        }
        builder.append(")");
        return builder.toString();
    }

    @Override
    public String visitUnaryMinus(Node.UnaryMinus node) {
        String inner = node.operand.accept(this);
        if (isAtom(node.operand)) {
            return "-" + inner;
        }
        return "-(" + inner + ")";
    }

    private String operand(Node child, Node.Op parent) {
        String text = child.accept(this);
        if (child instanceof Node.BinaryOp) {
            return "(" + text + ")";
        }
        // "-2 ^ 2" would read as -(2^2)
        if (parent == Node.Op.EXPONENT && child instanceof Node.UnaryMinus) {
            return "(" + text + ")";
        }
        // literal folded to a negative number
        if (child instanceof Node.NumberLit && ((Node.NumberLit)child).value < 0) {
            return "(" + text + ")";
        }
        return text;
    }

    private static boolean isAtom(Node node) {
        if (node instanceof Node.NumberLit) {
            return ((Node.NumberLit)node).value >= 0;
        }
        return node instanceof Node.Variable || node instanceof Node.FunctionCall;
    }

    // plain decimal notation, since the scanner has no exponent syntax
    static String formatNumber(double d) {
        if (Double.isNaN(d) || Double.isInfinite(d)) {
            return String.valueOf(d);
        }
        if (d == 0) {
            return "0";
        }
        return BigDecimal.valueOf(d).stripTrailingZeros().toPlainString();
    }
}
