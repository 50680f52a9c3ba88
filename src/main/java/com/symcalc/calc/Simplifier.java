package com.symcalc.calc;

import java.util.ArrayList;
import java.util.List;

/**
 * Bottom-up structural simplification: identity elimination and folding of
 * operators whose operands are both literals. Calls, assignments,
 * definitions and batches are only simplified inside; nothing is folded
 * through a function call.
 *
 * simplify(simplify(n)) equals simplify(n) for every tree.
 */
public class Simplifier implements Node.Visitor<Node> {
    private final Evaluator evaluator = new Evaluator();

    public Node simplify(Node node) {
        return node.accept(this);
    }

    @Override
    public Node visitNumberLit(Node.NumberLit node) {
        return node;
    }

    @Override
    public Node visitComplexLit(Node.ComplexLit node) {
        return node;
    }

    @Override
    public Node visitVariable(Node.Variable node) {
        return node;
    }

    @Override
    public Node visitAssignment(Node.Assignment node) {
        return new Node.Assignment(node.name, simplify(node.value));
    }

    @Override
    public Node visitFunctionDef(Node.FunctionDef node) {
        return new Node.FunctionDef(node.name, node.params, simplify(node.body));
    }

    @Override
    public Node visitBatch(Node.Batch node) {
        return new Node.Batch(simplifyAll(node.expressions));
    }

    @Override
    public Node visitFunctionCall(Node.FunctionCall node) {
        return new Node.FunctionCall(node.name, simplifyAll(node.args));
    }

    @Override
    public Node visitUnaryMinus(Node.UnaryMinus node) {
        Node operand = simplify(node.operand);
        if (operand instanceof Node.NumberLit) {
            return new Node.NumberLit(-((Node.NumberLit)operand).value);
        }
        if (operand instanceof Node.UnaryMinus) { // --x => x
            return ((Node.UnaryMinus)operand).operand;
        }
        return new Node.UnaryMinus(operand);
    }

    @Override
    public Node visitBinaryOp(Node.BinaryOp node) {
        Node left = simplify(node.left);
        Node right = simplify(node.right);

        if (left instanceof Node.NumberLit && right instanceof Node.NumberLit) {
            Node folded = new Node.BinaryOp(node.op, left, right);
            Object value = evaluator.evaluate(folded, new Scope());
            return new Node.NumberLit((Double)value);
        }

        switch (node.op) {
            case ADD:
                if (isNumber(left, 0)) return right; // 0 + x = x
                if (isNumber(right, 0)) return left; // x + 0 = x
                break;
            case SUBTRACT:
                if (isNumber(right, 0)) return left; // x - 0 = x
                break;
            case MULTIPLY:
                if (isNumber(left, 1)) return right; // 1 * x = x
                if (isNumber(right, 1)) return left; // x * 1 = x
                if (isNumber(left, 0) || isNumber(right, 0)) {
                    return new Node.NumberLit(0);
                }
                break;
            case DIVIDE:
                if (isNumber(right, 1)) return left; // x / 1 = x
                if (isNumber(left, 0) && right instanceof Node.NumberLit &&
                        ((Node.NumberLit)right).value != 0) {
                    return new Node.NumberLit(0);
                }
                break;
            case EXPONENT:
                if (isNumber(right, 1)) return left; // x ^ 1 = x
                if (isNumber(left, 1)) return new Node.NumberLit(1); // 1 ^ x = 1
                if (isNumber(right, 0)) return new Node.NumberLit(1); // x ^ 0 = 1
                break;
        }

        return new Node.BinaryOp(node.op, left, right);
    }

    private List<Node> simplifyAll(List<Node> nodes) {
        List<Node> simplified = new ArrayList<>();
        for (Node node : nodes) {
            simplified.add(simplify(node));
        }
        return simplified;
    }

    private static boolean isNumber(Node node, double value) {
        return node instanceof Node.NumberLit && ((Node.NumberLit)node).value == value;
    }
}
