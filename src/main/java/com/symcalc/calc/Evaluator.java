package com.symcalc.calc;

import java.util.ArrayList;
import java.util.List;

/**
 * Tree-walking evaluator. Results are {@code Double}, or a {@code String}
 * holding a symbolic rendering when part of the tree has no numeric value
 * (complex literals, function definitions and anything computed from them).
 *
 * An Evaluator holds the scope of the call in progress, so one instance must
 * not be shared between threads.
 */
public class Evaluator implements Node.Visitor<Object> {
    private Scope scope;

    public Object evaluate(Node node, Scope scope) {
        Scope previous = this.scope;
        this.scope = scope;
        try {
            return node.accept(this);
        } finally {
            this.scope = previous;
        }
    }

    @Override
    public Object visitNumberLit(Node.NumberLit node) {
        return node.value;
    }

    @Override
    public Object visitComplexLit(Node.ComplexLit node) {
        String sign = node.im >= 0 ? "+" : "";
        return stringify(node.re) + sign + stringify(node.im) + "i";
    }

    @Override
    public Object visitVariable(Node.Variable node) {
        Double value = scope.lookup(node.name);
        if (value != null) {
            return value;
        }
        value = Builtins.constant(node.name);
        if (value != null) {
            return value;
        }
        throw new EvalError("undefined variable", node.name);
    }

    @Override
    public Object visitAssignment(Node.Assignment node) {
        Object value = node.value.accept(this);
        if (value instanceof Double) {
            scope.define(node.name, (Double)value);
        }
        return value;
    }

    @Override
    public Object visitFunctionDef(Node.FunctionDef node) {
        scope.defineFunction(node.name, new UserFunction(node, scope));
        return node.name + "(" + join(node.params, ",") + ") defined";
    }

    @Override
    public Object visitBatch(Node.Batch node) {
        Object last = null;
        for (Node expr : node.expressions) {
            last = expr.accept(this);
        }
        return last;
    }

    @Override
    public Object visitBinaryOp(Node.BinaryOp node) {
        Object left = node.left.accept(this);
        Object right = node.right.accept(this);

        if (left instanceof Double && right instanceof Double) {
            // IEEE semantics: x/0 is +-Infinity or NaN, not an error
            return node.op.apply((Double)left, (Double)right);
        }
        return "(" + stringify(left) + " " + node.op.symbol + " " + stringify(right) + ")";
    }

    @Override
    public Object visitFunctionCall(Node.FunctionCall node) {
        CalcCallable callable = scope.getFunction(node.name);
        if (callable == null) {
            callable = Builtins.function(node.name);
        }
        if (callable == null) {
            throw new EvalError("unknown function", node.name);
        }

        List<Object> evaluated = new ArrayList<>();
        boolean symbolic = false;
        for (Node arg : node.args) {
            Object value = arg.accept(this);
            if (!(value instanceof Double)) {
                symbolic = true;
            }
            evaluated.add(value);
        }

        if (!acceptsNArgs(callable, evaluated.size())) {
            throw new EvalError("invalid arity (got " + evaluated.size() + ") for function", node.name);
        }

        if (symbolic) {
            List<String> parts = new ArrayList<>();
            for (Object value : evaluated) {
                parts.add(stringify(value));
            }
            return node.name + "(" + join(parts, ", ") + ")";
        }

        List<Double> args = new ArrayList<>();
        for (Object value : evaluated) {
            args.add((Double)value);
        }
        return callable.call(this, args);
    }

    @Override
    public Object visitUnaryMinus(Node.UnaryMinus node) {
        Object operand = node.operand.accept(this);
        if (operand instanceof Double) {
            return -((Double)operand);
        }
        return "-(" + stringify(operand) + ")";
    }

    static boolean acceptsNArgs(CalcCallable callable, int nArgs) {
        int arityMin = callable.arityMin();
        int arityMax = callable.arityMax();
        if (arityMax < 0) { arityMax = Integer.MAX_VALUE; }
        return nArgs >= arityMin && nArgs <= arityMax;
    }

    public static String stringify(Object object) {
        if (object == null) return "";

        if (object instanceof Double) {
            return CalcUtil.formatNumber((Double)object);
        }

        return object.toString();
    }

    private static String join(List<String> parts, String sep) {
        StringBuilder builder = new StringBuilder();
        for (int i = 0; i < parts.size(); i++) {
            if (i > 0) builder.append(sep);
            builder.append(parts.get(i));
        }
        return builder.toString();
    }
}
