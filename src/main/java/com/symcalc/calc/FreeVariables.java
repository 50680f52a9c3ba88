package com.symcalc.calc;

import java.util.ArrayList;
import java.util.HashSet;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Set;
import java.util.Stack;

/**
 * Collects the variables a tree reads without binding them first, ie. the
 * names a caller has to put in the scope before evaluating. Built-in
 * constants, function parameters and names assigned earlier in the same
 * batch are not free.
 */
public class FreeVariables implements Node.Visitor<Void> {
    private final Stack<Set<String>> scopes = new Stack<>();
    private final Set<String> free = new LinkedHashSet<>();

    private FreeVariables() {
        scopes.push(new HashSet<String>());
    }

    // names in order of first occurrence
    public static List<String> of(Node node) {
        FreeVariables collector = new FreeVariables();
        node.accept(collector);
        return new ArrayList<>(collector.free);
    }

    @Override
    public Void visitNumberLit(Node.NumberLit node) {
        return null;
    }

    @Override
    public Void visitComplexLit(Node.ComplexLit node) {
        return null;
    }

    @Override
    public Void visitVariable(Node.Variable node) {
        if (!isBound(node.name) && Builtins.constant(node.name) == null) {
            free.add(node.name);
        }
        return null;
    }

    @Override
    public Void visitAssignment(Node.Assignment node) {
        node.value.accept(this);
        scopes.peek().add(node.name);
        return null;
    }

    @Override
    public Void visitFunctionDef(Node.FunctionDef node) {
        scopes.push(new HashSet<String>(node.params));
        try {
            node.body.accept(this);
        } finally {
            scopes.pop();
        }
        return null;
    }

    @Override
    public Void visitBatch(Node.Batch node) {
        for (Node expr : node.expressions) {
            expr.accept(this);
        }
        return null;
    }

    @Override
    public Void visitBinaryOp(Node.BinaryOp node) {
        node.left.accept(this);
        node.right.accept(this);
        return null;
    }

    @Override
    public Void visitFunctionCall(Node.FunctionCall node) {
        for (Node arg : node.args) {
            arg.accept(this);
        }
        return null;
    }

    @Override
    public Void visitUnaryMinus(Node.UnaryMinus node) {
        node.operand.accept(this);
        return null;
    }

    private boolean isBound(String name) {
        for (Set<String> scope : scopes) {
            if (scope.contains(name)) return true;
        }
        return false;
    }
}
