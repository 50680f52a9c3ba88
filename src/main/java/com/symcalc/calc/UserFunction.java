package com.symcalc.calc;

import java.util.List;

// Function bound by a definition like "f(x, y) = x^2 + y".
class UserFunction implements CalcCallable {
    final Node.FunctionDef declaration;
    final Scope closure;

    UserFunction(Node.FunctionDef declaration, Scope closure) {
        this.declaration = declaration;
        this.closure = closure;
    }

    @Override
    public double call(Evaluator evaluator, List<Double> args) {
        Scope scope = new Scope(closure);
        for (int i = 0; i < declaration.params.size(); i++) {
            scope.define(declaration.params.get(i), args.get(i));
        }
        Object result = evaluator.evaluate(declaration.body, scope);
        if (!(result instanceof Double)) {
            throw new EvalError("non-numeric result from function", getName());
        }
        return (Double)result;
    }

    @Override
    public String getName() {
        return declaration.name;
    }

    @Override
    public int arityMin() {
        return declaration.params.size();
    }

    @Override
    public int arityMax() {
        return declaration.params.size();
    }

    @Override
    public String toString() {
        return "<fn " + getName() + ">";
    }
}
