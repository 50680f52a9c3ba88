package com.symcalc.calc;

import java.util.List;

/**
 * Built-in function. Subclasses override {@link #_call}; arity has already
 * been checked by the evaluator when it runs.
 */
class NativeFunction implements CalcCallable {
    final String name;
    final int arityMin;
    final int arityMax;

    NativeFunction(String name, int arityMin, int arityMax) {
        this.name = name;
        this.arityMin = arityMin;
        this.arityMax = arityMax;
    }

    @Override
    public double call(Evaluator evaluator, List<Double> args) {
        try {
            return _call(args);
        } catch (IllegalArgumentException e) {
            throw new EvalError("domain error (" + e.getMessage() + ") in function", name);
        }
    }

    // to override in subclass
    protected double _call(List<Double> args) {
        throw new EvalError("unimplemented function", name);
    }

    @Override
    public String getName() {
        return this.name;
    }

    @Override
    public int arityMin() {
        return this.arityMin;
    }

    @Override
    public int arityMax() {
        return this.arityMax;
    }

    @Override
    public String toString() {
        return "<native fn " + getName() + ">";
    }
}
