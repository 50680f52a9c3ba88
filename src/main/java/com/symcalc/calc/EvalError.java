package com.symcalc.calc;

public class EvalError extends CalcError {
    final String name;

    EvalError(String message, String name) {
        super(message + " '" + name + "'", -1);
        this.name = name;
    }

    // the variable or function name the error is about
    public String getName() {
        return name;
    }
}
