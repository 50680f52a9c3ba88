package com.symcalc.calc;

public class SolutionStep {
    public enum Kind {
        SIMPLIFICATION,
        SUBSTITUTION,
        EVALUATION
    }

    public final int id;
    public final Kind kind;
    public final String description;
    public final String expression;
    public final String result; // the expression itself when the step has no result

    SolutionStep(int id, Kind kind, String description, String expression, String result) {
        this.id = id;
        this.kind = kind;
        this.description = description;
        this.expression = expression;
        this.result = result == null ? expression : result;
    }

    @Override
    public String toString() {
        return id + ". " + description + ": " + expression +
            (result.equals(expression) ? "" : " => " + result);
    }
}
