package com.symcalc.calc;

import java.util.List;

public interface CalcCallable {
    public double call(Evaluator evaluator, List<Double> args);
    public int arityMin();
    public int arityMax(); // -1 for variadic
    public String getName(); // ex: "sin"
    public String toString(); // ex: "<fn sin>"
}
