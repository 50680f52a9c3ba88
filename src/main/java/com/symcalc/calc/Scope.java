package com.symcalc.calc;

import java.util.Collections;
import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Name to value bindings for one evaluation. A root scope may wrap a map
 * owned by the caller, in which case assignments are visible to the caller
 * after evaluation. Function bodies run in a child scope that falls back to
 * the scope the function was defined in.
 */
public class Scope {
    private final Map<String, Double> values;
    private final Map<String, CalcCallable> functions = new HashMap<>();
    final Scope enclosing;

    public Scope() {
        this(new LinkedHashMap<String, Double>());
    }

    public Scope(Map<String, Double> values) {
        this.values = values;
        this.enclosing = null;
    }

    Scope(Scope enclosing) {
        this.values = new HashMap<>();
        this.enclosing = enclosing;
    }

    // binds in this scope, overwriting any previous value
    public void define(String name, double value) {
        values.put(name, value);
    }

    // null when the name isn't bound here or in any enclosing scope
    public Double lookup(String name) {
        if (values.containsKey(name)) {
            return values.get(name);
        }

        if (enclosing != null) {
            return enclosing.lookup(name);
        }

        return null;
    }

    public void defineFunction(String name, CalcCallable function) {
        functions.put(name, function);
    }

    public CalcCallable getFunction(String name) {
        if (functions.containsKey(name)) {
            return functions.get(name);
        }

        if (enclosing != null) {
            return enclosing.getFunction(name);
        }

        return null;
    }

    public Map<String, Double> values() {
        return Collections.unmodifiableMap(values);
    }

    public Map<String, CalcCallable> functions() {
        return Collections.unmodifiableMap(functions);
    }
}
