package com.symcalc.calc;

import java.util.ArrayList;
import java.util.Collections;
import java.util.HashMap;
import java.util.List;
import java.util.Map;

/**
 * Built-in constants and functions. Both tables are filled once when the
 * class is loaded and are read-only afterwards, so they are shared freely
 * between evaluations. Names are stored lower-case.
 */
public final class Builtins {
    static final Map<String, Double> CONSTANTS;
    static final Map<String, CalcCallable> FUNCTIONS;

    static {
        Map<String, Double> constants = new HashMap<>();
        constants.put("pi", Math.PI);
        constants.put("e", Math.E);
        CONSTANTS = Collections.unmodifiableMap(constants);

        Map<String, CalcCallable> functions = new HashMap<>();
        defineTrigFunctions(functions);
        defineArithmeticFunctions(functions);
        defineCombinatoricsFunctions(functions);
        defineFinancialFunctions(functions);
        defineStatisticsFunctions(functions);
        FUNCTIONS = Collections.unmodifiableMap(functions);
    }

    private Builtins() {}

    public static Double constant(String name) {
        return CONSTANTS.get(name.toLowerCase());
    }

    public static CalcCallable function(String name) {
        return FUNCTIONS.get(name.toLowerCase());
    }

    public static boolean isBuiltinName(String name) {
        String lower = name.toLowerCase();
        return CONSTANTS.containsKey(lower) || FUNCTIONS.containsKey(lower);
    }

    // single-argument functions over a double
    private abstract static class MathFunction extends NativeFunction {
        MathFunction(String name) {
            super(name, 1, 1);
        }

        abstract double apply(double x);

        @Override
        protected double _call(List<Double> args) {
            return apply(args.get(0));
        }
    }

    private static void define(Map<String, CalcCallable> functions, CalcCallable fn) {
        functions.put(fn.getName(), fn);
    }

    private static void defineTrigFunctions(Map<String, CalcCallable> functions) {
        define(functions, new MathFunction("sin") {
            double apply(double x) { return Math.sin(x); }
        });
        define(functions, new MathFunction("cos") {
            double apply(double x) { return Math.cos(x); }
        });
        define(functions, new MathFunction("tan") {
            double apply(double x) { return Math.tan(x); }
        });
        define(functions, new MathFunction("asin") {
            double apply(double x) { return Math.asin(x); }
        });
        define(functions, new MathFunction("acos") {
            double apply(double x) { return Math.acos(x); }
        });
        define(functions, new MathFunction("atan") {
            double apply(double x) { return Math.atan(x); }
        });
        define(functions, new MathFunction("sinh") {
            double apply(double x) { return Math.sinh(x); }
        });
        define(functions, new MathFunction("cosh") {
            double apply(double x) { return Math.cosh(x); }
        });
        define(functions, new MathFunction("tanh") {
            double apply(double x) { return Math.tanh(x); }
        });
        define(functions, new MathFunction("asinh") {
            double apply(double x) {
                if (Double.isInfinite(x)) return x;
                return Math.log(x + Math.sqrt(x * x + 1.0));
            }
        });
        define(functions, new MathFunction("acosh") {
            double apply(double x) { return Math.log(x + Math.sqrt(x * x - 1.0)); }
        });
        define(functions, new MathFunction("atanh") {
            double apply(double x) { return 0.5 * Math.log((1.0 + x) / (1.0 - x)); }
        });
    }

    private static void defineArithmeticFunctions(Map<String, CalcCallable> functions) {
        define(functions, new MathFunction("ln") {
            double apply(double x) { return Math.log(x); }
        });
        // log is base 10, like log10
        define(functions, new MathFunction("log") {
            double apply(double x) { return Math.log10(x); }
        });
        define(functions, new MathFunction("log10") {
            double apply(double x) { return Math.log10(x); }
        });
        define(functions, new MathFunction("log2") {
            double apply(double x) { return Math.log(x) / Math.log(2.0); }
        });
        define(functions, new MathFunction("sqrt") {
            double apply(double x) { return Math.sqrt(x); }
        });
        define(functions, new MathFunction("abs") {
            double apply(double x) { return Math.abs(x); }
        });
        define(functions, new MathFunction("exp") {
            double apply(double x) { return Math.exp(x); }
        });
        define(functions, new MathFunction("floor") {
            double apply(double x) { return Math.floor(x); }
        });
        define(functions, new MathFunction("ceil") {
            double apply(double x) { return Math.ceil(x); }
        });
        // half up, so round(-2.5) is -2
        define(functions, new MathFunction("round") {
            double apply(double x) { return Math.floor(x + 0.5); }
        });
        define(functions, new NativeFunction("pow", 2, 2) {
            @Override
            protected double _call(List<Double> args) {
                return Math.pow(args.get(0), args.get(1));
            }
        });
        define(functions, new NativeFunction("min", 1, -1) {
            @Override
            protected double _call(List<Double> args) {
                double min = Double.POSITIVE_INFINITY;
                for (double arg : args) {
                    min = Math.min(min, arg);
                }
                return min;
            }
        });
        define(functions, new NativeFunction("max", 1, -1) {
            @Override
            protected double _call(List<Double> args) {
                double max = Double.NEGATIVE_INFINITY;
                for (double arg : args) {
                    max = Math.max(max, arg);
                }
                return max;
            }
        });
    }

    static double factorial(double n) {
        if (n < 0 || !CalcUtil.isInteger(n)) {
            throw new IllegalArgumentException("factorial only defined for non-negative integers");
        }
        // 171! is past Double.MAX_VALUE
        if (n > 170) return Double.POSITIVE_INFINITY;
        double res = 1;
        for (int i = 2; i <= n; i++) res *= i;
        return res;
    }

    // n! / (r! (n-r)!) as a running product; each factor is at least 2, so the
    // loop overflows to Infinity within a bounded number of steps
    static double choose(double n, double r) {
        double k = Math.min(r, n - r);
        double res = 1;
        for (double i = 1; i <= k && !Double.isInfinite(res); i++) {
            res = res * (n - k + i) / i;
        }
        return res;
    }

    // n! / (n-r)!, the product (n-r+1) * ... * n, stopping once it overflows
    static double permute(double n, double r) {
        double res = 1;
        for (double i = n - r + 1; i <= n && !Double.isInfinite(res); i++) {
            res *= i;
        }
        return res;
    }

    private static void checkChoose(double n, double r, String fname) {
        if (n < 0 || r < 0 || !CalcUtil.isInteger(n) || !CalcUtil.isInteger(r) || r > n) {
            throw new IllegalArgumentException(fname + " only defined for non-negative integers with r <= n");
        }
    }

    private static void defineCombinatoricsFunctions(Map<String, CalcCallable> functions) {
        define(functions, new MathFunction("factorial") {
            double apply(double x) { return factorial(x); }
        });
        define(functions, new NativeFunction("ncr", 2, 2) {
            @Override
            protected double _call(List<Double> args) {
                double n = args.get(0);
                double r = args.get(1);
                checkChoose(n, r, "nCr");
                return choose(n, r);
            }
        });
        define(functions, new NativeFunction("npr", 2, 2) {
            @Override
            protected double _call(List<Double> args) {
                double n = args.get(0);
                double r = args.get(1);
                checkChoose(n, r, "nPr");
                return permute(n, r);
            }
        });
    }

    private static void defineFinancialFunctions(Map<String, CalcCallable> functions) {
        // pv(fv, rate, periods)
        define(functions, new NativeFunction("pv", 3, 3) {
            @Override
            protected double _call(List<Double> args) {
                return args.get(0) / Math.pow(1 + args.get(1), args.get(2));
            }
        });
        // fv(pv, rate, periods)
        define(functions, new NativeFunction("fv", 3, 3) {
            @Override
            protected double _call(List<Double> args) {
                return args.get(0) * Math.pow(1 + args.get(1), args.get(2));
            }
        });
        // pmt(pv, rate, periods)
        define(functions, new NativeFunction("pmt", 3, 3) {
            @Override
            protected double _call(List<Double> args) {
                double pv = args.get(0);
                double rate = args.get(1);
                double n = args.get(2);
                return (pv * rate) / (1 - Math.pow(1 + rate, -n));
            }
        });
        // npv(rate, cf1, cf2, ...), first cash flow discounted one period
        define(functions, new NativeFunction("npv", 1, -1) {
            @Override
            protected double _call(List<Double> args) {
                double rate = args.get(0);
                double acc = 0;
                for (int i = 1; i < args.size(); i++) {
                    acc += args.get(i) / Math.pow(1 + rate, i);
                }
                return acc;
            }
        });
        // irr(cf0, cf1, ...) by Newton's method from a 10% guess
        define(functions, new NativeFunction("irr", 1, -1) {
            @Override
            protected double _call(List<Double> args) {
                double guess = 0.1;
                for (int iter = 0; iter < 100; iter++) {
                    double npv = 0;
                    double dnpv = 0;
                    for (int i = 0; i < args.size(); i++) {
                        npv += args.get(i) / Math.pow(1 + guess, i);
                        if (i > 0) dnpv -= i * args.get(i) / Math.pow(1 + guess, i + 1);
                    }
                    double next = guess - npv / dnpv;
                    if (Math.abs(next - guess) < 1e-7) return next;
                    guess = next;
                }
                throw new IllegalArgumentException("IRR did not converge");
            }
        });
    }

    static double mean(List<Double> nums) {
        double sum = 0;
        for (double n : nums) sum += n;
        return sum / nums.size();
    }

    static double variance(List<Double> nums) {
        double m = mean(nums);
        double acc = 0;
        for (double n : nums) acc += (n - m) * (n - m);
        return acc / nums.size();
    }

    private static void defineStatisticsFunctions(Map<String, CalcCallable> functions) {
        define(functions, new NativeFunction("mean", 1, -1) {
            @Override
            protected double _call(List<Double> args) {
                return mean(args);
            }
        });
        define(functions, new NativeFunction("median", 1, -1) {
            @Override
            protected double _call(List<Double> args) {
                List<Double> sorted = new ArrayList<>(args);
                Collections.sort(sorted);
                int mid = sorted.size() / 2;
                if (sorted.size() % 2 == 0) {
                    return (sorted.get(mid - 1) + sorted.get(mid)) / 2;
                }
                return sorted.get(mid);
            }
        });
        // most frequent value, the smallest one on ties
        define(functions, new NativeFunction("mode", 1, -1) {
            @Override
            protected double _call(List<Double> args) {
                Map<Double, Integer> freq = new HashMap<>();
                for (Double n : args) {
                    Integer count = freq.get(n);
                    freq.put(n, count == null ? 1 : count + 1);
                }
                double mode = Double.NaN;
                int maxFreq = 0;
                for (Map.Entry<Double, Integer> entry : freq.entrySet()) {
                    int count = entry.getValue();
                    double value = entry.getKey();
                    if (count > maxFreq || (count == maxFreq && value < mode)) {
                        maxFreq = count;
                        mode = value;
                    }
                }
                return mode;
            }
        });
        define(functions, new NativeFunction("stddev", 1, -1) {
            @Override
            protected double _call(List<Double> args) {
                return Math.sqrt(variance(args));
            }
        });
        define(functions, new NativeFunction("variance", 1, -1) {
            @Override
            protected double _call(List<Double> args) {
                return variance(args);
            }
        });
    }
}
