package com.symcalc.test;

import java.util.HashMap;

import static org.junit.Assert.assertEquals;
import static org.junit.Assert.assertFalse;
import static org.junit.Assert.assertNull;
import static org.junit.Assert.assertTrue;
import static org.junit.Assert.fail;
import org.junit.Test;
import com.symcalc.calc.Builtins;
import com.symcalc.calc.Calc;
import com.symcalc.calc.EvalError;

public class BuiltinsTest {
    private static final double DELTA = 1e-9;

    @Test
    public void testRegistryLookup() {
        assertTrue(Builtins.isBuiltinName("sin"));
        assertTrue(Builtins.isBuiltinName("Log10"));
        assertTrue(Builtins.isBuiltinName("pi"));
        assertFalse(Builtins.isBuiltinName("x"));
        assertNull(Builtins.function("nosuch"));
        assertEquals(1, Builtins.function("sqrt").arityMin());
        assertEquals(-1, Builtins.function("max").arityMax());
    }

    @Test
    public void testLogarithms() {
        assertEquals(3.0, evalNum("log10(1000)"), DELTA);
        assertEquals(3.0, evalNum("log(1000)"), DELTA);
        assertEquals(3.0, evalNum("log2(8)"), DELTA);
        assertEquals(2.0, evalNum("ln(exp(2))"), DELTA);
    }

    @Test
    public void testTrig() {
        assertEquals(1.0, evalNum("sin(pi/2)"), DELTA);
        assertEquals(-1.0, evalNum("cos(pi)"), DELTA);
        assertEquals(Math.PI / 4, evalNum("atan(1)"), DELTA);
        assertEquals(0.5, evalNum("asinh(sinh(0.5))"), DELTA);
        assertEquals(2.0, evalNum("acosh(cosh(2))"), DELTA);
        assertEquals(0.25, evalNum("atanh(tanh(0.25))"), DELTA);
    }

    @Test
    public void testRounding() {
        assertEquals(3.0, evalNum("round(2.5)"), 0.0);
        assertEquals(-2.0, evalNum("round(-2.5)"), 0.0);
        assertEquals(2.0, evalNum("floor(2.7)"), 0.0);
        assertEquals(3.0, evalNum("ceil(2.1)"), 0.0);
    }

    @Test
    public void testVariadicMinMax() {
        assertEquals(1.0, evalNum("min(3, 1, 2)"), 0.0);
        assertEquals(3.0, evalNum("max(3, 1, 2)"), 0.0);
        assertEquals(7.0, evalNum("max(7)"), 0.0);
        assertArityError("max()", "max");
    }

    @Test
    public void testCombinatorics() {
        assertEquals(120.0, evalNum("factorial(5)"), 0.0);
        assertEquals(1.0, evalNum("factorial(0)"), 0.0);
        assertEquals(10.0, evalNum("ncr(5, 2)"), 0.0);
        assertEquals(20.0, evalNum("npr(5, 2)"), 0.0);
    }

    @Test(timeout = 5000)
    public void testCombinatoricsOnHugeArguments() {
        assertEquals(Double.POSITIVE_INFINITY, evalNum("factorial(171)"), 0.0);
        assertEquals(Double.POSITIVE_INFINITY, evalNum("factorial(3000000000)"), 0.0);
        assertEquals(3000000000.0, evalNum("ncr(3000000000, 1)"), 0.0);
        assertEquals(3000000000.0, evalNum("ncr(3000000000, 2999999999)"), 0.0);
        assertEquals(3000000000.0, evalNum("npr(3000000000, 1)"), 0.0);
        assertEquals(Double.POSITIVE_INFINITY, evalNum("ncr(3000000000, 1500000000)"), 0.0);
        assertEquals(Double.POSITIVE_INFINITY, evalNum("npr(3000000000, 3000000000)"), 0.0);
    }

    @Test
    public void testCombinatoricsEdges() {
        assertEquals(120.0, evalNum("ncr(10, 3)"), 0.0);
        assertEquals(1.0, evalNum("ncr(5, 0)"), 0.0);
        assertEquals(1.0, evalNum("ncr(5, 5)"), 0.0);
        assertEquals(1.0, evalNum("npr(5, 0)"), 0.0);
        assertEquals(120.0, evalNum("npr(5, 5)"), 0.0);
    }

    @Test
    public void testDomainErrors() {
        assertDomainError("factorial(-1)", "factorial");
        assertDomainError("factorial(2.5)", "factorial");
        assertDomainError("ncr(2, 5)", "ncr");
    }

    @Test
    public void testFinancial() {
        assertEquals(100.0, evalNum("pv(110, 0.1, 1)"), DELTA);
        assertEquals(121.0, evalNum("fv(100, 0.1, 2)"), DELTA);
        assertEquals(100.0, evalNum("npv(0.1, 110)"), DELTA);
        assertEquals(0.1, evalNum("irr(-100, 110)"), 1e-6);
        // 1000 over 12 periods at 1%
        assertEquals(88.84878867834168, evalNum("pmt(1000, 0.01, 12)"), 1e-6);
    }

    @Test
    public void testStatistics() {
        assertEquals(2.5, evalNum("mean(1, 2, 3, 4)"), DELTA);
        assertEquals(2.0, evalNum("median(3, 1, 2)"), DELTA);
        assertEquals(2.5, evalNum("median(4, 1, 3, 2)"), DELTA);
        assertEquals(2.0, evalNum("mode(1, 2, 2, 3)"), DELTA);
        assertEquals(1.0, evalNum("mode(2, 1)"), DELTA);
        assertEquals(4.0, evalNum("variance(2, 4, 4, 4, 5, 5, 7, 9)"), DELTA);
        assertEquals(2.0, evalNum("stddev(2, 4, 4, 4, 5, 5, 7, 9)"), DELTA);
    }

    private static double evalNum(String src) {
        return (Double)Calc.evaluateAST(Calc.parseExpression(src), new HashMap<String, Double>());
    }

    private static void assertDomainError(String src, String name) {
        try {
            evalNum(src);
            fail("expected EvalError for " + src);
        } catch (EvalError err) {
            assertEquals(name, err.getName());
            assertTrue(err.getMessage().startsWith("domain error"));
        }
    }

    private static void assertArityError(String src, String name) {
        try {
            evalNum(src);
            fail("expected EvalError for " + src);
        } catch (EvalError err) {
            assertEquals(name, err.getName());
            assertTrue(err.getMessage().startsWith("invalid arity"));
        }
    }
}
