package com.symcalc.test;

import java.io.ByteArrayOutputStream;
import java.io.PrintStream;
import java.util.HashMap;
import java.util.Map;

import static org.junit.Assert.assertEquals;
import static org.junit.Assert.fail;
import org.junit.Test;
import com.symcalc.calc.Calc;
import com.symcalc.calc.CalcError;
import com.symcalc.calc.Node;
import com.symcalc.calc.Scanner;

public class CalcTest {

    @Test
    public void testTokenize() {
        assertEquals(6, Calc.tokenize("f(x)=1").size());
    }

    @Test
    public void testLexErrorsSurfaceFromParse() {
        try {
            Calc.parseExpression("1 + 2.3.4");
            fail("expected LexError");
        } catch (Scanner.LexError err) {
            assertEquals(4, err.getPosition());
        }
    }

    @Test
    public void testAllErrorsShareBaseType() {
        String[] bad = { "1 $ 2", "1 +", "nosuch(1)" };
        for (String src : bad) {
            try {
                Calc.evaluateAST(Calc.parseExpression(src), new HashMap<String, Double>());
                fail("expected error for " + src);
            } catch (CalcError err) {
                // expected
            }
        }
    }

    @Test
    public void testDebugOutputOnlyForEnabledKeys() {
        PrintStream oldErr = System.err;
        ByteArrayOutputStream err = new ByteArrayOutputStream();
        System.setErr(new PrintStream(err, true));
        try {
            Calc.simplifyAST(Calc.parseExpression("x * 1"));
            assertEquals("", err.toString());

            Calc.debugKeys.put("simplify", true);
            Calc.simplifyAST(Calc.parseExpression("x * 1"));
            assertEquals("[DEBUG] (simplify): x * 1 => x", err.toString().trim());
        } finally {
            Calc.debugKeys.clear();
            System.setErr(oldErr);
        }
    }

    @Test
    public void testParseSimplifyEvaluate() {
        Map<String, Double> scope = new HashMap<>();
        scope.put("x", 4.0);
        Node simplified = Calc.simplifyAST(Calc.parseExpression("x^1 * (2 + 3) + 0"));
        assertEquals(new Node.BinaryOp(Node.Op.MULTIPLY, new Node.Variable("x"), new Node.NumberLit(5)),
            simplified);
        assertEquals(20.0, (Double)Calc.evaluateAST(simplified, scope), 0.0);
    }
}
