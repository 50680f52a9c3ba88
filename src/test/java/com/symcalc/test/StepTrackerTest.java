package com.symcalc.test;

import java.util.List;

import static org.junit.Assert.assertEquals;
import org.junit.Test;
import com.symcalc.calc.Calc;
import com.symcalc.calc.Scope;
import com.symcalc.calc.SolutionStep;
import com.symcalc.calc.StepTracker;

public class StepTrackerTest {

    @Test
    public void testAllSteps() {
        Scope scope = new Scope();
        scope.define("x", 3);
        StepTracker tracker = new StepTracker();
        Object result = tracker.evaluateWithSteps(Calc.parseExpression("x*1+0"), scope);
        assertEquals(3.0, (Double)result, 0.0);

        List<SolutionStep> steps = tracker.getSteps();
        assertEquals(4, steps.size());
        assertStep(steps.get(0), 0, SolutionStep.Kind.EVALUATION, "(x * 1) + 0", "(x * 1) + 0");
        assertStep(steps.get(1), 1, SolutionStep.Kind.SIMPLIFICATION, "x", "x");
        assertStep(steps.get(2), 2, SolutionStep.Kind.SUBSTITUTION, "x", "x = 3");
        assertEquals("Substitute values: x = 3", steps.get(2).description);
        assertStep(steps.get(3), 3, SolutionStep.Kind.EVALUATION, "x", "3");
        assertEquals("Final result", steps.get(3).description);
    }

    @Test
    public void testUnchangedAndUnboundStepsAreSkipped() {
        StepTracker tracker = new StepTracker();
        tracker.evaluateWithSteps(Calc.parseExpression("sqrt(16)"), new Scope());
        List<SolutionStep> steps = tracker.getSteps();
        assertEquals(2, steps.size());
        assertStep(steps.get(0), 0, SolutionStep.Kind.EVALUATION, "sqrt(16)", "sqrt(16)");
        assertStep(steps.get(1), 1, SolutionStep.Kind.EVALUATION, "sqrt(16)", "4");
    }

    @Test
    public void testConstantExpression() {
        StepTracker tracker = new StepTracker();
        tracker.evaluateWithSteps(Calc.parseExpression("2+3"), new Scope());
        List<SolutionStep> steps = tracker.getSteps();
        assertEquals(3, steps.size());
        assertEquals("5", steps.get(1).expression);
        assertEquals("5", steps.get(2).result);
        assertEquals("2. Final result: 5", steps.get(2).toString());
    }

    @Test
    public void testClear() {
        StepTracker tracker = new StepTracker();
        tracker.addStep(SolutionStep.Kind.EVALUATION, "first", "1", null);
        tracker.clear();
        tracker.addStep(SolutionStep.Kind.EVALUATION, "second", "2", "2");
        assertEquals(1, tracker.getSteps().size());
        assertEquals(0, tracker.getSteps().get(0).id);
    }

    private static void assertStep(SolutionStep step, int id, SolutionStep.Kind kind,
            String expression, String result) {
        assertEquals(id, step.id);
        assertEquals(kind, step.kind);
        assertEquals(expression, step.expression);
        assertEquals(result, step.result);
    }
}
