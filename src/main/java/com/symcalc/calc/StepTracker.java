package com.symcalc.calc;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Map;

/**
 * Records a worked solution: the expression as written, its simplified form,
 * the variable substitution and the final value.
 */
public class StepTracker {
    private final List<SolutionStep> steps = new ArrayList<>();
    private int currentId = 0;

    public void addStep(SolutionStep.Kind kind, String description, String expression, String result) {
        steps.add(new SolutionStep(currentId++, kind, description, expression, result));
    }

    public List<SolutionStep> getSteps() {
        return Collections.unmodifiableList(new ArrayList<>(steps));
    }

    public void clear() {
        steps.clear();
        currentId = 0;
    }

    public Object evaluateWithSteps(Node node, Scope scope) {
        String original = InfixPrinter.print(node);
        addStep(SolutionStep.Kind.EVALUATION, "Original expression", original, null);

        Node simplified = Calc.simplifyAST(node);
        String simplifiedText = InfixPrinter.print(simplified);
        if (!simplifiedText.equals(original)) {
            addStep(SolutionStep.Kind.SIMPLIFICATION, "Simplified expression", simplifiedText, null);
        }

        Map<String, Double> values = scope.values();
        if (!values.isEmpty()) {
            StringBuilder substitutions = new StringBuilder();
            for (Map.Entry<String, Double> entry : values.entrySet()) {
                if (substitutions.length() > 0) substitutions.append(", ");
                substitutions.append(entry.getKey()).append(" = ")
                    .append(CalcUtil.formatNumber(entry.getValue()));
            }
            addStep(SolutionStep.Kind.SUBSTITUTION, "Substitute values: " + substitutions,
                simplifiedText, substitutions.toString());
        }

        Object result = Calc.evaluateAST(simplified, scope);
        addStep(SolutionStep.Kind.EVALUATION, "Final result", simplifiedText,
            Evaluator.stringify(result));
        return result;
    }
}
