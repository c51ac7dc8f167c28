package com.qaplatform.formula;

import com.qaplatform.formula.ast.FormulaNode;
import com.qaplatform.formula.ast.FunctionCall;
import com.qaplatform.formula.ast.Variable;

import java.util.ArrayList;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Set;

/**
 * Tree helpers used for editor hints, plus a sample context for trying formulas out.
 */
public final class FormulaUtils {

    private FormulaUtils() {
    }

    /**
     * Unique variable names in source order. Function names and boolean keywords are not variables.
     */
    public static List<String> extractVariables(FormulaNode root) {
        Set<String> names = new LinkedHashSet<>();
        collect(root, names, true);
        return new ArrayList<>(names);
    }

    /**
     * Unique function names in source order.
     */
    public static List<String> extractFunctions(FormulaNode root) {
        Set<String> names = new LinkedHashSet<>();
        collect(root, names, false);
        return new ArrayList<>(names);
    }

    private static void collect(FormulaNode node, Set<String> names, boolean variables) {
        if (variables && node instanceof Variable v) {
            names.add(v.getName());
        } else if (!variables && node instanceof FunctionCall call) {
            names.add(call.getName());
        }
        for (FormulaNode child : node.getChildren()) {
            collect(child, names, variables);
        }
    }

    /**
     * Representative values for exploratory testing of formulas.
     */
    public static FormulaContext createTestContext() {
        return FormulaContext.builder()
                .dimension("fluency", 85)
                .dimension("adequacy", 90)
                .dimension("style", 75)
                .dimension("terminology", 95)
                .errorType("minor", 2)
                .errorType("major", 1)
                .errorType("critical", 0)
                .weight("fluency", 30)
                .weight("adequacy", 40)
                .weight("style", 20)
                .weight("terminology", 10)
                .totalErrors(3)
                .unitCount(100)
                .errorRate(0.03)
                .constant("pi", Math.PI)
                .constant("e", Math.E)
                .maxScore(100)
                .passingThreshold(85)
                .build();
    }
}
