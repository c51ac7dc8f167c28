package com.qaplatform.formula.template;

import com.qaplatform.formula.ExecutionResult;

/**
 * Result of running one template example through the engine.
 */
public final class ExampleOutcome {

    public static final double TOLERANCE = 1e-6;

    private final FormulaExample example;
    private final ExecutionResult execution;
    private final boolean passed;

    public ExampleOutcome(FormulaExample example, ExecutionResult execution) {
        this.example = example;
        this.execution = execution;
        this.passed = execution.isValid() && matches(example.getExpectedResult(), execution.getResult());
    }

    static boolean matches(Object expected, Object actual) {
        if (expected instanceof Double e && actual instanceof Double a) {
            return Math.abs(e - a) <= TOLERANCE;
        }
        return expected.equals(actual);
    }

    public FormulaExample getExample() {
        return example;
    }

    public ExecutionResult getExecution() {
        return execution;
    }

    public boolean isPassed() {
        return passed;
    }

    @Override
    public String toString() {
        return example.getName() + ": " + (passed ? "passed" : "failed")
                + " (expected " + example.getExpectedResult() + ", got "
                + (execution.isValid() ? execution.getResult() : execution.getErrors()) + ")";
    }
}
