package com.qaplatform.formula;

import java.util.List;

/**
 * Outcome of one evaluation. The result is a Double or a Boolean when valid and null
 * when any error occurred.
 */
public final class ExecutionResult {

    private final Object result;
    private final boolean valid;
    private final List<FormulaError> errors;
    private final List<String> warnings;
    private final double executionTimeMs;

    private ExecutionResult(Object result, List<FormulaError> errors, List<String> warnings, double executionTimeMs) {
        this.errors = List.copyOf(errors);
        this.valid = this.errors.isEmpty();
        this.result = valid ? result : null;
        this.warnings = List.copyOf(warnings);
        this.executionTimeMs = executionTimeMs;
    }

    public static ExecutionResult success(Object result, List<String> warnings, double executionTimeMs) {
        if (!(result instanceof Double) && !(result instanceof Boolean)) {
            throw new IllegalArgumentException("Result must be a Double or Boolean but got: " + result);
        }
        return new ExecutionResult(result, List.of(), warnings, executionTimeMs);
    }

    public static ExecutionResult failure(List<FormulaError> errors, List<String> warnings, double executionTimeMs) {
        if (errors.isEmpty()) {
            throw new IllegalArgumentException("A failed result needs at least one error");
        }
        return new ExecutionResult(null, errors, warnings, executionTimeMs);
    }

    public static ExecutionResult failure(FormulaError error, List<String> warnings, double executionTimeMs) {
        return failure(List.of(error), warnings, executionTimeMs);
    }

    public Object getResult() {
        return result;
    }

    public boolean isValid() {
        return valid;
    }

    public boolean isNumeric() {
        return result instanceof Double;
    }

    public boolean isBoolean() {
        return result instanceof Boolean;
    }

    /**
     * Numeric result, with booleans read as 1 and 0.
     *
     * @throws IllegalStateException when the evaluation failed
     */
    public double asNumber() {
        if (result instanceof Double d) return d;
        if (result instanceof Boolean b) return b ? 1.0 : 0.0;
        throw new IllegalStateException("No result available: " + errors);
    }

    public List<FormulaError> getErrors() {
        return errors;
    }

    public List<String> getWarnings() {
        return warnings;
    }

    /**
     * Time spent walking the tree, excluding tokenize and parse.
     */
    public double getExecutionTimeMs() {
        return executionTimeMs;
    }

    public boolean hasError(FormulaErrorType type) {
        return errors.stream().anyMatch(e -> e.getType() == type);
    }

    @Override
    public String toString() {
        return "ExecutionResult{result=" + result +
                ", valid=" + valid +
                ", errors=" + errors +
                ", warnings=" + warnings + '}';
    }
}
