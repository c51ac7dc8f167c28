package com.qaplatform.formula;

import java.util.List;

/**
 * Outcome of static validation. {@code errors} block the formula, {@code warnings} and
 * {@code suggestedFixes} are hints only.
 */
public final class ValidationResult {

    private final boolean valid;
    private final List<FormulaError> errors;
    private final List<String> warnings;
    private final List<String> suggestedFixes;
    private final double parseTimeMs;

    public ValidationResult(List<FormulaError> errors, List<String> warnings,
                            List<String> suggestedFixes, double parseTimeMs) {
        this.errors = List.copyOf(errors);
        this.warnings = List.copyOf(warnings);
        this.suggestedFixes = List.copyOf(suggestedFixes);
        this.valid = this.errors.isEmpty();
        this.parseTimeMs = parseTimeMs;
    }

    public boolean isValid() {
        return valid;
    }

    public List<FormulaError> getErrors() {
        return errors;
    }

    public List<String> getWarnings() {
        return warnings;
    }

    public List<String> getSuggestedFixes() {
        return suggestedFixes;
    }

    /**
     * Wall-clock time of tokenize, parse and static checks. Informational only.
     */
    public double getParseTimeMs() {
        return parseTimeMs;
    }

    public boolean hasError(FormulaErrorType type) {
        return errors.stream().anyMatch(e -> e.getType() == type);
    }

    @Override
    public String toString() {
        return "ValidationResult{valid=" + valid +
                ", errors=" + errors +
                ", warnings=" + warnings +
                ", suggestedFixes=" + suggestedFixes + '}';
    }
}
