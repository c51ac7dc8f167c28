package com.qaplatform.formula;

/**
 * Carries a {@link FormulaError} out of the tokenizer, parser, validator or evaluator.
 * The engine facade converts it back into result entries, so it never reaches callers
 * of {@link FormulaEngine}.
 */
public class FormulaException extends RuntimeException {

    private final FormulaError error;
    private final String suggestion;

    public FormulaException(FormulaErrorType type, String message, SourcePosition position) {
        this(type, message, position, null, null);
    }

    public FormulaException(FormulaErrorType type, String message, SourcePosition position, String suggestion) {
        this(type, message, position, suggestion, null);
    }

    public FormulaException(FormulaErrorType type, String message, SourcePosition position,
                            String suggestion, Throwable cause) {
        super(message, cause);
        this.error = new FormulaError(type, message, position);
        this.suggestion = suggestion;
    }

    public FormulaError getError() {
        return error;
    }

    public FormulaErrorType getType() {
        return error.getType();
    }

    public SourcePosition getPosition() {
        return error.getPosition();
    }

    /**
     * Optional hint on how to fix the problem, or null.
     */
    public String getSuggestion() {
        return suggestion;
    }
}
