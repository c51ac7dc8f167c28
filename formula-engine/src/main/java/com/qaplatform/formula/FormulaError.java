package com.qaplatform.formula;

import java.util.Objects;

/**
 * A blocking error reported by validation or evaluation. The position is null when
 * the error is not tied to a location in the source.
 */
public final class FormulaError {

    private final FormulaErrorType type;
    private final String message;
    private final SourcePosition position;

    public FormulaError(FormulaErrorType type, String message, SourcePosition position) {
        this.type = Objects.requireNonNull(type, "type");
        this.message = Objects.requireNonNull(message, "message");
        this.position = position;
    }

    public FormulaErrorType getType() {
        return type;
    }

    public String getMessage() {
        return message;
    }

    public SourcePosition getPosition() {
        return position;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof FormulaError)) return false;
        FormulaError that = (FormulaError) o;
        return type == that.type && message.equals(that.message) && Objects.equals(position, that.position);
    }

    @Override
    public int hashCode() {
        return Objects.hash(type, message, position);
    }

    @Override
    public String toString() {
        return position == null
                ? type + ": " + message
                : type + " at " + position + ": " + message;
    }
}
