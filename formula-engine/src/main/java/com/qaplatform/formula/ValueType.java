package com.qaplatform.formula;

/**
 * Static type of an expression as seen by the validator.
 */
public enum ValueType {
    NUMBER,
    BOOLEAN,
    /**
     * Not known before evaluation, accepted wherever a value is expected.
     */
    ANY;

    public boolean compatibleWith(ValueType other) {
        return this == ANY || other == ANY || this == other;
    }
}
