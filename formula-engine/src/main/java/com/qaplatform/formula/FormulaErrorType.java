package com.qaplatform.formula;

/**
 * Categories of formula failures. Every one of them is fatal for the call that raised it.
 */
public enum FormulaErrorType {
    /**
     * Tokenizing or parsing failed.
     */
    SYNTAX_ERROR,

    /**
     * A bare variable could not be resolved from the context.
     */
    UNKNOWN_IDENTIFIER,

    /**
     * A call names a function that is not registered.
     */
    UNKNOWN_FUNCTION,

    /**
     * A call has too few or too many arguments.
     */
    ARITY_ERROR,

    /**
     * An operand or argument has the wrong type.
     */
    TYPE_ERROR,

    /**
     * A divisor evaluated to exactly zero.
     */
    DIVISION_BY_ZERO,

    /**
     * The expression exceeds the configured node count or nesting depth.
     */
    COMPLEXITY_EXCEEDED,

    /**
     * Unexpected internal failure while evaluating a node.
     */
    RUNTIME_ERROR
}
