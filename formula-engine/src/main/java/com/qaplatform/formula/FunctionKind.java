package com.qaplatform.formula;

/**
 * How a built-in treats its arguments.
 */
public enum FunctionKind {
    /**
     * Every argument is evaluated and must be a number.
     */
    NUMERIC,

    /**
     * Arguments are coerced to booleans and evaluated left to right, stopping early where possible.
     */
    LOGICAL,

    /**
     * Single string-literal id looked up in one of the context maps.
     */
    ACCESSOR,

    /**
     * No arguments, reads a scalar field of the context.
     */
    CONTEXT,

    /**
     * {@code if(cond, whenTrue, whenFalse)}: only the chosen branch is evaluated.
     */
    CONDITIONAL
}
