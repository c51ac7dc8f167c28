package com.qaplatform.formula;

import java.util.Objects;

/**
 * One registry entry: canonical name, arity bounds, argument handling, static result type
 * and the implementation used at evaluation time.
 */
public final class FunctionDefinition {

    public static final int VARIADIC = Integer.MAX_VALUE;

    private final String name;
    private final int minArity;
    private final int maxArity;
    private final FunctionKind kind;
    private final ValueType resultType;
    private final String description;
    private final FunctionImplementation implementation;

    public FunctionDefinition(String name, int minArity, int maxArity, FunctionKind kind,
                              ValueType resultType, String description,
                              FunctionImplementation implementation) {
        if (minArity < 0 || maxArity < minArity) {
            throw new IllegalArgumentException("Invalid arity " + minArity + ".." + maxArity + " for " + name);
        }
        this.name = Objects.requireNonNull(name, "name");
        this.minArity = minArity;
        this.maxArity = maxArity;
        this.kind = Objects.requireNonNull(kind, "kind");
        this.resultType = Objects.requireNonNull(resultType, "resultType");
        this.description = description;
        this.implementation = Objects.requireNonNull(implementation, "implementation");
    }

    public String getName() {
        return name;
    }

    public int getMinArity() {
        return minArity;
    }

    public int getMaxArity() {
        return maxArity;
    }

    public boolean isVariadic() {
        return maxArity == VARIADIC;
    }

    public FunctionKind getKind() {
        return kind;
    }

    /**
     * Result type for static checks. For {@code if} this is ANY and the validator
     * narrows it from the branches.
     */
    public ValueType getResultType() {
        return resultType;
    }

    public String getDescription() {
        return description;
    }

    public FunctionImplementation getImplementation() {
        return implementation;
    }

    public boolean acceptsArity(int count) {
        return count >= minArity && count <= maxArity;
    }

    /**
     * Arity in words, e.g. "exactly 1 argument" or "at least 2 arguments".
     */
    public String describeArity() {
        if (minArity == maxArity) {
            return minArity == 0 ? "no arguments" : "exactly " + minArity + plural(minArity);
        }
        if (isVariadic()) {
            return "at least " + minArity + plural(minArity);
        }
        return "between " + minArity + " and " + maxArity + " arguments";
    }

    private static String plural(int count) {
        return count == 1 ? " argument" : " arguments";
    }

    @Override
    public String toString() {
        return name + "/" + (isVariadic() ? minArity + "+" : minArity == maxArity ? String.valueOf(minArity) : minArity + ".." + maxArity);
    }
}
