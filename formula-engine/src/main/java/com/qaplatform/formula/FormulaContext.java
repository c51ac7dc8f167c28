package com.qaplatform.formula;

import com.fasterxml.jackson.databind.JsonNode;

import java.util.*;

/**
 * Read-only snapshot of the values a formula is evaluated against. Instances are
 * immutable; use {@link #builder()} or {@link #toBuilder()} to derive new ones.
 */
public final class FormulaContext {

    private static final FormulaContext EMPTY = builder().build();

    private final Map<String, Double> dimensions;
    private final Map<String, Double> errorTypes;
    private final Map<String, Double> weights;
    private final double totalErrors;
    private final double unitCount;
    private final double errorRate;
    private final double maxScore;
    private final double passingThreshold;
    private final Map<String, Double> constants;
    private final Map<String, Double> variables;

    private FormulaContext(Builder builder) {
        this.dimensions = Collections.unmodifiableMap(new LinkedHashMap<>(builder.dimensions));
        this.errorTypes = Collections.unmodifiableMap(new LinkedHashMap<>(builder.errorTypes));
        this.weights = Collections.unmodifiableMap(new LinkedHashMap<>(builder.weights));
        this.totalErrors = builder.totalErrors;
        this.unitCount = builder.unitCount;
        this.errorRate = builder.errorRate;
        this.maxScore = builder.maxScore;
        this.passingThreshold = builder.passingThreshold;
        this.constants = Collections.unmodifiableMap(new LinkedHashMap<>(builder.constants));
        this.variables = Collections.unmodifiableMap(new LinkedHashMap<>(builder.variables));
    }

    public static FormulaContext empty() {
        return EMPTY;
    }

    public static Builder builder() {
        return new Builder();
    }

    public Builder toBuilder() {
        Builder builder = new Builder();
        builder.dimensions.putAll(dimensions);
        builder.errorTypes.putAll(errorTypes);
        builder.weights.putAll(weights);
        builder.totalErrors = totalErrors;
        builder.unitCount = unitCount;
        builder.errorRate = errorRate;
        builder.maxScore = maxScore;
        builder.passingThreshold = passingThreshold;
        builder.constants.putAll(constants);
        builder.variables.putAll(variables);
        return builder;
    }

    /**
     * Copy of this context with one extra variable binding.
     */
    public FormulaContext withVariable(String name, double value) {
        return toBuilder().variable(name, value).build();
    }

    /**
     * Read a context from JSON. Every field is optional; missing fields keep the defaults
     * of {@code base}.
     */
    public static FormulaContext fromJson(JsonNode root, FormulaContext base) {
        Builder builder = base.toBuilder();
        if (root == null || root.isNull() || root.isMissingNode()) {
            return builder.build();
        }
        if (!root.isObject()) {
            throw new IllegalArgumentException("Formula context must be a JSON object");
        }

        readMap(root, "dimensions", builder.dimensions);
        readMap(root, "errorTypes", builder.errorTypes);
        readMap(root, "weights", builder.weights);
        readMap(root, "constants", builder.constants);
        readMap(root, "variables", builder.variables);

        if (root.has("totalErrors")) builder.totalErrors(readNumber(root, "totalErrors"));
        if (root.has("unitCount")) builder.unitCount(readNumber(root, "unitCount"));
        if (root.has("errorRate")) builder.errorRate(readNumber(root, "errorRate"));
        if (root.has("maxScore")) builder.maxScore(readNumber(root, "maxScore"));
        if (root.has("passingThreshold")) builder.passingThreshold(readNumber(root, "passingThreshold"));

        return builder.build();
    }

    public static FormulaContext fromJson(JsonNode root) {
        return fromJson(root, EMPTY);
    }

    private static void readMap(JsonNode root, String field, Map<String, Double> target) {
        JsonNode node = root.get(field);
        if (node == null || node.isNull()) {
            return;
        }
        if (!node.isObject()) {
            throw new IllegalArgumentException("Context field '" + field + "' must be an object");
        }
        node.fields().forEachRemaining(entry -> {
            JsonNode value = entry.getValue();
            if (value.isNumber()) {
                target.put(entry.getKey(), value.doubleValue());
            } else if (value.isBoolean()) {
                target.put(entry.getKey(), value.booleanValue() ? 1.0 : 0.0);
            } else {
                throw new IllegalArgumentException("Context value '" + field + "." + entry.getKey()
                        + "' must be a number but was: " + value);
            }
        });
    }

    private static double readNumber(JsonNode root, String field) {
        JsonNode node = root.get(field);
        if (!node.isNumber()) {
            throw new IllegalArgumentException("Context field '" + field + "' must be a number but was: " + node);
        }
        return node.doubleValue();
    }

    public Map<String, Double> getDimensions() {
        return dimensions;
    }

    public Map<String, Double> getErrorTypes() {
        return errorTypes;
    }

    public Map<String, Double> getWeights() {
        return weights;
    }

    public double getTotalErrors() {
        return totalErrors;
    }

    public double getUnitCount() {
        return unitCount;
    }

    public double getErrorRate() {
        return errorRate;
    }

    public double getMaxScore() {
        return maxScore;
    }

    public double getPassingThreshold() {
        return passingThreshold;
    }

    public Map<String, Double> getConstants() {
        return constants;
    }

    public Map<String, Double> getVariables() {
        return variables;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof FormulaContext)) return false;
        FormulaContext that = (FormulaContext) o;
        return Double.compare(totalErrors, that.totalErrors) == 0
                && Double.compare(unitCount, that.unitCount) == 0
                && Double.compare(errorRate, that.errorRate) == 0
                && Double.compare(maxScore, that.maxScore) == 0
                && Double.compare(passingThreshold, that.passingThreshold) == 0
                && dimensions.equals(that.dimensions)
                && errorTypes.equals(that.errorTypes)
                && weights.equals(that.weights)
                && constants.equals(that.constants)
                && variables.equals(that.variables);
    }

    @Override
    public int hashCode() {
        return Objects.hash(dimensions, errorTypes, weights, totalErrors, unitCount, errorRate,
                maxScore, passingThreshold, constants, variables);
    }

    @Override
    public String toString() {
        return "FormulaContext{dimensions=" + dimensions +
                ", errorTypes=" + errorTypes +
                ", weights=" + weights +
                ", totalErrors=" + totalErrors +
                ", unitCount=" + unitCount +
                ", errorRate=" + errorRate +
                ", maxScore=" + maxScore +
                ", passingThreshold=" + passingThreshold +
                ", constants=" + constants +
                ", variables=" + variables + '}';
    }

    public static final class Builder {
        private final Map<String, Double> dimensions = new LinkedHashMap<>();
        private final Map<String, Double> errorTypes = new LinkedHashMap<>();
        private final Map<String, Double> weights = new LinkedHashMap<>();
        private double totalErrors;
        private double unitCount;
        private double errorRate;
        private double maxScore;
        private double passingThreshold;
        private final Map<String, Double> constants = new LinkedHashMap<>();
        private final Map<String, Double> variables = new LinkedHashMap<>();

        private Builder() {
        }

        public Builder dimension(String id, double score) {
            dimensions.put(Objects.requireNonNull(id, "id"), score);
            return this;
        }

        public Builder dimensions(Map<String, ? extends Number> values) {
            values.forEach((k, v) -> dimension(k, v.doubleValue()));
            return this;
        }

        public Builder errorType(String id, double count) {
            errorTypes.put(Objects.requireNonNull(id, "id"), count);
            return this;
        }

        public Builder errorTypes(Map<String, ? extends Number> values) {
            values.forEach((k, v) -> errorType(k, v.doubleValue()));
            return this;
        }

        public Builder weight(String id, double value) {
            weights.put(Objects.requireNonNull(id, "id"), value);
            return this;
        }

        public Builder weights(Map<String, ? extends Number> values) {
            values.forEach((k, v) -> weight(k, v.doubleValue()));
            return this;
        }

        public Builder constant(String name, double value) {
            constants.put(Objects.requireNonNull(name, "name"), value);
            return this;
        }

        public Builder constants(Map<String, ? extends Number> values) {
            values.forEach((k, v) -> constant(k, v.doubleValue()));
            return this;
        }

        public Builder variable(String name, double value) {
            variables.put(Objects.requireNonNull(name, "name"), value);
            return this;
        }

        public Builder variables(Map<String, ? extends Number> values) {
            values.forEach((k, v) -> variable(k, v.doubleValue()));
            return this;
        }

        public Builder totalErrors(double totalErrors) {
            this.totalErrors = totalErrors;
            return this;
        }

        public Builder unitCount(double unitCount) {
            this.unitCount = unitCount;
            return this;
        }

        public Builder errorRate(double errorRate) {
            this.errorRate = errorRate;
            return this;
        }

        public Builder maxScore(double maxScore) {
            this.maxScore = maxScore;
            return this;
        }

        public Builder passingThreshold(double passingThreshold) {
            this.passingThreshold = passingThreshold;
            return this;
        }

        public FormulaContext build() {
            return new FormulaContext(this);
        }
    }
}
