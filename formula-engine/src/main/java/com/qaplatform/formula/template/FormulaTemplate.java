package com.qaplatform.formula.template;

import java.util.List;
import java.util.Objects;

/**
 * A reusable scoring formula with metadata and worked examples.
 */
public final class FormulaTemplate {

    private final String id;
    private final String name;
    private final String description;
    private final String expression;
    private final TemplateCategory category;
    private final List<String> tags;
    private final List<String> variables;
    private final List<String> functions;
    private final int usageCount;
    private final double rating;
    private final List<FormulaExample> examples;

    public FormulaTemplate(String id, String name, String description, String expression,
                           TemplateCategory category, List<String> tags,
                           List<String> variables, List<String> functions,
                           int usageCount, double rating, List<FormulaExample> examples) {
        this.id = Objects.requireNonNull(id, "id");
        this.name = Objects.requireNonNull(name, "name");
        this.description = description == null ? "" : description;
        this.expression = Objects.requireNonNull(expression, "expression");
        this.category = Objects.requireNonNull(category, "category");
        this.tags = List.copyOf(tags);
        this.variables = List.copyOf(variables);
        this.functions = List.copyOf(functions);
        this.usageCount = usageCount;
        this.rating = rating;
        this.examples = List.copyOf(examples);
    }

    public String getId() {
        return id;
    }

    public String getName() {
        return name;
    }

    public String getDescription() {
        return description;
    }

    public String getExpression() {
        return expression;
    }

    public TemplateCategory getCategory() {
        return category;
    }

    public List<String> getTags() {
        return tags;
    }

    /**
     * Free variables of the expression.
     */
    public List<String> getVariables() {
        return variables;
    }

    /**
     * Functions called by the expression.
     */
    public List<String> getFunctions() {
        return functions;
    }

    public int getUsageCount() {
        return usageCount;
    }

    /**
     * Rating in [0, 5], 0 when unrated.
     */
    public double getRating() {
        return rating;
    }

    public List<FormulaExample> getExamples() {
        return examples;
    }

    @Override
    public String toString() {
        return id + " [" + category + "]: " + expression;
    }
}
