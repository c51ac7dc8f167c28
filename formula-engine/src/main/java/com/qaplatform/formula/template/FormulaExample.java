package com.qaplatform.formula.template;

import com.qaplatform.formula.FormulaContext;

/**
 * A worked example attached to a template: a context and the result the template's
 * expression should produce for it.
 */
public final class FormulaExample {

    private final String name;
    private final String description;
    private final FormulaContext context;
    private final Object expectedResult;
    private final String explanation;

    public FormulaExample(String name, String description, FormulaContext context,
                          Object expectedResult, String explanation) {
        if (!(expectedResult instanceof Double) && !(expectedResult instanceof Boolean)) {
            throw new IllegalArgumentException("Expected result of example '" + name
                    + "' must be a number or a boolean but was: " + expectedResult);
        }
        this.name = name;
        this.description = description;
        this.context = context;
        this.expectedResult = expectedResult;
        this.explanation = explanation;
    }

    public String getName() {
        return name;
    }

    public String getDescription() {
        return description;
    }

    public FormulaContext getContext() {
        return context;
    }

    public Object getExpectedResult() {
        return expectedResult;
    }

    public String getExplanation() {
        return explanation;
    }
}
