package com.qaplatform.formula.ast;

import com.qaplatform.formula.SourcePosition;

import java.util.List;

/**
 * Quoted text. Only meaningful as the id argument of a domain accessor such as
 * {@code dimension("fluency")}.
 */
public final class StringLiteral extends FormulaNode {

    private final String value;

    public StringLiteral(String value, SourcePosition position) {
        super(position);
        this.value = value;
    }

    public String getValue() {
        return value;
    }

    @Override
    public List<FormulaNode> getChildren() {
        return List.of();
    }

    @Override
    public String toString() {
        return "\"" + value.replace("\"", "\\\"") + "\"";
    }
}
