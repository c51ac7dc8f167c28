package com.qaplatform.formula.ast;

import com.qaplatform.formula.SourcePosition;

import java.util.List;

/**
 * A bare identifier, resolved through the context's variables and then its constants.
 */
public final class Variable extends FormulaNode {

    private final String name;

    public Variable(String name, SourcePosition position) {
        super(position);
        this.name = name;
    }

    public String getName() {
        return name;
    }

    @Override
    public List<FormulaNode> getChildren() {
        return List.of();
    }

    @Override
    public String toString() {
        return name;
    }
}
