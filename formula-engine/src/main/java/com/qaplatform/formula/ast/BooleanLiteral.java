package com.qaplatform.formula.ast;

import com.qaplatform.formula.SourcePosition;

import java.util.List;

public final class BooleanLiteral extends FormulaNode {

    private final boolean value;

    public BooleanLiteral(boolean value, SourcePosition position) {
        super(position);
        this.value = value;
    }

    public boolean getValue() {
        return value;
    }

    @Override
    public List<FormulaNode> getChildren() {
        return List.of();
    }

    @Override
    public String toString() {
        return String.valueOf(value);
    }
}
