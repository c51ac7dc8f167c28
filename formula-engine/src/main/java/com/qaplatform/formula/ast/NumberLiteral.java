package com.qaplatform.formula.ast;

import com.qaplatform.formula.SourcePosition;

import java.util.List;

public final class NumberLiteral extends FormulaNode {

    private final double value;

    public NumberLiteral(double value, SourcePosition position) {
        super(position);
        this.value = value;
    }

    public double getValue() {
        return value;
    }

    @Override
    public List<FormulaNode> getChildren() {
        return List.of();
    }

    @Override
    public String toString() {
        return value == Math.rint(value) && !Double.isInfinite(value)
                ? String.valueOf((long) value)
                : String.valueOf(value);
    }
}
