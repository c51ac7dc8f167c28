package com.qaplatform.formula.ast;

import com.qaplatform.formula.SourcePosition;

import java.util.List;

/**
 * Prefix {@code -} (negation) or {@code !} (logical not).
 */
public final class UnaryOperation extends FormulaNode {

    private final String operator;
    private final FormulaNode operand;

    public UnaryOperation(String operator, FormulaNode operand, SourcePosition position) {
        super(position);
        this.operator = operator;
        this.operand = operand;
    }

    public String getOperator() {
        return operator;
    }

    public FormulaNode getOperand() {
        return operand;
    }

    @Override
    public List<FormulaNode> getChildren() {
        return List.of(operand);
    }

    @Override
    public String toString() {
        return operator + operand;
    }
}
