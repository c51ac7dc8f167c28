package com.qaplatform.formula.ast;

import com.qaplatform.formula.SourcePosition;

import java.util.List;
import java.util.Set;

/**
 * Infix operation. The position is that of the operator token.
 */
public final class BinaryOperation extends FormulaNode {

    public static final Set<String> ARITHMETIC = Set.of("+", "-", "*", "/", "%", "^");
    public static final Set<String> COMPARISON = Set.of(">", "<", ">=", "<=", "==", "!=");

    private final String operator;
    private final FormulaNode left;
    private final FormulaNode right;

    public BinaryOperation(String operator, FormulaNode left, FormulaNode right, SourcePosition position) {
        super(position);
        this.operator = operator;
        this.left = left;
        this.right = right;
    }

    public String getOperator() {
        return operator;
    }

    public FormulaNode getLeft() {
        return left;
    }

    public FormulaNode getRight() {
        return right;
    }

    public boolean isComparison() {
        return COMPARISON.contains(operator);
    }

    public boolean isDivision() {
        return operator.equals("/") || operator.equals("%");
    }

    @Override
    public List<FormulaNode> getChildren() {
        return List.of(left, right);
    }

    @Override
    public String toString() {
        return "(" + left + " " + operator + " " + right + ")";
    }
}
