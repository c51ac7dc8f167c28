package com.qaplatform.formula.ast;

import com.qaplatform.formula.SourcePosition;

import java.util.List;

/**
 * Base of the immutable syntax tree. Nodes own their children, never point back to
 * a parent and are built bottom-up by the parser, so a tree is always acyclic.
 */
public abstract class FormulaNode {

    private final SourcePosition position;

    protected FormulaNode(SourcePosition position) {
        this.position = position;
    }

    public SourcePosition getPosition() {
        return position;
    }

    /**
     * Direct children in source order.
     */
    public abstract List<FormulaNode> getChildren();
}
