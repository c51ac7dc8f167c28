package com.qaplatform.formula.ast;

import com.qaplatform.formula.SourcePosition;

import java.util.List;
import java.util.stream.Collectors;

public final class FunctionCall extends FormulaNode {

    private final String name;
    private final List<FormulaNode> arguments;

    public FunctionCall(String name, List<FormulaNode> arguments, SourcePosition position) {
        super(position);
        this.name = name;
        this.arguments = List.copyOf(arguments);
    }

    public String getName() {
        return name;
    }

    public List<FormulaNode> getArguments() {
        return arguments;
    }

    public int getArgumentCount() {
        return arguments.size();
    }

    @Override
    public List<FormulaNode> getChildren() {
        return arguments;
    }

    @Override
    public String toString() {
        return name + arguments.stream().map(String::valueOf).collect(Collectors.joining(", ", "(", ")"));
    }
}
