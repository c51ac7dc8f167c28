package com.qaplatform.formula;

import com.qaplatform.formula.ast.*;
import com.qaplatform.util.LoggingUtil;

import java.util.ArrayList;
import java.util.IdentityHashMap;
import java.util.List;
import java.util.Map;

/**
 * Recursive-descent parser over the token stream. Precedence from loosest to tightest:
 * comparisons, additive, multiplicative, {@code ^} (right-associative), prefix {@code -}/{@code !}.
 * <p>
 * The parser counts nodes, parenthesis nesting and the depth of the finished tree, and fails
 * with {@link FormulaErrorType#COMPLEXITY_EXCEEDED} once a limit is passed. Long operator
 * chains such as {@code 1 + 1 + ... + 1} build left-deep trees, so they count against
 * {@code maxDepth} as well.
 */
public class FormulaParser {

    public static final int DEFAULT_MAX_NODES = 500;
    public static final int DEFAULT_MAX_DEPTH = 100;

    private final List<Token> tokens;
    private final int maxNodes;
    private final int maxDepth;
    private int pos = 0;
    private int nodeCount = 0;
    private int depth = 0;
    private final Map<FormulaNode, Integer> treeDepths = new IdentityHashMap<>();

    public FormulaParser(List<Token> tokens) {
        this(tokens, DEFAULT_MAX_NODES, DEFAULT_MAX_DEPTH);
    }

    public FormulaParser(List<Token> tokens, int maxNodes, int maxDepth) {
        if (tokens.isEmpty() || !tokens.get(tokens.size() - 1).is(TokenType.EOF)) {
            throw new IllegalArgumentException("Token stream must end with EOF");
        }
        this.tokens = tokens;
        this.maxNodes = maxNodes;
        this.maxDepth = maxDepth;
    }

    /**
     * Tokenize and parse with the default limits.
     */
    public static FormulaNode parse(String expr) {
        return new FormulaParser(FormulaTokenizer.tokenize(expr)).parse();
    }

    /**
     * Parse exactly one expression; anything left before EOF is an error.
     */
    public FormulaNode parse() {
        if (current().is(TokenType.EOF)) {
            throw new FormulaException(FormulaErrorType.SYNTAX_ERROR,
                    "Formula is empty", current().getPosition(),
                    "Enter an expression such as dimension(\"fluency\") * 0.5");
        }

        FormulaNode root = parseComparison();

        Token trailing = current();
        if (!trailing.is(TokenType.EOF)) {
            String suggestion = trailing.is(TokenType.RPAREN)
                    ? "Remove the unmatched ')' or add a matching '('"
                    : "Join the parts with an operator such as '+' or '*'";
            throw new FormulaException(FormulaErrorType.SYNTAX_ERROR,
                    "Unexpected " + trailing.describe() + " after complete expression at " + trailing.getPosition(),
                    trailing.getPosition(), suggestion);
        }

        LoggingUtil.debug("Parsed formula into %d nodes", nodeCount);
        return root;
    }

    public int getNodeCount() {
        return nodeCount;
    }

    private FormulaNode parseComparison() {
        FormulaNode left = parseAdditive();
        while (peekOperator(">", "<", ">=", "<=", "==", "!=")) {
            Token op = advance();
            FormulaNode right = parseAdditive();
            left = count(new BinaryOperation(op.getText(), left, right, op.getPosition()));
        }
        return left;
    }

    private FormulaNode parseAdditive() {
        FormulaNode left = parseMultiplicative();
        while (peekOperator("+", "-")) {
            Token op = advance();
            FormulaNode right = parseMultiplicative();
            left = count(new BinaryOperation(op.getText(), left, right, op.getPosition()));
        }
        return left;
    }

    private FormulaNode parseMultiplicative() {
        FormulaNode left = parsePower();
        while (peekOperator("*", "/", "%")) {
            Token op = advance();
            FormulaNode right = parsePower();
            left = count(new BinaryOperation(op.getText(), left, right, op.getPosition()));
        }
        return left;
    }

    private FormulaNode parsePower() {
        enter();
        try {
            FormulaNode base = parseUnary();
            if (peekOperator("^")) {
                Token op = advance();
                FormulaNode exponent = parsePower();
                return count(new BinaryOperation("^", base, exponent, op.getPosition()));
            }
            return base;
        } finally {
            depth--;
        }
    }

    private FormulaNode parseUnary() {
        if (peekOperator("-", "!")) {
            enter();
            try {
                Token op = advance();
                FormulaNode operand = parseUnary();
                return count(new UnaryOperation(op.getText(), operand, op.getPosition()));
            } finally {
                depth--;
            }
        }
        return parsePrimary();
    }

    private FormulaNode parsePrimary() {
        Token token = current();
        switch (token.getType()) {
            case NUMBER:
                advance();
                return count(new NumberLiteral((Double) token.getValue(), token.getPosition()));
            case STRING:
                advance();
                return count(new StringLiteral((String) token.getValue(), token.getPosition()));
            case IDENTIFIER:
                advance();
                if (current().is(TokenType.LPAREN)) {
                    return parseCall(token);
                }
                if (token.getText().equals("true") || token.getText().equals("false")) {
                    return count(new BooleanLiteral(Boolean.parseBoolean(token.getText()), token.getPosition()));
                }
                return count(new Variable(token.getText(), token.getPosition()));
            case LPAREN:
                advance();
                FormulaNode inner = parseComparison();
                expectClosing(token, "Expected ')' to close '(' opened at " + token.getPosition());
                return inner;
            case EOF:
                throw new FormulaException(FormulaErrorType.SYNTAX_ERROR,
                        "Unexpected end of expression at " + token.getPosition(), token.getPosition(),
                        "Complete the expression after the last operator");
            default:
                throw new FormulaException(FormulaErrorType.SYNTAX_ERROR,
                        "Unexpected " + token.describe() + " at " + token.getPosition(), token.getPosition(),
                        "Check for missing operands, parentheses or commas");
        }
    }

    private FormulaNode parseCall(Token name) {
        Token open = advance();
        List<FormulaNode> args = new ArrayList<>();
        if (!current().is(TokenType.RPAREN)) {
            do {
                if (current().is(TokenType.COMMA) || current().is(TokenType.RPAREN)) {
                    throw new FormulaException(FormulaErrorType.SYNTAX_ERROR,
                            "Missing argument in call to '" + name.getText() + "' at " + current().getPosition(),
                            current().getPosition(), "Remove the extra ',' or supply the argument");
                }
                args.add(parseComparison());
            } while (matchComma());
        }
        expectClosing(open, "Expected ')' to close call to '" + name.getText() + "' opened at " + open.getPosition());
        return count(new FunctionCall(name.getText(), args, name.getPosition()));
    }

    private void expectClosing(Token open, String message) {
        Token token = current();
        if (token.is(TokenType.RPAREN)) {
            advance();
            return;
        }
        String found = token.is(TokenType.EOF) ? "" : " but found " + token.describe() + " at " + token.getPosition();
        throw new FormulaException(FormulaErrorType.SYNTAX_ERROR,
                message + found, token.getPosition(), "Add the missing ')'");
    }

    private boolean matchComma() {
        if (current().is(TokenType.COMMA)) {
            advance();
            return true;
        }
        return false;
    }

    private boolean peekOperator(String... symbols) {
        Token token = current();
        if (!token.is(TokenType.OPERATOR)) {
            return false;
        }
        for (String symbol : symbols) {
            if (token.getText().equals(symbol)) {
                return true;
            }
        }
        return false;
    }

    private Token current() {
        return tokens.get(pos);
    }

    private Token advance() {
        Token token = tokens.get(pos);
        if (pos < tokens.size() - 1) {
            pos++;
        }
        return token;
    }

    private void enter() {
        if (++depth > maxDepth) {
            throw new FormulaException(FormulaErrorType.COMPLEXITY_EXCEEDED,
                    "Formula nesting exceeds the limit of " + maxDepth + " levels",
                    current().getPosition(), "Split the formula into smaller parts");
        }
    }

    private <T extends FormulaNode> T count(T node) {
        if (++nodeCount > maxNodes) {
            throw new FormulaException(FormulaErrorType.COMPLEXITY_EXCEEDED,
                    "Formula exceeds the limit of " + maxNodes + " nodes",
                    node.getPosition(), "Split the formula into smaller parts");
        }
        int treeDepth = 1 + childDepth(node);
        if (treeDepth > maxDepth) {
            throw new FormulaException(FormulaErrorType.COMPLEXITY_EXCEEDED,
                    "Formula nesting exceeds the limit of " + maxDepth + " levels",
                    node.getPosition(), "Split the formula into smaller parts");
        }
        treeDepths.put(node, treeDepth);
        return node;
    }

    private int childDepth(FormulaNode node) {
        if (node instanceof BinaryOperation b) {
            return Math.max(depthOf(b.getLeft()), depthOf(b.getRight()));
        }
        if (node instanceof UnaryOperation u) {
            return depthOf(u.getOperand());
        }
        if (node instanceof FunctionCall call) {
            int deepest = 0;
            for (FormulaNode arg : call.getArguments()) {
                deepest = Math.max(deepest, depthOf(arg));
            }
            return deepest;
        }
        return 0;
    }

    private int depthOf(FormulaNode node) {
        return treeDepths.getOrDefault(node, 1);
    }
}
