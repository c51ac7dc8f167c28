package com.qaplatform.formula;

import com.qaplatform.formula.ast.*;

import java.util.List;

/**
 * Walks a parsed formula against a {@link FormulaContext}. Values are Doubles or Booleans.
 * Failures are raised as {@link FormulaException}; any other runtime exception thrown
 * while evaluating a node is wrapped as {@link FormulaErrorType#RUNTIME_ERROR} at that
 * node's position.
 */
public class FormulaEvaluator {

    private final FunctionRegistry registry;

    public FormulaEvaluator(FunctionRegistry registry) {
        this.registry = registry;
    }

    /**
     * @param warnings receives non-fatal findings such as missing dimension ids
     * @return a Double or a Boolean
     */
    public Object evaluate(FormulaNode root, FormulaContext context, List<String> warnings) {
        return new Run(context, warnings).eval(root);
    }

    private final class Run {
        private final FormulaContext context;
        private final List<String> warnings;

        Run(FormulaContext context, List<String> warnings) {
            this.context = context;
            this.warnings = warnings;
        }

        Object eval(FormulaNode node) {
            try {
                return dispatch(node);
            } catch (FormulaException e) {
                throw e;
            } catch (RuntimeException e) {
                throw new FormulaException(FormulaErrorType.RUNTIME_ERROR,
                        "Failed to evaluate " + node + " at " + node.getPosition() + ": " + e.getMessage(),
                        node.getPosition(), null, e);
            }
        }

        private Object dispatch(FormulaNode node) {
            if (node instanceof NumberLiteral n) {
                return n.getValue();
            }
            if (node instanceof BooleanLiteral b) {
                return b.getValue();
            }
            if (node instanceof Variable v) {
                return resolve(v);
            }
            if (node instanceof UnaryOperation u) {
                if (u.getOperator().equals("-")) {
                    return -number(eval(u.getOperand()), u.getOperand(), "operand of unary '-'");
                }
                return !truthy(eval(u.getOperand()));
            }
            if (node instanceof BinaryOperation b) {
                return binary(b);
            }
            if (node instanceof FunctionCall call) {
                return call(call);
            }
            if (node instanceof StringLiteral s) {
                throw new FormulaException(FormulaErrorType.TYPE_ERROR,
                        "Text " + s + " at " + s.getPosition() + " cannot be used as a value",
                        s.getPosition());
            }
            throw new IllegalStateException("Unsupported node: " + node.getClass().getSimpleName());
        }

        private Object resolve(Variable v) {
            Double value = context.getVariables().get(v.getName());
            if (value == null) {
                value = context.getConstants().get(v.getName());
            }
            if (value == null) {
                throw new FormulaException(FormulaErrorType.UNKNOWN_IDENTIFIER,
                        "Unknown identifier '" + v.getName() + "' at " + v.getPosition(),
                        v.getPosition(), "Supply '" + v.getName() + "' in the context variables or constants");
            }
            return value;
        }

        private Object binary(BinaryOperation b) {
            String op = b.getOperator();
            Object leftValue = eval(b.getLeft());
            Object rightValue = eval(b.getRight());

            if (op.equals("==") || op.equals("!=")) {
                boolean equal;
                if (leftValue instanceof Double l && rightValue instanceof Double r) {
                    equal = l.doubleValue() == r.doubleValue();
                } else if (leftValue instanceof Boolean lb && rightValue instanceof Boolean rb) {
                    equal = lb.equals(rb);
                } else {
                    throw new FormulaException(FormulaErrorType.TYPE_ERROR,
                            "Cannot compare " + typeName(leftValue) + " with " + typeName(rightValue)
                                    + " using '" + op + "' at " + b.getPosition(),
                            b.getPosition());
                }
                return op.equals("==") == equal;
            }

            double left = number(leftValue, b.getLeft(), "left operand of '" + op + "'");
            double right = number(rightValue, b.getRight(), "right operand of '" + op + "'");
            switch (op) {
                case "+":
                    return left + right;
                case "-":
                    return left - right;
                case "*":
                    return left * right;
                case "/":
                    checkDivisor(right, b);
                    return left / right;
                case "%":
                    checkDivisor(right, b);
                    return left % right;
                case "^":
                    return Math.pow(left, right);
                case ">":
                    return left > right;
                case "<":
                    return left < right;
                case ">=":
                    return left >= right;
                case "<=":
                    return left <= right;
                default:
                    throw new IllegalStateException("Unknown operator: " + op);
            }
        }

        private void checkDivisor(double divisor, BinaryOperation b) {
            if (divisor == 0) {
                throw new FormulaException(FormulaErrorType.DIVISION_BY_ZERO,
                        "Division by zero in " + b + " at " + b.getPosition(),
                        b.getPosition(), "Guard the divisor, e.g. if(x != 0, a / x, 0)");
            }
        }

        private Object call(FunctionCall call) {
            FunctionDefinition def = registry.get(call.getName());
            if (def == null) {
                throw new FormulaException(FormulaErrorType.UNKNOWN_FUNCTION,
                        "Unknown function '" + call.getName() + "' at " + call.getPosition(),
                        call.getPosition());
            }
            if (!def.acceptsArity(call.getArgumentCount())) {
                throw new FormulaException(FormulaErrorType.ARITY_ERROR,
                        "Function '" + def.getName() + "' expects " + def.describeArity()
                                + " but got " + call.getArgumentCount() + " at " + call.getPosition(),
                        call.getPosition());
            }
            Object result = def.getImplementation().invoke(new Frame(call));
            if (!(result instanceof Double) && !(result instanceof Boolean)) {
                throw new IllegalStateException("Function '" + def.getName() + "' returned " + result);
            }
            return result;
        }

        private double number(Object value, FormulaNode source, String what) {
            if (value instanceof Double d) {
                return d;
            }
            throw new FormulaException(FormulaErrorType.TYPE_ERROR,
                    "Expected a number for the " + what + " but got " + typeName(value)
                            + " at " + source.getPosition(),
                    source.getPosition());
        }

        private boolean truthy(Object value) {
            if (value instanceof Boolean b) {
                return b;
            }
            if (value instanceof Double d) {
                return d != 0;
            }
            throw new IllegalStateException("Unexpected value: " + value);
        }

        private String typeName(Object value) {
            return value instanceof Boolean ? "a boolean (" + value + ")" : "a number (" + value + ")";
        }

        private final class Frame implements CallFrame {
            private final FunctionCall call;

            Frame(FunctionCall call) {
                this.call = call;
            }

            @Override
            public FunctionCall getCall() {
                return call;
            }

            @Override
            public FormulaContext getContext() {
                return context;
            }

            @Override
            public int argumentCount() {
                return call.getArgumentCount();
            }

            @Override
            public Object evaluate(int index) {
                return eval(call.getArguments().get(index));
            }

            @Override
            public double number(int index) {
                FormulaNode arg = call.getArguments().get(index);
                return Run.this.number(eval(arg), arg, "argument " + (index + 1) + " of '" + call.getName() + "'");
            }

            @Override
            public boolean truthy(int index) {
                return Run.this.truthy(evaluate(index));
            }

            @Override
            public String literal(int index) {
                FormulaNode arg = call.getArguments().get(index);
                if (arg instanceof StringLiteral s) {
                    return s.getValue();
                }
                throw new FormulaException(FormulaErrorType.TYPE_ERROR,
                        "Function '" + call.getName() + "' needs a quoted id such as "
                                + call.getName() + "(\"fluency\") at " + arg.getPosition(),
                        arg.getPosition());
            }

            @Override
            public void warn(String message) {
                if (!warnings.contains(message)) {
                    warnings.add(message);
                }
            }
        }
    }
}
