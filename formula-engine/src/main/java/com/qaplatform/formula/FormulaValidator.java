package com.qaplatform.formula;

import com.qaplatform.formula.ast.*;
import com.qaplatform.util.EngineConfig;

import java.util.*;

/**
 * Static checks over a parsed formula. Nothing is evaluated and no context is needed.
 * <p>
 * {@link #checkStructure} covers what never depends on values (unknown functions, arity,
 * accessor ids) and runs before every evaluation. {@link #validate} adds static typing,
 * free-variable hints and literal-zero divisor warnings.
 */
public class FormulaValidator {

    private final FunctionRegistry registry;
    private final EngineConfig config;

    public FormulaValidator(FunctionRegistry registry, EngineConfig config) {
        this.registry = registry;
        this.config = config;
    }

    /**
     * Findings of one static pass.
     */
    public static final class Report {
        private final List<FormulaError> errors = new ArrayList<>();
        private final Set<String> warnings = new LinkedHashSet<>();
        private final Set<String> suggestedFixes = new LinkedHashSet<>();

        void error(FormulaErrorType type, String message, SourcePosition position) {
            errors.add(new FormulaError(type, message, position));
        }

        void warn(String message) {
            warnings.add(message);
        }

        void suggest(String fix) {
            if (fix != null) {
                suggestedFixes.add(fix);
            }
        }

        public List<FormulaError> getErrors() {
            return errors;
        }

        public List<String> getWarnings() {
            return new ArrayList<>(warnings);
        }

        public List<String> getSuggestedFixes() {
            return new ArrayList<>(suggestedFixes);
        }

        public boolean hasErrors() {
            return !errors.isEmpty();
        }
    }

    public Report checkStructure(FormulaNode root) {
        Report report = new Report();
        new Walk(report, false, Set.of()).infer(root);
        return report;
    }

    public Report validate(FormulaNode root, Collection<String> knownVariables) {
        Report report = new Report();
        new Walk(report, true, new LinkedHashSet<>(knownVariables)).infer(root);
        return report;
    }

    private final class Walk {
        private final Report report;
        private final boolean full;
        private final Set<String> knownVariables;
        private final Set<String> hintedVariables = new HashSet<>();

        Walk(Report report, boolean full, Set<String> knownVariables) {
            this.report = report;
            this.full = full;
            this.knownVariables = knownVariables;
        }

        ValueType infer(FormulaNode node) {
            if (node instanceof NumberLiteral) {
                return ValueType.NUMBER;
            }
            if (node instanceof BooleanLiteral) {
                return ValueType.BOOLEAN;
            }
            if (node instanceof StringLiteral s) {
                if (full) {
                    report.error(FormulaErrorType.TYPE_ERROR,
                            "Text " + s + " at " + s.getPosition()
                                    + " can only be used as the id of a lookup such as dimension(" + s + ")",
                            s.getPosition());
                }
                return ValueType.ANY;
            }
            if (node instanceof Variable v) {
                if (full) {
                    hintVariable(v);
                }
                return ValueType.NUMBER;
            }
            if (node instanceof UnaryOperation u) {
                ValueType operand = infer(u.getOperand());
                if (u.getOperator().equals("-")) {
                    requireNumber(operand, u.getOperand(), "operand of unary '-'");
                    return ValueType.NUMBER;
                }
                return ValueType.BOOLEAN;
            }
            if (node instanceof BinaryOperation b) {
                return inferBinary(b);
            }
            if (node instanceof FunctionCall call) {
                return inferCall(call);
            }
            throw new IllegalStateException("Unsupported node: " + node.getClass().getSimpleName());
        }

        private ValueType inferBinary(BinaryOperation b) {
            ValueType left = infer(b.getLeft());
            ValueType right = infer(b.getRight());
            String op = b.getOperator();

            if (full && b.isDivision() && b.getRight() instanceof NumberLiteral n && n.getValue() == 0) {
                report.warn("Possible division by zero at " + b.getPosition());
                report.suggest("Guard the divisor, e.g. if(x != 0, a / x, 0)");
            }

            if (op.equals("==") || op.equals("!=")) {
                if (full && !left.compatibleWith(right)) {
                    report.error(FormulaErrorType.TYPE_ERROR,
                            "Cannot compare " + describe(left) + " with " + describe(right)
                                    + " using '" + op + "' at " + b.getPosition(),
                            b.getPosition());
                }
                return ValueType.BOOLEAN;
            }

            requireNumber(left, b.getLeft(), "left operand of '" + op + "'");
            requireNumber(right, b.getRight(), "right operand of '" + op + "'");
            return b.isComparison() ? ValueType.BOOLEAN : ValueType.NUMBER;
        }

        private ValueType inferCall(FunctionCall call) {
            FunctionDefinition def = registry.get(call.getName());
            if (def == null) {
                report.error(FormulaErrorType.UNKNOWN_FUNCTION,
                        "Unknown function '" + call.getName() + "' at " + call.getPosition(),
                        call.getPosition());
                String closest = registry.closestName(call.getName(), config.getSuggestionDistance());
                report.suggest(closest != null
                        ? "Did you mean '" + closest + "'?"
                        : "Check the function name or use one of: " + String.join(", ", registry.getNames()));
                call.getArguments().forEach(this::infer);
                return ValueType.ANY;
            }

            boolean arityOk = def.acceptsArity(call.getArgumentCount());
            if (!arityOk) {
                report.error(FormulaErrorType.ARITY_ERROR,
                        "Function '" + def.getName() + "' expects " + def.describeArity()
                                + " but got " + call.getArgumentCount() + " at " + call.getPosition(),
                        call.getPosition());
            }

            List<FormulaNode> args = call.getArguments();
            switch (def.getKind()) {
                case ACCESSOR:
                    for (FormulaNode arg : args) {
                        if (arg instanceof StringLiteral) {
                            continue;
                        }
                        if (arityOk) {
                            report.error(FormulaErrorType.TYPE_ERROR,
                                    "Function '" + def.getName() + "' needs a quoted id such as "
                                            + def.getName() + "(\"fluency\") at " + arg.getPosition(),
                                    arg.getPosition());
                        }
                        infer(arg);
                    }
                    return ValueType.NUMBER;
                case NUMERIC:
                    for (int i = 0; i < args.size(); i++) {
                        requireNumber(infer(args.get(i)), args.get(i),
                                "argument " + (i + 1) + " of '" + def.getName() + "'");
                    }
                    return def.getResultType();
                case CONDITIONAL:
                    List<ValueType> types = new ArrayList<>();
                    args.forEach(arg -> types.add(infer(arg)));
                    if (arityOk && types.get(1) == types.get(2)) {
                        return types.get(1);
                    }
                    return ValueType.ANY;
                case LOGICAL:
                case CONTEXT:
                default:
                    args.forEach(this::infer);
                    return def.getResultType();
            }
        }

        private void requireNumber(ValueType type, FormulaNode node, String what) {
            if (full && type == ValueType.BOOLEAN) {
                report.error(FormulaErrorType.TYPE_ERROR,
                        "Expected a number for the " + what + " but found a boolean expression at "
                                + node.getPosition(),
                        node.getPosition());
            }
        }

        private void hintVariable(Variable v) {
            String name = v.getName();
            if (!hintedVariables.add(name)) {
                return;
            }
            if (config.getKnownConstants().contains(name) || knownVariables.contains(name)) {
                return;
            }

            FunctionDefinition def = registry.get(name);
            if (def != null) {
                report.warn("'" + name + "' at " + v.getPosition() + " is a function but is used as a variable");
                report.suggest(def.getKind() == FunctionKind.CONTEXT
                        ? "Did you mean " + name + "()?"
                        : "Call it with arguments, e.g. " + name + "(...)");
                return;
            }

            report.warn("Variable '" + name + "' at " + v.getPosition()
                    + " is not a known constant and must be supplied in the evaluation context");
            report.suggest(suggestFor(name));
        }

        private String suggestFor(String name) {
            int limit = config.getSuggestionDistance();
            if (config.getKnownDimensionIds().contains(name)) {
                return "Did you mean dimension(\"" + name + "\")?";
            }
            if (config.getKnownErrorTypeIds().contains(name)) {
                return "Did you mean errorType(\"" + name + "\")?";
            }

            Set<String> names = new LinkedHashSet<>(knownVariables);
            names.addAll(config.getKnownConstants());
            String best = null;
            int bestDistance = Integer.MAX_VALUE;

            String candidate = EditDistance.closest(name, names, limit);
            if (candidate != null) {
                best = "Did you mean '" + candidate + "'?";
                bestDistance = EditDistance.between(name, candidate);
            }
            candidate = EditDistance.closest(name, config.getKnownDimensionIds(), limit);
            if (candidate != null && EditDistance.between(name, candidate) < bestDistance) {
                best = "Did you mean dimension(\"" + candidate + "\")?";
                bestDistance = EditDistance.between(name, candidate);
            }
            candidate = EditDistance.closest(name, config.getKnownErrorTypeIds(), limit);
            if (candidate != null && EditDistance.between(name, candidate) < bestDistance) {
                best = "Did you mean errorType(\"" + candidate + "\")?";
                bestDistance = EditDistance.between(name, candidate);
            }
            List<String> contextNames = new ArrayList<>();
            registry.getDefinitions(FunctionKind.CONTEXT).forEach(d -> contextNames.add(d.getName()));
            candidate = EditDistance.closest(name, contextNames, limit);
            if (candidate != null && EditDistance.between(name, candidate) < bestDistance) {
                best = "Did you mean " + candidate + "()?";
            }
            return best;
        }

        private String describe(ValueType type) {
            return type == ValueType.BOOLEAN ? "a boolean" : "a number";
        }
    }
}
