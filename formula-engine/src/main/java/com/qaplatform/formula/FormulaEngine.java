package com.qaplatform.formula;

import com.qaplatform.formula.ast.FormulaNode;
import com.qaplatform.formula.template.ExampleOutcome;
import com.qaplatform.formula.template.FormulaExample;
import com.qaplatform.formula.template.FormulaTemplate;
import com.qaplatform.util.EngineConfig;
import com.qaplatform.util.LoggingUtil;

import java.util.*;

/**
 * Entry point for validating and evaluating scoring formulas.
 * <p>
 * No method throws for a bad formula: tokenizer, parser, validator and evaluator failures
 * all come back as {@link FormulaError} entries on the returned result. An engine holds no
 * per-call state, so one instance can serve concurrent callers.
 */
public class FormulaEngine {

    private final EngineConfig config;
    private final FunctionRegistry registry;
    private final FormulaValidator validator;
    private final FormulaEvaluator evaluator;
    private final ParseCache cache;

    public FormulaEngine() {
        this(EngineConfig.defaults());
    }

    public FormulaEngine(EngineConfig config) {
        this.config = config;
        this.registry = FunctionRegistry.builtins();
        this.validator = new FormulaValidator(registry, config);
        this.evaluator = new FormulaEvaluator(registry);
        this.cache = config.getParseCacheSize() > 0 ? new ParseCache(config.getParseCacheSize()) : null;
    }

    public EngineConfig getConfig() {
        return config;
    }

    public FunctionRegistry getRegistry() {
        return registry;
    }

    /**
     * Tokenize and parse, reusing a cached tree for text seen before.
     *
     * @throws FormulaException on syntax errors or when the complexity limits are exceeded
     */
    public FormulaNode parse(String expr) {
        String source = expr == null ? "" : expr;
        if (cache != null) {
            FormulaNode cached = cache.get(source);
            if (cached != null) {
                return cached;
            }
        }
        List<Token> tokens = FormulaTokenizer.tokenize(source);
        FormulaNode root = new FormulaParser(tokens, config.getMaxNodes(), config.getMaxDepth()).parse();
        if (cache != null) {
            cache.put(source, root);
        }
        return root;
    }

    int cachedTreeCount() {
        return cache == null ? 0 : cache.size();
    }

    public ValidationResult validateFormula(String expr) {
        return validateFormula(expr, List.of());
    }

    /**
     * Static checks only. {@code knownVariables} silences the free-variable hint for names
     * the caller will supply at evaluation time.
     */
    public ValidationResult validateFormula(String expr, Collection<String> knownVariables) {
        long start = System.nanoTime();
        try {
            FormulaNode root = parse(expr);
            FormulaValidator.Report report = validator.validate(root,
                    knownVariables == null ? List.of() : knownVariables);
            double elapsed = millisSince(start);
            LoggingUtil.debug("Validated formula in %.3f ms with %d error(s)", elapsed, report.getErrors().size());
            return new ValidationResult(report.getErrors(), report.getWarnings(),
                    report.getSuggestedFixes(), elapsed);
        } catch (FormulaException e) {
            List<String> fixes = e.getSuggestion() == null ? List.of() : List.of(e.getSuggestion());
            return new ValidationResult(List.of(e.getError()), List.of(), fixes, millisSince(start));
        }
    }

    /**
     * Same as {@link #executeFormula(String, FormulaContext)}.
     */
    public ExecutionResult evaluate(String expr, FormulaContext context) {
        return executeFormula(expr, context);
    }

    public ExecutionResult executeFormula(String expr, FormulaContext context) {
        FormulaContext ctx = context == null ? FormulaContext.empty() : context;
        List<String> warnings = new ArrayList<>();
        long start = System.nanoTime();
        try {
            FormulaNode root = parse(expr);
            FormulaValidator.Report structure = validator.checkStructure(root);
            if (structure.hasErrors()) {
                return ExecutionResult.failure(structure.getErrors(), warnings, 0);
            }

            start = System.nanoTime();
            Object value = evaluator.evaluate(root, ctx, warnings);
            double elapsed = millisSince(start);
            if (value instanceof Double d && (d.isNaN() || d.isInfinite())) {
                warnings.add("Result is not a finite number: " + d);
            }
            LoggingUtil.debug("Evaluated %s = %s in %.3f ms", root, value, elapsed);
            return ExecutionResult.success(value, warnings, elapsed);
        } catch (FormulaException e) {
            return ExecutionResult.failure(e.getError(), warnings, millisSince(start));
        } catch (RuntimeException e) {
            LoggingUtil.warn("Unexpected failure evaluating formula: " + expr, e);
            FormulaError error = new FormulaError(FormulaErrorType.RUNTIME_ERROR,
                    "Evaluation failed: " + e.getMessage(), null);
            return ExecutionResult.failure(error, warnings, millisSince(start));
        }
    }

    /**
     * Variable names in source order, or an empty list when the formula does not parse.
     */
    public List<String> extractVariables(String expr) {
        try {
            return FormulaUtils.extractVariables(parse(expr));
        } catch (FormulaException e) {
            return List.of();
        }
    }

    /**
     * Function names in source order, or an empty list when the formula does not parse.
     */
    public List<String> extractFunctions(String expr) {
        try {
            return FormulaUtils.extractFunctions(parse(expr));
        } catch (FormulaException e) {
            return List.of();
        }
    }

    public FormulaContext createTestContext() {
        return FormulaUtils.createTestContext();
    }

    /**
     * Evaluate named formulas that may refer to each other by name. Each result is bound as a
     * variable (booleans as 1 and 0) for the formulas that depend on it. Formulas that take part
     * in a reference cycle fail with {@link FormulaErrorType#RUNTIME_ERROR}; formulas depending
     * on a failed one fail with {@link FormulaErrorType#UNKNOWN_IDENTIFIER}.
     *
     * @return results keyed by formula name, in declaration order
     */
    public Map<String, ExecutionResult> evaluateAll(Map<String, String> formulas, FormulaContext context) {
        Map<String, Set<String>> dependencies = dependencies(formulas);
        Set<String> cyclic = new LinkedHashSet<>();
        List<String> order = plan(formulas.keySet(), dependencies, cyclic);
        LoggingUtil.debug("Execution order: %s", order);

        FormulaContext current = context == null ? FormulaContext.empty() : context;
        Map<String, ExecutionResult> results = new HashMap<>();
        for (String name : order) {
            ExecutionResult result;
            if (cyclic.contains(name)) {
                result = ExecutionResult.failure(new FormulaError(FormulaErrorType.RUNTIME_ERROR,
                        "Circular reference: formula '" + name + "' depends on itself through "
                                + String.join(", ", cyclic), null), List.of(), 0);
            } else {
                String failed = firstFailed(dependencies.get(name), results);
                if (failed != null) {
                    result = ExecutionResult.failure(new FormulaError(FormulaErrorType.UNKNOWN_IDENTIFIER,
                            "Formula '" + name + "' depends on '" + failed + "', which has no value", null),
                            List.of(), 0);
                } else {
                    result = executeFormula(formulas.get(name), current);
                }
            }
            if (result.isValid()) {
                current = current.withVariable(name, result.asNumber());
            } else {
                LoggingUtil.debug("Formula '%s' failed: %s", name, result.getErrors());
            }
            results.put(name, result);
        }

        Map<String, ExecutionResult> ordered = new LinkedHashMap<>();
        for (String name : formulas.keySet()) {
            ordered.put(name, results.get(name));
        }
        return ordered;
    }

    /**
     * Order in which named formulas must run so that every referenced formula runs first.
     *
     * @throws IllegalStateException when the formulas reference each other in a cycle
     */
    public List<String> resolveExecutionOrder(Map<String, String> formulas) {
        Set<String> cyclic = new LinkedHashSet<>();
        List<String> order = plan(formulas.keySet(), dependencies(formulas), cyclic);
        if (!cyclic.isEmpty()) {
            throw new IllegalStateException("Cyclic dependency detected at: " + cyclic.iterator().next());
        }
        return order;
    }

    private Map<String, Set<String>> dependencies(Map<String, String> formulas) {
        Map<String, Set<String>> dependencies = new HashMap<>();
        for (Map.Entry<String, String> entry : formulas.entrySet()) {
            Set<String> refs = new LinkedHashSet<>();
            for (String variable : extractVariables(entry.getValue())) {
                // self references resolve against the incoming context
                if (!variable.equals(entry.getKey()) && formulas.containsKey(variable)) {
                    refs.add(variable);
                }
            }
            dependencies.put(entry.getKey(), refs);
        }
        return dependencies;
    }

    private List<String> plan(Collection<String> names, Map<String, Set<String>> dependencies, Set<String> cyclic) {
        List<String> sorted = new ArrayList<>();
        Set<String> visited = new HashSet<>();
        List<String> visiting = new ArrayList<>();
        for (String name : names) {
            visit(name, dependencies, visited, visiting, sorted, cyclic);
        }
        return sorted;
    }

    private void visit(String node,
                       Map<String, Set<String>> deps,
                       Set<String> visited,
                       List<String> visiting,
                       List<String> sorted,
                       Set<String> cyclic) {
        if (visited.contains(node)) return;
        int index = visiting.indexOf(node);
        if (index >= 0) {
            cyclic.addAll(visiting.subList(index, visiting.size()));
            return;
        }

        visiting.add(node);
        for (String dep : deps.getOrDefault(node, Set.of())) {
            visit(dep, deps, visited, visiting, sorted, cyclic);
        }
        visiting.remove(visiting.size() - 1);
        visited.add(node);
        sorted.add(node);
    }

    private static String firstFailed(Set<String> dependencies, Map<String, ExecutionResult> results) {
        for (String dep : dependencies) {
            ExecutionResult result = results.get(dep);
            if (result != null && !result.isValid()) {
                return dep;
            }
        }
        return null;
    }

    /**
     * Run every worked example of a template and compare against its expected result.
     */
    public List<ExampleOutcome> runExamples(FormulaTemplate template) {
        List<ExampleOutcome> outcomes = new ArrayList<>();
        for (FormulaExample example : template.getExamples()) {
            ExampleOutcome outcome = new ExampleOutcome(example,
                    executeFormula(template.getExpression(), example.getContext()));
            if (!outcome.isPassed()) {
                LoggingUtil.info("Template '" + template.getId() + "' example " + outcome);
            }
            outcomes.add(outcome);
        }
        return outcomes;
    }

    private static double millisSince(long start) {
        return (System.nanoTime() - start) / 1_000_000.0;
    }
}
