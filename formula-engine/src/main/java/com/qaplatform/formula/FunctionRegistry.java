package com.qaplatform.formula;

import java.util.*;

/**
 * Table of functions known to the engine, consulted by both the validator and the
 * evaluator. The built-in table returned by {@link #builtins()} is created once and
 * sealed, so concurrent readers need no synchronization.
 */
public class FunctionRegistry {

    private final Map<String, FunctionDefinition> functions = new LinkedHashMap<>();
    private boolean sealed = false;

    private static final class BuiltinsHolder {
        private static final FunctionRegistry INSTANCE = createBuiltins();
    }

    public static FunctionRegistry builtins() {
        return BuiltinsHolder.INSTANCE;
    }

    private static FunctionRegistry createBuiltins() {
        FunctionRegistry registry = new FunctionRegistry();
        ContextFunctions.register(registry);
        NumericFunctions.register(registry);
        LogicalFunctions.register(registry);
        registry.seal();
        return registry;
    }

    public void register(FunctionDefinition definition) {
        if (sealed) {
            throw new IllegalStateException("Registry is sealed, cannot register " + definition.getName());
        }
        if (functions.containsKey(definition.getName())) {
            throw new IllegalArgumentException("Function already registered: " + definition.getName());
        }
        functions.put(definition.getName(), definition);
    }

    public void registerNumeric(String name, int minArity, int maxArity, ValueType resultType,
                                String description, FunctionImplementation implementation) {
        register(new FunctionDefinition(name, minArity, maxArity, FunctionKind.NUMERIC,
                resultType, description, implementation));
    }

    public void registerLogical(String name, int minArity, int maxArity,
                                String description, FunctionImplementation implementation) {
        register(new FunctionDefinition(name, minArity, maxArity, FunctionKind.LOGICAL,
                ValueType.BOOLEAN, description, implementation));
    }

    public void registerAccessor(String name, String description, FunctionImplementation implementation) {
        register(new FunctionDefinition(name, 1, 1, FunctionKind.ACCESSOR,
                ValueType.NUMBER, description, implementation));
    }

    public void registerContext(String name, String description, FunctionImplementation implementation) {
        register(new FunctionDefinition(name, 0, 0, FunctionKind.CONTEXT,
                ValueType.NUMBER, description, implementation));
    }

    public void registerConditional(String name, String description, FunctionImplementation implementation) {
        register(new FunctionDefinition(name, 3, 3, FunctionKind.CONDITIONAL,
                ValueType.ANY, description, implementation));
    }

    public void seal() {
        sealed = true;
    }

    public boolean isSealed() {
        return sealed;
    }

    public boolean contains(String name) {
        return functions.containsKey(name);
    }

    public FunctionDefinition get(String name) {
        return functions.get(name);
    }

    public Set<String> getNames() {
        return Collections.unmodifiableSet(functions.keySet());
    }

    public List<FunctionDefinition> getDefinitions(FunctionKind kind) {
        List<FunctionDefinition> matches = new ArrayList<>();
        for (FunctionDefinition definition : functions.values()) {
            if (definition.getKind() == kind) {
                matches.add(definition);
            }
        }
        return matches;
    }

    /**
     * Registered name closest to {@code name}, or null when none is within {@code maxDistance} edits.
     */
    public String closestName(String name, int maxDistance) {
        return EditDistance.closest(name, functions.keySet(), maxDistance);
    }
}
