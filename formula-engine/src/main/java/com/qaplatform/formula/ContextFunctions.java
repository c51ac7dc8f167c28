package com.qaplatform.formula;

import java.util.Map;
import java.util.function.Function;
import java.util.function.ToDoubleFunction;

/**
 * Domain accessors reading named values and scalar fields out of the {@link FormulaContext}.
 */
public class ContextFunctions {

    public static void register(FunctionRegistry registry) {
        // Map lookups by string-literal id; a missing id reads as 0 with a warning
        registry.registerAccessor("dimension", "Score of a quality dimension by id",
                lookup("dimension", FormulaContext::getDimensions));
        registry.registerAccessor("errorType", "Error count of a category by id",
                lookup("errorType", FormulaContext::getErrorTypes));
        registry.registerAccessor("weight", "Weight by id",
                lookup("weight", FormulaContext::getWeights));
        registry.registerAccessor("constant", "Named constant",
                lookup("constant", FormulaContext::getConstants));
        registry.registerAccessor("variable", "Caller supplied variable",
                lookup("variable", FormulaContext::getVariables));

        // Scalar fields
        registry.registerContext("totalErrors", "Total number of errors",
                scalar(FormulaContext::getTotalErrors));
        registry.registerContext("unitCount", "Number of evaluated units",
                scalar(FormulaContext::getUnitCount));
        registry.registerContext("errorRate", "Errors per unit",
                scalar(FormulaContext::getErrorRate));
        registry.registerContext("maxScore", "Maximum achievable score",
                scalar(FormulaContext::getMaxScore));
        registry.registerContext("passingThreshold", "Minimum passing score",
                scalar(FormulaContext::getPassingThreshold));
    }

    private static FunctionImplementation lookup(String label,
                                                 Function<FormulaContext, Map<String, Double>> source) {
        return frame -> {
            String id = frame.literal(0);
            Double value = source.apply(frame.getContext()).get(id);
            if (value == null) {
                frame.warn(label + " not found, defaulted to 0: \"" + id + "\"");
                return 0.0;
            }
            return value;
        };
    }

    private static FunctionImplementation scalar(ToDoubleFunction<FormulaContext> field) {
        return frame -> field.applyAsDouble(frame.getContext());
    }
}
