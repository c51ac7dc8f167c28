package com.qaplatform.formula;

import static com.qaplatform.formula.FunctionDefinition.VARIADIC;

/**
 * Conditional and boolean built-ins. These evaluate their arguments lazily.
 */
public class LogicalFunctions {

    public static void register(FunctionRegistry registry) {
        registry.registerConditional("if", "Evaluates only the branch selected by the condition",
                frame -> frame.truthy(0) ? frame.evaluate(1) : frame.evaluate(2));

        registry.registerLogical("and", 2, VARIADIC, "True when every argument is true, stops at the first false",
                frame -> {
                    for (int i = 0; i < frame.argumentCount(); i++) {
                        if (!frame.truthy(i)) {
                            return false;
                        }
                    }
                    return true;
                });

        registry.registerLogical("or", 2, VARIADIC, "True when any argument is true, stops at the first true",
                frame -> {
                    for (int i = 0; i < frame.argumentCount(); i++) {
                        if (frame.truthy(i)) {
                            return true;
                        }
                    }
                    return false;
                });

        registry.registerLogical("not", 1, 1, "Logical negation",
                frame -> !frame.truthy(0));
    }
}
