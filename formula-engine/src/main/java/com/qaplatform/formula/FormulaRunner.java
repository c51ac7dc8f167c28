package com.qaplatform.formula;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.qaplatform.util.EngineConfig;
import com.qaplatform.util.LoggingUtil;

import java.io.File;
import java.io.IOException;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Command-line runner: evaluates the named formulas of a JSON file.
 * <pre>
 * { "context": { "dimensions": { "fluency": 85 } },
 *   "formulas": { "base": "dimension(\"fluency\")", "final": "base - 5" } }
 * </pre>
 * Exit code is 0 when every formula is valid, 1 when any failed and 2 when the input
 * cannot be read.
 */
public class FormulaRunner {

    public static final int EXIT_OK = 0;
    public static final int EXIT_FORMULA_ERRORS = 1;
    public static final int EXIT_BAD_INPUT = 2;

    public static void main(String[] args) {
        System.exit(run(args));
    }

    public static int run(String[] args) {
        if (args.length < 1 || args.length > 2) {
            LoggingUtil.error("Usage: FormulaRunner <formulas.json> [engine-config.json]");
            return EXIT_BAD_INPUT;
        }

        EngineConfig config;
        try {
            config = args.length == 2 ? EngineConfig.load(args[1]) : EngineConfig.fromResource(EngineConfig.DEFAULT_RESOURCE);
        } catch (IOException e) {
            LoggingUtil.error("Failed to read engine configuration", e);
            return EXIT_BAD_INPUT;
        }
        LoggingUtil.initialize(config);

        File input = new File(args[0]);
        if (!input.isFile()) {
            LoggingUtil.error("Formula file not found: " + args[0]);
            return EXIT_BAD_INPUT;
        }

        FormulaContext context;
        Map<String, String> formulas = new LinkedHashMap<>();
        try {
            JsonNode root = new ObjectMapper().readTree(input);
            context = FormulaContext.fromJson(root.get("context"));
            JsonNode formulasNode = root.path("formulas");
            if (!formulasNode.isObject()) {
                LoggingUtil.error("Input must contain a 'formulas' object: " + args[0]);
                return EXIT_BAD_INPUT;
            }
            formulasNode.fields().forEachRemaining(entry -> formulas.put(entry.getKey(), entry.getValue().asText()));
        } catch (IOException | IllegalArgumentException e) {
            LoggingUtil.error("Failed to read formula file: " + args[0], e);
            return EXIT_BAD_INPUT;
        }

        Map<String, ExecutionResult> results = new FormulaEngine(config).evaluateAll(formulas, context);

        boolean allValid = true;
        for (Map.Entry<String, ExecutionResult> entry : results.entrySet()) {
            ExecutionResult result = entry.getValue();
            if (result.isValid()) {
                LoggingUtil.info(entry.getKey() + " = " + result.getResult());
            } else {
                allValid = false;
                for (FormulaError error : result.getErrors()) {
                    LoggingUtil.warn(entry.getKey() + ": " + error.getType() + " " + error.getMessage());
                }
            }
            result.getWarnings().forEach(w -> LoggingUtil.info(entry.getKey() + " warning: " + w));
        }
        return allValid ? EXIT_OK : EXIT_FORMULA_ERRORS;
    }
}
