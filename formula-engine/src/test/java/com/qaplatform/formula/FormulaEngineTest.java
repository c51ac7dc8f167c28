package com.qaplatform.formula;

import com.qaplatform.util.EngineConfig;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;

public class FormulaEngineTest {

    private FormulaEngine engine;
    private FormulaContext context;

    @BeforeEach
    public void setup() {
        engine = new FormulaEngine();
        context = engine.createTestContext();
    }

    @Test
    public void testOperatorPrecedence() {
        assertEquals(14.0, engine.evaluate("2 + 3 * 4", context).getResult());
        assertEquals(20.0, engine.evaluate("(2 + 3) * 4", context).getResult());
        assertEquals(512.0, engine.evaluate("2 ^ 3 ^ 2", context).getResult());
    }

    @Test
    public void testRepeatedEvaluationIsDeterministic() {
        String expr = "dimension(\"fluency\") * weight(\"fluency\") / 100 + dimension(\"style\") / 5";
        ExecutionResult first = engine.evaluate(expr, context);
        for (int i = 0; i < 10; i++) {
            ExecutionResult again = engine.evaluate(expr, context);
            assertEquals(first.getResult(), again.getResult());
            assertEquals(first.getWarnings(), again.getWarnings());
        }
        assertEquals(40.5, first.getResult());
    }

    @Test
    public void testIfShortCircuit() {
        ExecutionResult result = engine.evaluate("if(true, 1, 1/0)", context);
        assertTrue(result.isValid());
        assertEquals(1.0, result.getResult());
    }

    @Test
    public void testMissingDimensionDefaultsToZero() {
        ExecutionResult result = engine.evaluate("dimension(\"fluency\")", FormulaContext.empty());
        assertTrue(result.isValid());
        assertEquals(0.0, result.getResult());
        assertEquals(1, result.getWarnings().size());
        assertTrue(result.getWarnings().get(0).startsWith("dimension"));
        assertTrue(result.getWarnings().get(0).contains("not found"));
    }

    @Test
    public void testUnknownIdentifier() {
        ExecutionResult result = engine.evaluate("undefinedVar + 1", context);
        assertFalse(result.isValid());
        assertNull(result.getResult());
        assertTrue(result.hasError(FormulaErrorType.UNKNOWN_IDENTIFIER));
        assertThrows(IllegalStateException.class, result::asNumber);
    }

    @Test
    public void testStructureIsCheckedBeforeEvaluation() {
        ExecutionResult unknown = engine.evaluate("if(true, 1, median(1, 2))", context);
        assertTrue(unknown.hasError(FormulaErrorType.UNKNOWN_FUNCTION));

        ExecutionResult arity = engine.evaluate("if(false, round(1, 2), 3)", context);
        assertTrue(arity.hasError(FormulaErrorType.ARITY_ERROR));

        ExecutionResult accessor = engine.evaluate("if(true, 1, dimension(fluency))", context);
        assertTrue(accessor.hasError(FormulaErrorType.TYPE_ERROR));
    }

    @Test
    public void testValuesInUntakenBranchAreNotComputed() {
        ExecutionResult result = engine.evaluate("if(totalErrors() > 10, undefinedVar / 0, 7)", context);
        assertTrue(result.isValid());
        assertEquals(7.0, result.getResult());
    }

    @Test
    public void testSyntaxErrorIsCaptured() {
        ExecutionResult result = engine.executeFormula("(1 + 2", context);
        assertFalse(result.isValid());
        assertTrue(result.hasError(FormulaErrorType.SYNTAX_ERROR));
    }

    @Test
    public void testDivisionByZero() {
        ExecutionResult result = engine.evaluate("dimension(\"fluency\") / errorType(\"critical\")", context);
        assertTrue(result.hasError(FormulaErrorType.DIVISION_BY_ZERO));
        assertNotNull(result.getErrors().get(0).getPosition());
    }

    @Test
    public void testBooleanResult() {
        ExecutionResult result = engine.evaluate("dimension(\"adequacy\") >= passingThreshold()", context);
        assertTrue(result.isValid());
        assertTrue(result.isBoolean());
        assertEquals(true, result.getResult());
        assertEquals(1.0, result.asNumber());
    }

    @Test
    public void testNonFiniteResultWarns() {
        ExecutionResult result = engine.evaluate("sqrt(-1)", context);
        assertTrue(result.isValid());
        assertTrue(Double.isNaN((Double) result.getResult()));
        assertTrue(result.getWarnings().get(0).contains("not a finite number"));
    }

    @Test
    public void testNullContextIsEmpty() {
        ExecutionResult result = engine.evaluate("maxScore() + 1", null);
        assertEquals(1.0, result.getResult());
    }

    @Test
    public void testComplexityExceeded() {
        EngineConfig config = new EngineConfig();
        config.setMaxNodes(5);
        FormulaEngine small = new FormulaEngine(config);

        ExecutionResult result = small.evaluate("1 + 2 + 3 + 4", context);
        assertTrue(result.hasError(FormulaErrorType.COMPLEXITY_EXCEEDED));
        assertTrue(small.evaluate("1 + 2", context).isValid());
    }

    @Test
    public void testLongOperatorChainIsRejectedWithRaisedNodeLimit() {
        EngineConfig config = new EngineConfig();
        config.setMaxNodes(400_000);
        FormulaEngine large = new FormulaEngine(config);
        String chain = "1" + "+1".repeat(100_000);

        assertTrue(large.evaluate(chain, context).hasError(FormulaErrorType.COMPLEXITY_EXCEEDED));
        assertTrue(large.validateFormula(chain).hasError(FormulaErrorType.COMPLEXITY_EXCEEDED));
        assertEquals(100.0, large.evaluate("1" + "+1".repeat(99), context).getResult());
    }

    @Test
    public void testValidateArityError() {
        assertTrue(engine.validateFormula("round(1,2,3)").hasError(FormulaErrorType.ARITY_ERROR));
    }

    @Test
    public void testExtraction() {
        assertEquals(List.of("x", "y"), engine.extractVariables("x + dimension(\"a\") + y"));
        assertEquals(List.of("dimension"), engine.extractFunctions("x + dimension(\"a\") + y"));
        assertEquals(List.of("x"), engine.extractVariables("x * x + true"));
        assertEquals(List.of("max", "round"), engine.extractFunctions("max(round(x), round(y))"));
        assertTrue(engine.extractVariables("x +").isEmpty());
        assertTrue(engine.extractFunctions("max(").isEmpty());
    }

    @Test
    public void testParseCache() {
        engine.evaluate("1 + 2", context);
        engine.evaluate("1 + 2", context);
        engine.validateFormula("1 + 2");
        assertEquals(1, engine.cachedTreeCount());

        engine.evaluate("1 +", context);
        assertEquals(1, engine.cachedTreeCount());
        assertSame(engine.parse("1 + 2"), engine.parse("1 + 2"));
    }

    @Test
    public void testParseCacheCanBeDisabled() {
        EngineConfig config = new EngineConfig();
        config.setParseCacheSize(0);
        FormulaEngine uncached = new FormulaEngine(config);
        uncached.evaluate("1 + 2", context);
        assertEquals(0, uncached.cachedTreeCount());
    }

    @Test
    public void testParseCacheEvictsLeastRecentlyUsed() {
        EngineConfig config = new EngineConfig();
        config.setParseCacheSize(2);
        FormulaEngine tiny = new FormulaEngine(config);
        tiny.parse("1");
        tiny.parse("2");
        tiny.parse("3");
        assertEquals(2, tiny.cachedTreeCount());
    }

    @Test
    public void testEvaluateAllResolvesReferences() {
        Map<String, String> formulas = new LinkedHashMap<>();
        formulas.put("total", "base + bonus");
        formulas.put("bonus", "base / 10");
        formulas.put("base", "dimension(\"fluency\")");

        Map<String, ExecutionResult> results = engine.evaluateAll(formulas, context);

        assertEquals(List.of("total", "bonus", "base"), List.copyOf(results.keySet()));
        assertEquals(85.0, results.get("base").getResult());
        assertEquals(8.5, results.get("bonus").getResult());
        assertEquals(93.5, results.get("total").getResult());
        assertEquals(List.of("base", "bonus", "total"), engine.resolveExecutionOrder(formulas));
    }

    @Test
    public void testEvaluateAllBindsBooleansAsNumbers() {
        Map<String, String> formulas = new LinkedHashMap<>();
        formulas.put("passed", "dimension(\"adequacy\") >= passingThreshold()");
        formulas.put("bonus", "passed * 10");

        Map<String, ExecutionResult> results = engine.evaluateAll(formulas, context);
        assertEquals(true, results.get("passed").getResult());
        assertEquals(10.0, results.get("bonus").getResult());
    }

    @Test
    public void testEvaluateAllCycle() {
        Map<String, String> formulas = new LinkedHashMap<>();
        formulas.put("a", "b + 1");
        formulas.put("b", "a + 1");
        formulas.put("c", "5");
        formulas.put("d", "a * 2");

        Map<String, ExecutionResult> results = engine.evaluateAll(formulas, context);

        assertTrue(results.get("a").hasError(FormulaErrorType.RUNTIME_ERROR));
        assertTrue(results.get("b").hasError(FormulaErrorType.RUNTIME_ERROR));
        assertTrue(results.get("a").getErrors().get(0).getMessage().contains("Circular reference"));
        assertEquals(5.0, results.get("c").getResult());
        assertTrue(results.get("d").hasError(FormulaErrorType.UNKNOWN_IDENTIFIER));

        assertThrows(IllegalStateException.class, () -> engine.resolveExecutionOrder(formulas));
    }

    @Test
    public void testEvaluateAllPropagatesFailures() {
        Map<String, String> formulas = new LinkedHashMap<>();
        formulas.put("bad", "1 / 0");
        formulas.put("uses", "bad + 1");
        formulas.put("independent", "2");

        Map<String, ExecutionResult> results = engine.evaluateAll(formulas, context);
        assertTrue(results.get("bad").hasError(FormulaErrorType.DIVISION_BY_ZERO));
        assertTrue(results.get("uses").hasError(FormulaErrorType.UNKNOWN_IDENTIFIER));
        assertTrue(results.get("independent").isValid());
    }

    @Test
    public void testEvaluateAllSelfReferenceReadsContext() {
        Map<String, String> formulas = new LinkedHashMap<>();
        formulas.put("x", "x + 1");

        Map<String, ExecutionResult> results = engine.evaluateAll(formulas, context.withVariable("x", 1));
        assertEquals(2.0, results.get("x").getResult());
    }
}
