package com.qaplatform.formula;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

public class FormulaValidatorTest {

    private FormulaEngine engine;

    @BeforeEach
    public void setup() {
        engine = new FormulaEngine();
    }

    @Test
    public void testValidFormula() {
        ValidationResult result = engine.validateFormula(
                "dimension(\"fluency\") * weight(\"fluency\") / 100 - errorType(\"major\") * 5");
        assertTrue(result.isValid());
        assertTrue(result.getErrors().isEmpty());
        assertTrue(result.getWarnings().isEmpty());
        assertTrue(result.getParseTimeMs() >= 0);
    }

    @Test
    public void testArityError() {
        ValidationResult result = engine.validateFormula("round(1,2,3)");
        assertFalse(result.isValid());
        assertTrue(result.hasError(FormulaErrorType.ARITY_ERROR));
        assertTrue(result.getErrors().get(0).getMessage().contains("exactly 1 argument"));
    }

    @Test
    public void testUnknownFunctionSuggestsClosestName() {
        ValidationResult result = engine.validateFormula("rond(2.5)");
        assertTrue(result.hasError(FormulaErrorType.UNKNOWN_FUNCTION));
        assertTrue(result.getSuggestedFixes().contains("Did you mean 'round'?"));
    }

    @Test
    public void testUnknownFunctionWithoutCloseMatchListsNames() {
        ValidationResult result = engine.validateFormula("standardDeviation(1, 2)");
        assertTrue(result.hasError(FormulaErrorType.UNKNOWN_FUNCTION));
        assertTrue(result.getSuggestedFixes().get(0).contains("dimension"));
    }

    @Test
    public void testReportsEveryError() {
        ValidationResult result = engine.validateFormula("rond(1) + round(1, 2)");
        assertEquals(2, result.getErrors().size());
        assertTrue(result.hasError(FormulaErrorType.UNKNOWN_FUNCTION));
        assertTrue(result.hasError(FormulaErrorType.ARITY_ERROR));
    }

    @Test
    public void testUntakenBranchIsStillChecked() {
        ValidationResult result = engine.validateFormula("if(true, 1, round(1, 2))");
        assertTrue(result.hasError(FormulaErrorType.ARITY_ERROR));
    }

    @Test
    public void testSyntaxErrorCarriesSuggestion() {
        ValidationResult result = engine.validateFormula("2 +");
        assertFalse(result.isValid());
        assertTrue(result.hasError(FormulaErrorType.SYNTAX_ERROR));
        assertNotNull(result.getErrors().get(0).getPosition());
        assertFalse(result.getSuggestedFixes().isEmpty());
    }

    @Test
    public void testBareDimensionIdIsHinted() {
        ValidationResult result = engine.validateFormula("fluency * 2");
        assertTrue(result.isValid());
        assertEquals(1, result.getWarnings().size());
        assertTrue(result.getWarnings().get(0).contains("'fluency'"));
        assertTrue(result.getSuggestedFixes().contains("Did you mean dimension(\"fluency\")?"));
    }

    @Test
    public void testMisspelledIdIsHinted() {
        ValidationResult result = engine.validateFormula("fluncy + majr");
        assertTrue(result.isValid());
        assertTrue(result.getSuggestedFixes().contains("Did you mean dimension(\"fluency\")?"));
        assertTrue(result.getSuggestedFixes().contains("Did you mean errorType(\"major\")?"));
    }

    @Test
    public void testContextFunctionUsedAsVariable() {
        ValidationResult result = engine.validateFormula("totalErrors * 2");
        assertTrue(result.isValid());
        assertTrue(result.getWarnings().get(0).contains("is a function"));
        assertTrue(result.getSuggestedFixes().contains("Did you mean totalErrors()?"));
    }

    @Test
    public void testKnownVariablesAndConstantsAreNotHinted() {
        assertTrue(engine.validateFormula("x * pi + e", List.of("x")).getWarnings().isEmpty());
        assertEquals(1, engine.validateFormula("x * pi").getWarnings().size());
    }

    @Test
    public void testLiteralZeroDivisorWarning() {
        ValidationResult result = engine.validateFormula("10 / 0");
        assertTrue(result.isValid());
        assertTrue(result.getWarnings().get(0).startsWith("Possible division by zero"));
        assertFalse(result.getSuggestedFixes().isEmpty());
    }

    @Test
    public void testStaticTypeErrors() {
        assertTrue(engine.validateFormula("true + 1").hasError(FormulaErrorType.TYPE_ERROR));
        assertTrue(engine.validateFormula("1 == true").hasError(FormulaErrorType.TYPE_ERROR));
        assertTrue(engine.validateFormula("max(true, 1)").hasError(FormulaErrorType.TYPE_ERROR));
        assertTrue(engine.validateFormula("-(1 > 0)").hasError(FormulaErrorType.TYPE_ERROR));
        assertTrue(engine.validateFormula("if(true, 1 > 0, 2 > 1) + 1").hasError(FormulaErrorType.TYPE_ERROR));
        assertTrue(engine.validateFormula("\"abc\" + 1").hasError(FormulaErrorType.TYPE_ERROR));
        assertTrue(engine.validateFormula("dimension(fluency)").hasError(FormulaErrorType.TYPE_ERROR));
    }

    @Test
    public void testWellTypedMixes() {
        assertTrue(engine.validateFormula("true == false").isValid());
        assertTrue(engine.validateFormula("and(x > 1, between(x, 0, 10))", List.of("x")).isValid());
        assertTrue(engine.validateFormula("if(x > 1, 1, 0) * 10", List.of("x")).isValid());
        assertTrue(engine.validateFormula("!x", List.of("x")).isValid());
    }

    @Test
    public void testComplexityLimit() {
        String expr = "1" + " + 1".repeat(600);
        ValidationResult result = engine.validateFormula(expr);
        assertTrue(result.hasError(FormulaErrorType.COMPLEXITY_EXCEEDED));
    }

    @Test
    public void testNullFormulaIsReportedAsEmpty() {
        ValidationResult result = engine.validateFormula(null);
        assertTrue(result.hasError(FormulaErrorType.SYNTAX_ERROR));
    }
}
