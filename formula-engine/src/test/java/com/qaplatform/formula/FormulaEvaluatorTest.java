package com.qaplatform.formula;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.util.ArrayList;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

public class FormulaEvaluatorTest {

    private FormulaEvaluator evaluator;
    private FormulaContext context;
    private List<String> warnings;

    @BeforeEach
    public void setup() {
        evaluator = new FormulaEvaluator(FunctionRegistry.builtins());
        context = FormulaUtils.createTestContext().toBuilder()
                .variable("x", 2)
                .variable("y", 5)
                .build();
        warnings = new ArrayList<>();
    }

    private Object eval(String expr) {
        return evaluator.evaluate(FormulaParser.parse(expr), context, warnings);
    }

    private FormulaErrorType failure(String expr) {
        return assertThrows(FormulaException.class, () -> eval(expr), expr).getType();
    }

    @Test
    public void testArithmetic() {
        assertEquals(14.0, eval("2 + 3 * 4"));
        assertEquals(20.0, eval("(2 + 3) * 4"));
        assertEquals(512.0, eval("2 ^ 3 ^ 2"));
        assertEquals(1.0, eval("10 % 3"));
        assertEquals(2.5, eval("5 / 2"));
        assertEquals(4.0, eval("-2 ^ 2"));
        assertEquals(-1.0, eval("-x + 1"));
    }

    @Test
    public void testComparisonsAndEquality() {
        assertEquals(true, eval("3 > 2"));
        assertEquals(false, eval("3 <= 2"));
        assertEquals(true, eval("x == 2"));
        assertEquals(true, eval("true != false"));
        assertEquals(true, eval("(1 < 2) == true"));
        assertEquals(FormulaErrorType.TYPE_ERROR, failure("1 == true"));
    }

    @Test
    public void testBooleansAreNotNumbers() {
        assertEquals(FormulaErrorType.TYPE_ERROR, failure("true + 1"));
        assertEquals(FormulaErrorType.TYPE_ERROR, failure("-(1 > 0)"));
        assertEquals(FormulaErrorType.TYPE_ERROR, failure("max(1, 2 > 1)"));
    }

    @Test
    public void testNotAcceptsNumbers() {
        assertEquals(false, eval("!5"));
        assertEquals(true, eval("!0"));
        assertEquals(true, eval("not(0)"));
    }

    @Test
    public void testDivisionByZero() {
        assertEquals(FormulaErrorType.DIVISION_BY_ZERO, failure("1 / 0"));
        assertEquals(FormulaErrorType.DIVISION_BY_ZERO, failure("5 % (x - 2)"));
    }

    @Test
    public void testVariablesAndConstants() {
        assertEquals(10.0, eval("x * y"));
        assertEquals(Math.PI * 2, (Double) eval("pi * 2"), 1e-12);
        assertEquals(FormulaErrorType.UNKNOWN_IDENTIFIER, failure("undefinedVar + 1"));
    }

    @Test
    public void testVariablesShadowConstants() {
        context = context.withVariable("pi", 3);
        assertEquals(3.0, eval("pi"));
    }

    @Test
    public void testAggregates() {
        assertEquals(1.0, eval("min(3, 1, 2)"));
        assertEquals(3.0, eval("max(3, 1, 2)"));
        assertEquals(2.5, eval("avg(1, 2, 3, 4)"));
        assertEquals(10.0, eval("sum(1, 2, 3, 4)"));
        assertEquals(3.0, eval("count(7, 8, 9)"));
        assertEquals(7.0, eval("max(7)"));
    }

    @Test
    public void testRoundingHalfAwayFromZero() {
        assertEquals(3.0, eval("round(2.5)"));
        assertEquals(-3.0, eval("round(-2.5)"));
        assertEquals(2.0, eval("round(2.4)"));
        assertEquals(0.0, eval("round(0.49999999999999994)"));
        assertEquals(4503599627370497.0, eval("round(4503599627370497)"));
        assertEquals(3.0, eval("abs(-3)"));
        assertEquals(3.0, eval("ceil(2.1)"));
        assertEquals(2.0, eval("floor(2.9)"));
    }

    @Test
    public void testDecimalRounding() {
        assertEquals(3.14, eval("toFixed(3.14159)"));
        assertEquals(3.1, eval("toFixed(3.14159, 1)"));
        assertEquals(-3.0, eval("toFixed(-2.5, 0)"));
        assertEquals(1.0, eval("toFixed(1.005, 2)"));
        assertEquals(123.0, eval("toPrecision(123.456)"));
        assertEquals(0.0012, eval("toPrecision(0.0012345, 2)"));
        assertEquals(28.3, eval("toFixed(dimension(\"fluency\") / 3, 1)"));
    }

    @Test
    public void testDecimalRoundingRejectsOutOfRangeDigits() {
        assertEquals(FormulaErrorType.RUNTIME_ERROR, failure("toFixed(1, 101)"));
        assertEquals(FormulaErrorType.RUNTIME_ERROR, failure("toFixed(1, -1)"));
        assertEquals(FormulaErrorType.RUNTIME_ERROR, failure("toPrecision(1, 0)"));
        assertEquals(FormulaErrorType.TYPE_ERROR, failure("toFixed(1, true)"));
    }

    @Test
    public void testMathFunctions() {
        assertEquals(3.0, eval("sqrt(9)"));
        assertEquals(1024.0, eval("pow(2, 10)"));
        assertEquals(2.0, eval("log10(100)"));
        assertEquals(1.0, (Double) eval("log(e)"), 1e-12);
    }

    @Test
    public void testRangesAndPercentages() {
        assertEquals(100.0, eval("clamp(150, 0, 100)"));
        assertEquals(0.0, eval("clamp(-5, 0, 100)"));
        assertEquals(true, eval("between(5, 1, 10)"));
        assertEquals(true, eval("between(10, 1, 10)"));
        assertEquals(false, eval("between(11, 1, 10)"));
        assertEquals(12.5, eval("percentage(25, 200)"));
        assertEquals(0.0, eval("percentage(5, 0)"));
        assertEquals(20.0, eval("percentageOf(10, 200)"));
    }

    @Test
    public void testContextAccessors() {
        assertEquals(85.0, eval("dimension(\"fluency\")"));
        assertEquals(1.0, eval("errorType(\"major\")"));
        assertEquals(40.0, eval("weight(\"adequacy\")"));
        assertEquals(2.0, eval("variable(\"x\")"));
        assertEquals(Math.E, eval("constant(\"e\")"));
        assertEquals(3.0, eval("totalErrors()"));
        assertEquals(100.0, eval("unitCount()"));
        assertEquals(0.03, eval("errorRate()"));
        assertEquals(100.0, eval("maxScore()"));
        assertEquals(85.0, eval("passingThreshold()"));
        assertTrue(warnings.isEmpty());
    }

    @Test
    public void testMissingKeyDefaultsToZeroWithWarning() {
        assertEquals(0.0, eval("dimension(\"accuracy\") + dimension(\"accuracy\")"));
        assertEquals(1, warnings.size());
        assertEquals("dimension not found, defaulted to 0: \"accuracy\"", warnings.get(0));
    }

    @Test
    public void testIfEvaluatesOnlySelectedBranch() {
        assertEquals(1.0, eval("if(true, 1, 1 / 0)"));
        assertEquals(2.0, eval("if(0, undefinedVar, 2)"));
        assertEquals(true, eval("if(x > 1, 1 > 0, 5)"));
        assertEquals(FormulaErrorType.DIVISION_BY_ZERO, failure("if(false, 1, 1 / 0)"));
    }

    @Test
    public void testAndOrShortCircuit() {
        assertEquals(false, eval("and(false, 1 / 0 > 0)"));
        assertEquals(true, eval("or(true, undefinedVar)"));
        assertEquals(true, eval("and(1, 2, x)"));
        assertEquals(false, eval("or(0, false, 0)"));
        assertEquals(FormulaErrorType.UNKNOWN_IDENTIFIER, failure("and(true, undefinedVar)"));
    }

    @Test
    public void testTextIsNotAValue() {
        assertEquals(FormulaErrorType.TYPE_ERROR, failure("\"fluency\" + 1"));
        assertEquals(FormulaErrorType.TYPE_ERROR, failure("dimension(x)"));
    }

    @Test
    public void testUnknownFunctionAndArity() {
        assertEquals(FormulaErrorType.UNKNOWN_FUNCTION, failure("median(1, 2)"));
        assertEquals(FormulaErrorType.ARITY_ERROR, failure("round(1, 2, 3)"));
    }

    @Test
    public void testErrorsCarryPositions() {
        FormulaException e = assertThrows(FormulaException.class, () -> eval("1 + missing"));
        assertEquals(5, e.getPosition().getColumn());
    }
}
