package com.qaplatform.formula;

import com.qaplatform.formula.ast.FormulaNode;

import java.math.BigDecimal;
import java.math.MathContext;
import java.math.RoundingMode;
import java.util.Arrays;

import static com.qaplatform.formula.FunctionDefinition.VARIADIC;

/**
 * Pure numeric built-ins. Every argument is evaluated and must be a number.
 */
public class NumericFunctions {

    public static void register(FunctionRegistry registry) {
        // Aggregates
        registry.registerNumeric("min", 1, VARIADIC, ValueType.NUMBER, "Smallest argument",
                frame -> Arrays.stream(frame.numbers()).min().orElseThrow());
        registry.registerNumeric("max", 1, VARIADIC, ValueType.NUMBER, "Largest argument",
                frame -> Arrays.stream(frame.numbers()).max().orElseThrow());
        registry.registerNumeric("avg", 1, VARIADIC, ValueType.NUMBER, "Arithmetic mean of the arguments",
                frame -> Arrays.stream(frame.numbers()).average().orElseThrow());
        registry.registerNumeric("sum", 1, VARIADIC, ValueType.NUMBER, "Sum of the arguments",
                frame -> Arrays.stream(frame.numbers()).sum());
        registry.registerNumeric("count", 1, VARIADIC, ValueType.NUMBER, "Number of arguments",
                frame -> (double) frame.numbers().length);

        // Rounding and sign
        registry.registerNumeric("round", 1, 1, ValueType.NUMBER, "Nearest integer, ties away from zero",
                frame -> roundHalfAwayFromZero(frame.number(0)));
        registry.registerNumeric("abs", 1, 1, ValueType.NUMBER, "Absolute value",
                frame -> Math.abs(frame.number(0)));
        registry.registerNumeric("ceil", 1, 1, ValueType.NUMBER, "Smallest integer not below the value",
                frame -> Math.ceil(frame.number(0)));
        registry.registerNumeric("floor", 1, 1, ValueType.NUMBER, "Largest integer not above the value",
                frame -> Math.floor(frame.number(0)));
        registry.registerNumeric("toFixed", 1, 2, ValueType.NUMBER, "Value rounded to the given decimal places, 2 by default",
                frame -> toFixed(frame.number(0), digitsArgument(frame, 2, 0, 100)));
        registry.registerNumeric("toPrecision", 1, 2, ValueType.NUMBER, "Value rounded to the given significant digits, 3 by default",
                frame -> toPrecision(frame.number(0), digitsArgument(frame, 3, 1, 100)));

        // Powers and logarithms
        registry.registerNumeric("sqrt", 1, 1, ValueType.NUMBER, "Square root",
                frame -> Math.sqrt(frame.number(0)));
        registry.registerNumeric("pow", 2, 2, ValueType.NUMBER, "Base raised to the exponent",
                frame -> Math.pow(frame.number(0), frame.number(1)));
        registry.registerNumeric("log", 1, 1, ValueType.NUMBER, "Natural logarithm",
                frame -> Math.log(frame.number(0)));
        registry.registerNumeric("log10", 1, 1, ValueType.NUMBER, "Base 10 logarithm",
                frame -> Math.log10(frame.number(0)));

        // Ranges and percentages
        registry.registerNumeric("clamp", 3, 3, ValueType.NUMBER, "Value limited to [min, max]",
                frame -> {
                    double[] args = frame.numbers();
                    return Math.min(Math.max(args[0], args[1]), args[2]);
                });
        registry.registerNumeric("between", 3, 3, ValueType.BOOLEAN, "Whether min <= value <= max",
                frame -> {
                    double[] args = frame.numbers();
                    return args[0] >= args[1] && args[0] <= args[2];
                });
        registry.registerNumeric("percentage", 2, 2, ValueType.NUMBER, "Value as a percentage of total, 0 when total <= 0",
                frame -> {
                    double value = frame.number(0);
                    double total = frame.number(1);
                    return total > 0 ? value / total * 100 : 0.0;
                });
        registry.registerNumeric("percentageOf", 2, 2, ValueType.NUMBER, "Given percentage of total",
                frame -> frame.number(0) / 100 * frame.number(1));
    }

    static double roundHalfAwayFromZero(double value) {
        // from 2^52 up every double is already an integer
        if (Double.isNaN(value) || Double.isInfinite(value) || Math.abs(value) >= 0x1p52) {
            return value;
        }
        return Math.signum(value) * Math.round(Math.abs(value));
    }

    /**
     * Round to {@code digits} decimal places, ties away from zero.
     */
    static double toFixed(double value, int digits) {
        if (Double.isNaN(value) || Double.isInfinite(value)) {
            return value;
        }
        return new BigDecimal(value).setScale(digits, RoundingMode.HALF_UP).doubleValue();
    }

    /**
     * Round to {@code precision} significant digits, ties away from zero.
     */
    static double toPrecision(double value, int precision) {
        if (Double.isNaN(value) || Double.isInfinite(value)) {
            return value;
        }
        return new BigDecimal(value).round(new MathContext(precision, RoundingMode.HALF_UP)).doubleValue();
    }

    private static int digitsArgument(CallFrame frame, int defaultValue, int min, int max) {
        if (frame.argumentCount() < 2) {
            return defaultValue;
        }
        double requested = frame.number(1);
        if (Double.isNaN(requested) || requested < min || requested >= max + 1) {
            FormulaNode arg = frame.getCall().getArguments().get(1);
            throw new FormulaException(FormulaErrorType.RUNTIME_ERROR,
                    "Argument 2 of '" + frame.getCall().getName() + "' must be between " + min + " and " + max
                            + " but was " + requested + " at " + arg.getPosition(),
                    arg.getPosition());
        }
        return (int) requested;
    }
}
