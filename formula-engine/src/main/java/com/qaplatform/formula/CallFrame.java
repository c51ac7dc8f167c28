package com.qaplatform.formula;

import com.qaplatform.formula.ast.FunctionCall;

/**
 * View of one function call handed to a {@link FunctionImplementation}. Arguments are
 * evaluated on demand, so an implementation decides which of them are ever computed.
 */
public interface CallFrame {

    FunctionCall getCall();

    FormulaContext getContext();

    int argumentCount();

    /**
     * Evaluate the argument at {@code index}; the result is a Double or a Boolean.
     */
    Object evaluate(int index);

    /**
     * Evaluate the argument and require a number.
     *
     * @throws FormulaException with {@link FormulaErrorType#TYPE_ERROR} for a non-number
     */
    double number(int index);

    /**
     * Evaluate the argument and coerce it to a boolean; non-zero numbers are true.
     */
    boolean truthy(int index);

    /**
     * The text of a string-literal argument, which is never evaluated.
     */
    String literal(int index);

    /**
     * Record a non-fatal warning for the current evaluation.
     */
    void warn(String message);

    default double[] numbers() {
        double[] values = new double[argumentCount()];
        for (int i = 0; i < values.length; i++) {
            values[i] = number(i);
        }
        return values;
    }
}
