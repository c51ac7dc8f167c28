package com.qaplatform.formula;

@FunctionalInterface
public interface FunctionImplementation {
    /**
     * @return a Double or a Boolean
     */
    Object invoke(CallFrame frame);
}
