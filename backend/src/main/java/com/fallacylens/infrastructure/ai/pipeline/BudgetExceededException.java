package com.fallacylens.infrastructure.ai.pipeline;

/**
 * A stage ran out of analysis budget. Handled inside the pipeline; never reaches callers.
 */
public class BudgetExceededException extends RuntimeException {

    public BudgetExceededException(String message) {
        super(message);
    }
}
