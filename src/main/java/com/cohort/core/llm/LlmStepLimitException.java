package com.cohort.core.llm;

/**
 * Thrown when the model keeps requesting tools after the last allowed tool round.
 */
public class LlmStepLimitException extends RuntimeException {

    private final int maxSteps;

    public LlmStepLimitException(int maxSteps) {
        super("Model still requested tools after " + maxSteps + " steps");
        this.maxSteps = maxSteps;
    }

    public int getMaxSteps() {
        return maxSteps;
    }
}
