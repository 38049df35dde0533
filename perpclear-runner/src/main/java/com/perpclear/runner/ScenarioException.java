package com.perpclear.runner;

/**
 * A scenario step did not behave as scripted.
 */
public class ScenarioException extends Exception {

    private final int stepIndex;

    public ScenarioException(String message, int stepIndex) {
        super(message);
        this.stepIndex = stepIndex;
    }

    public ScenarioException(String message, int stepIndex, Throwable cause) {
        super(message, cause);
        this.stepIndex = stepIndex;
    }

    public int getStepIndex() {
        return stepIndex;
    }
}
