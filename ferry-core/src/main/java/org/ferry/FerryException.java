package org.ferry;

/**
 * Root of every failure raised while reconciling two environments.
 * Subtypes identify what failed; the orchestrator attaches the stage it was in.
 */
public class FerryException extends RuntimeException {

    private String stage;

    public FerryException(String message) {
        super(message);
    }

    public FerryException(String message, Throwable cause) {
        super(message, cause);
    }

    public String getStage() {
        return stage;
    }

    /**
     * Records the stage the failure surfaced in, keeping the innermost one if already set.
     */
    public FerryException atStage(String stage) {
        if (this.stage == null) {
            this.stage = stage;
        }
        return this;
    }
}
