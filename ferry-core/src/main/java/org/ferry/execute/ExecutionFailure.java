package org.ferry.execute;

import org.ferry.FerryException;

/**
 * An operation failed in a way the run cannot continue from.
 */
public class ExecutionFailure extends FerryException {

    public enum Kind {
        /** Connection-level failure that persisted across every endpoint. */
        FATAL,
        /** Error output not covered by any tolerable rule. */
        UNEXPECTED
    }

    private final Kind kind;
    private final String operation;
    private final String lastOutput;

    public ExecutionFailure(Kind kind, String operation, String lastOutput) {
        super(kind + " failure in " + operation + (lastOutput == null ? "" : ": " + lastOutput));
        this.kind = kind;
        this.operation = operation;
        this.lastOutput = lastOutput;
    }

    public ExecutionFailure(Kind kind, String operation, String lastOutput, Throwable cause) {
        super(kind + " failure in " + operation + (lastOutput == null ? "" : ": " + lastOutput), cause);
        this.kind = kind;
        this.operation = operation;
        this.lastOutput = lastOutput;
    }

    public Kind getKind() {
        return kind;
    }

    public String getOperation() {
        return operation;
    }

    public String getLastOutput() {
        return lastOutput;
    }
}
