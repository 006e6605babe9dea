package org.ferry.execute;

import java.util.List;

/**
 * Overall class of a tool run plus the lines that decided it.
 */
public record ClassifiedOutput(Classification classification, List<String> toleratedLines, List<String> errorLines) {

    public ClassifiedOutput {
        toleratedLines = List.copyOf(toleratedLines);
        errorLines = List.copyOf(errorLines);
    }

    public boolean isSuccess() {
        return classification == Classification.CLEAN || classification == Classification.TOLERABLE;
    }

    /**
     * Last line that made the run fail, or {@code null} when it did not fail.
     */
    public String lastError() {
        return errorLines.isEmpty() ? null : errorLines.get(errorLines.size() - 1);
    }
}
