package org.ferry.execute;

import lombok.Getter;

import java.util.ArrayList;
import java.util.List;

/**
 * What happened to each operation of a run.
 */
@Getter
public class ExecutionReport {
    private final List<OperationOutcome> outcomes = new ArrayList<>();
    /** Columns left nullable because NULLs remained, as {@code schema.table.column}. */
    private final List<String> manualBackfill = new ArrayList<>();

    public void record(OperationOutcome outcome) {
        outcomes.add(outcome);
    }

    public void requireBackfill(String column) {
        manualBackfill.add(column);
    }

    public ExecutionReport merge(ExecutionReport other) {
        outcomes.addAll(other.outcomes);
        manualBackfill.addAll(other.manualBackfill);
        return this;
    }

    public long count(OperationOutcome.Status status) {
        return outcomes.stream().filter(o -> o.getStatus() == status).count();
    }
}
