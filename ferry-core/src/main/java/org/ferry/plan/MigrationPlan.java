package org.ferry.plan;

import lombok.Getter;
import org.ferry.model.SyncMode;
import org.ferry.model.TableRef;

import java.util.List;

/**
 * Ordered operations that bring a target in line with a source.
 */
@Getter
public class MigrationPlan {
    private final SyncMode mode;
    private final List<Operation> operations;
    private final List<SuppressedOperation> suppressed;
    private final PlanSummary summary;
    private final List<String> warnings;

    public MigrationPlan(SyncMode mode, List<Operation> operations, List<SuppressedOperation> suppressed,
                         PlanSummary summary, List<String> warnings) {
        this.mode = mode;
        this.operations = List.copyOf(operations);
        this.suppressed = List.copyOf(suppressed);
        this.summary = summary;
        this.warnings = List.copyOf(warnings);
    }

    public boolean isEmpty() {
        return operations.isEmpty();
    }

    public boolean isDestructive() {
        return operations.stream().anyMatch(Operation::isDestructive);
    }

    public List<Operation> getDestructiveOperations() {
        return operations.stream().filter(Operation::isDestructive).toList();
    }

    public List<Operation> operations(Phase phase) {
        return operations.stream().filter(op -> op.getPhase() == phase).toList();
    }

    public boolean hasStructuralChanges() {
        return operations.stream().anyMatch(op -> op.getPhase() != Phase.DATA);
    }

    /**
     * Tables whose rows the data phase loads, in load order.
     */
    public List<TableRef> getDataTables() {
        return operations.stream()
                .filter(op -> op.getKind() == OperationKind.LOAD_TABLE_DATA)
                .map(Operation::getTable)
                .toList();
    }
}
