package org.ferry.plan;

import java.util.ArrayList;
import java.util.List;

/**
 * Collects what one contributor emits.
 */
public class PlanOutput {

    static final String WITHHELD_INCREMENTAL = "withheld: incremental strategy never removes target-only objects";

    private final List<Operation> operations = new ArrayList<>();
    private final List<SuppressedOperation> suppressed = new ArrayList<>();

    public void add(Operation operation) {
        operations.add(operation);
    }

    /**
     * Emits a removal, or records it as withheld when the context is incremental.
     */
    public void addRemoval(PlanContext context, Operation operation) {
        if (context.incremental()) {
            suppressed.add(new SuppressedOperation(operation, WITHHELD_INCREMENTAL));
        } else {
            operations.add(operation);
        }
    }

    public List<Operation> getOperations() {
        return operations;
    }

    public List<SuppressedOperation> getSuppressed() {
        return suppressed;
    }
}
