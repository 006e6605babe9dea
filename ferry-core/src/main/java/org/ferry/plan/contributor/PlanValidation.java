package org.ferry.plan.contributor;

import org.ferry.model.ColumnDescriptor;
import org.ferry.model.ConstraintDescriptor;
import org.ferry.model.Descriptor;
import org.ferry.plan.PlanGenerationFailure;

final class PlanValidation {

    private PlanValidation() {
    }

    static void requireType(ColumnDescriptor column) {
        if (column.getType() == null || column.getType().isBlank()) {
            throw new PlanGenerationFailure("Column " + column.key() + " has no data type");
        }
    }

    static void requireDefinition(ConstraintDescriptor constraint) {
        if (constraint.getDefinition() == null || constraint.getDefinition().isBlank()) {
            throw new PlanGenerationFailure("Constraint " + constraint.key() + " has no definition");
        }
        if (constraint.getType() == null) {
            throw new PlanGenerationFailure("Constraint " + constraint.key() + " has no type");
        }
    }

    static void requireDefinition(Descriptor descriptor, String definition) {
        if (definition == null || definition.isBlank()) {
            throw new PlanGenerationFailure(descriptor.getClass().getSimpleName().replace("Descriptor", "")
                    + " " + descriptor.key() + " has no definition");
        }
    }
}
