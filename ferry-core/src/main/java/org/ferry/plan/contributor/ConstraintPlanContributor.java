package org.ferry.plan.contributor;

import org.ferry.diff.Change;
import org.ferry.model.ConstraintDescriptor;
import org.ferry.model.TableDescriptor;
import org.ferry.model.TableRef;
import org.ferry.plan.Operation;
import org.ferry.plan.OperationKind;
import org.ferry.plan.Phase;
import org.ferry.plan.PlanContext;
import org.ferry.plan.PlanContributor;
import org.ferry.plan.PlanOutput;
import org.ferry.plan.PostgresDdl;

import java.util.Set;
import java.util.stream.Collectors;

/**
 * Primary key and unique constraints are created before the data phase so conflict handling has a key to work with;
 * foreign key, check and exclusion constraints follow the data.
 */
public class ConstraintPlanContributor implements PlanContributor {

    @Override
    public int priority() {
        return 40;
    }

    @Override
    public void contribute(PlanContext context, PlanOutput output) {
        Set<TableRef> droppedTables = context.diff().getTables().getRemoved().stream()
                .map(TableDescriptor::table).collect(Collectors.toSet());

        for (ConstraintDescriptor con : context.diff().getConstraints().getRemoved()) {
            if (droppedTables.contains(con.table())) {
                continue;
            }
            output.addRemoval(context, drop(con));
        }

        for (Change<ConstraintDescriptor> change : context.diff().getConstraints().getChanged()) {
            PlanValidation.requireDefinition(change.getSource());
            output.add(drop(change.getTarget()));
            output.add(add(change.getSource()));
        }

        for (ConstraintDescriptor con : context.diff().getConstraints().getAdded()) {
            PlanValidation.requireDefinition(con);
            output.add(add(con));
        }
    }

    private Operation add(ConstraintDescriptor con) {
        return Operation.builder()
                .kind(OperationKind.ADD_CONSTRAINT)
                .phase(con.getType().isKey() ? Phase.PRE_DATA : Phase.POST_DATA)
                .targetObject(con.key())
                .sql(PostgresDdl.addConstraint(con))
                .table(con.table())
                .subject(con)
                .build();
    }

    private Operation drop(ConstraintDescriptor con) {
        return Operation.builder()
                .kind(OperationKind.DROP_CONSTRAINT)
                .phase(Phase.PRE_DATA)
                .targetObject(con.key())
                .sql(PostgresDdl.dropConstraint(con))
                .table(con.table())
                .subject(con)
                .build();
    }
}
