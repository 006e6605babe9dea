package org.ferry.plan.contributor;

import org.ferry.model.ColumnDescriptor;
import org.ferry.model.TableDescriptor;
import org.ferry.model.TableRef;
import org.ferry.plan.Operation;
import org.ferry.plan.OperationKind;
import org.ferry.plan.Phase;
import org.ferry.plan.PlanContext;
import org.ferry.plan.PlanContributor;
import org.ferry.plan.PlanOutput;
import org.ferry.plan.PostgresDdl;

import java.util.List;

/**
 * Creates tables that exist only in the source, from the source column list. Their columns are not also added one by one.
 */
public class TablePlanContributor implements PlanContributor {

    @Override
    public int priority() {
        return 20;
    }

    @Override
    public void contribute(PlanContext context, PlanOutput output) {
        for (TableDescriptor table : context.diff().getTables().getAdded()) {
            TableRef ref = table.table();
            List<ColumnDescriptor> columns = context.source().columnsOf(ref);
            columns.forEach(PlanValidation::requireType);
            output.add(Operation.builder()
                    .kind(OperationKind.CREATE_TABLE)
                    .phase(Phase.PRE_DATA)
                    .targetObject(ref.display())
                    .sql(PostgresDdl.createTable(ref, columns))
                    .table(ref)
                    .subject(table)
                    .build());
        }

        for (TableDescriptor table : context.diff().getTables().getRemoved()) {
            TableRef ref = table.table();
            output.addRemoval(context, Operation.builder()
                    .kind(OperationKind.DROP_TABLE)
                    .phase(Phase.PRE_DATA)
                    .targetObject(ref.display())
                    .sql(PostgresDdl.dropTable(ref))
                    .destructive(true)
                    .table(ref)
                    .subject(table)
                    .build());
        }
    }
}
