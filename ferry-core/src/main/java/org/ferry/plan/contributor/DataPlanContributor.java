package org.ferry.plan.contributor;

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
 * One load per source table. Under replace, every table is truncated before the first load,
 * so a cascading truncate never wipes rows that were already loaded.
 */
public class DataPlanContributor implements PlanContributor {

    @Override
    public int priority() {
        return 80;
    }

    @Override
    public boolean structural() {
        return false;
    }

    @Override
    public void contribute(PlanContext context, PlanOutput output) {
        if (!context.mode().includesData()) {
            return;
        }
        List<TableDescriptor> tables = context.source().getTables();

        if (!context.incremental()) {
            for (TableDescriptor table : tables) {
                TableRef ref = table.table();
                output.add(Operation.builder()
                        .kind(OperationKind.TRUNCATE_TABLE)
                        .phase(Phase.DATA)
                        .targetObject(ref.display())
                        .sql(PostgresDdl.truncate(List.of(ref)))
                        .destructive(true)
                        .table(ref)
                        .subject(table)
                        .build());
            }
        }

        for (TableDescriptor table : tables) {
            TableRef ref = table.table();
            output.add(Operation.builder()
                    .kind(OperationKind.LOAD_TABLE_DATA)
                    .phase(Phase.DATA)
                    .targetObject(ref.display())
                    .table(ref)
                    .subject(table)
                    .build());
        }
    }
}
