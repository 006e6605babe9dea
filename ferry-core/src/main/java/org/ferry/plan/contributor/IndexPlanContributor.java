package org.ferry.plan.contributor;

import org.ferry.diff.Change;
import org.ferry.model.IndexDescriptor;
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
 * Secondary indexes are built after the data is loaded. A changed index is rebuilt in one transaction.
 */
public class IndexPlanContributor implements PlanContributor {

    @Override
    public int priority() {
        return 65;
    }

    @Override
    public void contribute(PlanContext context, PlanOutput output) {
        for (IndexDescriptor index : context.diff().getIndexes().getAdded()) {
            PlanValidation.requireDefinition(index, index.getDefinition());
            output.add(operation(OperationKind.CREATE_INDEX, Phase.POST_DATA, index, PostgresDdl.createIndex(index)));
        }

        for (Change<IndexDescriptor> change : context.diff().getIndexes().getChanged()) {
            IndexDescriptor index = change.getSource();
            PlanValidation.requireDefinition(index, index.getDefinition());
            String group = "index:" + index.key();
            output.add(operation(OperationKind.DROP_INDEX, Phase.POST_DATA, change.getTarget(), PostgresDdl.dropIndex(index))
                    .toBuilder().transactionGroup(group).build());
            output.add(operation(OperationKind.CREATE_INDEX, Phase.POST_DATA, index, PostgresDdl.createIndex(index))
                    .toBuilder().transactionGroup(group).build());
        }

        Set<TableRef> droppedTables = context.diff().getTables().getRemoved().stream()
                .map(TableDescriptor::table).collect(Collectors.toSet());
        for (IndexDescriptor index : context.diff().getIndexes().getRemoved()) {
            if (droppedTables.contains(index.table())) {
                continue;
            }
            output.addRemoval(context, operation(OperationKind.DROP_INDEX, Phase.PRE_DATA, index, PostgresDdl.dropIndex(index)));
        }
    }

    private Operation operation(OperationKind kind, Phase phase, IndexDescriptor index, String sql) {
        return Operation.builder()
                .kind(kind)
                .phase(phase)
                .targetObject("index " + index.key())
                .sql(sql)
                .table(index.table())
                .subject(index)
                .build();
    }
}
