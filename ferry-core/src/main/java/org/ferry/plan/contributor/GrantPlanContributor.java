package org.ferry.plan.contributor;

import org.ferry.diff.Change;
import org.ferry.model.GrantDescriptor;
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

public class GrantPlanContributor implements PlanContributor {

    @Override
    public int priority() {
        return 60; // after policies
    }

    @Override
    public void contribute(PlanContext context, PlanOutput output) {
        for (GrantDescriptor grant : context.diff().getGrants().getAdded()) {
            output.add(operation(OperationKind.GRANT, grant, PostgresDdl.grant(grant)));
        }
        for (Change<GrantDescriptor> change : context.diff().getGrants().getChanged()) {
            output.add(operation(OperationKind.REVOKE, change.getTarget(), PostgresDdl.revoke(change.getTarget())));
            output.add(operation(OperationKind.GRANT, change.getSource(), PostgresDdl.grant(change.getSource())));
        }
        Set<TableRef> droppedTables = context.diff().getTables().getRemoved().stream()
                .map(TableDescriptor::table).collect(Collectors.toSet());
        for (GrantDescriptor grant : context.diff().getGrants().getRemoved()) {
            if (grant.table() != null && droppedTables.contains(grant.table())) {
                continue;
            }
            output.addRemoval(context, operation(OperationKind.REVOKE, grant, PostgresDdl.revoke(grant)));
        }
    }

    private Operation operation(OperationKind kind, GrantDescriptor grant, String sql) {
        return Operation.builder()
                .kind(kind)
                .phase(Phase.POST_DATA)
                .targetObject(grant.getPrivilege() + " on " + grant.getObjectType().name().toLowerCase()
                        + " " + grant.getSchema() + "." + grant.getObjectName() + " to " + grant.getGrantee())
                .sql(sql)
                .table(grant.table())
                .subject(grant)
                .build();
    }
}
