package org.ferry.plan.contributor;

import org.ferry.diff.Change;
import org.ferry.diff.SchemaDiff;
import org.ferry.model.Descriptor;
import org.ferry.model.PolicyDescriptor;
import org.ferry.model.TableDescriptor;
import org.ferry.model.TableRef;
import org.ferry.plan.Operation;
import org.ferry.plan.OperationKind;
import org.ferry.plan.Phase;
import org.ferry.plan.PlanContext;
import org.ferry.plan.PlanContributor;
import org.ferry.plan.PlanOutput;
import org.ferry.plan.PostgresDdl;

import java.util.Optional;
import java.util.SortedSet;
import java.util.TreeSet;

/**
 * Redefines the row-level security of every table whose policies or RLS flags differ.
 * Per table: RLS flags as in the source, then every target policy dropped, then every source policy created,
 * all in one transaction so the table is never left half-defined.
 */
public class PolicyPlanContributor implements PlanContributor {

    static final String GROUP_PREFIX = "rls:";

    @Override
    public int priority() {
        return 50;
    }

    @Override
    public void contribute(PlanContext context, PlanOutput output) {
        for (TableRef table : affectedTables(context)) {
            Optional<TableDescriptor> source = context.source().findTable(table);
            if (source.isEmpty()) {
                continue;
            }
            Optional<TableDescriptor> target = context.target().findTable(table);
            String group = GROUP_PREFIX + table.display();

            boolean targetEnabled = target.map(TableDescriptor::isRlsEnabled).orElse(false);
            boolean targetForced = target.map(TableDescriptor::isRlsForced).orElse(false);
            if (source.get().isRlsEnabled()) {
                output.add(tableOp(OperationKind.ENABLE_RLS, table, PostgresDdl.enableRls(table), group));
            } else if (targetEnabled) {
                output.add(tableOp(OperationKind.DISABLE_RLS, table, PostgresDdl.disableRls(table), group));
            }
            if (source.get().isRlsForced()) {
                output.add(tableOp(OperationKind.FORCE_RLS, table, PostgresDdl.forceRls(table), group));
            } else if (targetForced) {
                output.add(tableOp(OperationKind.NO_FORCE_RLS, table, PostgresDdl.noForceRls(table), group));
            }

            for (PolicyDescriptor policy : context.target().policiesOf(table)) {
                output.add(policyOp(OperationKind.DROP_POLICY, policy, PostgresDdl.dropPolicy(policy), group));
            }
            for (PolicyDescriptor policy : context.source().policiesOf(table)) {
                output.add(policyOp(OperationKind.CREATE_POLICY, policy, PostgresDdl.createPolicy(policy), group));
            }
        }
    }

    private SortedSet<TableRef> affectedTables(PlanContext context) {
        SchemaDiff diff = context.diff();
        SortedSet<TableRef> tables = new TreeSet<>();
        diff.getPolicies().getAdded().stream().map(Descriptor::table).forEach(tables::add);
        diff.getPolicies().getRemoved().stream().map(Descriptor::table).forEach(tables::add);
        diff.getPolicies().getChanged().stream().map(Change::getSource).map(Descriptor::table).forEach(tables::add);
        diff.getTables().getChanged().stream().map(Change::getSource).map(Descriptor::table).forEach(tables::add);
        diff.getTables().getAdded().stream()
                .filter(t -> t.isRlsEnabled() || t.isRlsForced())
                .map(Descriptor::table)
                .forEach(tables::add);
        return tables;
    }

    private Operation tableOp(OperationKind kind, TableRef table, String sql, String group) {
        return Operation.builder()
                .kind(kind)
                .phase(Phase.POST_DATA)
                .targetObject(table.display())
                .sql(sql)
                .transactionGroup(group)
                .table(table)
                .build();
    }

    private Operation policyOp(OperationKind kind, PolicyDescriptor policy, String sql, String group) {
        return Operation.builder()
                .kind(kind)
                .phase(Phase.POST_DATA)
                .targetObject(policy.key())
                .sql(sql)
                .transactionGroup(group)
                .table(policy.table())
                .subject(policy)
                .build();
    }
}
