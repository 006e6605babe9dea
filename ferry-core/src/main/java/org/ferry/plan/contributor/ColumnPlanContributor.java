package org.ferry.plan.contributor;

import org.ferry.diff.Change;
import org.ferry.diff.ColumnDiffer;
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

import java.util.Set;
import java.util.stream.Collectors;

/**
 * Column additions, property changes and drops on tables that exist on both sides.
 * A NOT NULL column is added nullable; the constraint follows after the data phase once no NULLs remain.
 */
public class ColumnPlanContributor implements PlanContributor {

    @Override
    public int priority() {
        return 30;
    }

    @Override
    public void contribute(PlanContext context, PlanOutput output) {
        Set<TableRef> createdTables = context.diff().getTables().getAdded().stream()
                .map(TableDescriptor::table).collect(Collectors.toSet());
        Set<TableRef> droppedTables = context.diff().getTables().getRemoved().stream()
                .map(TableDescriptor::table).collect(Collectors.toSet());

        for (ColumnDescriptor col : context.diff().getColumns().getAdded()) {
            if (createdTables.contains(col.table())) {
                continue;
            }
            PlanValidation.requireType(col);
            boolean deferNotNull = !col.isNullable() && !hasDefault(col) && !col.isIdentity();
            output.add(operation(OperationKind.ADD_COLUMN, Phase.PRE_DATA, col, PostgresDdl.addColumn(col, !deferNotNull)));
            if (deferNotNull) {
                output.add(deferredNotNull(col));
            }
        }

        for (Change<ColumnDescriptor> change : context.diff().getColumns().getChanged()) {
            ColumnDescriptor col = change.getSource();
            if (change.hasField(ColumnDiffer.TYPE)) {
                PlanValidation.requireType(col);
                output.add(operation(OperationKind.ALTER_COLUMN_TYPE, Phase.PRE_DATA, col, PostgresDdl.alterColumnType(col)));
            }
            if (change.hasField(ColumnDiffer.IDENTITY) && !col.isIdentity()) {
                output.add(operation(OperationKind.DROP_IDENTITY, Phase.PRE_DATA, col, PostgresDdl.dropIdentity(col)));
            }
            if (change.hasField(ColumnDiffer.DEFAULT)) {
                if (hasDefault(col)) {
                    output.add(operation(OperationKind.SET_DEFAULT, Phase.PRE_DATA, col, PostgresDdl.setDefault(col)));
                } else {
                    output.add(operation(OperationKind.DROP_DEFAULT, Phase.PRE_DATA, col, PostgresDdl.dropDefault(col)));
                }
            }
            boolean notNullNow = false;
            if (change.hasField(ColumnDiffer.IDENTITY) && col.isIdentity()) {
                notNullNow = identityChange(change, output);
            }
            if (change.hasField(ColumnDiffer.NULLABLE) && !notNullNow) {
                if (col.isNullable()) {
                    output.add(operation(OperationKind.DROP_NOT_NULL, Phase.PRE_DATA, col, PostgresDdl.dropNotNull(col)));
                } else {
                    output.add(deferredNotNull(col));
                }
            }
        }

        for (ColumnDescriptor col : context.diff().getColumns().getRemoved()) {
            if (droppedTables.contains(col.table())) {
                continue;
            }
            output.addRemoval(context, operation(OperationKind.DROP_COLUMN, Phase.PRE_DATA, col, PostgresDdl.dropColumn(col))
                    .toBuilder().destructive(true).build());
        }
    }

    /**
     * An identity can only be added to a NOT NULL column, so a pending NOT NULL is applied right away.
     *
     * @return true if NOT NULL was emitted here
     */
    private boolean identityChange(Change<ColumnDescriptor> change, PlanOutput output) {
        ColumnDescriptor col = change.getSource();
        if (change.getTarget().isIdentity()) {
            output.add(operation(OperationKind.SET_IDENTITY_GENERATION, Phase.PRE_DATA, col, PostgresDdl.setIdentityGeneration(col)));
            return false;
        }
        boolean notNullNow = change.hasField(ColumnDiffer.NULLABLE) && !col.isNullable();
        if (notNullNow) {
            output.add(operation(OperationKind.SET_NOT_NULL, Phase.PRE_DATA, col, PostgresDdl.setNotNull(col)));
        }
        output.add(operation(OperationKind.ADD_IDENTITY, Phase.PRE_DATA, col, PostgresDdl.addIdentity(col)));
        return notNullNow;
    }

    private Operation deferredNotNull(ColumnDescriptor col) {
        return operation(OperationKind.SET_NOT_NULL, Phase.POST_DATA, col, PostgresDdl.setNotNull(col))
                .toBuilder().deferred(true).build();
    }

    private Operation operation(OperationKind kind, Phase phase, ColumnDescriptor col, String sql) {
        return Operation.builder()
                .kind(kind)
                .phase(phase)
                .targetObject(col.key())
                .sql(sql)
                .table(col.table())
                .column(col.getName())
                .subject(col)
                .build();
    }

    private static boolean hasDefault(ColumnDescriptor col) {
        return col.getDefaultExpression() != null && !col.getDefaultExpression().isBlank();
    }
}
