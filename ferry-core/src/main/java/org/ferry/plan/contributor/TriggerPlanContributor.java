package org.ferry.plan.contributor;

import org.ferry.diff.Change;
import org.ferry.diff.TriggerDiffer;
import org.ferry.model.TableDescriptor;
import org.ferry.model.TableRef;
import org.ferry.model.TriggerDescriptor;
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
 * Triggers are dropped before the functions they call and created after the data phase.
 * A changed definition is dropped and recreated in one transaction.
 */
public class TriggerPlanContributor implements PlanContributor {

    @Override
    public int priority() {
        return 11;
    }

    @Override
    public void contribute(PlanContext context, PlanOutput output) {
        for (TriggerDescriptor trigger : context.diff().getTriggers().getAdded()) {
            PlanValidation.requireDefinition(trigger, trigger.getDefinition());
            output.add(operation(OperationKind.CREATE_TRIGGER, Phase.POST_DATA, trigger, PostgresDdl.createTrigger(trigger)));
        }

        for (Change<TriggerDescriptor> change : context.diff().getTriggers().getChanged()) {
            TriggerDescriptor trigger = change.getSource();
            if (change.hasField(TriggerDiffer.DEFINITION)) {
                PlanValidation.requireDefinition(trigger, trigger.getDefinition());
                String group = "trigger:" + trigger.key();
                output.add(operation(OperationKind.DROP_TRIGGER, Phase.POST_DATA, change.getTarget(), PostgresDdl.dropTrigger(trigger))
                        .toBuilder().transactionGroup(group).build());
                output.add(operation(OperationKind.CREATE_TRIGGER, Phase.POST_DATA, trigger, PostgresDdl.createTrigger(trigger))
                        .toBuilder().transactionGroup(group).build());
            } else {
                String sql = trigger.isEnabled() ? PostgresDdl.enableTrigger(trigger) : PostgresDdl.disableTrigger(trigger);
                output.add(operation(OperationKind.SET_TRIGGER_ENABLED, Phase.POST_DATA, trigger, sql));
            }
        }

        Set<TableRef> droppedTables = context.diff().getTables().getRemoved().stream()
                .map(TableDescriptor::table).collect(Collectors.toSet());
        for (TriggerDescriptor trigger : context.diff().getTriggers().getRemoved()) {
            if (droppedTables.contains(trigger.table())) {
                continue;
            }
            output.addRemoval(context, operation(OperationKind.DROP_TRIGGER, Phase.PRE_DATA, trigger, PostgresDdl.dropTrigger(trigger)));
        }
    }

    private Operation operation(OperationKind kind, Phase phase, TriggerDescriptor trigger, String sql) {
        return Operation.builder()
                .kind(kind)
                .phase(phase)
                .targetObject("trigger " + trigger.key())
                .sql(sql)
                .table(trigger.table())
                .subject(trigger)
                .build();
    }
}
