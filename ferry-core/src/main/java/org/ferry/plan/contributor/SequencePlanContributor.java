package org.ferry.plan.contributor;

import org.ferry.diff.Change;
import org.ferry.diff.SequenceDiffer;
import org.ferry.model.SequenceDescriptor;
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
 * Sequences are created before the tables whose defaults call {@code nextval} on them.
 * Ownership needs the owning column, so it is set after the data phase; drops wait until column defaults are gone.
 */
public class SequencePlanContributor implements PlanContributor {

    @Override
    public int priority() {
        return 15;
    }

    @Override
    public void contribute(PlanContext context, PlanOutput output) {
        for (SequenceDescriptor seq : context.diff().getSequences().getAdded()) {
            output.add(operation(OperationKind.CREATE_SEQUENCE, Phase.PRE_DATA, seq, PostgresDdl.createSequence(seq)));
            if (seq.isOwned()) {
                output.add(operation(OperationKind.SET_SEQUENCE_OWNER, Phase.POST_DATA, seq, PostgresDdl.sequenceOwnedBy(seq)));
            }
        }

        for (Change<SequenceDescriptor> change : context.diff().getSequences().getChanged()) {
            SequenceDescriptor seq = change.getSource();
            if (change.getFields().stream().anyMatch(f -> !SequenceDiffer.OWNER.equals(f))) {
                output.add(operation(OperationKind.ALTER_SEQUENCE, Phase.PRE_DATA, seq, PostgresDdl.alterSequence(seq)));
            }
            if (change.hasField(SequenceDiffer.OWNER)) {
                output.add(operation(OperationKind.SET_SEQUENCE_OWNER, Phase.POST_DATA, seq, PostgresDdl.sequenceOwnedBy(seq)));
            }
        }

        Set<TableRef> droppedTables = context.diff().getTables().getRemoved().stream()
                .map(TableDescriptor::table).collect(Collectors.toSet());
        for (SequenceDescriptor seq : context.diff().getSequences().getRemoved()) {
            if (seq.isOwned() && droppedTables.contains(seq.owner())) {
                continue;
            }
            output.addRemoval(context, operation(OperationKind.DROP_SEQUENCE, Phase.POST_DATA, seq, PostgresDdl.dropSequence(seq))
                    .toBuilder().destructive(true).build());
        }
    }

    private Operation operation(OperationKind kind, Phase phase, SequenceDescriptor seq, String sql) {
        return Operation.builder()
                .kind(kind)
                .phase(phase)
                .targetObject("sequence " + seq.key())
                .sql(sql)
                .subject(seq)
                .build();
    }
}
