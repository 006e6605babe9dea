package org.ferry.plan.contributor;

import org.ferry.diff.Change;
import org.ferry.model.EnumTypeDescriptor;
import org.ferry.plan.Operation;
import org.ferry.plan.OperationKind;
import org.ferry.plan.Phase;
import org.ferry.plan.PlanContext;
import org.ferry.plan.PlanContributor;
import org.ferry.plan.PlanOutput;
import org.ferry.plan.PostgresDdl;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.LinkedHashSet;
import java.util.List;
import java.util.Set;

/**
 * Enum types come before the columns and functions that use them; their drops come after.
 * Labels can only be added: a label that exists only on the target stays and is reported as drift.
 */
public class EnumTypePlanContributor implements PlanContributor {

    private static final Logger LOGGER = LoggerFactory.getLogger(EnumTypePlanContributor.class);

    @Override
    public int priority() {
        return 12;
    }

    @Override
    public void contribute(PlanContext context, PlanOutput output) {
        for (EnumTypeDescriptor type : context.diff().getEnumTypes().getAdded()) {
            output.add(operation(OperationKind.CREATE_ENUM_TYPE, Phase.PRE_DATA, type, PostgresDdl.createEnumType(type)));
        }

        for (Change<EnumTypeDescriptor> change : context.diff().getEnumTypes().getChanged()) {
            addMissingLabels(change.getSource(), change.getTarget(), output);
        }

        for (EnumTypeDescriptor type : context.diff().getEnumTypes().getRemoved()) {
            output.addRemoval(context, operation(OperationKind.DROP_ENUM_TYPE, Phase.POST_DATA, type, PostgresDdl.dropType(type)));
        }
    }

    private void addMissingLabels(EnumTypeDescriptor source, EnumTypeDescriptor target, PlanOutput output) {
        List<String> labels = source.getLabels();
        Set<String> present = new LinkedHashSet<>(target.getLabels());
        for (int i = 0; i < labels.size(); i++) {
            String label = labels.get(i);
            if (present.contains(label)) {
                continue;
            }
            String sql;
            if (i > 0) {
                sql = PostgresDdl.addEnumValue(source, label, labels.get(i - 1), false);
            } else {
                String next = labels.stream().skip(1).filter(present::contains).findFirst().orElse(null);
                sql = PostgresDdl.addEnumValue(source, label, next, true);
            }
            output.add(operation(OperationKind.ADD_ENUM_VALUE, Phase.PRE_DATA, source, sql));
            present.add(label);
        }
        List<String> extra = target.getLabels().stream().filter(l -> !labels.contains(l)).toList();
        if (!extra.isEmpty()) {
            LOGGER.warn("Enum type {} has labels only the target knows; they cannot be removed: {}", source.key(), extra);
        }
    }

    private Operation operation(OperationKind kind, Phase phase, EnumTypeDescriptor type, String sql) {
        return Operation.builder()
                .kind(kind)
                .phase(phase)
                .targetObject("type " + type.key())
                .sql(sql)
                .subject(type)
                .build();
    }
}
