package org.ferry.plan.contributor;

import org.ferry.diff.Change;
import org.ferry.model.ExtensionDescriptor;
import org.ferry.plan.Operation;
import org.ferry.plan.OperationKind;
import org.ferry.plan.Phase;
import org.ferry.plan.PlanContext;
import org.ferry.plan.PlanContributor;
import org.ferry.plan.PlanOutput;
import org.ferry.plan.PostgresDdl;

public class ExtensionPlanContributor implements PlanContributor {

    @Override
    public int priority() {
        return 10; // extensions provide types and functions used by everything else
    }

    @Override
    public void contribute(PlanContext context, PlanOutput output) {
        for (ExtensionDescriptor ext : context.diff().getExtensions().getAdded()) {
            output.add(operation(OperationKind.CREATE_EXTENSION, ext, PostgresDdl.createExtension(ext), false));
        }
        for (Change<ExtensionDescriptor> change : context.diff().getExtensions().getChanged()) {
            ExtensionDescriptor ext = change.getSource();
            output.add(operation(OperationKind.ALTER_EXTENSION_SCHEMA, ext, PostgresDdl.alterExtensionSchema(ext), false));
        }
        for (ExtensionDescriptor ext : context.diff().getExtensions().getRemoved()) {
            output.addRemoval(context, operation(OperationKind.DROP_EXTENSION, ext, PostgresDdl.dropExtension(ext), true));
        }
    }

    private Operation operation(OperationKind kind, ExtensionDescriptor ext, String sql, boolean destructive) {
        return Operation.builder()
                .kind(kind)
                .phase(Phase.PRE_DATA)
                .targetObject("extension " + ext.getName())
                .sql(sql)
                .destructive(destructive)
                .subject(ext)
                .build();
    }
}
