package org.ferry.plan.contributor;

import org.ferry.diff.Change;
import org.ferry.model.ViewDescriptor;
import org.ferry.plan.Operation;
import org.ferry.plan.OperationKind;
import org.ferry.plan.Phase;
import org.ferry.plan.PlanContext;
import org.ferry.plan.PlanContributor;
import org.ferry.plan.PlanOutput;
import org.ferry.plan.PostgresDdl;

/**
 * Views are dropped before the tables and columns they read change, and created once the data is in place.
 */
public class ViewPlanContributor implements PlanContributor {

    @Override
    public int priority() {
        return 18;
    }

    @Override
    public void contribute(PlanContext context, PlanOutput output) {
        for (ViewDescriptor view : context.diff().getViews().getAdded()) {
            PlanValidation.requireDefinition(view, view.getQuery());
            output.add(operation(OperationKind.CREATE_VIEW, Phase.POST_DATA, view, PostgresDdl.createView(view)));
        }
        for (Change<ViewDescriptor> change : context.diff().getViews().getChanged()) {
            ViewDescriptor view = change.getSource();
            PlanValidation.requireDefinition(view, view.getQuery());
            output.add(operation(OperationKind.CREATE_VIEW, Phase.POST_DATA, view, PostgresDdl.createView(view)));
        }
        for (ViewDescriptor view : context.diff().getViews().getRemoved()) {
            output.addRemoval(context, operation(OperationKind.DROP_VIEW, Phase.PRE_DATA, view, PostgresDdl.dropView(view)));
        }
    }

    private Operation operation(OperationKind kind, Phase phase, ViewDescriptor view, String sql) {
        return Operation.builder()
                .kind(kind)
                .phase(phase)
                .targetObject("view " + view.key())
                .sql(sql)
                .subject(view)
                .build();
    }
}
