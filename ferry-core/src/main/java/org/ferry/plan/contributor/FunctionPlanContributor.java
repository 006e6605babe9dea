package org.ferry.plan.contributor;

import org.ferry.diff.Change;
import org.ferry.model.FunctionDescriptor;
import org.ferry.plan.Operation;
import org.ferry.plan.OperationKind;
import org.ferry.plan.Phase;
import org.ferry.plan.PlanContext;
import org.ferry.plan.PlanContributor;
import org.ferry.plan.PlanOutput;
import org.ferry.plan.PostgresDdl;

/**
 * Functions and procedures, created before tables so column defaults and check constraints can call them.
 * A changed body is replaced in place; a changed return type fails at apply time and must be handled by hand.
 */
public class FunctionPlanContributor implements PlanContributor {

    @Override
    public int priority() {
        return 13;
    }

    @Override
    public void contribute(PlanContext context, PlanOutput output) {
        for (FunctionDescriptor fn : context.diff().getFunctions().getAdded()) {
            PlanValidation.requireDefinition(fn, fn.getDefinition());
            output.add(operation(OperationKind.CREATE_FUNCTION, fn, PostgresDdl.createFunction(fn)));
        }
        for (Change<FunctionDescriptor> change : context.diff().getFunctions().getChanged()) {
            FunctionDescriptor fn = change.getSource();
            PlanValidation.requireDefinition(fn, fn.getDefinition());
            output.add(operation(OperationKind.REPLACE_FUNCTION, fn, PostgresDdl.createFunction(fn)));
        }
        for (FunctionDescriptor fn : context.diff().getFunctions().getRemoved()) {
            output.addRemoval(context, operation(OperationKind.DROP_FUNCTION, fn, PostgresDdl.dropFunction(fn)));
        }
    }

    private Operation operation(OperationKind kind, FunctionDescriptor fn, String sql) {
        return Operation.builder()
                .kind(kind)
                .phase(Phase.PRE_DATA)
                .targetObject("function " + fn.key())
                .sql(sql)
                .subject(fn)
                .build();
    }
}
