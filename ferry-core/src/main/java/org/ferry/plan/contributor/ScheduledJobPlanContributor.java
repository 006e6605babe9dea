package org.ferry.plan.contributor;

import org.ferry.diff.Change;
import org.ferry.model.ScheduledJobDescriptor;
import org.ferry.plan.Operation;
import org.ferry.plan.OperationKind;
import org.ferry.plan.Phase;
import org.ferry.plan.PlanContext;
import org.ferry.plan.PlanContributor;
import org.ferry.plan.PlanOutput;
import org.ferry.plan.PostgresDdl;

public class ScheduledJobPlanContributor implements PlanContributor {

    @Override
    public int priority() {
        return 70;
    }

    @Override
    public void contribute(PlanContext context, PlanOutput output) {
        for (ScheduledJobDescriptor job : context.diff().getScheduledJobs().getAdded()) {
            output.add(operation(OperationKind.SCHEDULE_JOB, job, PostgresDdl.scheduleJob(job)));
        }
        for (Change<ScheduledJobDescriptor> change : context.diff().getScheduledJobs().getChanged()) {
            output.add(operation(OperationKind.SCHEDULE_JOB, change.getSource(), PostgresDdl.scheduleJob(change.getSource())));
        }
        for (ScheduledJobDescriptor job : context.diff().getScheduledJobs().getRemoved()) {
            output.addRemoval(context, operation(OperationKind.UNSCHEDULE_JOB, job, PostgresDdl.unscheduleJob(job)));
        }
    }

    private Operation operation(OperationKind kind, ScheduledJobDescriptor job, String sql) {
        return Operation.builder()
                .kind(kind)
                .phase(Phase.POST_DATA)
                .targetObject("cron job " + job.getJobName())
                .sql(sql)
                .subject(job)
                .build();
    }
}
