package org.ferry.diff;

import org.ferry.model.ScheduledJobDescriptor;
import org.ferry.model.Snapshot;

import java.util.List;
import java.util.Map;
import java.util.function.Function;

public class ScheduledJobDiffer extends DescriptorDiffer<ScheduledJobDescriptor> {

    @Override
    protected void declareFields(Map<String, Function<ScheduledJobDescriptor, ?>> fields) {
        fields.put("schedule", ScheduledJobDescriptor::getSchedule);
        fields.put("command", ScheduledJobDescriptor::getCommand);
        fields.put("active", ScheduledJobDescriptor::isActive);
    }

    @Override
    protected List<ScheduledJobDescriptor> extract(Snapshot snapshot) {
        return snapshot.getScheduledJobs();
    }

    @Override
    protected void store(SchemaDiff result, DiffResult<ScheduledJobDescriptor> diff) {
        result.setScheduledJobs(diff);
    }
}
