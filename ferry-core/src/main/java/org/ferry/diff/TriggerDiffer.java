package org.ferry.diff;

import org.ferry.model.TriggerDescriptor;
import org.ferry.model.Snapshot;

import java.util.List;
import java.util.Map;
import java.util.function.Function;

public class TriggerDiffer extends DescriptorDiffer<TriggerDescriptor> {

    public static final String DEFINITION = "definition";
    public static final String ENABLED = "enabled";

    @Override
    protected void declareFields(Map<String, Function<TriggerDescriptor, ?>> fields) {
        fields.put(DEFINITION, TriggerDescriptor::getDefinition);
        fields.put(ENABLED, TriggerDescriptor::isEnabled);
    }

    @Override
    protected List<TriggerDescriptor> extract(Snapshot snapshot) {
        return snapshot.getTriggers();
    }

    @Override
    protected void store(SchemaDiff result, DiffResult<TriggerDescriptor> diff) {
        result.setTriggers(diff);
    }
}
