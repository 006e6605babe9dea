package org.ferry.diff;

import org.ferry.model.SequenceDescriptor;
import org.ferry.model.Snapshot;

import java.util.List;
import java.util.Map;
import java.util.function.Function;

public class SequenceDiffer extends DescriptorDiffer<SequenceDescriptor> {

    public static final String OWNER = "owner";

    @Override
    protected void declareFields(Map<String, Function<SequenceDescriptor, ?>> fields) {
        fields.put("dataType", SequenceDescriptor::getDataType);
        fields.put("start", SequenceDescriptor::getStartValue);
        fields.put("increment", SequenceDescriptor::getIncrement);
        fields.put("min", SequenceDescriptor::getMinValue);
        fields.put("max", SequenceDescriptor::getMaxValue);
        fields.put("cache", SequenceDescriptor::getCache);
        fields.put("cycle", SequenceDescriptor::isCycle);
        fields.put(OWNER, s -> s.isOwned() ? s.getOwnedByTable() + "." + s.getOwnedByColumn() : null);
    }

    @Override
    protected List<SequenceDescriptor> extract(Snapshot snapshot) {
        return snapshot.getSequences();
    }

    @Override
    protected void store(SchemaDiff result, DiffResult<SequenceDescriptor> diff) {
        result.setSequences(diff);
    }
}
