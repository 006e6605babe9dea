package org.ferry.diff;

import org.ferry.model.ConstraintDescriptor;
import org.ferry.model.Snapshot;

import java.util.List;
import java.util.Map;
import java.util.function.Function;

public class ConstraintDiffer extends DescriptorDiffer<ConstraintDescriptor> {

    @Override
    protected void declareFields(Map<String, Function<ConstraintDescriptor, ?>> fields) {
        fields.put("type", ConstraintDescriptor::getType);
        fields.put("definition", ConstraintDescriptor::getDefinition);
    }

    @Override
    protected List<ConstraintDescriptor> extract(Snapshot snapshot) {
        return snapshot.getConstraints();
    }

    @Override
    protected void store(SchemaDiff result, DiffResult<ConstraintDescriptor> diff) {
        result.setConstraints(diff);
    }
}
