package org.ferry.diff;

import org.ferry.model.EnumTypeDescriptor;
import org.ferry.model.Snapshot;

import java.util.List;
import java.util.Map;
import java.util.function.Function;

public class EnumTypeDiffer extends DescriptorDiffer<EnumTypeDescriptor> {

    @Override
    protected void declareFields(Map<String, Function<EnumTypeDescriptor, ?>> fields) {
        fields.put("labels", EnumTypeDescriptor::getLabels);
    }

    @Override
    protected List<EnumTypeDescriptor> extract(Snapshot snapshot) {
        return snapshot.getEnumTypes();
    }

    @Override
    protected void store(SchemaDiff result, DiffResult<EnumTypeDescriptor> diff) {
        result.setEnumTypes(diff);
    }
}
