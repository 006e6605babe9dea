package org.ferry.diff;

import org.ferry.model.FunctionDescriptor;
import org.ferry.model.Snapshot;

import java.util.List;
import java.util.Map;
import java.util.function.Function;

public class FunctionDiffer extends DescriptorDiffer<FunctionDescriptor> {

    @Override
    protected void declareFields(Map<String, Function<FunctionDescriptor, ?>> fields) {
        fields.put("definition", FunctionDescriptor::getDefinition);
    }

    @Override
    protected List<FunctionDescriptor> extract(Snapshot snapshot) {
        return snapshot.getFunctions();
    }

    @Override
    protected void store(SchemaDiff result, DiffResult<FunctionDescriptor> diff) {
        result.setFunctions(diff);
    }
}
