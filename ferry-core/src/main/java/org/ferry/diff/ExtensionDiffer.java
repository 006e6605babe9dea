package org.ferry.diff;

import org.ferry.model.ExtensionDescriptor;
import org.ferry.model.Snapshot;

import java.util.List;
import java.util.Map;
import java.util.function.Function;

/**
 * Versions are not compared; upgrading extensions is left to the platform.
 */
public class ExtensionDiffer extends DescriptorDiffer<ExtensionDescriptor> {

    @Override
    protected void declareFields(Map<String, Function<ExtensionDescriptor, ?>> fields) {
        fields.put("schema", ExtensionDescriptor::getSchema);
    }

    @Override
    protected List<ExtensionDescriptor> extract(Snapshot snapshot) {
        return snapshot.getExtensions();
    }

    @Override
    protected void store(SchemaDiff result, DiffResult<ExtensionDescriptor> diff) {
        result.setExtensions(diff);
    }
}
