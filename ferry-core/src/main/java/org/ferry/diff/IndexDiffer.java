package org.ferry.diff;

import org.ferry.model.IndexDescriptor;
import org.ferry.model.Snapshot;

import java.util.List;
import java.util.Map;
import java.util.function.Function;

public class IndexDiffer extends DescriptorDiffer<IndexDescriptor> {

    @Override
    protected void declareFields(Map<String, Function<IndexDescriptor, ?>> fields) {
        fields.put("table", IndexDescriptor::getTableName);
        fields.put("definition", IndexDescriptor::getDefinition);
    }

    @Override
    protected List<IndexDescriptor> extract(Snapshot snapshot) {
        return snapshot.getIndexes();
    }

    @Override
    protected void store(SchemaDiff result, DiffResult<IndexDescriptor> diff) {
        result.setIndexes(diff);
    }
}
