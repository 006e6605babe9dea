package org.ferry.diff;

import org.ferry.model.ViewDescriptor;
import org.ferry.model.Snapshot;

import java.util.List;
import java.util.Map;
import java.util.function.Function;

public class ViewDiffer extends DescriptorDiffer<ViewDescriptor> {

    @Override
    protected void declareFields(Map<String, Function<ViewDescriptor, ?>> fields) {
        fields.put("query", ViewDescriptor::getQuery);
    }

    @Override
    protected List<ViewDescriptor> extract(Snapshot snapshot) {
        return snapshot.getViews();
    }

    @Override
    protected void store(SchemaDiff result, DiffResult<ViewDescriptor> diff) {
        result.setViews(diff);
    }
}
