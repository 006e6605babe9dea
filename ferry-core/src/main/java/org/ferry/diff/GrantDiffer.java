package org.ferry.diff;

import org.ferry.model.GrantDescriptor;
import org.ferry.model.Snapshot;

import java.util.List;
import java.util.Map;
import java.util.function.Function;

public class GrantDiffer extends DescriptorDiffer<GrantDescriptor> {

    @Override
    protected void declareFields(Map<String, Function<GrantDescriptor, ?>> fields) {
        fields.put("grantable", GrantDescriptor::isGrantable);
    }

    @Override
    protected List<GrantDescriptor> extract(Snapshot snapshot) {
        return snapshot.getGrants();
    }

    @Override
    protected void store(SchemaDiff result, DiffResult<GrantDescriptor> diff) {
        result.setGrants(diff);
    }
}
