package org.ferry.diff;

import org.ferry.model.Snapshot;
import org.ferry.model.TableDescriptor;

import java.util.List;
import java.util.Map;
import java.util.function.Function;

public class TableDiffer extends DescriptorDiffer<TableDescriptor> {

    @Override
    protected void declareFields(Map<String, Function<TableDescriptor, ?>> fields) {
        fields.put("rlsEnabled", TableDescriptor::isRlsEnabled);
        fields.put("rlsForced", TableDescriptor::isRlsForced);
    }

    @Override
    protected List<TableDescriptor> extract(Snapshot snapshot) {
        return snapshot.getTables();
    }

    @Override
    protected void store(SchemaDiff result, DiffResult<TableDescriptor> diff) {
        result.setTables(diff);
    }
}
