package org.ferry.diff;

import org.ferry.model.ColumnDescriptor;
import org.ferry.model.Snapshot;

import java.util.List;
import java.util.Map;
import java.util.function.Function;

public class ColumnDiffer extends DescriptorDiffer<ColumnDescriptor> {

    public static final String TYPE = "type";
    public static final String NULLABLE = "nullable";
    public static final String DEFAULT = "default";
    public static final String IDENTITY = "identity";

    @Override
    protected void declareFields(Map<String, Function<ColumnDescriptor, ?>> fields) {
        fields.put(TYPE, ColumnDescriptor::getType);
        fields.put(NULLABLE, ColumnDescriptor::isNullable);
        fields.put(DEFAULT, ColumnDescriptor::getDefaultExpression);
        fields.put(IDENTITY, ColumnDescriptor::getIdentity);
    }

    @Override
    protected List<ColumnDescriptor> extract(Snapshot snapshot) {
        return snapshot.getColumns();
    }

    @Override
    protected void store(SchemaDiff result, DiffResult<ColumnDescriptor> diff) {
        result.setColumns(diff);
    }
}
