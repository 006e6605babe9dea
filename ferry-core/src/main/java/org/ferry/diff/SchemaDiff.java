package org.ferry.diff;

import lombok.Builder;
import lombok.Getter;
import lombok.Setter;
import org.ferry.model.ColumnDescriptor;
import org.ferry.model.ConstraintDescriptor;
import org.ferry.model.EnumTypeDescriptor;
import org.ferry.model.ExtensionDescriptor;
import org.ferry.model.FunctionDescriptor;
import org.ferry.model.GrantDescriptor;
import org.ferry.model.IndexDescriptor;
import org.ferry.model.PolicyDescriptor;
import org.ferry.model.ScheduledJobDescriptor;
import org.ferry.model.SequenceDescriptor;
import org.ferry.model.TableDescriptor;
import org.ferry.model.TriggerDescriptor;
import org.ferry.model.ViewDescriptor;

import java.util.ArrayList;
import java.util.List;
import java.util.stream.Stream;

@Builder
@Getter
@Setter
public class SchemaDiff {
    @Builder.Default private DiffResult<TableDescriptor> tables = DiffResult.empty();
    @Builder.Default private DiffResult<ColumnDescriptor> columns = DiffResult.empty();
    @Builder.Default private DiffResult<ConstraintDescriptor> constraints = DiffResult.empty();
    @Builder.Default private DiffResult<PolicyDescriptor> policies = DiffResult.empty();
    @Builder.Default private DiffResult<GrantDescriptor> grants = DiffResult.empty();
    @Builder.Default private DiffResult<ExtensionDescriptor> extensions = DiffResult.empty();
    @Builder.Default private DiffResult<ScheduledJobDescriptor> scheduledJobs = DiffResult.empty();
    @Builder.Default private DiffResult<SequenceDescriptor> sequences = DiffResult.empty();
    @Builder.Default private DiffResult<EnumTypeDescriptor> enumTypes = DiffResult.empty();
    @Builder.Default private DiffResult<FunctionDescriptor> functions = DiffResult.empty();
    @Builder.Default private DiffResult<IndexDescriptor> indexes = DiffResult.empty();
    @Builder.Default private DiffResult<TriggerDescriptor> triggers = DiffResult.empty();
    @Builder.Default private DiffResult<ViewDescriptor> views = DiffResult.empty();
    @Builder.Default private List<String> warnings = new ArrayList<>();

    private Stream<DiffResult<?>> all() {
        return Stream.of(tables, columns, constraints, policies, grants, extensions, scheduledJobs,
                sequences, enumTypes, functions, indexes, triggers, views);
    }

    public boolean isEmpty() {
        return all().allMatch(DiffResult::isEmpty);
    }

    public int getAddedCount() {
        return all().mapToInt(r -> r.getAdded().size()).sum();
    }

    public int getRemovedCount() {
        return all().mapToInt(r -> r.getRemoved().size()).sum();
    }

    public int getChangedCount() {
        return all().mapToInt(r -> r.getChanged().size()).sum();
    }
}
