package org.ferry.verify;

import org.ferry.connect.ResolvedConnection;
import org.ferry.diff.Change;
import org.ferry.diff.DiffResult;
import org.ferry.diff.SchemaDiff;
import org.ferry.diff.SchemaDiffer;
import org.ferry.introspect.SchemaExclusions;
import org.ferry.introspect.SchemaIntrospector;
import org.ferry.model.Descriptor;
import org.ferry.model.Snapshot;
import org.ferry.model.SyncMode;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.List;
import java.util.Objects;

/**
 * Re-introspects both environments and names every difference that survived a run.
 */
public class Verifier {

    private static final Logger LOGGER = LoggerFactory.getLogger(Verifier.class);

    private final SchemaIntrospector introspector;
    private final SchemaDiffer differ;

    public Verifier(SchemaIntrospector introspector, SchemaDiffer differ) {
        this.introspector = Objects.requireNonNull(introspector, "introspector must not be null");
        this.differ = Objects.requireNonNull(differ, "differ must not be null");
    }

    public DriftReport verify(ResolvedConnection source, ResolvedConnection target, SchemaExclusions exclusions,
                              SyncMode mode) {
        Snapshot sourceSnapshot = introspector.capture(source, exclusions);
        Snapshot targetSnapshot = introspector.capture(target, exclusions);
        return compare(sourceSnapshot, targetSnapshot, mode);
    }

    /**
     * Target-only objects are expected under the incremental strategy, which never removes them.
     * Data-only runs leave the schema alone, so every structural difference is expected there.
     */
    public DriftReport compare(Snapshot source, Snapshot target, SyncMode mode) {
        SchemaDiff diff = differ.diff(source, target);
        boolean schemaUntouched = !mode.includesSchema();

        List<DriftItem> items = new ArrayList<>();
        collect(items, "extensions", diff.getExtensions(), mode, schemaUntouched);
        collect(items, "tables", diff.getTables(), mode, schemaUntouched);
        collect(items, "columns", diff.getColumns(), mode, schemaUntouched);
        collect(items, "constraints", diff.getConstraints(), mode, schemaUntouched);
        collect(items, "policies", diff.getPolicies(), mode, schemaUntouched);
        collect(items, "grants", diff.getGrants(), mode, schemaUntouched);
        collect(items, "scheduledJobs", diff.getScheduledJobs(), mode, schemaUntouched);
        collect(items, "sequences", diff.getSequences(), mode, schemaUntouched);
        collect(items, "enumTypes", diff.getEnumTypes(), mode, schemaUntouched);
        collect(items, "functions", diff.getFunctions(), mode, schemaUntouched);
        collect(items, "indexes", diff.getIndexes(), mode, schemaUntouched);
        collect(items, "triggers", diff.getTriggers(), mode, schemaUntouched);
        collect(items, "views", diff.getViews(), mode, schemaUntouched);

        DriftReport report = new DriftReport(source.getFingerprint(), target.getFingerprint(),
                source.getExcludedSchemas(), items, diff.getWarnings());
        if (report.isClean()) {
            LOGGER.info("No drift between {} and {} ({} expected differences)",
                    source.getEnvironment(), target.getEnvironment(), report.expectedDifferences().size());
        } else {
            LOGGER.warn("{} drifted from {}: {}", target.getEnvironment(), source.getEnvironment(), report.genuineDrift());
        }
        return report;
    }

    private static <T extends Descriptor> void collect(List<DriftItem> items, String category, DiffResult<T> result,
                                                       SyncMode mode, boolean schemaUntouched) {
        for (T added : result.getAdded()) {
            items.add(new DriftItem(category, DriftItem.Kind.ADDED, added.key(), "missing on target", schemaUntouched));
        }
        for (T removed : result.getRemoved()) {
            items.add(new DriftItem(category, DriftItem.Kind.REMOVED, removed.key(), "only on target",
                    schemaUntouched || mode.isIncremental()));
        }
        for (Change<T> change : result.getChanged()) {
            items.add(new DriftItem(category, DriftItem.Kind.CHANGED, change.getKey(),
                    String.join(", ", change.getFields()), schemaUntouched));
        }
    }
}
