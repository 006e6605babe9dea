package org.ferry.diff;

import org.ferry.model.Snapshot;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.List;
import java.util.Objects;

/**
 * Runs every category differ over two snapshots. A differ that fails leaves its category empty
 * and adds a warning; the others still run.
 */
public class SchemaDiffer {

    private static final Logger LOGGER = LoggerFactory.getLogger(SchemaDiffer.class);

    private final List<Differ> differs;

    public SchemaDiffer() {
        this(createDefaultDiffers());
    }

    public SchemaDiffer(List<Differ> differs) {
        this.differs = List.copyOf(Objects.requireNonNull(differs, "differs must not be null"));
    }

    private static List<Differ> createDefaultDiffers() {
        return List.of(
                new ExtensionDiffer(),
                new EnumTypeDiffer(),
                new FunctionDiffer(),
                new SequenceDiffer(),
                new TableDiffer(),
                new ColumnDiffer(),
                new ConstraintDiffer(),
                new PolicyDiffer(),
                new GrantDiffer(),
                new ScheduledJobDiffer(),
                new ViewDiffer(),
                new IndexDiffer(),
                new TriggerDiffer()
        );
    }

    public SchemaDiff diff(Snapshot source, Snapshot target) {
        Objects.requireNonNull(source, "source must not be null");
        Objects.requireNonNull(target, "target must not be null");

        SchemaDiff result = SchemaDiff.builder().build();
        for (Differ differ : differs) {
            executeDifferSafely(differ, source, target, result);
        }
        LOGGER.info("Diff {} -> {}: {} added, {} removed, {} changed",
                source.getEnvironment(), target.getEnvironment(),
                result.getAddedCount(), result.getRemovedCount(), result.getChangedCount());
        return result;
    }

    private void executeDifferSafely(Differ differ, Snapshot source, Snapshot target, SchemaDiff result) {
        try {
            differ.diff(source, target, result);
        } catch (Exception e) {
            String warning = String.format("Differ failed: %s (%s: %s)",
                    differ.getClass().getSimpleName(), e.getClass().getSimpleName(), e.getMessage());
            LOGGER.warn(warning);
            result.getWarnings().add(warning);
        }
    }
}
