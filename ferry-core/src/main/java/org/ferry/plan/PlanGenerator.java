package org.ferry.plan;

import org.ferry.diff.SchemaDiff;
import org.ferry.diff.SchemaDiffer;
import org.ferry.model.Snapshot;
import org.ferry.model.SyncMode;
import org.ferry.plan.contributor.ColumnPlanContributor;
import org.ferry.plan.contributor.ConstraintPlanContributor;
import org.ferry.plan.contributor.DataPlanContributor;
import org.ferry.plan.contributor.EnumTypePlanContributor;
import org.ferry.plan.contributor.ExtensionPlanContributor;
import org.ferry.plan.contributor.FunctionPlanContributor;
import org.ferry.plan.contributor.GrantPlanContributor;
import org.ferry.plan.contributor.IndexPlanContributor;
import org.ferry.plan.contributor.PolicyPlanContributor;
import org.ferry.plan.contributor.ScheduledJobPlanContributor;
import org.ferry.plan.contributor.SequencePlanContributor;
import org.ferry.plan.contributor.TablePlanContributor;
import org.ferry.plan.contributor.TriggerPlanContributor;
import org.ferry.plan.contributor.ViewPlanContributor;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.Objects;

/**
 * Turns a diff into an ordered {@link MigrationPlan}. Pure: the same snapshots and mode always yield the same plan.
 */
public class PlanGenerator {

    private static final Logger LOGGER = LoggerFactory.getLogger(PlanGenerator.class);

    private final List<PlanContributor> contributors;

    public PlanGenerator() {
        this(createDefaultContributors());
    }

    public PlanGenerator(List<PlanContributor> contributors) {
        this.contributors = Objects.requireNonNull(contributors, "contributors must not be null").stream()
                .sorted(Comparator.comparingInt(PlanContributor::priority))
                .toList();
    }

    private static List<PlanContributor> createDefaultContributors() {
        return List.of(
                new ExtensionPlanContributor(),
                new TriggerPlanContributor(),
                new EnumTypePlanContributor(),
                new FunctionPlanContributor(),
                new SequencePlanContributor(),
                new ViewPlanContributor(),
                new TablePlanContributor(),
                new ColumnPlanContributor(),
                new ConstraintPlanContributor(),
                new PolicyPlanContributor(),
                new GrantPlanContributor(),
                new IndexPlanContributor(),
                new ScheduledJobPlanContributor(),
                new DataPlanContributor()
        );
    }

    public MigrationPlan generate(Snapshot source, Snapshot target, SyncMode mode) {
        return generate(new SchemaDiffer().diff(source, target), source, target, mode);
    }

    /**
     * @throws PlanGenerationFailure if an object to create lacks the metadata needed to render it
     */
    public MigrationPlan generate(SchemaDiff diff, Snapshot source, Snapshot target, SyncMode mode) {
        PlanContext context = new PlanContext(diff, source, target, mode);

        List<PlanOutput> outputs = new ArrayList<>();
        for (PlanContributor contributor : contributors) {
            if (contributor.structural() && !mode.includesSchema()) {
                continue;
            }
            PlanOutput output = new PlanOutput();
            contributor.contribute(context, output);
            outputs.add(output);
        }

        List<Operation> ordered = new ArrayList<>();
        for (Phase phase : Phase.values()) {
            for (PlanOutput output : outputs) {
                output.getOperations().stream().filter(op -> op.getPhase() == phase).forEach(ordered::add);
            }
        }
        List<SuppressedOperation> suppressed = outputs.stream().flatMap(o -> o.getSuppressed().stream()).toList();

        PlanSummary summary = new PlanSummary(diff.getAddedCount(), diff.getRemovedCount(), diff.getChangedCount());
        MigrationPlan plan = new MigrationPlan(mode, ordered, suppressed, summary, diff.getWarnings());
        LOGGER.info("Generated plan ({}): {} operations, {} withheld, destructive={}",
                mode, ordered.size(), suppressed.size(), plan.isDestructive());
        return plan;
    }
}
