package org.ferry.model;

import com.fasterxml.jackson.annotation.JsonIgnore;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import lombok.Builder;
import lombok.Getter;
import lombok.Singular;

import java.nio.charset.StandardCharsets;
import java.security.MessageDigest;
import java.security.NoSuchAlgorithmException;
import java.util.Comparator;
import java.util.HexFormat;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.SortedSet;
import java.util.TreeSet;
import java.util.function.Function;
import java.util.stream.Collectors;

/**
 * Complete catalog description of one environment at one moment.
 * Every list is sorted by descriptor key, so two captures of an unchanged database are equal.
 */
@Getter
public final class Snapshot {

    private static final ObjectMapper FINGERPRINT_MAPPER = new ObjectMapper()
            .configure(SerializationFeature.ORDER_MAP_ENTRIES_BY_KEYS, true);

    private final String environment;
    private final SortedSet<String> excludedSchemas;
    private final List<TableDescriptor> tables;
    private final List<ColumnDescriptor> columns;
    private final List<ConstraintDescriptor> constraints;
    private final List<PolicyDescriptor> policies;
    private final List<GrantDescriptor> grants;
    private final List<ExtensionDescriptor> extensions;
    private final List<ScheduledJobDescriptor> scheduledJobs;
    private final List<SequenceDescriptor> sequences;
    private final List<EnumTypeDescriptor> enumTypes;
    private final List<FunctionDescriptor> functions;
    private final List<IndexDescriptor> indexes;
    private final List<TriggerDescriptor> triggers;
    private final List<ViewDescriptor> views;

    @Builder
    private Snapshot(String environment,
                     @Singular("excludedSchema") java.util.Collection<String> excludedSchemas,
                     @Singular List<TableDescriptor> tables,
                     @Singular List<ColumnDescriptor> columns,
                     @Singular List<ConstraintDescriptor> constraints,
                     @Singular List<PolicyDescriptor> policies,
                     @Singular List<GrantDescriptor> grants,
                     @Singular List<ExtensionDescriptor> extensions,
                     @Singular List<ScheduledJobDescriptor> scheduledJobs,
                     @Singular List<SequenceDescriptor> sequences,
                     @Singular List<EnumTypeDescriptor> enumTypes,
                     @Singular List<FunctionDescriptor> functions,
                     @Singular("index") List<IndexDescriptor> indexes,
                     @Singular List<TriggerDescriptor> triggers,
                     @Singular List<ViewDescriptor> views) {
        this.environment = environment;
        this.excludedSchemas = new TreeSet<>(excludedSchemas);
        this.tables = sorted(tables);
        this.columns = sorted(columns);
        this.constraints = sorted(constraints);
        this.policies = sorted(policies);
        this.grants = sorted(grants);
        this.extensions = sorted(extensions);
        this.scheduledJobs = sorted(scheduledJobs);
        this.sequences = sorted(sequences);
        this.enumTypes = sorted(enumTypes);
        this.functions = sorted(functions);
        this.indexes = sorted(indexes);
        this.triggers = sorted(triggers);
        this.views = sorted(views);
    }

    private static <T extends Descriptor> List<T> sorted(List<T> descriptors) {
        return descriptors.stream()
                .sorted(Comparator.comparing(Descriptor::key))
                .toList();
    }

    public Optional<TableDescriptor> findTable(TableRef ref) {
        return tables.stream().filter(t -> ref.equals(t.table())).findFirst();
    }

    public boolean hasTable(TableRef ref) {
        return findTable(ref).isPresent();
    }

    /**
     * Columns of one table in ordinal order.
     */
    public List<ColumnDescriptor> columnsOf(TableRef ref) {
        return columns.stream()
                .filter(c -> ref.equals(c.table()))
                .sorted(Comparator.comparingInt(ColumnDescriptor::getOrdinalPosition)
                        .thenComparing(ColumnDescriptor::getName))
                .toList();
    }

    public List<PolicyDescriptor> policiesOf(TableRef ref) {
        return policies.stream().filter(p -> ref.equals(p.table())).toList();
    }

    public List<ConstraintDescriptor> constraintsOf(TableRef ref) {
        return constraints.stream().filter(c -> ref.equals(c.table())).toList();
    }

    public Map<String, ColumnDescriptor> columnIndex() {
        return columns.stream().collect(Collectors.toMap(Descriptor::key, Function.identity()));
    }

    @JsonIgnore
    public List<TableRef> getTableRefs() {
        return tables.stream().map(TableDescriptor::table).toList();
    }

    /**
     * SHA-256 over the canonical JSON form of this snapshot, excluding the environment name.
     */
    @JsonIgnore
    public String getFingerprint() {
        try {
            String json = FINGERPRINT_MAPPER.writeValueAsString(Map.ofEntries(
                    Map.entry("excludedSchemas", excludedSchemas),
                    Map.entry("tables", tables),
                    Map.entry("columns", columns),
                    Map.entry("constraints", constraints),
                    Map.entry("policies", policies),
                    Map.entry("grants", grants),
                    Map.entry("extensions", extensions),
                    Map.entry("scheduledJobs", scheduledJobs),
                    Map.entry("sequences", sequences),
                    Map.entry("enumTypes", enumTypes),
                    Map.entry("functions", functions),
                    Map.entry("indexes", indexes),
                    Map.entry("triggers", triggers),
                    Map.entry("views", views)
            ));
            MessageDigest digest = MessageDigest.getInstance("SHA-256");
            byte[] hash = digest.digest(json.getBytes(StandardCharsets.UTF_8));
            return HexFormat.of().formatHex(hash);
        } catch (JsonProcessingException | NoSuchAlgorithmException e) {
            throw new IllegalStateException("Failed to fingerprint snapshot of " + environment, e);
        }
    }

    public int objectCount() {
        return tables.size() + columns.size() + constraints.size() + policies.size()
                + grants.size() + extensions.size() + scheduledJobs.size() + sequences.size() + enumTypes.size()
                + functions.size() + indexes.size() + triggers.size() + views.size();
    }
}
