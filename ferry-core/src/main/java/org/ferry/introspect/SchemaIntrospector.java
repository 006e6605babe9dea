package org.ferry.introspect;

import org.ferry.connect.DatabaseClient;
import org.ferry.connect.QueryResult;
import org.ferry.connect.ResolvedConnection;
import org.ferry.model.ColumnDescriptor;
import org.ferry.model.ConstraintDescriptor;
import org.ferry.model.ConstraintType;
import org.ferry.model.EnumTypeDescriptor;
import org.ferry.model.ExtensionDescriptor;
import org.ferry.model.FunctionDescriptor;
import org.ferry.model.GrantDescriptor;
import org.ferry.model.GrantObjectType;
import org.ferry.model.IndexDescriptor;
import org.ferry.model.PolicyCommand;
import org.ferry.model.PolicyDescriptor;
import org.ferry.model.ScheduledJobDescriptor;
import org.ferry.model.SequenceDescriptor;
import org.ferry.model.Snapshot;
import org.ferry.model.TableDescriptor;
import org.ferry.model.TriggerDescriptor;
import org.ferry.model.ViewDescriptor;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.List;
import java.util.function.Function;

/**
 * Reads the catalog of one environment into a {@link Snapshot}. Read-only.
 */
public class SchemaIntrospector {

    private static final Logger LOGGER = LoggerFactory.getLogger(SchemaIntrospector.class);

    static final String PG_CRON = "pg_cron";

    private final DatabaseClient client;

    public SchemaIntrospector(DatabaseClient client) {
        this.client = client;
    }

    /**
     * @throws IntrospectionFailure naming the catalog area whose query failed
     */
    public Snapshot capture(ResolvedConnection connection, SchemaExclusions exclusions) {
        LOGGER.info("Introspecting {}", connection);
        Snapshot.SnapshotBuilder builder = Snapshot.builder()
                .environment(connection.environment())
                .excludedSchemas(exclusions.getSchemas());

        builder.tables(read(connection, "tables",
                CatalogQueries.withSchemas(CatalogQueries.TABLES, exclusions, "n.nspname"), this::toTable));
        builder.columns(read(connection, "columns",
                CatalogQueries.withSchemas(CatalogQueries.COLUMNS, exclusions, "n.nspname"), this::toColumn));
        builder.constraints(read(connection, "constraints",
                CatalogQueries.withSchemas(CatalogQueries.CONSTRAINTS, exclusions, "n.nspname"), this::toConstraint));
        builder.policies(read(connection, "policies",
                CatalogQueries.withSchemas(CatalogQueries.POLICIES, exclusions, "n.nspname"), this::toPolicy));
        builder.sequences(read(connection, "sequences",
                CatalogQueries.withSchemas(CatalogQueries.SEQUENCES, exclusions, "n.nspname"), this::toSequence));
        builder.enumTypes(read(connection, "enum types",
                CatalogQueries.withSchemas(CatalogQueries.ENUM_TYPES, exclusions, "n.nspname"), this::toEnumType));
        builder.functions(read(connection, "functions",
                CatalogQueries.withSchemas(CatalogQueries.FUNCTIONS, exclusions, "n.nspname"), this::toFunction));
        builder.indexes(read(connection, "indexes",
                CatalogQueries.withSchemas(CatalogQueries.INDEXES, exclusions, "n.nspname"), this::toIndex));
        builder.triggers(read(connection, "triggers",
                CatalogQueries.withSchemas(CatalogQueries.TRIGGERS, exclusions, "n.nspname"), this::toTrigger));
        builder.views(read(connection, "views",
                CatalogQueries.withSchemas(CatalogQueries.VIEWS, exclusions, "n.nspname"), this::toView));
        for (String grantQuery : List.of(CatalogQueries.TABLE_GRANTS, CatalogQueries.SEQUENCE_GRANTS,
                CatalogQueries.FUNCTION_GRANTS, CatalogQueries.SCHEMA_GRANTS)) {
            builder.grants(read(connection, "grants", CatalogQueries.grants(grantQuery, exclusions), this::toGrant));
        }

        List<ExtensionDescriptor> extensions = read(connection, "extensions", CatalogQueries.EXTENSIONS, this::toExtension);
        builder.extensions(extensions);
        if (extensions.stream().anyMatch(e -> PG_CRON.equals(e.getName()))) {
            builder.scheduledJobs(read(connection, "scheduled jobs", CatalogQueries.SCHEDULED_JOBS, this::toJob));
        }

        Snapshot snapshot = builder.build();
        LOGGER.info("Captured {} objects from {} ({} tables, {} functions, {} policies, {} grants)",
                snapshot.objectCount(), connection.environment(), snapshot.getTables().size(),
                snapshot.getFunctions().size(), snapshot.getPolicies().size(), snapshot.getGrants().size());
        return snapshot;
    }

    private <T> List<T> read(ResolvedConnection connection, String area, String sql, Function<QueryResult.Row, T> mapper) {
        try {
            QueryResult result = client.query(connection.target(), sql);
            return result.rows().stream().map(mapper).toList();
        } catch (RuntimeException e) {
            throw new IntrospectionFailure(connection.environment(), area, e);
        }
    }

    private TableDescriptor toTable(QueryResult.Row row) {
        return TableDescriptor.builder()
                .schema(row.require("schema_name"))
                .name(row.require("table_name"))
                .rlsEnabled(row.bool("rls_enabled"))
                .rlsForced(row.bool("rls_forced"))
                .build();
    }

    private ColumnDescriptor toColumn(QueryResult.Row row) {
        return ColumnDescriptor.builder()
                .schema(row.require("schema_name"))
                .tableName(row.require("table_name"))
                .name(row.require("column_name"))
                .type(row.get("formatted_type"))
                .nullable(row.bool("is_nullable"))
                .defaultExpression(row.get("column_default"))
                .identity(row.get("identity"))
                .ordinalPosition(row.integer("ordinal_position"))
                .build();
    }

    private ConstraintDescriptor toConstraint(QueryResult.Row row) {
        return ConstraintDescriptor.builder()
                .schema(row.require("schema_name"))
                .tableName(row.require("table_name"))
                .name(row.require("constraint_name"))
                .type(ConstraintType.fromCatalogCode(row.require("constraint_type")))
                .definition(row.get("definition"))
                .build();
    }

    private PolicyDescriptor toPolicy(QueryResult.Row row) {
        return PolicyDescriptor.builder()
                .schema(row.require("schema_name"))
                .tableName(row.require("table_name"))
                .name(row.require("policy_name"))
                .command(PolicyCommand.fromCatalogCode(row.require("command")))
                .permissive(row.bool("permissive"))
                .roles(row.list("roles"))
                .usingExpression(row.get("using_expression"))
                .checkExpression(row.get("check_expression"))
                .build();
    }

    private GrantDescriptor toGrant(QueryResult.Row row) {
        return GrantDescriptor.builder()
                .objectType(GrantObjectType.valueOf(row.require("object_type")))
                .schema(row.require("schema_name"))
                .objectName(row.require("object_name"))
                .grantee(row.require("grantee"))
                .privilege(row.require("privilege"))
                .grantable(row.bool("grantable"))
                .build();
    }

    private ExtensionDescriptor toExtension(QueryResult.Row row) {
        return ExtensionDescriptor.builder()
                .name(row.require("extension_name"))
                .schema(row.require("schema_name"))
                .version(row.get("version"))
                .build();
    }

    private SequenceDescriptor toSequence(QueryResult.Row row) {
        return SequenceDescriptor.builder()
                .schema(row.require("schema_name"))
                .name(row.require("sequence_name"))
                .dataType(row.require("data_type"))
                .startValue(row.get("start_value"))
                .increment(row.get("increment"))
                .minValue(row.get("min_value"))
                .maxValue(row.get("max_value"))
                .cache(row.get("cache_size"))
                .cycle(row.bool("cycle"))
                .ownedByTable(row.get("owned_by_table"))
                .ownedByColumn(row.get("owned_by_column"))
                .build();
    }

    private EnumTypeDescriptor toEnumType(QueryResult.Row row) {
        return EnumTypeDescriptor.builder()
                .schema(row.require("schema_name"))
                .name(row.require("type_name"))
                .labels(row.list("labels"))
                .build();
    }

    private FunctionDescriptor toFunction(QueryResult.Row row) {
        return FunctionDescriptor.builder()
                .schema(row.require("schema_name"))
                .name(row.require("function_name"))
                .identityArguments(row.get("identity_arguments"))
                .definition(row.require("definition"))
                .procedure(row.bool("is_procedure"))
                .build();
    }

    private IndexDescriptor toIndex(QueryResult.Row row) {
        return IndexDescriptor.builder()
                .schema(row.require("schema_name"))
                .tableName(row.require("table_name"))
                .name(row.require("index_name"))
                .definition(row.require("definition"))
                .build();
    }

    private TriggerDescriptor toTrigger(QueryResult.Row row) {
        return TriggerDescriptor.builder()
                .schema(row.require("schema_name"))
                .tableName(row.require("table_name"))
                .name(row.require("trigger_name"))
                .definition(row.require("definition"))
                .enabled(row.bool("enabled"))
                .build();
    }

    private ViewDescriptor toView(QueryResult.Row row) {
        String query = row.require("query").strip();
        if (query.endsWith(";")) {
            query = query.substring(0, query.length() - 1).stripTrailing();
        }
        return ViewDescriptor.builder()
                .schema(row.require("schema_name"))
                .name(row.require("view_name"))
                .query(query)
                .build();
    }

    private ScheduledJobDescriptor toJob(QueryResult.Row row) {
        return ScheduledJobDescriptor.builder()
                .jobName(row.require("job_name"))
                .schedule(row.require("schedule"))
                .command(row.require("command"))
                .active(row.bool("active"))
                .build();
    }
}
