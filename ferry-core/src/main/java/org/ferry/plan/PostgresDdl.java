package org.ferry.plan;

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
import org.ferry.model.Sql;
import org.ferry.model.TableRef;
import org.ferry.model.TriggerDescriptor;
import org.ferry.model.ViewDescriptor;

import java.util.List;
import java.util.regex.Pattern;
import java.util.stream.Collectors;

/**
 * Renders PostgreSQL statements. Every statement ends with a semicolon.
 */
public final class PostgresDdl {

    private static final String DOLLAR_TAG = "$ferry$";
    private static final Pattern CREATE_INDEX = Pattern.compile("^CREATE (UNIQUE )?INDEX (?!IF NOT EXISTS )");

    private PostgresDdl() {
    }

    public static String createExtension(ExtensionDescriptor ext) {
        return "CREATE EXTENSION IF NOT EXISTS " + Sql.ident(ext.getName())
                + " WITH SCHEMA " + Sql.ident(ext.getSchema()) + ";";
    }

    public static String alterExtensionSchema(ExtensionDescriptor ext) {
        return "ALTER EXTENSION " + Sql.ident(ext.getName()) + " SET SCHEMA " + Sql.ident(ext.getSchema()) + ";";
    }

    public static String dropExtension(ExtensionDescriptor ext) {
        return "DROP EXTENSION IF EXISTS " + Sql.ident(ext.getName()) + ";";
    }

    public static String createTable(TableRef table, List<ColumnDescriptor> columns) {
        String body = columns.stream()
                .map(c -> "    " + columnDefinition(c, true))
                .collect(Collectors.joining(",\n"));
        return "CREATE TABLE IF NOT EXISTS " + table.qualified() + " (\n" + body + "\n);";
    }

    public static String dropTable(TableRef table) {
        return "DROP TABLE IF EXISTS " + table.qualified() + " CASCADE;";
    }

    /**
     * {@code "name" type [DEFAULT expr | GENERATED ... AS IDENTITY] [NOT NULL]}.
     */
    public static String columnDefinition(ColumnDescriptor col, boolean withNotNull) {
        StringBuilder sb = new StringBuilder(Sql.ident(col.getName())).append(' ').append(col.getType());
        if (col.isIdentity()) {
            sb.append(" GENERATED ").append(col.getIdentity()).append(" AS IDENTITY");
        } else if (hasText(col.getDefaultExpression())) {
            sb.append(" DEFAULT ").append(col.getDefaultExpression());
        }
        if (withNotNull && !col.isNullable()) {
            sb.append(" NOT NULL");
        }
        return sb.toString();
    }

    public static String addColumn(ColumnDescriptor col, boolean withNotNull) {
        return alterTable(col.table()) + "ADD COLUMN " + columnDefinition(col, withNotNull) + ";";
    }

    public static String alterColumnType(ColumnDescriptor col) {
        String name = Sql.ident(col.getName());
        return alterTable(col.table()) + "ALTER COLUMN " + name + " TYPE " + col.getType()
                + " USING " + name + "::" + col.getType() + ";";
    }

    public static String setDefault(ColumnDescriptor col) {
        return alterTable(col.table()) + "ALTER COLUMN " + Sql.ident(col.getName())
                + " SET DEFAULT " + col.getDefaultExpression() + ";";
    }

    public static String dropDefault(ColumnDescriptor col) {
        return alterTable(col.table()) + "ALTER COLUMN " + Sql.ident(col.getName()) + " DROP DEFAULT;";
    }

    public static String addIdentity(ColumnDescriptor col) {
        return alterTable(col.table()) + "ALTER COLUMN " + Sql.ident(col.getName())
                + " ADD GENERATED " + col.getIdentity() + " AS IDENTITY;";
    }

    public static String setIdentityGeneration(ColumnDescriptor col) {
        return alterTable(col.table()) + "ALTER COLUMN " + Sql.ident(col.getName())
                + " SET GENERATED " + col.getIdentity() + ";";
    }

    public static String dropIdentity(ColumnDescriptor col) {
        return alterTable(col.table()) + "ALTER COLUMN " + Sql.ident(col.getName()) + " DROP IDENTITY IF EXISTS;";
    }

    public static String setNotNull(ColumnDescriptor col) {
        return alterTable(col.table()) + "ALTER COLUMN " + Sql.ident(col.getName()) + " SET NOT NULL;";
    }

    public static String dropNotNull(ColumnDescriptor col) {
        return alterTable(col.table()) + "ALTER COLUMN " + Sql.ident(col.getName()) + " DROP NOT NULL;";
    }

    public static String dropColumn(ColumnDescriptor col) {
        return alterTable(col.table()) + "DROP COLUMN IF EXISTS " + Sql.ident(col.getName()) + ";";
    }

    public static String addConstraint(ConstraintDescriptor con) {
        return alterTable(con.table()) + "ADD CONSTRAINT " + Sql.ident(con.getName()) + " " + con.getDefinition() + ";";
    }

    public static String dropConstraint(ConstraintDescriptor con) {
        return alterTable(con.table()) + "DROP CONSTRAINT IF EXISTS " + Sql.ident(con.getName()) + ";";
    }

    public static String enableRls(TableRef table) {
        return alterTable(table) + "ENABLE ROW LEVEL SECURITY;";
    }

    public static String disableRls(TableRef table) {
        return alterTable(table) + "DISABLE ROW LEVEL SECURITY;";
    }

    public static String forceRls(TableRef table) {
        return alterTable(table) + "FORCE ROW LEVEL SECURITY;";
    }

    public static String noForceRls(TableRef table) {
        return alterTable(table) + "NO FORCE ROW LEVEL SECURITY;";
    }

    public static String dropPolicy(PolicyDescriptor policy) {
        return "DROP POLICY IF EXISTS " + Sql.ident(policy.getName()) + " ON " + policy.table().qualified() + ";";
    }

    public static String createPolicy(PolicyDescriptor policy) {
        StringBuilder sb = new StringBuilder("CREATE POLICY ")
                .append(Sql.ident(policy.getName()))
                .append(" ON ").append(policy.table().qualified());
        if (!policy.isPermissive()) {
            sb.append(" AS RESTRICTIVE");
        }
        sb.append(" FOR ").append(policy.getCommand().name());
        if (!policy.getRoles().isEmpty()) {
            sb.append(" TO ").append(policy.getRoles().stream().map(Sql::role).collect(Collectors.joining(", ")));
        }
        if (hasText(policy.getUsingExpression())) {
            sb.append(" USING (").append(policy.getUsingExpression()).append(')');
        }
        if (hasText(policy.getCheckExpression())) {
            sb.append(" WITH CHECK (").append(policy.getCheckExpression()).append(')');
        }
        return sb.append(';').toString();
    }

    public static String grant(GrantDescriptor grant) {
        return "GRANT " + grant.getPrivilege() + " ON " + grantObject(grant) + " TO " + Sql.role(grant.getGrantee())
                + (grant.isGrantable() ? " WITH GRANT OPTION" : "") + ";";
    }

    public static String revoke(GrantDescriptor grant) {
        return "REVOKE " + grant.getPrivilege() + " ON " + grantObject(grant) + " FROM " + Sql.role(grant.getGrantee()) + ";";
    }

    static String grantObject(GrantDescriptor grant) {
        return switch (grant.getObjectType()) {
            case TABLE -> "TABLE " + Sql.ident(grant.getSchema()) + "." + Sql.ident(grant.getObjectName());
            case SEQUENCE -> "SEQUENCE " + Sql.ident(grant.getSchema()) + "." + Sql.ident(grant.getObjectName());
            case FUNCTION -> "FUNCTION " + Sql.ident(grant.getSchema()) + "." + functionSignature(grant.getObjectName());
            case SCHEMA -> "SCHEMA " + Sql.ident(grant.getSchema());
        };
    }

    private static String functionSignature(String signature) {
        int paren = signature.indexOf('(');
        if (paren < 0) {
            return Sql.ident(signature) + "()";
        }
        return Sql.ident(signature.substring(0, paren)) + signature.substring(paren);
    }

    /**
     * pg_cron replaces a job of the same name, so scheduling doubles as update.
     */
    public static String scheduleJob(ScheduledJobDescriptor job) {
        String sql = "SELECT cron.schedule(" + Sql.literal(job.getJobName()) + ", " + Sql.literal(job.getSchedule())
                + ", " + dollarQuote(job.getCommand()) + ");";
        if (!job.isActive()) {
            sql += "\nUPDATE cron.job SET active = false WHERE jobname = " + Sql.literal(job.getJobName()) + ";";
        }
        return sql;
    }

    public static String unscheduleJob(ScheduledJobDescriptor job) {
        return "SELECT cron.unschedule(" + Sql.literal(job.getJobName()) + ");";
    }

    public static String createSequence(SequenceDescriptor seq) {
        return "CREATE SEQUENCE IF NOT EXISTS " + seq.qualified() + sequenceOptions(seq) + ";";
    }

    public static String alterSequence(SequenceDescriptor seq) {
        return "ALTER SEQUENCE " + seq.qualified() + sequenceOptions(seq) + ";";
    }

    private static String sequenceOptions(SequenceDescriptor seq) {
        StringBuilder sb = new StringBuilder();
        if (hasText(seq.getDataType())) {
            sb.append(" AS ").append(seq.getDataType());
        }
        if (hasText(seq.getIncrement())) {
            sb.append(" INCREMENT BY ").append(seq.getIncrement());
        }
        if (hasText(seq.getMinValue())) {
            sb.append(" MINVALUE ").append(seq.getMinValue());
        }
        if (hasText(seq.getMaxValue())) {
            sb.append(" MAXVALUE ").append(seq.getMaxValue());
        }
        if (hasText(seq.getStartValue())) {
            sb.append(" START WITH ").append(seq.getStartValue());
        }
        if (hasText(seq.getCache())) {
            sb.append(" CACHE ").append(seq.getCache());
        }
        return sb.append(seq.isCycle() ? " CYCLE" : " NO CYCLE").toString();
    }

    /**
     * Ties the sequence to its column so it is dropped with it; {@code OWNED BY NONE} for free-standing sequences.
     */
    public static String sequenceOwnedBy(SequenceDescriptor seq) {
        String owner = seq.isOwned()
                ? seq.owner().qualified() + "." + Sql.ident(seq.getOwnedByColumn())
                : "NONE";
        return "ALTER SEQUENCE " + seq.qualified() + " OWNED BY " + owner + ";";
    }

    public static String dropSequence(SequenceDescriptor seq) {
        return "DROP SEQUENCE IF EXISTS " + seq.qualified() + ";";
    }

    public static String createEnumType(EnumTypeDescriptor type) {
        return "CREATE TYPE " + type.qualified() + " AS ENUM (" + Sql.literalList(type.getLabels()) + ");";
    }

    /**
     * Adds one label next to its source neighbour so the sort order matches; {@code anchor} may be {@code null}.
     */
    public static String addEnumValue(EnumTypeDescriptor type, String label, String anchor, boolean before) {
        String sql = "ALTER TYPE " + type.qualified() + " ADD VALUE IF NOT EXISTS " + Sql.literal(label);
        if (anchor != null) {
            sql += (before ? " BEFORE " : " AFTER ") + Sql.literal(anchor);
        }
        return sql + ";";
    }

    public static String dropType(EnumTypeDescriptor type) {
        return "DROP TYPE IF EXISTS " + type.qualified() + ";";
    }

    /**
     * Bodies are not validated at creation, so functions may be created before the tables they read.
     */
    public static String createFunction(FunctionDescriptor fn) {
        return "SET check_function_bodies = false;\n" + terminated(fn.getDefinition());
    }

    public static String dropFunction(FunctionDescriptor fn) {
        return "DROP " + (fn.isProcedure() ? "PROCEDURE" : "FUNCTION") + " IF EXISTS "
                + Sql.ident(fn.getSchema()) + "." + functionSignature(fn.signature()) + ";";
    }

    public static String createIndex(IndexDescriptor index) {
        return terminated(CREATE_INDEX.matcher(index.getDefinition().strip()).replaceFirst("CREATE $1INDEX IF NOT EXISTS "));
    }

    public static String dropIndex(IndexDescriptor index) {
        return "DROP INDEX IF EXISTS " + Sql.ident(index.getSchema()) + "." + Sql.ident(index.getName()) + ";";
    }

    public static String createTrigger(TriggerDescriptor trigger) {
        String sql = terminated(trigger.getDefinition());
        if (!trigger.isEnabled()) {
            sql += "\n" + disableTrigger(trigger);
        }
        return sql;
    }

    public static String dropTrigger(TriggerDescriptor trigger) {
        return "DROP TRIGGER IF EXISTS " + Sql.ident(trigger.getName()) + " ON " + trigger.table().qualified() + ";";
    }

    public static String enableTrigger(TriggerDescriptor trigger) {
        return alterTable(trigger.table()) + "ENABLE TRIGGER " + Sql.ident(trigger.getName()) + ";";
    }

    public static String disableTrigger(TriggerDescriptor trigger) {
        return alterTable(trigger.table()) + "DISABLE TRIGGER " + Sql.ident(trigger.getName()) + ";";
    }

    public static String createView(ViewDescriptor view) {
        return "CREATE OR REPLACE VIEW " + view.ref().qualified() + " AS\n" + view.getQuery() + ";";
    }

    public static String dropView(ViewDescriptor view) {
        return "DROP VIEW IF EXISTS " + view.ref().qualified() + ";";
    }

    public static String truncate(List<TableRef> tables) {
        return "TRUNCATE TABLE " + tables.stream().map(TableRef::qualified).collect(Collectors.joining(", "))
                + " RESTART IDENTITY CASCADE;";
    }

    public static String countRows(TableRef table) {
        return "SELECT count(*) AS row_count FROM " + table.qualified();
    }

    public static String countNulls(TableRef table, String column) {
        return "SELECT count(*) AS null_count FROM " + table.qualified() + " WHERE " + Sql.ident(column) + " IS NULL";
    }

    private static String dollarQuote(String text) {
        if (text.contains(DOLLAR_TAG)) {
            return Sql.literal(text);
        }
        return DOLLAR_TAG + text + DOLLAR_TAG;
    }

    private static String terminated(String statement) {
        String trimmed = statement.stripTrailing();
        return trimmed.endsWith(";") ? trimmed : trimmed + ";";
    }

    private static String alterTable(TableRef table) {
        return "ALTER TABLE " + table.qualified() + " ";
    }

    private static boolean hasText(String value) {
        return value != null && !value.isBlank();
    }
}
