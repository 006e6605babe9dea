package org.ferry.introspect;

import org.ferry.model.Sql;
import org.ferry.options.FerryOptions;

/**
 * Catalog queries used to build a snapshot. {@code {schemas}} is replaced with the exclusion predicate.
 */
final class CatalogQueries {

    private CatalogQueries() {
    }

    static final String TABLES = """
            SELECT n.nspname AS schema_name,
                   c.relname AS table_name,
                   c.relrowsecurity AS rls_enabled,
                   c.relforcerowsecurity AS rls_forced
            FROM pg_catalog.pg_class c
            JOIN pg_catalog.pg_namespace n ON n.oid = c.relnamespace
            WHERE c.relkind IN ('r', 'p')
              AND {schemas}
            ORDER BY 1, 2
            """;

    static final String COLUMNS = """
            SELECT n.nspname AS schema_name,
                   c.relname AS table_name,
                   a.attname AS column_name,
                   pg_catalog.format_type(a.atttypid, a.atttypmod) AS formatted_type,
                   NOT a.attnotnull AS is_nullable,
                   pg_catalog.pg_get_expr(d.adbin, d.adrelid) AS column_default,
                   CASE a.attidentity WHEN 'a' THEN 'ALWAYS' WHEN 'd' THEN 'BY DEFAULT' END AS identity,
                   a.attnum AS ordinal_position
            FROM pg_catalog.pg_attribute a
            JOIN pg_catalog.pg_class c ON c.oid = a.attrelid
            JOIN pg_catalog.pg_namespace n ON n.oid = c.relnamespace
            LEFT JOIN pg_catalog.pg_attrdef d ON d.adrelid = a.attrelid AND d.adnum = a.attnum
            WHERE c.relkind IN ('r', 'p')
              AND a.attnum > 0
              AND NOT a.attisdropped
              AND {schemas}
            ORDER BY 1, 2, 8
            """;

    static final String CONSTRAINTS = """
            SELECT n.nspname AS schema_name,
                   c.relname AS table_name,
                   con.conname AS constraint_name,
                   con.contype AS constraint_type,
                   pg_catalog.pg_get_constraintdef(con.oid, true) AS definition
            FROM pg_catalog.pg_constraint con
            JOIN pg_catalog.pg_class c ON c.oid = con.conrelid
            JOIN pg_catalog.pg_namespace n ON n.oid = c.relnamespace
            WHERE con.contype IN ('p', 'u', 'f', 'c', 'x')
              AND {schemas}
            ORDER BY 1, 2, 3
            """;

    static final String POLICIES = """
            SELECT n.nspname AS schema_name,
                   c.relname AS table_name,
                   pol.polname AS policy_name,
                   pol.polcmd AS command,
                   pol.polpermissive AS permissive,
                   array_to_json(ARRAY(
                       SELECT CASE WHEN role_oid = 0 THEN 'public' ELSE pg_catalog.pg_get_userbyid(role_oid) END
                       FROM unnest(pol.polroles) AS role_oid
                       ORDER BY 1))::text AS roles,
                   pg_catalog.pg_get_expr(pol.polqual, pol.polrelid) AS using_expression,
                   pg_catalog.pg_get_expr(pol.polwithcheck, pol.polrelid) AS check_expression
            FROM pg_catalog.pg_policy pol
            JOIN pg_catalog.pg_class c ON c.oid = pol.polrelid
            JOIN pg_catalog.pg_namespace n ON n.oid = c.relnamespace
            WHERE {schemas}
            ORDER BY 1, 2, 3
            """;

    static final String TABLE_GRANTS = """
            SELECT 'TABLE' AS object_type,
                   g.table_schema AS schema_name,
                   g.table_name AS object_name,
                   g.grantee AS grantee,
                   g.privilege_type AS privilege,
                   g.is_grantable AS grantable
            FROM information_schema.role_table_grants g
            JOIN pg_catalog.pg_namespace n ON n.nspname = g.table_schema
            JOIN pg_catalog.pg_class c ON c.relnamespace = n.oid AND c.relname = g.table_name
            WHERE c.relkind IN ('r', 'p', 'v')
              AND {schemas}
            """;

    static final String SEQUENCE_GRANTS = """
            SELECT 'SEQUENCE' AS object_type,
                   n.nspname AS schema_name,
                   c.relname AS object_name,
                   CASE WHEN acl.grantee = 0 THEN 'PUBLIC' ELSE pg_catalog.pg_get_userbyid(acl.grantee) END AS grantee,
                   acl.privilege_type AS privilege,
                   acl.is_grantable AS grantable
            FROM pg_catalog.pg_class c
            JOIN pg_catalog.pg_namespace n ON n.oid = c.relnamespace
            CROSS JOIN LATERAL aclexplode(c.relacl) acl
            WHERE c.relkind = 'S'
              AND {schemas}
            """;

    static final String FUNCTION_GRANTS = """
            SELECT 'FUNCTION' AS object_type,
                   n.nspname AS schema_name,
                   p.proname || '(' || pg_catalog.pg_get_function_identity_arguments(p.oid) || ')' AS object_name,
                   CASE WHEN acl.grantee = 0 THEN 'PUBLIC' ELSE pg_catalog.pg_get_userbyid(acl.grantee) END AS grantee,
                   acl.privilege_type AS privilege,
                   acl.is_grantable AS grantable
            FROM pg_catalog.pg_proc p
            JOIN pg_catalog.pg_namespace n ON n.oid = p.pronamespace
            CROSS JOIN LATERAL aclexplode(p.proacl) acl
            WHERE p.prokind IN ('f', 'p')
              AND {schemas}
            """;

    static final String SCHEMA_GRANTS = """
            SELECT 'SCHEMA' AS object_type,
                   n.nspname AS schema_name,
                   n.nspname AS object_name,
                   CASE WHEN acl.grantee = 0 THEN 'PUBLIC' ELSE pg_catalog.pg_get_userbyid(acl.grantee) END AS grantee,
                   acl.privilege_type AS privilege,
                   acl.is_grantable AS grantable
            FROM pg_catalog.pg_namespace n
            CROSS JOIN LATERAL aclexplode(n.nspacl) acl
            WHERE {schemas}
            """;

    static final String EXTENSIONS = """
            SELECT e.extname AS extension_name,
                   n.nspname AS schema_name,
                   e.extversion AS version
            FROM pg_catalog.pg_extension e
            JOIN pg_catalog.pg_namespace n ON n.oid = e.extnamespace
            WHERE e.extname <> 'plpgsql'
            ORDER BY 1
            """;

    static final String SEQUENCES = """
            SELECT n.nspname AS schema_name,
                   c.relname AS sequence_name,
                   pg_catalog.format_type(s.seqtypid, NULL) AS data_type,
                   s.seqstart AS start_value,
                   s.seqincrement AS increment,
                   s.seqmin AS min_value,
                   s.seqmax AS max_value,
                   s.seqcache AS cache_size,
                   s.seqcycle AS cycle,
                   owner.relname AS owned_by_table,
                   a.attname AS owned_by_column
            FROM pg_catalog.pg_sequence s
            JOIN pg_catalog.pg_class c ON c.oid = s.seqrelid
            JOIN pg_catalog.pg_namespace n ON n.oid = c.relnamespace
            LEFT JOIN pg_catalog.pg_depend d ON d.classid = 'pg_catalog.pg_class'::regclass
                                            AND d.objid = c.oid
                                            AND d.refclassid = 'pg_catalog.pg_class'::regclass
                                            AND d.deptype = 'a'
            LEFT JOIN pg_catalog.pg_class owner ON owner.oid = d.refobjid
            LEFT JOIN pg_catalog.pg_attribute a ON a.attrelid = d.refobjid AND a.attnum = d.refobjsubid
            WHERE NOT EXISTS (SELECT 1 FROM pg_catalog.pg_depend x
                              WHERE x.classid = 'pg_catalog.pg_class'::regclass
                                AND x.objid = c.oid
                                AND x.deptype IN ('i', 'e'))
              AND {schemas}
            ORDER BY 1, 2
            """;

    static final String ENUM_TYPES = """
            SELECT n.nspname AS schema_name,
                   t.typname AS type_name,
                   array_to_json(ARRAY(
                       SELECT e.enumlabel FROM pg_catalog.pg_enum e
                       WHERE e.enumtypid = t.oid
                       ORDER BY e.enumsortorder))::text AS labels
            FROM pg_catalog.pg_type t
            JOIN pg_catalog.pg_namespace n ON n.oid = t.typnamespace
            WHERE t.typtype = 'e'
              AND NOT EXISTS (SELECT 1 FROM pg_catalog.pg_depend x
                              WHERE x.classid = 'pg_catalog.pg_type'::regclass AND x.objid = t.oid AND x.deptype = 'e')
              AND {schemas}
            ORDER BY 1, 2
            """;

    static final String FUNCTIONS = """
            SELECT n.nspname AS schema_name,
                   p.proname AS function_name,
                   pg_catalog.pg_get_function_identity_arguments(p.oid) AS identity_arguments,
                   pg_catalog.pg_get_functiondef(p.oid) AS definition,
                   p.prokind = 'p' AS is_procedure
            FROM pg_catalog.pg_proc p
            JOIN pg_catalog.pg_namespace n ON n.oid = p.pronamespace
            WHERE p.prokind IN ('f', 'p')
              AND NOT EXISTS (SELECT 1 FROM pg_catalog.pg_depend x
                              WHERE x.classid = 'pg_catalog.pg_proc'::regclass AND x.objid = p.oid AND x.deptype = 'e')
              AND {schemas}
            ORDER BY 1, 2, 3
            """;

    static final String INDEXES = """
            SELECT n.nspname AS schema_name,
                   t.relname AS table_name,
                   ic.relname AS index_name,
                   pg_catalog.pg_get_indexdef(i.indexrelid) AS definition
            FROM pg_catalog.pg_index i
            JOIN pg_catalog.pg_class ic ON ic.oid = i.indexrelid
            JOIN pg_catalog.pg_class t ON t.oid = i.indrelid
            JOIN pg_catalog.pg_namespace n ON n.oid = t.relnamespace
            WHERE t.relkind IN ('r', 'p')
              AND NOT EXISTS (SELECT 1 FROM pg_catalog.pg_constraint con
                              WHERE con.conindid = i.indexrelid AND con.contype IN ('p', 'u', 'x'))
              AND {schemas}
            ORDER BY 1, 3
            """;

    static final String TRIGGERS = """
            SELECT n.nspname AS schema_name,
                   c.relname AS table_name,
                   tg.tgname AS trigger_name,
                   pg_catalog.pg_get_triggerdef(tg.oid) AS definition,
                   tg.tgenabled <> 'D' AS enabled
            FROM pg_catalog.pg_trigger tg
            JOIN pg_catalog.pg_class c ON c.oid = tg.tgrelid
            JOIN pg_catalog.pg_namespace n ON n.oid = c.relnamespace
            WHERE NOT tg.tgisinternal
              AND c.relkind IN ('r', 'p')
              AND {schemas}
            ORDER BY 1, 2, 3
            """;

    static final String VIEWS = """
            SELECT n.nspname AS schema_name,
                   c.relname AS view_name,
                   pg_catalog.pg_get_viewdef(c.oid, true) AS query
            FROM pg_catalog.pg_class c
            JOIN pg_catalog.pg_namespace n ON n.oid = c.relnamespace
            WHERE c.relkind = 'v'
              AND NOT EXISTS (SELECT 1 FROM pg_catalog.pg_depend x
                              WHERE x.classid = 'pg_catalog.pg_class'::regclass AND x.objid = c.oid AND x.deptype = 'e')
              AND {schemas}
            ORDER BY 1, 2
            """;

    static final String SCHEDULED_JOBS = """
            SELECT COALESCE(jobname, 'job_' || jobid) AS job_name,
                   schedule,
                   command,
                   active
            FROM cron.job
            ORDER BY 1
            """;

    static String withSchemas(String query, SchemaExclusions exclusions, String column) {
        return query.replace("{schemas}", exclusions.predicate(column));
    }

    /**
     * Wraps a grant query so managed grantees are filtered the same way for every object type.
     */
    static String grants(String query, SchemaExclusions exclusions) {
        String inner = withSchemas(query, exclusions, "n.nspname");
        return "SELECT * FROM (" + inner + ") grants WHERE " + granteePredicate("grants.grantee")
                + " ORDER BY object_type, schema_name, object_name, grantee, privilege";
    }

    static String granteePredicate(String column) {
        return column + " NOT IN (" + Sql.literalList(FerryOptions.Catalog.MANAGED_ROLES) + ")"
                + " AND " + column + " NOT LIKE " + Sql.literal(FerryOptions.Catalog.MANAGED_ROLE_PREFIX.replace("_", "\\_") + "%");
    }
}
