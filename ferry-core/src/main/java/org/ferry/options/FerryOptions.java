package org.ferry.options;

import java.util.List;

/**
 * Defines option constants shared by the core engine and the CLI.
 */
public final class FerryOptions {

    private FerryOptions() {
    }

    /**
     * Profile-related settings.
     */
    public static final class Profile {
        private Profile() {}

        /**
         * Default profile name.
         */
        public static final String DEFAULT = "default";

        /**
         * Profile environment variable name.
         */
        public static final String ENV_VAR = "FERRY_PROFILE";

        /**
         * Configuration file name.
         */
        public static final String CONFIG_FILE = "ferry.yaml";
    }

    /**
     * Connection endpoint settings.
     */
    public static final class Connection {
        private Connection() {}

        public static final int DEFAULT_POOLER_PORT = 6543;
        public static final int DIRECT_PORT = 5432;
        public static final String DEFAULT_POOLER_REGION = "aws-1-us-east-2";
        public static final String DEFAULT_DATABASE = "postgres";
        public static final String DIRECT_USER = "postgres";

        /**
         * Seconds allowed for a single connection check.
         */
        public static final int CONNECT_TIMEOUT_DEFAULT = 10;

        /**
         * Seconds allowed for one external tool invocation (pg_dump, psql).
         */
        public static final int TOOL_TIMEOUT_DEFAULT = 1800;

        public static final String POOLER_HOST_FORMAT = "%s.pooler.supabase.com";
        public static final String DIRECT_HOST_FORMAT = "db.%s.supabase.co";
    }

    /**
     * Environment variable names used when an environment is not declared in the configuration file.
     * {@code %s} is replaced with the canonical environment key (PROD, TEST, DEV, ...).
     */
    public static final class Environment {
        private Environment() {}

        public static final String PROJECT_REF = "SUPABASE_%s_PROJECT_REF";
        public static final String DB_PASSWORD = "SUPABASE_%s_DB_PASSWORD";
        public static final String POOLER_REGION = "SUPABASE_%s_POOLER_REGION";
        public static final String POOLER_PORT = "SUPABASE_%s_POOLER_PORT";
        public static final String ACCESS_TOKEN = "SUPABASE_ACCESS_TOKEN";
    }

    /**
     * Management API settings.
     */
    public static final class ManagementApi {
        private ManagementApi() {}

        public static final String DEFAULT_URL = "https://api.supabase.com";
        public static final String POOLER_CONFIG_PATH = "/v1/projects/%s/config/database/pooler";
    }

    /**
     * Schemas and roles owned by the platform rather than the application.
     */
    public static final class Catalog {
        private Catalog() {}

        public static final List<String> DEFAULT_EXCLUDED_SCHEMAS = List.of(
                "pg_catalog", "information_schema", "pg_toast",
                "auth", "storage", "realtime", "_realtime",
                "supabase_functions", "supabase_migrations",
                "extensions", "graphql", "graphql_public",
                "pgbouncer", "pgsodium", "pgsodium_masks",
                "vault", "net", "cron", "_analytics"
        );

        public static final List<String> EXCLUDED_SCHEMA_PREFIXES = List.of("pg_temp_", "pg_toast_temp_");

        /**
         * Grantees whose privileges are managed by the platform and never reconciled.
         */
        public static final List<String> MANAGED_ROLES = List.of(
                "postgres", "supabase_admin", "supabase_auth_admin", "supabase_storage_admin"
        );

        public static final String MANAGED_ROLE_PREFIX = "pg_";

        /**
         * Schema that holds temporary copies of target rows while a risky schema change runs.
         */
        public static final String BACKUP_SCHEMA = "ferry_backup";
    }

    /**
     * Output classification settings.
     */
    public static final class Classification {
        private Classification() {}

        public static final String DEFAULT_RULES_RESOURCE = "ferry/classification-rules.yaml";
    }

    /**
     * Run output settings.
     */
    public static final class Output {
        private Output() {}

        public static final String DEFAULT_MIGRATION_DIR = "ferry-runs";
        public static final String REPORT_FILE = "report.json";
        public static final String PLAN_FILE = "plan.sql";
    }
}
