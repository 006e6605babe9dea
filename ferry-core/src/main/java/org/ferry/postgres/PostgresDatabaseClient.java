package org.ferry.postgres;

import org.ferry.connect.CopyLoad;
import org.ferry.connect.DatabaseAccessException;
import org.ferry.connect.DatabaseClient;
import org.ferry.connect.DumpRequest;
import org.ferry.connect.QueryResult;
import org.ferry.connect.ToolResult;
import org.ferry.model.ConnectionTarget;
import org.postgresql.PGConnection;
import org.postgresql.copy.CopyManager;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.io.StringReader;
import java.io.StringWriter;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.sql.Connection;
import java.sql.DriverManager;
import java.sql.ResultSet;
import java.sql.ResultSetMetaData;
import java.sql.SQLException;
import java.sql.SQLWarning;
import java.sql.Statement;
import java.time.Duration;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Properties;

/**
 * {@link DatabaseClient} for PostgreSQL.
 * Queries and COPY use the JDBC driver; scripts run through psql and dumps through pg_dump.
 * When psql is not installed, scripts fall back to a JDBC session and errors are rendered the way psql prints them.
 */
public class PostgresDatabaseClient implements DatabaseClient {

    private static final Logger LOGGER = LoggerFactory.getLogger(PostgresDatabaseClient.class);

    private final Duration connectTimeout;
    private final ProcessRunner processRunner;

    public PostgresDatabaseClient(Duration connectTimeout, Duration toolTimeout) {
        this(connectTimeout, new ProcessRunner(toolTimeout));
    }

    PostgresDatabaseClient(Duration connectTimeout, ProcessRunner processRunner) {
        this.connectTimeout = connectTimeout;
        this.processRunner = processRunner;
        try {
            Class.forName("org.postgresql.Driver");
        } catch (ClassNotFoundException e) {
            throw new IllegalStateException("PostgreSQL JDBC driver not found on the classpath", e);
        }
    }

    @Override
    public QueryResult query(ConnectionTarget target, String sql) {
        try (Connection conn = open(target);
             Statement stmt = conn.createStatement();
             ResultSet rs = stmt.executeQuery(sql)) {
            ResultSetMetaData meta = rs.getMetaData();
            List<QueryResult.Row> rows = new ArrayList<>();
            while (rs.next()) {
                Map<String, String> row = new LinkedHashMap<>();
                for (int i = 1; i <= meta.getColumnCount(); i++) {
                    row.put(meta.getColumnLabel(i), rs.getString(i));
                }
                rows.add(new QueryResult.Row(row));
            }
            return new QueryResult(rows);
        } catch (SQLException e) {
            throw new DatabaseAccessException(describe(e), e);
        }
    }

    @Override
    public ToolResult execute(ConnectionTarget target, String script) {
        Path file = null;
        try {
            file = Files.createTempFile("ferry-", ".sql");
            Files.writeString(file, script, StandardCharsets.UTF_8);
            List<String> command = List.of("psql",
                    "-h", target.endpoint().host(),
                    "-p", String.valueOf(target.endpoint().port()),
                    "-U", target.endpoint().user(),
                    "-d", target.database(),
                    "-X", "-q",
                    "-v", "ON_ERROR_STOP=0",
                    "-f", file.toString());
            ToolResult result = processRunner.run(command, toolEnvironment(target));
            if (!result.toolUnavailable()) {
                return result;
            }
            LOGGER.debug("psql unavailable, running script over JDBC");
            return executeOverJdbc(target, script);
        } catch (IOException e) {
            return ToolResult.failure("ERROR:  could not stage script: " + e.getMessage());
        } finally {
            deleteQuietly(file);
        }
    }

    private ToolResult executeOverJdbc(ConnectionTarget target, String script) {
        try (Connection conn = open(target); Statement stmt = conn.createStatement()) {
            return runStatements(SqlScriptSplitter.split(script), sql -> {
                stmt.clearWarnings();
                stmt.execute(sql);
                return stmt.getWarnings();
            });
        } catch (SQLException e) {
            return ToolResult.failure(describe(e));
        }
    }

    /**
     * Runs statements one at a time and keeps going after a failed one, printing errors the way psql does
     * with {@code ON_ERROR_STOP=0}. A COMMIT closing a transaction in which a statement failed prints ROLLBACK.
     */
    static ToolResult runStatements(List<String> statements, StatementAction action) {
        StringBuilder output = new StringBuilder();
        boolean failed = false;
        boolean inTransaction = false;
        boolean aborted = false;
        for (String sql : statements) {
            try {
                appendWarnings(action.execute(sql), output);
            } catch (SQLException e) {
                output.append(errorLine(e)).append('\n');
                failed = true;
                aborted = inTransaction;
            }
            switch (firstKeyword(sql)) {
                case "BEGIN", "START" -> {
                    inTransaction = true;
                    aborted = false;
                }
                case "COMMIT", "END" -> {
                    if (aborted) {
                        output.append("ROLLBACK\n");
                    }
                    inTransaction = false;
                    aborted = false;
                }
                case "ROLLBACK", "ABORT" -> {
                    inTransaction = false;
                    aborted = false;
                }
                default -> {
                }
            }
        }
        return failed ? ToolResult.failure(output.toString()) : ToolResult.success(output.toString());
    }

    private static String firstKeyword(String sql) {
        String[] words = sql.stripLeading().split("[\\s;]+", 2);
        return words.length == 0 ? "" : words[0].toUpperCase(Locale.ROOT);
    }

    private static String errorLine(SQLException e) {
        String text = e.getMessage() == null ? e.getClass().getSimpleName() : e.getMessage();
        return text.startsWith("ERROR:") ? text : "ERROR:  " + text;
    }

    /**
     * One statement of a script; returns the notices it raised.
     */
    @FunctionalInterface
    interface StatementAction {
        SQLWarning execute(String sql) throws SQLException;
    }

    @Override
    public ToolResult dump(ConnectionTarget target, DumpRequest request) {
        List<String> command = new ArrayList<>(List.of("pg_dump",
                "-h", target.endpoint().host(),
                "-p", String.valueOf(target.endpoint().port()),
                "-U", target.endpoint().user(),
                "-d", target.database(),
                "--no-owner", "--no-privileges",
                "-f", request.getOutputFile().toString()));
        if (request.isDataOnly()) {
            command.add("--data-only");
        }
        if (request.isSchemaOnly()) {
            command.add("--schema-only");
        }
        if (request.isColumnInserts()) {
            command.add("--column-inserts");
        }
        if (request.getSchema() != null) {
            command.add("--schema=" + request.getSchema());
        }
        if (request.getTable() != null) {
            command.add("--table=" + quoteForTool(request.getSchema()) + "." + quoteForTool(request.getTable()));
        }
        return processRunner.run(command, toolEnvironment(target));
    }

    @Override
    public String copyOut(ConnectionTarget target, String copySql) {
        try (Connection conn = open(target)) {
            CopyManager copyManager = conn.unwrap(PGConnection.class).getCopyAPI();
            StringWriter writer = new StringWriter();
            copyManager.copyOut(copySql, writer);
            return writer.toString();
        } catch (SQLException e) {
            throw new DatabaseAccessException(describe(e), e);
        } catch (IOException e) {
            throw new DatabaseAccessException("COPY out failed: " + e.getMessage(), e);
        }
    }

    @Override
    public ToolResult copyIn(ConnectionTarget target, CopyLoad load) {
        StringBuilder output = new StringBuilder();
        try (Connection conn = open(target); Statement stmt = conn.createStatement()) {
            for (String sql : load.bestEffortStatements()) {
                try {
                    stmt.execute(sql);
                } catch (SQLException e) {
                    output.append("WARNING:  ").append(e.getMessage()).append('\n');
                }
            }
            try {
                for (String sql : load.setupStatements()) {
                    stmt.execute(sql);
                }
                CopyManager copyManager = conn.unwrap(PGConnection.class).getCopyAPI();
                long rows = copyManager.copyIn(load.copySql(), new StringReader(load.data()));
                output.append("COPY ").append(rows).append('\n');
                for (String sql : load.finishStatements()) {
                    stmt.execute(sql);
                }
                appendWarnings(stmt.getWarnings(), output);
                return ToolResult.success(output.toString());
            } catch (SQLException e) {
                output.append("ERROR:  ").append(e.getMessage()).append('\n');
                return ToolResult.failure(output.toString());
            } catch (IOException e) {
                output.append("ERROR:  COPY stream failed: ").append(e.getMessage()).append('\n');
                return ToolResult.failure(output.toString());
            }
        } catch (SQLException e) {
            return ToolResult.failure(describe(e));
        }
    }

    private Connection open(ConnectionTarget target) throws SQLException {
        Properties props = new Properties();
        props.setProperty("user", target.endpoint().user());
        props.setProperty("password", target.password() == null ? "" : target.password());
        props.setProperty("sslmode", "require");
        props.setProperty("connectTimeout", String.valueOf(connectTimeout.toSeconds()));
        props.setProperty("ApplicationName", "ferry");
        // transaction poolers reject named server-side prepared statements
        props.setProperty("prepareThreshold", "0");
        return DriverManager.getConnection(target.jdbcUrl(), props);
    }

    private static Map<String, String> toolEnvironment(ConnectionTarget target) {
        Map<String, String> env = new LinkedHashMap<>();
        env.put("PGPASSWORD", target.password() == null ? "" : target.password());
        env.put("PGSSLMODE", "require");
        env.put("PGAPPNAME", "ferry");
        return env;
    }

    /**
     * Renders a driver failure the way the server tools print it, so classification sees the same text.
     * Connection-class SQL states (08, 28) are reported as FATAL.
     */
    static String describe(SQLException e) {
        String state = e.getSQLState() == null ? "" : e.getSQLState();
        StringBuilder message = new StringBuilder();
        String text = e.getMessage() == null ? e.getClass().getSimpleName() : e.getMessage();
        boolean connectionClass = state.startsWith("08") || state.startsWith("28");
        if (connectionClass && !text.startsWith("FATAL:")) {
            message.append("FATAL:  ");
        } else if (!connectionClass && !text.startsWith("ERROR:")) {
            message.append("ERROR:  ");
        }
        message.append(text);
        Throwable cause = e.getCause();
        while (cause != null) {
            message.append(" (").append(cause.getClass().getSimpleName()).append(": ").append(cause.getMessage()).append(')');
            cause = cause.getCause();
        }
        return message.toString();
    }

    private static void appendWarnings(SQLWarning warning, StringBuilder output) {
        while (warning != null) {
            output.append("NOTICE:  ").append(warning.getMessage()).append('\n');
            warning = warning.getNextWarning();
        }
    }

    private static String quoteForTool(String identifier) {
        return '"' + identifier.replace("\"", "\"\"") + '"';
    }

    private static void deleteQuietly(Path file) {
        if (file == null) {
            return;
        }
        try {
            Files.deleteIfExists(file);
        } catch (IOException e) {
            LOGGER.debug("Could not delete temporary file {}: {}", file, e.getMessage());
        }
    }
}
