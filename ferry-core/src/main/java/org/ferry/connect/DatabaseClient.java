package org.ferry.connect;

import org.ferry.model.ConnectionTarget;

/**
 * Capability to talk to one PostgreSQL database.
 * Catalog reads and COPY go through a driver session; scripts and dumps may go through external tools,
 * so their outcome is reported as exit status plus output text rather than as an exception.
 */
public interface DatabaseClient {

    /**
     * Runs a read-only query and returns every row as text.
     *
     * @throws DatabaseAccessException if the session cannot be opened or the query fails
     */
    QueryResult query(ConnectionTarget target, String sql);

    /**
     * Runs a SQL script. Statement errors do not stop the script; they are reported in the output.
     */
    ToolResult execute(ConnectionTarget target, String script);

    /**
     * Dumps part of the database to {@link DumpRequest#outputFile()}.
     */
    ToolResult dump(ConnectionTarget target, DumpRequest request);

    /**
     * Runs a {@code COPY ... TO STDOUT} statement and returns the produced text.
     *
     * @throws DatabaseAccessException if the copy fails
     */
    String copyOut(ConnectionTarget target, String copySql);

    /**
     * Runs the setup statements, the {@code COPY ... FROM STDIN} and the finishing statements of a load
     * inside one session.
     */
    ToolResult copyIn(ConnectionTarget target, CopyLoad load);

    /**
     * Cheapest possible round trip, used to check endpoints.
     */
    default void ping(ConnectionTarget target) {
        query(target, "SELECT 1");
    }
}
