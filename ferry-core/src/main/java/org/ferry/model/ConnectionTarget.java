package org.ferry.model;

/**
 * A concrete endpoint paired with the secrets needed to open a session on it.
 */
public record ConnectionTarget(Endpoint endpoint, String password, String database) {

    public String jdbcUrl() {
        return String.format("jdbc:postgresql://%s:%d/%s", endpoint.host(), endpoint.port(), database);
    }

    @Override
    public String toString() {
        return endpoint.display() + "/" + database;
    }
}
