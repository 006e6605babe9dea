package org.ferry.model;

/**
 * One way of reaching a database.
 *
 * @param label short name of the strategy that produced the endpoint, e.g. {@code shared_pooler}
 */
public record Endpoint(String host, int port, String user, String label) {

    public String display() {
        return label + " (" + user + "@" + host + ":" + port + ")";
    }

    @Override
    public String toString() {
        return display();
    }
}
