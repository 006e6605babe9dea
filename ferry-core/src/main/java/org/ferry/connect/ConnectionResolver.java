package org.ferry.connect;

import org.ferry.model.EnvironmentCredentials;

import java.util.Objects;

/**
 * Finds a working endpoint for a named environment.
 */
public class ConnectionResolver {

    private final DatabaseClient client;
    private final ManagementApiClient managementApi;

    public ConnectionResolver(DatabaseClient client, ManagementApiClient managementApi) {
        this.client = Objects.requireNonNull(client, "client must not be null");
        this.managementApi = managementApi;
    }

    /**
     * @throws ConnectFailure listing every attempted endpoint if none answered
     */
    public ResolvedConnection resolve(EnvironmentCredentials env, String purpose) {
        return cursor(env, purpose).current();
    }

    /**
     * A fresh cursor over the environment's endpoints. Nothing is contacted until the cursor is first used.
     */
    public EndpointCursor cursor(EnvironmentCredentials env, String purpose) {
        Objects.requireNonNull(env, "env must not be null");
        return new EndpointCursor(env, client, managementApi, purpose);
    }
}
