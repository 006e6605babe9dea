package org.ferry.connect;

import org.ferry.model.Endpoint;
import org.ferry.model.EnvironmentCredentials;
import org.ferry.options.FerryOptions;

import java.util.ArrayList;
import java.util.List;

/**
 * Builds the ordered endpoint list of an environment.
 * Pooled endpoints come first, the direct host last; the API-resolved host is inserted between them on demand.
 */
public final class EndpointCandidates {

    public static final String SHARED_POOLER = "shared_pooler";
    public static final String SHARED_SESSION = "shared_session";
    public static final String API_POOLER = "api_pooler";
    public static final String DIRECT = "direct";

    private EndpointCandidates() {
    }

    public static List<Endpoint> pooled(EnvironmentCredentials env) {
        String host = String.format(FerryOptions.Connection.POOLER_HOST_FORMAT, env.getPoolerRegion());
        String user = pooledUser(env);
        List<Endpoint> endpoints = new ArrayList<>();
        endpoints.add(new Endpoint(host, env.getPoolerPort(), user, SHARED_POOLER));
        if (env.getPoolerPort() != FerryOptions.Connection.DIRECT_PORT) {
            endpoints.add(new Endpoint(host, FerryOptions.Connection.DIRECT_PORT, user, SHARED_SESSION));
        }
        return endpoints;
    }

    public static Endpoint apiResolved(String host, EnvironmentCredentials env) {
        return new Endpoint(host, env.getPoolerPort(), pooledUser(env), API_POOLER);
    }

    public static Endpoint direct(EnvironmentCredentials env) {
        String host = String.format(FerryOptions.Connection.DIRECT_HOST_FORMAT, env.getProjectRef());
        return new Endpoint(host, FerryOptions.Connection.DIRECT_PORT, FerryOptions.Connection.DIRECT_USER, DIRECT);
    }

    private static String pooledUser(EnvironmentCredentials env) {
        return FerryOptions.Connection.DIRECT_USER + "." + env.getProjectRef();
    }
}
