package org.ferry.connect;

import org.ferry.FerryException;

import java.util.List;
import java.util.stream.Collectors;

/**
 * Every candidate endpoint of an environment failed.
 */
public class ConnectFailure extends FerryException {

    private final String environment;
    private final List<ConnectAttempt> attempts;

    public ConnectFailure(String environment, List<ConnectAttempt> attempts) {
        super(buildMessage(environment, attempts));
        this.environment = environment;
        this.attempts = List.copyOf(attempts);
    }

    private static String buildMessage(String environment, List<ConnectAttempt> attempts) {
        if (attempts.isEmpty()) {
            return "No connection endpoint available for environment '" + environment + "'";
        }
        return "Could not connect to environment '" + environment + "'; tried:\n"
                + attempts.stream().map(a -> "  - " + a).collect(Collectors.joining("\n"));
    }

    public String getEnvironment() {
        return environment;
    }

    public List<ConnectAttempt> getAttempts() {
        return attempts;
    }
}
