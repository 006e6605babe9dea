package org.ferry.connect;

import org.ferry.model.ConnectionTarget;

/**
 * An endpoint of a named environment that answered a connection check.
 */
public record ResolvedConnection(String environment, ConnectionTarget target) {

    @Override
    public String toString() {
        return environment + " via " + target;
    }
}
