package org.ferry.connect;

/**
 * Record of one endpoint that could not be used.
 */
public record ConnectAttempt(String endpoint, FailureReason reason, String message) {

    @Override
    public String toString() {
        return endpoint + ": " + reason + " (" + message + ")";
    }
}
