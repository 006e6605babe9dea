package org.ferry.connect;

import org.ferry.FerryException;

/**
 * Raised by a {@link DatabaseClient} when a session or statement fails outright.
 */
public class DatabaseAccessException extends FerryException {

    public DatabaseAccessException(String message) {
        super(message);
    }

    public DatabaseAccessException(String message, Throwable cause) {
        super(message, cause);
    }
}
