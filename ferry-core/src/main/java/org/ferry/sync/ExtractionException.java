package org.ferry.sync;

import org.ferry.FerryException;

/**
 * One extraction path could not produce the rows of a table.
 */
public class ExtractionException extends FerryException {

    public ExtractionException(String message) {
        super(message);
    }

    public ExtractionException(String message, Throwable cause) {
        super(message, cause);
    }
}
