package org.ferry.connect;

import org.ferry.FerryException;

public class ManagementApiException extends FerryException {

    public ManagementApiException(String message) {
        super(message);
    }

    public ManagementApiException(String message, Throwable cause) {
        super(message, cause);
    }
}
