package org.ferry.introspect;

import org.ferry.FerryException;

/**
 * A catalog query failed; {@link #getArea()} names which part of the catalog.
 */
public class IntrospectionFailure extends FerryException {

    private final String area;

    public IntrospectionFailure(String environment, String area, Throwable cause) {
        super("Failed to read " + area + " of environment '" + environment + "': " + cause.getMessage(), cause);
        this.area = area;
    }

    public String getArea() {
        return area;
    }
}
