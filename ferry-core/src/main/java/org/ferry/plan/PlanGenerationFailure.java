package org.ferry.plan;

import org.ferry.FerryException;

/**
 * Catalog metadata too malformed to turn into SQL.
 */
public class PlanGenerationFailure extends FerryException {

    public PlanGenerationFailure(String message) {
        super(message);
    }
}
