package org.ferry.plan;

/**
 * Object counts of the diff a plan was generated from.
 */
public record PlanSummary(int added, int removed, int changed) {

    @Override
    public String toString() {
        return added + " added, " + removed + " removed, " + changed + " changed";
    }
}
