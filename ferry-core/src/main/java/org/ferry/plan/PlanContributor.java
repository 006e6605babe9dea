package org.ferry.plan;

/**
 * Turns one category of differences into operations.
 * Within a phase, operations are ordered by contributor priority (lower first) and then by emission order.
 */
public interface PlanContributor {

    int priority();

    /**
     * Structural contributors are skipped when only data is synchronised.
     */
    default boolean structural() {
        return true;
    }

    void contribute(PlanContext context, PlanOutput output);
}
