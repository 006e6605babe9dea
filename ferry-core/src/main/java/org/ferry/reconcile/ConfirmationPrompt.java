package org.ferry.reconcile;

import org.ferry.plan.MigrationPlan;

/**
 * Asks whether a destructive plan may be applied.
 */
@FunctionalInterface
public interface ConfirmationPrompt {

    boolean confirm(MigrationPlan plan, String source, String target);

    static ConfirmationPrompt always() {
        return (plan, source, target) -> true;
    }
}
