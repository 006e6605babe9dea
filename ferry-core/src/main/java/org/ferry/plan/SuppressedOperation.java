package org.ferry.plan;

/**
 * An operation the plan deliberately withholds, with the reason.
 */
public record SuppressedOperation(Operation operation, String reason) {
}
