package org.ferry.plan;

/**
 * Execution order of operations: structure that data needs, the data itself, then everything that may reject or
 * hide rows.
 */
public enum Phase {
    PRE_DATA,
    DATA,
    POST_DATA
}
