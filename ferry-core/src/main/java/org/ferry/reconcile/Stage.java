package org.ferry.reconcile;

/**
 * Stages of a run, in execution order.
 */
public enum Stage {
    CONNECT,
    INTROSPECT,
    DIFF,
    PLAN,
    CONFIRM,
    BACKUP,
    PRE_DATA,
    DATA,
    POST_DATA,
    VERIFY
}
