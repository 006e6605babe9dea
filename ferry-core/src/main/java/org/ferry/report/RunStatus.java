package org.ferry.report;

public enum RunStatus {
    /** Every stage completed and verification found no genuine drift. */
    SUCCEEDED,
    /** Every stage completed but verification found drift. */
    DRIFTED,
    /** The plan was empty; nothing was applied. */
    NO_CHANGES,
    /** A destructive plan was declined at the confirmation prompt. */
    CANCELLED,
    FAILED
}
