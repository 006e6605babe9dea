package org.ferry.execute;

/**
 * Outcome class of one output line or of a whole tool run, ordered from harmless to worst.
 * {@link #IGNORE} only appears on rules: a matching line is dropped before anything else looks at it.
 */
public enum Classification {
    IGNORE,
    CLEAN,
    TOLERABLE,
    UNEXPECTED,
    FATAL;

    public Classification worst(Classification other) {
        return other.ordinal() > ordinal() ? other : this;
    }
}
