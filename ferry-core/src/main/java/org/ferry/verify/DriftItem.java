package org.ferry.verify;

/**
 * One difference still present after a run.
 *
 * @param category descriptor kind, e.g. {@code columns} or {@code policies}
 * @param expected true when the run deliberately left it in place
 */
public record DriftItem(String category, Kind kind, String key, String detail, boolean expected) {

    public enum Kind {
        ADDED, REMOVED, CHANGED
    }

    @Override
    public String toString() {
        return category + " " + kind + " " + key + (detail == null ? "" : " (" + detail + ")");
    }
}
