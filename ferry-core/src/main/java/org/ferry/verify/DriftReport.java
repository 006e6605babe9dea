package org.ferry.verify;

import lombok.Getter;

import java.util.List;
import java.util.SortedSet;
import java.util.TreeSet;

/**
 * Residual differences between source and target after a run, split into genuine drift and expected differences.
 */
@Getter
public class DriftReport {
    private final String sourceFingerprint;
    private final String targetFingerprint;
    /** Schemas neither side was compared on. */
    private final SortedSet<String> excludedSchemas;
    private final List<DriftItem> items;
    private final List<String> warnings;

    public DriftReport(String sourceFingerprint, String targetFingerprint, SortedSet<String> excludedSchemas,
                       List<DriftItem> items, List<String> warnings) {
        this.sourceFingerprint = sourceFingerprint;
        this.targetFingerprint = targetFingerprint;
        this.excludedSchemas = new TreeSet<>(excludedSchemas);
        this.items = List.copyOf(items);
        this.warnings = List.copyOf(warnings);
    }

    public List<DriftItem> genuineDrift() {
        return items.stream().filter(i -> !i.expected()).toList();
    }

    public List<DriftItem> expectedDifferences() {
        return items.stream().filter(DriftItem::expected).toList();
    }

    public boolean isClean() {
        return genuineDrift().isEmpty();
    }

    public boolean isIdentical() {
        return sourceFingerprint.equals(targetFingerprint);
    }
}
