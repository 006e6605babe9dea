package org.ferry.diff;

import lombok.Getter;
import org.ferry.model.Descriptor;

import java.util.List;

/**
 * Difference of one descriptor category: source-only, target-only and changed objects, each sorted by key.
 */
@Getter
public final class DiffResult<T extends Descriptor> {
    private final List<T> added;
    private final List<T> removed;
    private final List<Change<T>> changed;

    public DiffResult(List<T> added, List<T> removed, List<Change<T>> changed) {
        this.added = List.copyOf(added);
        this.removed = List.copyOf(removed);
        this.changed = List.copyOf(changed);
    }

    public static <T extends Descriptor> DiffResult<T> empty() {
        return new DiffResult<>(List.of(), List.of(), List.of());
    }

    public boolean isEmpty() {
        return added.isEmpty() && removed.isEmpty() && changed.isEmpty();
    }

    public int size() {
        return added.size() + removed.size() + changed.size();
    }
}
