package org.ferry.diff;

import org.ferry.model.Descriptor;
import org.ferry.model.Snapshot;

import java.util.ArrayList;
import java.util.Collection;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.TreeMap;
import java.util.function.Function;

/**
 * Keyed comparison of one descriptor category.
 * Subclasses declare which fields are compared; anything else (ordinal position, extension version, ...) is ignored.
 */
public abstract class DescriptorDiffer<T extends Descriptor> implements Differ {

    private final Map<String, Function<T, ?>> comparableFields;

    protected DescriptorDiffer() {
        this.comparableFields = new LinkedHashMap<>();
        declareFields(comparableFields);
    }

    /**
     * Registers the compared fields in the order they are reported.
     */
    protected abstract void declareFields(Map<String, Function<T, ?>> fields);

    protected abstract List<T> extract(Snapshot snapshot);

    protected abstract void store(SchemaDiff result, DiffResult<T> diff);

    @Override
    public void diff(Snapshot source, Snapshot target, SchemaDiff result) {
        store(result, compare(extract(source), extract(target)));
    }

    public DiffResult<T> compare(Collection<T> source, Collection<T> target) {
        Map<String, T> sourceByKey = index(source);
        Map<String, T> targetByKey = index(target);

        List<T> added = new ArrayList<>();
        List<Change<T>> changed = new ArrayList<>();
        sourceByKey.forEach((key, s) -> {
            T t = targetByKey.get(key);
            if (t == null) {
                added.add(s);
                return;
            }
            List<String> differing = differingFields(s, t);
            if (!differing.isEmpty()) {
                changed.add(new Change<>(key, s, t, differing));
            }
        });

        List<T> removed = targetByKey.entrySet().stream()
                .filter(e -> !sourceByKey.containsKey(e.getKey()))
                .map(Map.Entry::getValue)
                .toList();

        return new DiffResult<>(added, removed, changed);
    }

    private List<String> differingFields(T source, T target) {
        List<String> differing = new ArrayList<>();
        comparableFields.forEach((name, accessor) -> {
            if (!sameValue(accessor.apply(source), accessor.apply(target))) {
                differing.add(name);
            }
        });
        return differing;
    }

    /**
     * Null and empty text are the same value; everything else compares with {@code equals}.
     */
    private static boolean sameValue(Object a, Object b) {
        return Objects.equals(normalize(a), normalize(b));
    }

    private static Object normalize(Object value) {
        if (value instanceof String s && s.isEmpty()) {
            return null;
        }
        return value;
    }

    private Map<String, T> index(Collection<T> descriptors) {
        Map<String, T> byKey = new TreeMap<>();
        for (T descriptor : descriptors) {
            T previous = byKey.put(descriptor.key(), descriptor);
            if (previous != null) {
                throw new IllegalStateException("Duplicate " + getClass().getSimpleName() + " key: " + descriptor.key());
            }
        }
        return byKey;
    }
}
