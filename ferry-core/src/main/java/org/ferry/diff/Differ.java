package org.ferry.diff;

import org.ferry.model.Snapshot;

public interface Differ {
    void diff(Snapshot source, Snapshot target, SchemaDiff result);
}
