package org.ferry.sync;

import org.ferry.model.ConnectionTarget;
import org.ferry.model.TableRef;

/**
 * One way of reading the rows of a source table.
 */
public interface TableExtractor {

    String name();

    /**
     * @throws ExtractionException if this path cannot produce the rows
     */
    ExtractedTable extract(ConnectionTarget source, TableRef table);
}
