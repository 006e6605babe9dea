package org.ferry.plan;

import com.fasterxml.jackson.annotation.JsonIgnore;
import lombok.Builder;
import lombok.Value;
import org.ferry.model.Descriptor;
import org.ferry.model.TableRef;

/**
 * One unit of change against the target.
 * {@code sql} is {@code null} only for {@link OperationKind#LOAD_TABLE_DATA}, which the data sync engine carries out.
 */
@Value
@Builder(toBuilder = true)
public class Operation {
    OperationKind kind;
    Phase phase;
    /** Human-readable name of the object changed, e.g. {@code public.orders.total}. */
    String targetObject;
    String sql;
    boolean destructive;
    /** Operations sharing a group run in one transaction. */
    String transactionGroup;
    /** A SET NOT NULL that must only run once no NULLs remain. */
    boolean deferred;
    TableRef table;
    String column;
    /** Catalog object the operation was derived from. */
    @JsonIgnore
    Descriptor subject;

    public boolean hasSql() {
        return sql != null && !sql.isBlank();
    }

    @Override
    public String toString() {
        return kind + " " + targetObject;
    }
}
