package org.ferry.execute;

import lombok.Builder;
import lombok.Singular;
import lombok.Value;

import java.util.List;

@Value
@Builder
public class OperationOutcome {

    public enum Status {
        APPLIED,
        TOLERATED,
        SKIPPED
    }

    String label;
    Status status;
    /** Endpoint the operation finally ran on. */
    String endpoint;
    @Singular
    List<String> notes;
}
