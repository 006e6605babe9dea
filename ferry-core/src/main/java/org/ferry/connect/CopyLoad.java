package org.ferry.connect;

import java.util.List;

/**
 * A COPY FROM STDIN with the statements that must run before and after it in the same session.
 *
 * @param bestEffortStatements run first; a failure is reported as a warning and the load continues
 */
public record CopyLoad(List<String> bestEffortStatements, List<String> setupStatements, String copySql, String data,
                       List<String> finishStatements) {

    public CopyLoad {
        bestEffortStatements = List.copyOf(bestEffortStatements);
        setupStatements = List.copyOf(setupStatements);
        finishStatements = List.copyOf(finishStatements);
    }
}
