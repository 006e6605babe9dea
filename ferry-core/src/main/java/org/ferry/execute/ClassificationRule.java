package org.ferry.execute;

import org.ferry.model.SyncMode;

import java.util.Set;
import java.util.regex.Pattern;

/**
 * A pattern and the class it assigns to matching lines.
 *
 * @param strategies strategies the rule applies under; empty means all
 */
public record ClassificationRule(String name, Pattern pattern, Classification classification,
                                 Set<SyncMode.Strategy> strategies) {

    public ClassificationRule {
        strategies = Set.copyOf(strategies);
    }

    public boolean appliesTo(SyncMode.Strategy strategy) {
        return strategies.isEmpty() || strategies.contains(strategy);
    }

    public boolean matches(String line) {
        return pattern.matcher(line).find();
    }
}
