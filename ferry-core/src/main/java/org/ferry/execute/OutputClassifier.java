package org.ferry.execute;

import org.ferry.connect.ToolResult;
import org.ferry.model.SyncMode;

import java.util.ArrayList;
import java.util.List;

/**
 * Classifies tool output line by line against an ordered rule table.
 * The first matching rule decides a line; unmatched lines are clean; the worst line decides the run.
 * A non-zero exit whose output matched nothing worse than clean is unexpected.
 */
public class OutputClassifier {

    private final List<ClassificationRule> rules;

    public OutputClassifier(List<ClassificationRule> rules) {
        this.rules = List.copyOf(rules);
    }

    public static OutputClassifier withDefaultRules() {
        return new OutputClassifier(ClassificationRules.defaults());
    }

    public ClassifiedOutput classify(ToolResult result, SyncMode.Strategy strategy) {
        Classification overall = Classification.CLEAN;
        List<String> tolerated = new ArrayList<>();
        List<String> errors = new ArrayList<>();

        for (String line : result.output().split("\\R")) {
            if (line.isBlank()) {
                continue;
            }
            Classification lineClass = classifyLine(line, strategy);
            switch (lineClass) {
                case TOLERABLE -> tolerated.add(line.trim());
                case UNEXPECTED, FATAL -> errors.add(line.trim());
                default -> {
                }
            }
            if (lineClass != Classification.IGNORE) {
                overall = overall.worst(lineClass);
            }
        }

        if (!result.succeeded() && overall == Classification.CLEAN) {
            overall = Classification.UNEXPECTED;
            errors.add("exit code " + result.exitCode() + " without recognisable error output");
        }
        return new ClassifiedOutput(overall, tolerated, errors);
    }

    Classification classifyLine(String line, SyncMode.Strategy strategy) {
        for (ClassificationRule rule : rules) {
            if (rule.appliesTo(strategy) && rule.matches(line)) {
                return rule.classification();
            }
        }
        return Classification.CLEAN;
    }
}
