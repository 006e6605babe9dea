package org.ferry.execute;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.dataformat.yaml.YAMLFactory;
import lombok.Data;
import org.ferry.config.ConfigurationException;
import org.ferry.model.SyncMode;
import org.ferry.options.FerryOptions;

import java.io.IOException;
import java.io.InputStream;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.EnumSet;
import java.util.List;
import java.util.regex.Pattern;
import java.util.regex.PatternSyntaxException;

/**
 * Loads the ordered rule table from YAML.
 */
public final class ClassificationRules {

    private static final ObjectMapper YAML = new ObjectMapper(new YAMLFactory());

    private ClassificationRules() {
    }

    public static List<ClassificationRule> defaults() {
        String resource = FerryOptions.Classification.DEFAULT_RULES_RESOURCE;
        try (InputStream in = ClassificationRules.class.getClassLoader().getResourceAsStream(resource)) {
            if (in == null) {
                throw new IllegalStateException("Missing classpath resource " + resource);
            }
            return compile(YAML.readValue(in, RuleFile.class), resource);
        } catch (IOException e) {
            throw new IllegalStateException("Failed to read " + resource, e);
        }
    }

    /**
     * @throws ConfigurationException if the file cannot be read or a rule is invalid
     */
    public static List<ClassificationRule> load(Path file) {
        try {
            return compile(YAML.readValue(Files.readAllBytes(file), RuleFile.class), file.toString());
        } catch (IOException e) {
            throw new ConfigurationException("Failed to read classification rules " + file + ": " + e.getMessage(), e);
        }
    }

    /**
     * Rules from the given file when set, the bundled rules otherwise.
     */
    public static List<ClassificationRule> loadOrDefaults(String file) {
        if (file == null || file.isBlank()) {
            return defaults();
        }
        return load(Path.of(file));
    }

    private static List<ClassificationRule> compile(RuleFile file, String origin) {
        if (file == null || file.getRules() == null || file.getRules().isEmpty()) {
            throw new ConfigurationException("No classification rules in " + origin);
        }
        List<ClassificationRule> rules = new ArrayList<>();
        for (RuleDefinition def : file.getRules()) {
            if (def.getPattern() == null || def.getClassification() == null) {
                throw new ConfigurationException("Rule '" + def.getName() + "' in " + origin
                        + " needs both a pattern and a classification");
            }
            Pattern pattern;
            try {
                pattern = Pattern.compile(def.getPattern());
            } catch (PatternSyntaxException e) {
                throw new ConfigurationException("Rule '" + def.getName() + "' in " + origin
                        + " has an invalid pattern: " + e.getDescription(), e);
            }
            EnumSet<SyncMode.Strategy> strategies = EnumSet.noneOf(SyncMode.Strategy.class);
            if (def.getStrategies() != null) {
                strategies.addAll(def.getStrategies());
            }
            rules.add(new ClassificationRule(def.getName(), pattern, def.getClassification(), strategies));
        }
        return rules;
    }

    @Data
    @JsonIgnoreProperties(ignoreUnknown = true)
    static class RuleFile {
        @JsonProperty("rules")
        private List<RuleDefinition> rules;
    }

    @Data
    @JsonIgnoreProperties(ignoreUnknown = true)
    static class RuleDefinition {
        @JsonProperty("name")
        private String name;

        @JsonProperty("pattern")
        private String pattern;

        @JsonProperty("classification")
        private Classification classification;

        @JsonProperty("strategies")
        private List<SyncMode.Strategy> strategies;
    }
}
