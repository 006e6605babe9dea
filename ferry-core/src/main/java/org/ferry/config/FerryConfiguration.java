package org.ferry.config;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;
import lombok.Data;
import lombok.ToString;

import java.util.HashMap;
import java.util.List;
import java.util.Map;

@Data
@JsonIgnoreProperties(ignoreUnknown = true)
public class FerryConfiguration {

    /**
     * Settings per profile name.
     */
    @JsonProperty("profiles")
    private Map<String, ProfileConfiguration> profiles = new HashMap<>();

    @Data
    @JsonIgnoreProperties(ignoreUnknown = true)
    public static class ProfileConfiguration {

        /**
         * Environments keyed by name or alias (prod, test, dev, ...).
         */
        @JsonProperty("environments")
        private Map<String, EnvironmentConfiguration> environments = new HashMap<>();

        /**
         * Replaces the built-in exclusion set when present.
         */
        @JsonProperty("excludedSchemas")
        private List<String> excludedSchemas;

        /**
         * Path of a YAML file replacing the bundled output classification rules.
         */
        @JsonProperty("classificationRules")
        private String classificationRules;

        @JsonProperty("managementApiUrl")
        private String managementApiUrl;

        @JsonProperty("connectTimeoutSeconds")
        private Integer connectTimeoutSeconds;

        @JsonProperty("toolTimeoutSeconds")
        private Integer toolTimeoutSeconds;
    }

    @Data
    @JsonIgnoreProperties(ignoreUnknown = true)
    public static class EnvironmentConfiguration {

        @JsonProperty("projectRef")
        private String projectRef;

        @ToString.Exclude
        @JsonProperty("dbPassword")
        private String dbPassword;

        @JsonProperty("poolerRegion")
        private String poolerRegion;

        @JsonProperty("poolerPort")
        private Integer poolerPort;

        @ToString.Exclude
        @JsonProperty("accessToken")
        private String accessToken;

        @JsonProperty("database")
        private String database;
    }
}
