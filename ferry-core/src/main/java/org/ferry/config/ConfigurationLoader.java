package org.ferry.config;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.dataformat.yaml.YAMLFactory;
import org.ferry.config.FerryConfiguration.ProfileConfiguration;
import org.ferry.options.FerryOptions;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.Paths;
import java.util.Optional;
import java.util.function.UnaryOperator;

public class ConfigurationLoader {

    private static final Logger LOGGER = LoggerFactory.getLogger(ConfigurationLoader.class);

    private static final String CONFIG_FILE_NAME = FerryOptions.Profile.CONFIG_FILE;
    private static final String DEFAULT_PROFILE = FerryOptions.Profile.DEFAULT;
    private static final String PROFILE_ENV_VAR = FerryOptions.Profile.ENV_VAR;

    private final ObjectMapper yamlMapper;
    private final Path startDirectory;
    private final UnaryOperator<String> envLookup;

    public ConfigurationLoader() {
        this(Paths.get("").toAbsolutePath(), System::getenv);
    }

    public ConfigurationLoader(Path startDirectory, UnaryOperator<String> envLookup) {
        this.yamlMapper = new ObjectMapper(new YAMLFactory());
        this.startDirectory = startDirectory;
        this.envLookup = envLookup;
    }

    /**
     * Loads the configuration file and selects the active profile.
     * <p>
     * Priority: CLI profile > FERRY_PROFILE environment variable > default.
     *
     * @param cliProfile profile given on the command line (may be null)
     * @return the active profile, or an empty profile when no file or profile exists
     * @throws ConfigurationException if a configuration file exists but cannot be parsed
     */
    public ProfileConfiguration loadProfile(String cliProfile) {
        String activeProfile = resolveActiveProfile(cliProfile);

        Optional<FerryConfiguration> config = findAndLoadConfiguration();
        if (config.isEmpty()) {
            LOGGER.debug("No {} found above {}, using defaults", CONFIG_FILE_NAME, startDirectory);
            return createDefaultProfile();
        }

        ProfileConfiguration profile = config.get().getProfiles().get(activeProfile);
        if (profile == null) {
            if (cliProfile != null && !cliProfile.isBlank()) {
                throw new ConfigurationException("Profile '" + activeProfile + "' not found in " + CONFIG_FILE_NAME);
            }
            LOGGER.warn("Profile '{}' not found in configuration. Using defaults.", activeProfile);
            return createDefaultProfile();
        }
        LOGGER.debug("Using profile '{}'", activeProfile);
        return profile;
    }

    String resolveActiveProfile(String cliProfile) {
        if (cliProfile != null && !cliProfile.trim().isEmpty()) {
            return cliProfile.trim();
        }

        String envProfile = envLookup.apply(PROFILE_ENV_VAR);
        if (envProfile != null && !envProfile.trim().isEmpty()) {
            return envProfile.trim();
        }

        return DEFAULT_PROFILE;
    }

    /**
     * Walks from the start directory up to the filesystem root looking for ferry.yaml.
     */
    private Optional<FerryConfiguration> findAndLoadConfiguration() {
        Path currentDir = startDirectory;

        while (currentDir != null) {
            Path configFile = currentDir.resolve(CONFIG_FILE_NAME);
            if (Files.exists(configFile)) {
                try {
                    FerryConfiguration config = yamlMapper.readValue(configFile.toFile(), FerryConfiguration.class);
                    LOGGER.debug("Loaded configuration from {}", configFile);
                    return Optional.of(config);
                } catch (IOException e) {
                    throw new ConfigurationException("Failed to parse " + configFile + ": " + e.getMessage(), e);
                }
            }
            currentDir = currentDir.getParent();
        }

        return Optional.empty();
    }

    private ProfileConfiguration createDefaultProfile() {
        return new ProfileConfiguration();
    }
}
