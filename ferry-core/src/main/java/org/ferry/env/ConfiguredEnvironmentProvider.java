package org.ferry.env;

import org.ferry.config.ConfigurationException;
import org.ferry.config.FerryConfiguration.EnvironmentConfiguration;
import org.ferry.config.FerryConfiguration.ProfileConfiguration;
import org.ferry.model.EnvironmentCredentials;
import org.ferry.options.FerryOptions;

import java.util.Locale;
import java.util.Map;
import java.util.function.UnaryOperator;

/**
 * Resolves environments from the active configuration profile, falling back to
 * {@code SUPABASE_<ENV>_*} environment variables for any value the profile leaves out.
 */
public class ConfiguredEnvironmentProvider implements EnvironmentProvider {

    private static final Map<String, String> ALIASES = Map.of(
            "prod", "PROD",
            "production", "PROD",
            "main", "PROD",
            "test", "TEST",
            "staging", "TEST",
            "dev", "DEV",
            "develop", "DEV"
    );

    private final ProfileConfiguration profile;
    private final UnaryOperator<String> envLookup;

    public ConfiguredEnvironmentProvider(ProfileConfiguration profile) {
        this(profile, System::getenv);
    }

    public ConfiguredEnvironmentProvider(ProfileConfiguration profile, UnaryOperator<String> envLookup) {
        this.profile = profile == null ? new ProfileConfiguration() : profile;
        this.envLookup = envLookup;
    }

    @Override
    public String canonicalName(String environment) {
        if (environment == null || environment.isBlank()) {
            throw new ConfigurationException("Environment name must not be empty");
        }
        String lower = environment.trim().toLowerCase(Locale.ROOT);
        return ALIASES.getOrDefault(lower, lower.toUpperCase(Locale.ROOT).replace('-', '_'));
    }

    @Override
    public EnvironmentCredentials credentials(String environment) {
        String key = canonicalName(environment);
        EnvironmentConfiguration configured = findConfigured(key);

        String projectRef = firstNonBlank(configured == null ? null : configured.getProjectRef(),
                envLookup.apply(String.format(FerryOptions.Environment.PROJECT_REF, key)));
        String password = firstNonBlank(configured == null ? null : configured.getDbPassword(),
                envLookup.apply(String.format(FerryOptions.Environment.DB_PASSWORD, key)));

        if (projectRef == null) {
            throw new ConfigurationException("Environment '" + environment + "' has no project ref; set it in "
                    + FerryOptions.Profile.CONFIG_FILE + " or " + String.format(FerryOptions.Environment.PROJECT_REF, key));
        }
        if (password == null) {
            throw new ConfigurationException("Environment '" + environment + "' has no database password; set it in "
                    + FerryOptions.Profile.CONFIG_FILE + " or " + String.format(FerryOptions.Environment.DB_PASSWORD, key));
        }

        String region = firstNonBlank(configured == null ? null : configured.getPoolerRegion(),
                envLookup.apply(String.format(FerryOptions.Environment.POOLER_REGION, key)),
                FerryOptions.Connection.DEFAULT_POOLER_REGION);
        int port = resolvePort(configured, key);
        String token = firstNonBlank(configured == null ? null : configured.getAccessToken(),
                envLookup.apply(FerryOptions.Environment.ACCESS_TOKEN));
        String database = firstNonBlank(configured == null ? null : configured.getDatabase(),
                FerryOptions.Connection.DEFAULT_DATABASE);

        return EnvironmentCredentials.builder()
                .name(key.toLowerCase(Locale.ROOT))
                .projectRef(projectRef)
                .password(password)
                .poolerRegion(region)
                .poolerPort(port)
                .accessToken(token)
                .database(database)
                .build();
    }

    private EnvironmentConfiguration findConfigured(String key) {
        for (Map.Entry<String, EnvironmentConfiguration> entry : profile.getEnvironments().entrySet()) {
            if (canonicalName(entry.getKey()).equals(key)) {
                return entry.getValue();
            }
        }
        return null;
    }

    private int resolvePort(EnvironmentConfiguration configured, String key) {
        if (configured != null && configured.getPoolerPort() != null) {
            return configured.getPoolerPort();
        }
        String fromEnv = envLookup.apply(String.format(FerryOptions.Environment.POOLER_PORT, key));
        if (fromEnv == null || fromEnv.isBlank()) {
            return FerryOptions.Connection.DEFAULT_POOLER_PORT;
        }
        try {
            return Integer.parseInt(fromEnv.trim());
        } catch (NumberFormatException e) {
            throw new ConfigurationException("Invalid pooler port '" + fromEnv + "' for environment " + key, e);
        }
    }

    private static String firstNonBlank(String... values) {
        for (String value : values) {
            if (value != null && !value.isBlank()) {
                return value.trim();
            }
        }
        return null;
    }
}
