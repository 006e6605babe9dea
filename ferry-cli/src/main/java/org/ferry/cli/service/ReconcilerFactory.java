package org.ferry.cli.service;

import org.ferry.config.ConfigurationLoader;
import org.ferry.config.FerryConfiguration.ProfileConfiguration;
import org.ferry.connect.ConnectionResolver;
import org.ferry.connect.DatabaseClient;
import org.ferry.connect.HttpManagementApiClient;
import org.ferry.connect.ManagementApiClient;
import org.ferry.diff.SchemaDiffer;
import org.ferry.env.ConfiguredEnvironmentProvider;
import org.ferry.execute.ClassificationRules;
import org.ferry.execute.ExecutionEngine;
import org.ferry.execute.OutputClassifier;
import org.ferry.introspect.SchemaIntrospector;
import org.ferry.options.FerryOptions;
import org.ferry.plan.PlanGenerator;
import org.ferry.postgres.PostgresDatabaseClient;
import org.ferry.reconcile.ConfirmationPrompt;
import org.ferry.reconcile.Reconciler;
import org.ferry.reconcile.TargetBackup;
import org.ferry.report.ReportWriter;
import org.ferry.sync.DataSyncEngine;
import org.ferry.sync.TargetRowGuard;
import org.ferry.verify.Verifier;

import java.time.Duration;

/**
 * Wires a {@link Reconciler} from the active configuration profile.
 */
public class ReconcilerFactory {

    private final ConfigurationLoader loader;

    public ReconcilerFactory() {
        this(new ConfigurationLoader());
    }

    public ReconcilerFactory(ConfigurationLoader loader) {
        this.loader = loader;
    }

    /**
     * Loads the profile selected by the CLI flag, the environment variable or the default, in that order.
     */
    public ProfileConfiguration loadProfile(String cliProfile) {
        return loader.loadProfile(cliProfile);
    }

    public Reconciler create(ProfileConfiguration profile, ConfirmationPrompt prompt) {
        Duration connectTimeout = Duration.ofSeconds(orDefault(profile.getConnectTimeoutSeconds(),
                FerryOptions.Connection.CONNECT_TIMEOUT_DEFAULT));
        Duration toolTimeout = Duration.ofSeconds(orDefault(profile.getToolTimeoutSeconds(),
                FerryOptions.Connection.TOOL_TIMEOUT_DEFAULT));

        DatabaseClient client = new PostgresDatabaseClient(connectTimeout, toolTimeout);
        String apiUrl = profile.getManagementApiUrl() != null
                ? profile.getManagementApiUrl() : FerryOptions.ManagementApi.DEFAULT_URL;
        ManagementApiClient managementApi = new HttpManagementApiClient(apiUrl, connectTimeout);

        OutputClassifier classifier = new OutputClassifier(
                ClassificationRules.loadOrDefaults(profile.getClassificationRules()));
        ExecutionEngine engine = new ExecutionEngine(client, classifier);
        SchemaIntrospector introspector = new SchemaIntrospector(client);
        SchemaDiffer differ = new SchemaDiffer();

        return new Reconciler(
                new ConfiguredEnvironmentProvider(profile),
                new ConnectionResolver(client, managementApi),
                introspector,
                differ,
                new PlanGenerator(),
                engine,
                new DataSyncEngine(client, engine),
                new TargetRowGuard(client, engine),
                new Verifier(introspector, differ),
                new ReportWriter(),
                prompt,
                new TargetBackup(client));
    }

    private static int orDefault(Integer value, int fallback) {
        return value != null && value > 0 ? value : fallback;
    }
}
