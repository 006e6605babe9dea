package org.ferry.connect;

import org.ferry.model.ConnectionTarget;
import org.ferry.model.Endpoint;
import org.ferry.model.EnvironmentCredentials;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Deque;
import java.util.List;
import java.util.Optional;

/**
 * Walks the endpoints of one environment in order, probing each before handing it out.
 * The Management API is consulted at most once, after every pooled endpoint has failed.
 * Callers that hit a connection-level failure mid-run call {@link #advance()} to move on.
 */
public class EndpointCursor {

    private static final Logger LOGGER = LoggerFactory.getLogger(EndpointCursor.class);

    private final EnvironmentCredentials env;
    private final DatabaseClient client;
    private final ManagementApiClient managementApi;
    private final String purpose;
    private final Deque<Endpoint> pending;
    private final List<ConnectAttempt> attempts = new ArrayList<>();

    private boolean apiConsulted;
    private boolean directQueued;
    private ResolvedConnection current;

    EndpointCursor(EnvironmentCredentials env, DatabaseClient client, ManagementApiClient managementApi, String purpose) {
        this.env = env;
        this.client = client;
        this.managementApi = managementApi;
        this.purpose = purpose;
        this.pending = new ArrayDeque<>(EndpointCandidates.pooled(env));
    }

    public String getEnvironment() {
        return env.getName();
    }

    /**
     * The endpoint currently in use, probing candidates until one answers.
     *
     * @throws ConnectFailure if every candidate failed
     */
    public ResolvedConnection current() {
        if (current == null) {
            current = nextWorking().orElseThrow(this::failure);
        }
        return current;
    }

    /**
     * Abandons the current endpoint and moves to the next one that answers.
     *
     * @return the new endpoint, or empty when none is left
     */
    public Optional<ResolvedConnection> advance() {
        if (current != null) {
            attempts.add(new ConnectAttempt(current.target().endpoint().display(), FailureReason.OTHER,
                    "abandoned after connection-level failure during " + purpose));
            current = null;
        }
        Optional<ResolvedConnection> next = nextWorking();
        next.ifPresent(c -> current = c);
        return next;
    }

    public List<ConnectAttempt> getAttempts() {
        return List.copyOf(attempts);
    }

    public ConnectFailure failure() {
        return new ConnectFailure(env.getName(), attempts);
    }

    private Optional<ResolvedConnection> nextWorking() {
        while (true) {
            Endpoint endpoint = nextCandidate();
            if (endpoint == null) {
                return Optional.empty();
            }
            ConnectionTarget target = new ConnectionTarget(endpoint, env.getPassword(), env.getDatabase());
            try {
                client.ping(target);
                LOGGER.info("Connected to {} for {} via {}", env.getName(), purpose, endpoint.display());
                return Optional.of(new ResolvedConnection(env.getName(), target));
            } catch (RuntimeException e) {
                FailureReason reason = FailureReason.classify(e.getMessage());
                LOGGER.warn("Endpoint {} of {} failed: {} ({})", endpoint.display(), env.getName(), reason, e.getMessage());
                attempts.add(new ConnectAttempt(endpoint.display(), reason, e.getMessage()));
            }
        }
    }

    private Endpoint nextCandidate() {
        if (!pending.isEmpty()) {
            return pending.poll();
        }
        if (!apiConsulted) {
            apiConsulted = true;
            consultManagementApi();
            if (!pending.isEmpty()) {
                return pending.poll();
            }
        }
        if (!directQueued) {
            directQueued = true;
            return EndpointCandidates.direct(env);
        }
        return null;
    }

    private void consultManagementApi() {
        if (!env.hasAccessToken() || managementApi == null) {
            LOGGER.debug("Skipping management API lookup for {}: no access token", env.getName());
            return;
        }
        try {
            String host = managementApi.resolvePoolerHost(env.getProjectRef(), env.getAccessToken());
            pending.add(EndpointCandidates.apiResolved(host, env));
        } catch (RuntimeException e) {
            LOGGER.warn("Management API lookup for {} failed: {}", env.getName(), e.getMessage());
            attempts.add(new ConnectAttempt(EndpointCandidates.API_POOLER, FailureReason.classify(e.getMessage()),
                    e.getMessage()));
        }
    }
}
