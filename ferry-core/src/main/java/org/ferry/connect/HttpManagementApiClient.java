package org.ferry.connect;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.ferry.options.FerryOptions;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.net.URI;
import java.net.http.HttpClient;
import java.net.http.HttpRequest;
import java.net.http.HttpResponse;
import java.time.Duration;
import java.util.List;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * {@link ManagementApiClient} backed by the pooler configuration endpoint.
 * The response is either one object or an array of objects; the first of
 * {@code db_host}, {@code pooler_url} or {@code connection_string} found wins.
 */
public class HttpManagementApiClient implements ManagementApiClient {

    private static final Logger LOGGER = LoggerFactory.getLogger(HttpManagementApiClient.class);

    private static final List<String> HOST_FIELDS = List.of("db_host");
    private static final List<String> URL_FIELDS = List.of("pooler_url", "connection_string");
    private static final Pattern HOST_AFTER_CREDENTIALS = Pattern.compile("@([^:/?]+)");
    private static final Pattern HOST_AFTER_SCHEME = Pattern.compile("://([^:/?@]+)");

    private final HttpClient httpClient;
    private final ObjectMapper mapper;
    private final String baseUrl;
    private final Duration timeout;

    public HttpManagementApiClient() {
        this(FerryOptions.ManagementApi.DEFAULT_URL, Duration.ofSeconds(FerryOptions.Connection.CONNECT_TIMEOUT_DEFAULT));
    }

    public HttpManagementApiClient(String baseUrl, Duration timeout) {
        this(HttpClient.newBuilder().connectTimeout(timeout).build(), new ObjectMapper(), baseUrl, timeout);
    }

    HttpManagementApiClient(HttpClient httpClient, ObjectMapper mapper, String baseUrl, Duration timeout) {
        this.httpClient = httpClient;
        this.mapper = mapper;
        this.baseUrl = baseUrl.endsWith("/") ? baseUrl.substring(0, baseUrl.length() - 1) : baseUrl;
        this.timeout = timeout;
    }

    @Override
    public String resolvePoolerHost(String projectRef, String accessToken) {
        if (accessToken == null || accessToken.isBlank()) {
            throw new ManagementApiException("No access token configured for project " + projectRef);
        }
        URI uri = URI.create(baseUrl + String.format(FerryOptions.ManagementApi.POOLER_CONFIG_PATH, projectRef));
        HttpRequest request = HttpRequest.newBuilder(uri)
                .timeout(timeout)
                .header("Authorization", "Bearer " + accessToken)
                .header("Accept", "application/json")
                .GET()
                .build();

        HttpResponse<String> response;
        try {
            response = httpClient.send(request, HttpResponse.BodyHandlers.ofString());
        } catch (IOException e) {
            throw new ManagementApiException("Management API request failed: " + e.getMessage(), e);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new ManagementApiException("Management API request interrupted", e);
        }

        if (response.statusCode() / 100 != 2) {
            throw new ManagementApiException("Management API returned HTTP " + response.statusCode()
                    + " for project " + projectRef);
        }
        String host = extractHost(response.body());
        LOGGER.debug("Management API resolved project {} to {}", projectRef, host);
        return host;
    }

    String extractHost(String body) {
        JsonNode root;
        try {
            root = mapper.readTree(body);
        } catch (IOException e) {
            throw new ManagementApiException("Management API returned malformed JSON", e);
        }
        if (root != null && root.isArray()) {
            for (JsonNode entry : root) {
                String host = hostFrom(entry);
                if (host != null) {
                    return host;
                }
            }
        } else if (root != null) {
            String host = hostFrom(root);
            if (host != null) {
                return host;
            }
        }
        throw new ManagementApiException("Management API response carries no pooler host");
    }

    private String hostFrom(JsonNode node) {
        for (String field : HOST_FIELDS) {
            String value = node.path(field).asText(null);
            if (value != null && !value.isBlank()) {
                return value.trim();
            }
        }
        for (String field : URL_FIELDS) {
            String value = node.path(field).asText(null);
            if (value != null && !value.isBlank()) {
                String host = hostFromUrl(value);
                if (host != null) {
                    return host;
                }
            }
        }
        return null;
    }

    static String hostFromUrl(String url) {
        Matcher matcher = url.contains("@") ? HOST_AFTER_CREDENTIALS.matcher(url) : HOST_AFTER_SCHEME.matcher(url);
        return matcher.find() ? matcher.group(1) : null;
    }
}
