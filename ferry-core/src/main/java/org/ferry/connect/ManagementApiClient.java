package org.ferry.connect;

/**
 * Looks up the connection host of a project through the hosting provider's management API.
 */
public interface ManagementApiClient {

    /**
     * @return pooler host name for the project
     * @throws ManagementApiException if the lookup fails or the response carries no host
     */
    String resolvePoolerHost(String projectRef, String accessToken);
}
