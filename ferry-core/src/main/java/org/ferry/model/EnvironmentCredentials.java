package org.ferry.model;

import lombok.Builder;
import lombok.ToString;
import lombok.Value;

/**
 * Everything needed to reach one named environment.
 */
@Value
@Builder(toBuilder = true)
public class EnvironmentCredentials {
    String name;
    String projectRef;
    @ToString.Exclude
    String password;
    String poolerRegion;
    int poolerPort;
    @ToString.Exclude
    String accessToken;
    String database;

    public boolean hasAccessToken() {
        return accessToken != null && !accessToken.isBlank();
    }
}
