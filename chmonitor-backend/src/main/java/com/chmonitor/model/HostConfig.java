package com.chmonitor.model;

import lombok.Builder;
import lombok.ToString;
import lombok.Value;

/**
 * Connection descriptor for one ClickHouse host.
 *
 * <p>Instances are created once by {@link com.chmonitor.service.HostRegistry} and never mutated.
 */
@Value
@Builder
public class HostConfig {
    int id;
    String host;
    String user;
    @ToString.Exclude
    String password;
    /**
     * Server-side execution ceiling in seconds, or null to use the server default.
     */
    Integer maxExecutionTime;
    String timezone;
    String customName;

    /**
     * Name shown to operators: the configured custom name, or the host address.
     *
     * @return display name
     */
    public String getDisplayName() {
        return customName != null && !customName.isBlank() ? customName : host;
    }
}
