package com.chmonitor.api;

import lombok.AllArgsConstructor;
import lombok.Data;

/**
 * Host entry exposed to clients. Credentials are never included.
 */
@Data
@AllArgsConstructor
public class HostSummary {
    private int id;
    private String host;
    private String name;
}
