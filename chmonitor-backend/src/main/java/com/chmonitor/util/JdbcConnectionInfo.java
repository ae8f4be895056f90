package com.chmonitor.util;

import lombok.Builder;
import lombok.Data;
import lombok.ToString;

@Data
@Builder
public class JdbcConnectionInfo {
    private String url;
    private String username;
    @ToString.Exclude
    private String password;
}
