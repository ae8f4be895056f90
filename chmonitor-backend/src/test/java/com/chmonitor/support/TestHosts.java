package com.chmonitor.support;

import com.chmonitor.model.HostConfig;
import com.chmonitor.service.HostRegistry;

import java.util.ArrayList;
import java.util.List;

public final class TestHosts {

    private TestHosts() {
    }

    public static HostConfig host(int id) {
        return HostConfig.builder()
                .id(id)
                .host("http://ch" + id + ":8123")
                .user("default")
                .password("")
                .build();
    }

    public static HostRegistry registry(int count) {
        List<HostConfig> hosts = new ArrayList<>();
        for (int i = 0; i < count; i++) {
            hosts.add(host(i));
        }
        return new HostRegistry(hosts);
    }
}
