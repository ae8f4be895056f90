package com.chmonitor.client;

import com.chmonitor.model.HostConfig;
import com.zaxxer.hikari.HikariConfig;
import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;

class HikariClientFactoryTest {

    private final HikariClientFactory factory = new HikariClientFactory(8, 2, 3000);

    @Test
    void configuresOnePoolPerHost() {
        HostConfig host = HostConfig.builder().id(3).host("http://ch3:8123").user("monitor").password("pw").build();

        HikariConfig config = factory.buildHikariConfig(host);

        assertThat(config.getPoolName()).isEqualTo("ch-host-3");
        assertThat(config.getJdbcUrl()).isEqualTo("jdbc:clickhouse:http://ch3:8123");
        assertThat(config.getUsername()).isEqualTo("monitor");
        assertThat(config.getPassword()).isEqualTo("pw");
        assertThat(config.getMaximumPoolSize()).isEqualTo(8);
        assertThat(config.getMinimumIdle()).isEqualTo(2);
        assertThat(config.getConnectionTimeout()).isEqualTo(3000);
        assertThat(config.getExceptionOverrideClassName()).isEqualTo(HikariSqlExceptionOverride.class.getName());
    }

    @Test
    void fallsBackToDefaultUser() {
        HostConfig host = HostConfig.builder().id(0).host("http://localhost:8123").build();

        HikariConfig config = factory.buildHikariConfig(host);

        assertThat(config.getUsername()).isEqualTo("default");
        assertThat(config.getPassword()).isEmpty();
    }
}
