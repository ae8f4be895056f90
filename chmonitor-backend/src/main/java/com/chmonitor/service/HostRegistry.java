package com.chmonitor.service;

import com.chmonitor.model.HostConfig;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Service;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collections;
import java.util.List;
import java.util.Optional;
import java.util.regex.Pattern;

/**
 * Read-only catalog of the ClickHouse hosts this process talks to.
 *
 * <p>Hosts are configured as comma separated lists ({@code CLICKHOUSE_HOST},
 * {@code CLICKHOUSE_USER}, ...) where the n-th entry of each list describes host {@code n}. A list
 * with a single entry applies to every host.
 */
@Slf4j
@Service
public class HostRegistry {
    private static final Pattern HOST_ID = Pattern.compile("\\d+");

    private final List<HostConfig> hosts;

    @Autowired
    public HostRegistry(
            @Value("${chmonitor.clickhouse.host:}") String hosts,
            @Value("${chmonitor.clickhouse.user:}") String users,
            @Value("${chmonitor.clickhouse.password:}") String passwords,
            @Value("${chmonitor.clickhouse.name:}") String names,
            @Value("${chmonitor.clickhouse.max-execution-time:}") String maxExecutionTimes,
            @Value("${chmonitor.clickhouse.timezone:}") String timezones
    ) {
        this(load(hosts, users, passwords, names, maxExecutionTimes, timezones));
    }

    public HostRegistry(List<HostConfig> hosts) {
        this.hosts = Collections.unmodifiableList(new ArrayList<>(hosts));
        if (this.hosts.isEmpty()) {
            log.error("No ClickHouse hosts configured. Set CLICKHOUSE_HOST, e.g. CLICKHOUSE_HOST=http://localhost:8123");
        } else {
            log.info("Loaded {} ClickHouse host(s)", this.hosts.size());
        }
    }

    public List<HostConfig> list() {
        return hosts;
    }

    public boolean isEmpty() {
        return hosts.isEmpty();
    }

    public Optional<HostConfig> find(int hostId) {
        if (hostId < 0 || hostId >= hosts.size()) {
            return Optional.empty();
        }
        return Optional.of(hosts.get(hostId));
    }

    /**
     * Looks up a host.
     *
     * @param hostId host id
     * @return host configuration
     * @throws HostNotFoundException for unknown ids
     */
    public HostConfig get(int hostId) {
        if (hosts.isEmpty()) {
            throw new HostNotFoundException("No ClickHouse hosts configured. Please set CLICKHOUSE_HOST environment variable.");
        }
        return find(hostId).orElseThrow(() -> new HostNotFoundException(
                "Invalid hostId: " + hostId + ". Available hosts: 0-" + (hosts.size() - 1)));
    }

    /**
     * Parses a host id coming from a request parameter. Only plain non-negative integers are
     * accepted; a missing value means host 0.
     *
     * @param raw raw value
     * @return host id
     */
    public static int parseHostId(String raw) {
        if (raw == null || raw.isBlank()) {
            return 0;
        }
        String trimmed = raw.trim();
        if (!HOST_ID.matcher(trimmed).matches()) {
            throw new HostNotFoundException("Invalid hostId: " + raw + ". Must be a non-negative integer.");
        }
        try {
            return Integer.parseInt(trimmed);
        } catch (NumberFormatException e) {
            throw new HostNotFoundException("Invalid hostId: " + raw + ". Must be a non-negative integer.");
        }
    }

    static List<HostConfig> load(
            String hosts,
            String users,
            String passwords,
            String names,
            String maxExecutionTimes,
            String timezones
    ) {
        List<String> hostList = split(hosts, true);
        List<String> userList = split(users, false);
        List<String> passwordList = split(passwords, false);
        List<String> nameList = split(names, false);
        List<String> maxExecList = split(maxExecutionTimes, false);
        List<String> tzList = split(timezones, false);

        List<HostConfig> configs = new ArrayList<>(hostList.size());
        for (int i = 0; i < hostList.size(); i++) {
            String maxExec = pick(maxExecList, i);
            configs.add(HostConfig.builder()
                    .id(i)
                    .host(hostList.get(i))
                    .user(orDefault(pick(userList, i), "default"))
                    .password(orDefault(pick(passwordList, i), ""))
                    .customName(blankToNull(pick(nameList, i)))
                    .maxExecutionTime(parseSeconds(maxExec))
                    .timezone(blankToNull(pick(tzList, i)))
                    .build());
        }
        return configs;
    }

    private static List<String> split(String value, boolean dropEmpty) {
        if (value == null || value.isBlank()) {
            return List.of();
        }
        List<String> out = new ArrayList<>();
        for (String part : value.split(",", -1)) {
            String trimmed = part.trim();
            if (dropEmpty && trimmed.isEmpty()) {
                continue;
            }
            out.add(trimmed);
        }
        return out;
    }

    private static String pick(List<String> values, int index) {
        if (values.isEmpty()) {
            return null;
        }
        if (values.size() == 1) {
            return values.get(0);
        }
        return index < values.size() ? values.get(index) : null;
    }

    private static String orDefault(String value, String defaultValue) {
        return value == null || value.isEmpty() ? defaultValue : value;
    }

    private static String blankToNull(String value) {
        return value == null || value.isBlank() ? null : value;
    }

    private static Integer parseSeconds(String value) {
        if (value == null || value.isBlank()) {
            return null;
        }
        try {
            int seconds = Integer.parseInt(value);
            return seconds > 0 ? seconds : null;
        } catch (NumberFormatException e) {
            throw new IllegalArgumentException("Invalid max execution time: " + value, e);
        }
    }

    @Override
    public String toString() {
        return "HostRegistry" + Arrays.toString(hosts.stream().map(HostConfig::getHost).toArray());
    }
}
