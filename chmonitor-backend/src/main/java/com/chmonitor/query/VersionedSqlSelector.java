package com.chmonitor.query;

import com.chmonitor.model.EngineVersion;
import com.chmonitor.model.VersionedSql;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;

/**
 * Picks the SQL variant that matches a ClickHouse server version.
 */
public final class VersionedSqlSelector {
    private static final Comparator<VersionedSql> BY_SINCE =
            Comparator.comparing(v -> EngineVersion.parse(v.getSince()));

    private VersionedSqlSelector() {
    }

    /**
     * Selects the entry with the greatest {@code since} not above {@code version}.
     *
     * <p>When the version is unknown or older than every entry, the entry with the smallest
     * {@code since} is returned.
     *
     * @param entries variants, in any order
     * @param version server version, or {@code null} when it could not be detected
     * @return chosen variant
     * @throws IllegalArgumentException when {@code entries} is empty or a {@code since} is malformed
     */
    public static VersionedSql select(List<VersionedSql> entries, EngineVersion version) {
        if (entries == null || entries.isEmpty()) {
            throw new IllegalArgumentException("No SQL variants defined");
        }
        List<VersionedSql> sorted = new ArrayList<>(entries);
        sorted.sort(BY_SINCE);

        if (version == null) {
            return sorted.get(0);
        }
        VersionedSql chosen = sorted.get(0);
        for (VersionedSql candidate : sorted) {
            if (EngineVersion.parse(candidate.getSince()).compareTo(version) <= 0) {
                chosen = candidate;
            } else {
                break;
            }
        }
        return chosen;
    }

    public static String selectSql(List<VersionedSql> entries, EngineVersion version) {
        return select(entries, version).getSql();
    }
}
