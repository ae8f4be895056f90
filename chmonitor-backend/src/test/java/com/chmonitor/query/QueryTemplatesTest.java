package com.chmonitor.query;

import com.chmonitor.util.ClickHouseInterval;
import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;

class QueryTemplatesTest {

    @Test
    void expandsAllMacros() {
        String sql = "SELECT $interval(event_time), count() FROM system.query_log "
                + "GROUP BY event_time ORDER BY event_time WITH FILL TO $nowOrToday STEP $fillStep";

        assertThat(QueryTemplates.expand(sql, ClickHouseInterval.TO_START_OF_DAY)).isEqualTo(
                "SELECT toDate(toStartOfDay(event_time)) AS event_time, count() FROM system.query_log "
                        + "GROUP BY event_time ORDER BY event_time WITH FILL TO today() STEP toIntervalDay(1)");
    }

    @Test
    void defaultsToHourlyBuckets() {
        assertThat(QueryTemplates.expand("SELECT $interval(event_time, ts)", null))
                .isEqualTo("SELECT toStartOfHour(event_time) AS ts");
    }

    @Test
    void leavesPlainSqlAlone() {
        String sql = "SELECT '$100' AS price";

        assertThat(QueryTemplates.hasMacros(sql)).isFalse();
        assertThat(QueryTemplates.expand(sql, ClickHouseInterval.TO_START_OF_MINUTE)).isSameAs(sql);
    }
}
