package com.chmonitor.util;

import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;

class ClickHouseIntervalTest {

    @Test
    void minuteBucketsKeepDateTime() {
        ClickHouseInterval interval = ClickHouseInterval.TO_START_OF_FIVE_MINUTES;

        assertThat(interval.apply("event_time", null)).isEqualTo("toStartOfFiveMinutes(event_time) AS event_time");
        assertThat(interval.fillStep()).isEqualTo("toIntervalMinute(5)");
        assertThat(interval.nowOrToday()).isEqualTo("now()");
    }

    @Test
    void dayBucketsAreWrappedInToDate() {
        ClickHouseInterval interval = ClickHouseInterval.TO_START_OF_DAY;

        assertThat(interval.apply("event_time", "day")).isEqualTo("toDate(toStartOfDay(event_time)) AS day");
        assertThat(interval.nowOrToday()).isEqualTo("today()");
    }

    @Test
    void resolvesByFunctionName() {
        assertThat(ClickHouseInterval.fromFunction("toStartOfHour")).contains(ClickHouseInterval.TO_START_OF_HOUR);
        assertThat(ClickHouseInterval.fromFunction("toStartOfCentury")).isEmpty();
    }
}
