package com.chmonitor.util;

import java.util.Arrays;
import java.util.Optional;

/**
 * Time bucketing functions offered to chart queries.
 */
public enum ClickHouseInterval {
    TO_START_OF_MINUTE("toStartOfMinute", "toIntervalMinute(1)", false),
    TO_START_OF_FIVE_MINUTES("toStartOfFiveMinutes", "toIntervalMinute(5)", false),
    TO_START_OF_TEN_MINUTES("toStartOfTenMinutes", "toIntervalMinute(10)", false),
    TO_START_OF_FIFTEEN_MINUTES("toStartOfFifteenMinutes", "toIntervalMinute(15)", false),
    TO_START_OF_HOUR("toStartOfHour", "toIntervalHour(1)", false),
    TO_START_OF_DAY("toStartOfDay", "toIntervalDay(1)", true),
    TO_START_OF_WEEK("toStartOfWeek", "toIntervalDay(7)", true),
    TO_START_OF_MONTH("toStartOfMonth", "toIntervalMonth(1)", true);

    private final String function;
    private final String fillStep;
    private final boolean dateGranularity;

    ClickHouseInterval(String function, String fillStep, boolean dateGranularity) {
        this.function = function;
        this.fillStep = fillStep;
        this.dateGranularity = dateGranularity;
    }

    public static Optional<ClickHouseInterval> fromFunction(String function) {
        return Arrays.stream(values()).filter(v -> v.function.equals(function)).findFirst();
    }

    public String getFunction() {
        return function;
    }

    /**
     * Bucketing expression for {@code column}, aliased to {@code alias} or to the column itself.
     * Day and coarser buckets are wrapped in {@code toDate}.
     *
     * @param column column expression
     * @param alias alias, may be null
     * @return select expression
     */
    public String apply(String column, String alias) {
        String name = alias != null && !alias.isBlank() ? alias : column;
        String bucket = function + "(" + column + ")";
        if (dateGranularity) {
            bucket = "toDate(" + bucket + ")";
        }
        return bucket + " AS " + name;
    }

    /**
     * Step for {@code WITH FILL ... STEP}.
     *
     * @return interval expression
     */
    public String fillStep() {
        return fillStep;
    }

    public String nowOrToday() {
        return dateGranularity ? "today()" : "now()";
    }
}
