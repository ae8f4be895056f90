package com.chmonitor.model;

import lombok.Builder;
import lombok.Data;

@Data
@Builder
public class TableCacheMetrics {
    private int size;
    private int maxSize;
    private String memoryLimit;
    private String ttl;
    /**
     * {@code empty} when nothing is cached yet, otherwise {@code available}.
     */
    private String hitRate;
}
