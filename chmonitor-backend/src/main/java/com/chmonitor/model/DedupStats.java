package com.chmonitor.model;

import lombok.AllArgsConstructor;
import lombok.Data;

import java.time.Instant;

@Data
@AllArgsConstructor
public class DedupStats {
    private int pending;
    /**
     * Start time of the oldest in-flight request, {@code null} when nothing is pending.
     */
    private Instant oldestTimestamp;
}
