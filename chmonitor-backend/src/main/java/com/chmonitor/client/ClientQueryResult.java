package com.chmonitor.client;

import lombok.Builder;
import lombok.Value;

import java.util.List;
import java.util.Map;

@Value
@Builder
public class ClientQueryResult {
    List<Map<String, Object>> rows;
    long rowCount;
    long durationMs;
    String queryId;
}
