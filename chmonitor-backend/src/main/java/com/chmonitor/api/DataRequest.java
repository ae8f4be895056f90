package com.chmonitor.api;

import jakarta.validation.constraints.Min;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.Size;
import lombok.Data;

import java.util.LinkedHashMap;
import java.util.Map;

@Data
public class DataRequest {
    @NotBlank(message = "query is required")
    @Size(max = 100_000, message = "query must be at most 100000 characters")
    private String query;
    private Map<String, Object> queryParams = new LinkedHashMap<>();
    @Min(value = 0, message = "hostId must be a non-negative integer")
    private int hostId;
    private String format = "JSONEachRow";
    private Map<String, Object> settings = new LinkedHashMap<>();
}
