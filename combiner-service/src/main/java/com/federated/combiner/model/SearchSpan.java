package com.federated.combiner.model;

import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.LinkedHashMap;
import java.util.Map;

@Data
@NoArgsConstructor
@AllArgsConstructor
public class SearchSpan {
    private String spanId;
    private String name;
    private long startTimeUnixNano;
    private long durationNanos;
    private Map<String, Object> attributes = new LinkedHashMap<>();

    public SearchSpan(String spanId) {
        this.spanId = spanId;
    }
}
