package com.federated.combiner.model;

import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

@Data
@NoArgsConstructor
@AllArgsConstructor
public class SpanSet {
    private List<SearchSpan> spans = new ArrayList<>();
    private int matched;
    private Map<String, Object> attributes = new LinkedHashMap<>();

    public SpanSet(List<SearchSpan> spans, int matched) {
        this(spans, matched, new LinkedHashMap<>());
    }
}
