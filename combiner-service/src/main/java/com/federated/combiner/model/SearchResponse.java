package com.federated.combiner.model;

import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.ArrayList;
import java.util.List;

@Data
@NoArgsConstructor
@AllArgsConstructor
public class SearchResponse {
    private List<TraceSearchMetadata> traces = new ArrayList<>();
    private SearchMetrics metrics;
}
