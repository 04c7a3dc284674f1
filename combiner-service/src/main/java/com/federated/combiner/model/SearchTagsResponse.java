package com.federated.combiner.model;

import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.ArrayList;
import java.util.List;

@Data
@NoArgsConstructor
@AllArgsConstructor
public class SearchTagsResponse {
    private List<String> tagNames = new ArrayList<>();
    private MetadataMetrics metrics;
}
