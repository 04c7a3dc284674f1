package com.federated.combiner.model;

import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.ArrayList;
import java.util.List;

@Data
@NoArgsConstructor
@AllArgsConstructor
public class SearchTagsV2Response {
    private List<SearchTagsV2Scope> scopes = new ArrayList<>();
    private MetadataMetrics metrics;
}
