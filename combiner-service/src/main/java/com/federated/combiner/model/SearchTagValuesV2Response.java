package com.federated.combiner.model;

import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.ArrayList;
import java.util.List;

@Data
@NoArgsConstructor
@AllArgsConstructor
public class SearchTagValuesV2Response {
    private List<TagValue> tagValues = new ArrayList<>();
    private MetadataMetrics metrics;
}
