package com.federated.combiner.model;

import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;

@Data
@NoArgsConstructor
@AllArgsConstructor
public class MetadataMetrics {
    private long inspectedBytes;
    private long totalBlocks;
    private long totalJobs;
    private long completedJobs;
    private long totalBlockBytes;
}
