package com.federated.combiner.model;

import lombok.Data;

@Data
public class SearchMetrics {
    private long inspectedTraces;
    private long inspectedBytes;
    private long totalBlocks;
    private long completedJobs;
    private long totalJobs;
    private long totalBlockBytes;
    private long inspectedSpans;
}
