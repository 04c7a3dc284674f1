package com.federated.combiner.service;

import com.federated.tracemerge.TraceMerger;

@FunctionalInterface
public interface TraceMergerFactory {
    TraceMerger create(long maxSizeBytes, boolean dedupeSpans);
}
