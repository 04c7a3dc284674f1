package com.federated.tracemerge.model;

public record MergedTrace(Trace trace, int spanCount) {
}
