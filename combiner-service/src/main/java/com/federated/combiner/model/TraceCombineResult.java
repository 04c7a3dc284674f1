package com.federated.combiner.model;

import com.federated.tracemerge.model.Trace;

public class TraceCombineResult {
    private Trace trace;
    private CombineMetadata metadata;

    public TraceCombineResult() {
    }

    public TraceCombineResult(Trace trace, CombineMetadata metadata) {
        this.trace = trace;
        this.metadata = metadata;
    }

    public Trace getTrace() {
        return trace;
    }

    public void setTrace(Trace trace) {
        this.trace = trace;
    }

    public CombineMetadata getMetadata() {
        return metadata;
    }

    public void setMetadata(CombineMetadata metadata) {
        this.metadata = metadata;
    }
}
