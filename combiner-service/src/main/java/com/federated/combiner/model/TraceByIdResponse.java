package com.federated.combiner.model;

import com.federated.tracemerge.model.Trace;

public class TraceByIdResponse {
    private Trace trace;
    private TraceByIdMetrics metrics;

    public TraceByIdResponse() {
    }

    public TraceByIdResponse(Trace trace, TraceByIdMetrics metrics) {
        this.trace = trace;
        this.metrics = metrics;
    }

    public Trace getTrace() {
        return trace;
    }

    public void setTrace(Trace trace) {
        this.trace = trace;
    }

    public TraceByIdMetrics getMetrics() {
        return metrics;
    }

    public void setMetrics(TraceByIdMetrics metrics) {
        this.metrics = metrics;
    }
}
