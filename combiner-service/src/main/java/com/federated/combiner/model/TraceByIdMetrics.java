package com.federated.combiner.model;

public class TraceByIdMetrics {
    private long inspectedBytes;

    public TraceByIdMetrics() {
    }

    public TraceByIdMetrics(long inspectedBytes) {
        this.inspectedBytes = inspectedBytes;
    }

    public long getInspectedBytes() {
        return inspectedBytes;
    }

    public void setInspectedBytes(long inspectedBytes) {
        this.inspectedBytes = inspectedBytes;
    }
}
