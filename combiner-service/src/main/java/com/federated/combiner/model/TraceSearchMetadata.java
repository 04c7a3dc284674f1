package com.federated.combiner.model;

import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

@Data
@NoArgsConstructor
public class TraceSearchMetadata {
    private String traceId;
    private String rootServiceName;
    private String rootTraceName;
    private long startTimeUnixNano;
    private long durationMs;
    private Map<String, ServiceStats> serviceStats = new LinkedHashMap<>();
    // Superseded by spanSets, still read by older clients.
    private SpanSet spanSet;
    private List<SpanSet> spanSets = new ArrayList<>();

    public TraceSearchMetadata(String traceId, String rootServiceName, String rootTraceName, long startTimeUnixNano, long durationMs) {
        this.traceId = traceId;
        this.rootServiceName = rootServiceName;
        this.rootTraceName = rootTraceName;
        this.startTimeUnixNano = startTimeUnixNano;
        this.durationMs = durationMs;
    }

    public static TraceSearchMetadata copyOf(TraceSearchMetadata source) {
        TraceSearchMetadata copy = new TraceSearchMetadata(
                source.traceId,
                source.rootServiceName,
                source.rootTraceName,
                source.startTimeUnixNano,
                source.durationMs
        );
        if (source.serviceStats != null) {
            source.serviceStats.forEach((service, stats) -> copy.serviceStats.put(
                    service,
                    stats == null ? new ServiceStats() : new ServiceStats(stats.getSpanCount(), stats.getErrorCount())
            ));
        }
        if (source.spanSets != null) {
            copy.spanSets.addAll(source.spanSets);
        }
        copy.spanSet = source.spanSet;
        return copy;
    }
}
