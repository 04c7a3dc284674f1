package com.federated.combiner.service;

import com.federated.combiner.model.SearchSpan;
import com.federated.combiner.model.ServiceStats;
import com.federated.combiner.model.SpanSet;
import com.federated.combiner.model.TraceSearchMetadata;

import java.util.ArrayList;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * Folds a duplicate search hit for the same trace into the one already collected.
 */
public final class SearchResultMerger {

    private SearchResultMerger() {
    }

    public static void merge(TraceSearchMetadata existing, TraceSearchMetadata incoming) {
        if (incoming == null) {
            return;
        }

        if (isEmpty(existing.getTraceId())) {
            existing.setTraceId(incoming.getTraceId());
        }
        if (isEmpty(existing.getRootServiceName())) {
            existing.setRootServiceName(incoming.getRootServiceName());
        }
        if (isEmpty(existing.getRootTraceName())) {
            existing.setRootTraceName(incoming.getRootTraceName());
        }

        // zero means unset
        if (existing.getStartTimeUnixNano() == 0 || incoming.getStartTimeUnixNano() < existing.getStartTimeUnixNano()) {
            existing.setStartTimeUnixNano(incoming.getStartTimeUnixNano());
        }
        if (existing.getDurationMs() == 0 || incoming.getDurationMs() > existing.getDurationMs()) {
            existing.setDurationMs(incoming.getDurationMs());
        }

        mergeServiceStats(existing, incoming);
        mergeSpanSets(existing, incoming);
    }

    private static void mergeServiceStats(TraceSearchMetadata existing, TraceSearchMetadata incoming) {
        if (incoming.getServiceStats() == null || incoming.getServiceStats().isEmpty()) {
            return;
        }
        if (existing.getServiceStats() == null) {
            existing.setServiceStats(new LinkedHashMap<>());
        }
        Map<String, ServiceStats> target = existing.getServiceStats();
        incoming.getServiceStats().forEach((service, stats) -> {
            ServiceStats current = target.computeIfAbsent(service, ignored -> new ServiceStats());
            if (stats == null) {
                return;
            }
            current.setSpanCount(Math.max(current.getSpanCount(), stats.getSpanCount()));
            current.setErrorCount(Math.max(current.getErrorCount(), stats.getErrorCount()));
        });
    }

    private static void mergeSpanSets(TraceSearchMetadata existing, TraceSearchMetadata incoming) {
        List<SpanSet> merged = new ArrayList<>();
        Set<String> keys = new HashSet<>();
        if (existing.getSpanSets() != null) {
            for (SpanSet spanSet : existing.getSpanSets()) {
                if (spanSet != null) {
                    merged.add(spanSet);
                    keys.add(spanSetKey(spanSet));
                }
            }
        }
        if (incoming.getSpanSets() != null) {
            for (SpanSet spanSet : incoming.getSpanSets()) {
                if (spanSet != null && keys.add(spanSetKey(spanSet))) {
                    merged.add(spanSet);
                }
            }
        }
        existing.setSpanSets(merged);
        if (!merged.isEmpty()) {
            existing.setSpanSet(merged.get(0));
        }
    }

    static String spanSetKey(SpanSet spanSet) {
        List<SearchSpan> spans = spanSet.getSpans();
        if (spans != null && !spans.isEmpty() && spans.get(0) != null) {
            return "span:" + spans.get(0).getSpanId();
        }
        return "matched:" + spanSet.getMatched();
    }

    private static boolean isEmpty(String value) {
        return value == null || value.isEmpty();
    }
}
