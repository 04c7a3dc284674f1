package com.federated.tracemerge;

import com.federated.tracemerge.model.ResourceSpans;
import com.federated.tracemerge.model.ScopeSpans;
import com.federated.tracemerge.model.Span;
import com.federated.tracemerge.model.Trace;

import java.util.Comparator;
import java.util.List;

/**
 * Puts a trace into canonical order: spans by start time then span id, scopes and resources by
 * the earliest span they hold.
 */
public final class TraceSorter {

    // null entries sort last and are otherwise left alone
    private static final Comparator<Span> SPAN_ORDER = Comparator.nullsLast(Comparator
            .comparingLong(Span::getStartTimeUnixNano)
            .thenComparing(span -> span.getSpanId() == null ? "" : span.getSpanId()));
    private static final Comparator<ScopeSpans> SCOPE_ORDER =
            Comparator.nullsLast(Comparator.comparingLong(TraceSorter::scopeStart));
    private static final Comparator<ResourceSpans> RESOURCE_ORDER =
            Comparator.nullsLast(Comparator.comparingLong(TraceSorter::resourceStart));

    private TraceSorter() {
    }

    public static Trace sort(Trace trace) {
        if (trace == null || trace.getResourceSpans() == null) {
            return trace;
        }
        for (ResourceSpans rs : trace.getResourceSpans()) {
            if (rs == null || rs.getScopeSpans() == null) {
                continue;
            }
            for (ScopeSpans ss : rs.getScopeSpans()) {
                if (ss != null && ss.getSpans() != null) {
                    ss.getSpans().sort(SPAN_ORDER);
                }
            }
            rs.getScopeSpans().sort(SCOPE_ORDER);
        }
        trace.getResourceSpans().sort(RESOURCE_ORDER);
        return trace;
    }

    private static long scopeStart(ScopeSpans ss) {
        return earliest(ss.getSpans());
    }

    private static long resourceStart(ResourceSpans rs) {
        long earliest = Long.MAX_VALUE;
        if (rs.getScopeSpans() != null) {
            for (ScopeSpans ss : rs.getScopeSpans()) {
                if (ss != null) {
                    earliest = Math.min(earliest, scopeStart(ss));
                }
            }
        }
        return earliest;
    }

    private static long earliest(List<Span> spans) {
        long earliest = Long.MAX_VALUE;
        if (spans != null) {
            for (Span span : spans) {
                if (span != null) {
                    earliest = Math.min(earliest, span.getStartTimeUnixNano());
                }
            }
        }
        return earliest;
    }
}
