package com.federated.tracemerge;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.federated.tracemerge.model.MergedTrace;
import com.federated.tracemerge.model.ResourceSpans;
import com.federated.tracemerge.model.ScopeSpans;
import com.federated.tracemerge.model.Span;
import com.federated.tracemerge.model.Trace;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.HashMap;
import java.util.HashSet;
import java.util.List;
import java.util.Set;

/**
 * Unions spans from several fragments of the same trace. A span is identified by its span id,
 * parent span id and kind, so client and server halves that share a span id are both kept.
 * Not thread-safe.
 */
public class SpanDedupTraceMerger implements TraceMerger {

    private static final Logger log = LoggerFactory.getLogger(SpanDedupTraceMerger.class);

    private final long maxSizeBytes;
    private final boolean dedupeSpans;
    private final ObjectMapper objectMapper;
    private final Trace merged = new Trace();
    private final Set<SpanKey> seen = new HashSet<>();
    private long sizeBytes;
    private int spanCount;

    public SpanDedupTraceMerger(long maxSizeBytes, boolean dedupeSpans) {
        this(maxSizeBytes, dedupeSpans, new ObjectMapper());
    }

    public SpanDedupTraceMerger(long maxSizeBytes, boolean dedupeSpans, ObjectMapper objectMapper) {
        this.maxSizeBytes = Math.max(0L, maxSizeBytes);
        this.dedupeSpans = dedupeSpans;
        this.objectMapper = objectMapper;
    }

    @Override
    public int consume(Trace fragment) throws TraceMergeException {
        if (fragment == null || !fragment.hasResourceSpans()) {
            return 0;
        }

        Set<SpanKey> pendingKeys = new HashSet<>();
        List<ResourceSpans> admittedResources = new ArrayList<>();
        int admitted = 0;
        for (ResourceSpans rs : fragment.getResourceSpans()) {
            if (rs == null || rs.getScopeSpans() == null) {
                continue;
            }
            List<ScopeSpans> keptScopes = new ArrayList<>();
            for (ScopeSpans ss : rs.getScopeSpans()) {
                if (ss == null || ss.getSpans() == null) {
                    continue;
                }
                List<Span> keptSpans = new ArrayList<>();
                for (Span span : ss.getSpans()) {
                    if (span == null) {
                        continue;
                    }
                    if (dedupeSpans) {
                        SpanKey key = SpanKey.of(span);
                        if (seen.contains(key) || !pendingKeys.add(key)) {
                            continue;
                        }
                    }
                    keptSpans.add(span);
                }
                if (!keptSpans.isEmpty()) {
                    keptScopes.add(new ScopeSpans(ss.getScopeName(), ss.getScopeVersion(), keptSpans));
                    admitted += keptSpans.size();
                }
            }
            if (!keptScopes.isEmpty()) {
                admittedResources.add(new ResourceSpans(copyAttributes(rs), keptScopes));
            }
        }
        if (admitted == 0) {
            return 0;
        }

        // only spans that grow the merged trace count against the ceiling
        long admittedSize = measure(new Trace(admittedResources));
        if (maxSizeBytes > 0 && sizeBytes + admittedSize > maxSizeBytes) {
            log.debug("trace fragment rejected admitted_bytes={} merged_bytes={} max_bytes={}",
                    admittedSize, sizeBytes, maxSizeBytes);
            throw new TraceTooLargeException(sizeBytes + admittedSize, maxSizeBytes);
        }

        sizeBytes += admittedSize;
        seen.addAll(pendingKeys);
        merged.getResourceSpans().addAll(admittedResources);
        spanCount += admitted;
        return admitted;
    }

    @Override
    public MergedTrace result() {
        return new MergedTrace(merged, spanCount);
    }

    private long measure(Trace fragment) throws TraceMergeException {
        try {
            return objectMapper.writeValueAsBytes(fragment).length;
        } catch (JsonProcessingException ex) {
            throw new TraceMergeException("unable to measure trace fragment", ex);
        }
    }

    private static HashMap<String, String> copyAttributes(ResourceSpans rs) {
        return rs.getResourceAttributes() == null ? new HashMap<>() : new HashMap<>(rs.getResourceAttributes());
    }

    private record SpanKey(String spanId, String parentSpanId, String kind) {
        static SpanKey of(Span span) {
            return new SpanKey(span.getSpanId(), span.getParentSpanId(), span.getKind());
        }
    }
}
