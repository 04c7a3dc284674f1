package com.federated.combiner.service;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.federated.combiner.model.CombineMetadata;
import com.federated.combiner.model.InstanceResult;
import com.federated.combiner.model.MetadataMetrics;
import com.federated.combiner.model.SearchCombineResult;
import com.federated.combiner.model.SearchMetadata;
import com.federated.combiner.model.SearchMetrics;
import com.federated.combiner.model.SearchResponse;
import com.federated.combiner.model.SearchTagValuesResponse;
import com.federated.combiner.model.SearchTagValuesV2Response;
import com.federated.combiner.model.SearchTagsResponse;
import com.federated.combiner.model.SearchTagsV2Response;
import com.federated.combiner.model.SearchTagsV2Scope;
import com.federated.combiner.model.TagValue;
import com.federated.combiner.model.TraceByIdResponse;
import com.federated.combiner.model.TraceCombineResult;
import com.federated.combiner.model.TraceSearchMetadata;
import com.federated.tracemerge.SpanDedupTraceMerger;
import com.federated.tracemerge.TraceMergeException;
import com.federated.tracemerge.TraceMerger;
import com.federated.tracemerge.TraceSorter;
import com.federated.tracemerge.model.MergedTrace;
import com.federated.tracemerge.model.Trace;
import io.micrometer.core.instrument.MeterRegistry;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Service;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.TreeMap;
import java.util.TreeSet;
import java.util.concurrent.TimeUnit;
import java.util.function.Consumer;
import java.util.function.Function;

/**
 * Merges the per-instance results of one federated query into a single response.
 *
 * <p>No operation throws because an instance failed: failures are counted and described in the
 * returned metadata next to a best-effort merged payload. Each call builds its own state, so one
 * instance can be shared between request threads.
 */
@Service
public class ResultCombiner {

    private static final long DEFAULT_MAX_SIZE_BYTES = 50L * 1024 * 1024;
    private static final String OP_TRACE = "trace";
    private static final String OP_TRACE_V2 = "trace_v2";
    private static final String OP_SEARCH = "search";
    private static final String OP_TAGS = "tags";
    private static final String OP_TAGS_V2 = "tags_v2";
    private static final String OP_TAG_VALUES = "tag_values";
    private static final String OP_TAG_VALUES_V2 = "tag_values_v2";
    private static final String NOT_FOUND_CAUSE = "not found";
    private static final String CONSUME_ERROR_PREFIX = "consume error: ";

    private static final Comparator<TraceSearchMetadata> MOST_RECENT_FIRST = Comparator
            .comparingLong(TraceSearchMetadata::getStartTimeUnixNano).reversed()
            .thenComparing(t -> t.getTraceId() == null ? "" : t.getTraceId());

    private final long maxSizeBytes;
    private final boolean dedupeSpans;
    private final TraceMergerFactory traceMergerFactory;
    private final MeterRegistry meterRegistry;
    private final Logger log;

    public ResultCombiner() {
        this(DEFAULT_MAX_SIZE_BYTES, true, new ObjectMapper(), null);
    }

    @Autowired
    public ResultCombiner(
            @Value("${combiner.trace.max-size-bytes:52428800}") long maxSizeBytes,
            @Value("${combiner.trace.dedupe-spans:true}") boolean dedupeSpans,
            ObjectMapper objectMapper,
            MeterRegistry meterRegistry
    ) {
        this(
                maxSizeBytes,
                dedupeSpans,
                (max, dedupe) -> new SpanDedupTraceMerger(max, dedupe, objectMapper),
                meterRegistry,
                LoggerFactory.getLogger(ResultCombiner.class)
        );
    }

    public ResultCombiner(
            long maxSizeBytes,
            boolean dedupeSpans,
            TraceMergerFactory traceMergerFactory,
            MeterRegistry meterRegistry,
            Logger log
    ) {
        this.maxSizeBytes = Math.max(0L, maxSizeBytes);
        this.dedupeSpans = dedupeSpans;
        this.traceMergerFactory = traceMergerFactory;
        this.meterRegistry = meterRegistry;
        this.log = log;
    }

    public TraceCombineResult combineTrace(List<InstanceResult<Trace>> results) {
        return combineTraceResults(OP_TRACE, results, Function.identity());
    }

    /**
     * Same as {@link #combineTrace(List)} for instances answering with the response envelope. Only the
     * traces are merged; the per-instance metrics in the envelope are not carried over.
     */
    public TraceCombineResult combineTraceV2(List<InstanceResult<TraceByIdResponse>> results) {
        return combineTraceResults(OP_TRACE_V2, results, TraceByIdResponse::getTrace);
    }

    private <T> TraceCombineResult combineTraceResults(
            String op,
            List<InstanceResult<T>> results,
            Function<T, Trace> traceOf
    ) {
        long start = System.nanoTime();
        List<InstanceResult<T>> safeResults = results == null ? List.of() : results;
        CombineMetadata metadata = new CombineMetadata(safeResults.size());
        TraceMerger merger = traceMergerFactory.create(maxSizeBytes, dedupeSpans);
        int spanTally = 0;

        for (InstanceResult<T> result : safeResults) {
            if (result == null) {
                continue;
            }
            if (result instanceof InstanceResult.Failure<T> failure) {
                metadata.setInstancesFailed(metadata.getInstancesFailed() + 1);
                metadata.addError(failure.instance(), failure.cause());
                recordFailure(op, failure);
                continue;
            }
            if (result instanceof InstanceResult.NotFound<T> notFound) {
                metadata.setInstancesResponded(metadata.getInstancesResponded() + 1);
                metadata.setInstancesNotFound(metadata.getInstancesNotFound() + 1);
                recordNotFound(op, notFound.instance());
                continue;
            }

            InstanceResult.Success<T> success = (InstanceResult.Success<T>) result;
            metadata.setInstancesResponded(metadata.getInstancesResponded() + 1);
            Trace trace = success.payload() == null ? null : traceOf.apply(success.payload());
            if (trace == null || !trace.hasResourceSpans()) {
                metadata.setInstancesNotFound(metadata.getInstancesNotFound() + 1);
                log.debug("event=instance_empty_trace op={} instance={}", op, success.instance());
                continue;
            }

            metadata.setInstancesWithTrace(metadata.getInstancesWithTrace() + 1);
            try {
                spanTally += merger.consume(trace);
            } catch (TraceMergeException ex) {
                metadata.addError(success.instance(), CONSUME_ERROR_PREFIX + ex.getMessage());
                incrementCounter("federated_trace_consume_error_total", op);
                log.warn("event=trace_consume_failed op={} instance={} cause={}", op, success.instance(), ex.getMessage());
            }
        }

        metadata.setPartialResponse(metadata.getInstancesFailed() > 0);
        metadata.setTotalSpans(spanTally);

        MergedTrace merged = merger.result();
        if (merged.spanCount() != 0) {
            metadata.setTotalSpans(merged.spanCount());
        }
        recordTimer(op, start);

        if (merged.trace() == null || merged.trace().spanCount() == 0) {
            log.debug("event=trace_combined op={} found=false queried={} failed={}",
                    op, metadata.getInstancesQueried(), metadata.getInstancesFailed());
            return new TraceCombineResult(null, metadata);
        }

        log.debug("event=trace_combined op={} found=true spans={} instances_with_trace={}",
                op, metadata.getTotalSpans(), metadata.getInstancesWithTrace());
        return new TraceCombineResult(TraceSorter.sort(merged.trace()), metadata);
    }

    public SearchCombineResult combineSearch(List<InstanceResult<SearchResponse>> results) {
        long start = System.nanoTime();
        List<InstanceResult<SearchResponse>> safeResults = results == null ? List.of() : results;
        SearchMetadata metadata = new SearchMetadata(safeResults.size());
        Map<String, TraceSearchMetadata> tracesById = new HashMap<>();
        SearchMetrics combinedMetrics = new SearchMetrics();

        for (InstanceResult<SearchResponse> result : safeResults) {
            if (result == null) {
                continue;
            }
            if (result instanceof InstanceResult.Failure<SearchResponse> failure) {
                metadata.setInstancesFailed(metadata.getInstancesFailed() + 1);
                metadata.addError(failure.instance(), failure.cause());
                recordFailure(OP_SEARCH, failure);
                continue;
            }
            if (result instanceof InstanceResult.NotFound<SearchResponse> notFound) {
                // a search that comes back not-found is treated as a failed instance
                metadata.setInstancesFailed(metadata.getInstancesFailed() + 1);
                metadata.addError(notFound.instance(), NOT_FOUND_CAUSE);
                recordNotFound(OP_SEARCH, notFound.instance());
                continue;
            }

            InstanceResult.Success<SearchResponse> success = (InstanceResult.Success<SearchResponse>) result;
            metadata.setInstancesResponded(metadata.getInstancesResponded() + 1);
            SearchResponse response = success.payload();
            if (response == null) {
                log.debug("event=instance_empty_response op={} instance={}", OP_SEARCH, success.instance());
                continue;
            }

            addSearchMetrics(combinedMetrics, response.getMetrics());
            if (response.getTraces() == null) {
                continue;
            }
            for (TraceSearchMetadata trace : response.getTraces()) {
                if (trace == null) {
                    continue;
                }
                String traceId = trace.getTraceId() == null ? "" : trace.getTraceId();
                TraceSearchMetadata existing = tracesById.get(traceId);
                if (existing == null) {
                    tracesById.put(traceId, TraceSearchMetadata.copyOf(trace));
                } else {
                    SearchResultMerger.merge(existing, trace);
                }
            }
        }

        List<TraceSearchMetadata> traces = new ArrayList<>(tracesById.values());
        traces.sort(MOST_RECENT_FIRST);
        recordTimer(OP_SEARCH, start);
        log.debug("event=search_combined traces={} responded={} failed={}",
                traces.size(), metadata.getInstancesResponded(), metadata.getInstancesFailed());
        return new SearchCombineResult(new SearchResponse(traces, combinedMetrics), metadata);
    }

    public SearchTagsResponse combineTags(List<InstanceResult<SearchTagsResponse>> results) {
        long start = System.nanoTime();
        TreeSet<String> tagNames = new TreeSet<>();
        MetadataMetrics metrics = collectTagResults(OP_TAGS, results, SearchTagsResponse::getMetrics, response -> {
            if (response.getTagNames() != null) {
                addAllNonNull(tagNames, response.getTagNames());
            }
        });
        recordTimer(OP_TAGS, start);
        return new SearchTagsResponse(new ArrayList<>(tagNames), metrics);
    }

    public SearchTagsV2Response combineTagsV2(List<InstanceResult<SearchTagsV2Response>> results) {
        long start = System.nanoTime();
        TreeMap<String, TreeSet<String>> tagsByScope = new TreeMap<>();
        MetadataMetrics metrics = collectTagResults(OP_TAGS_V2, results, SearchTagsV2Response::getMetrics, response -> {
            if (response.getScopes() == null) {
                return;
            }
            for (SearchTagsV2Scope scope : response.getScopes()) {
                if (scope == null) {
                    continue;
                }
                String name = scope.getName() == null ? "" : scope.getName();
                TreeSet<String> tags = tagsByScope.computeIfAbsent(name, ignored -> new TreeSet<>());
                if (scope.getTags() != null) {
                    addAllNonNull(tags, scope.getTags());
                }
            }
        });

        List<SearchTagsV2Scope> scopes = new ArrayList<>(tagsByScope.size());
        tagsByScope.forEach((name, tags) -> scopes.add(new SearchTagsV2Scope(name, new ArrayList<>(tags))));
        recordTimer(OP_TAGS_V2, start);
        return new SearchTagsV2Response(scopes, metrics);
    }

    public SearchTagValuesResponse combineTagValues(List<InstanceResult<SearchTagValuesResponse>> results) {
        long start = System.nanoTime();
        TreeSet<String> tagValues = new TreeSet<>();
        MetadataMetrics metrics = collectTagResults(OP_TAG_VALUES, results, SearchTagValuesResponse::getMetrics, response -> {
            if (response.getTagValues() != null) {
                addAllNonNull(tagValues, response.getTagValues());
            }
        });
        recordTimer(OP_TAG_VALUES, start);
        return new SearchTagValuesResponse(new ArrayList<>(tagValues), metrics);
    }

    public SearchTagValuesV2Response combineTagValuesV2(List<InstanceResult<SearchTagValuesV2Response>> results) {
        long start = System.nanoTime();
        TreeMap<String, TagValue> byValue = new TreeMap<>();
        MetadataMetrics metrics = collectTagResults(OP_TAG_VALUES_V2, results, SearchTagValuesV2Response::getMetrics, response -> {
            if (response.getTagValues() == null) {
                return;
            }
            for (TagValue tagValue : response.getTagValues()) {
                if (tagValue == null || tagValue.getValue() == null) {
                    continue;
                }
                // first type seen for a value wins
                byValue.putIfAbsent(tagValue.getValue(), new TagValue(tagValue.getType(), tagValue.getValue()));
            }
        });
        recordTimer(OP_TAG_VALUES_V2, start);
        return new SearchTagValuesV2Response(new ArrayList<>(byValue.values()), metrics);
    }

    /**
     * Sums two metadata metrics reports. An absent side yields the other one unchanged.
     */
    public static MetadataMetrics combineMetadataMetrics(MetadataMetrics existing, MetadataMetrics incoming) {
        if (existing == null) {
            return incoming;
        }
        if (incoming == null) {
            return existing;
        }
        return new MetadataMetrics(
                existing.getInspectedBytes() + incoming.getInspectedBytes(),
                existing.getTotalBlocks() + incoming.getTotalBlocks(),
                existing.getTotalJobs() + incoming.getTotalJobs(),
                existing.getCompletedJobs() + incoming.getCompletedJobs(),
                existing.getTotalBlockBytes() + incoming.getTotalBlockBytes()
        );
    }

    private <T> MetadataMetrics collectTagResults(
            String op,
            List<InstanceResult<T>> results,
            Function<T, MetadataMetrics> metricsOf,
            Consumer<T> accumulator
    ) {
        if (results == null) {
            return null;
        }
        MetadataMetrics combined = null;
        for (InstanceResult<T> result : results) {
            if (result == null) {
                continue;
            }
            if (result instanceof InstanceResult.Failure<T> failure) {
                recordFailure(op, failure);
                continue;
            }
            if (result instanceof InstanceResult.NotFound<T> notFound) {
                recordNotFound(op, notFound.instance());
                continue;
            }
            T payload = ((InstanceResult.Success<T>) result).payload();
            if (payload == null) {
                log.debug("event=instance_empty_response op={} instance={}", op, result.instance());
                continue;
            }
            combined = combineMetadataMetrics(combined, metricsOf.apply(payload));
            accumulator.accept(payload);
        }
        return combined;
    }

    private static void addSearchMetrics(SearchMetrics target, SearchMetrics source) {
        if (source == null) {
            return;
        }
        target.setInspectedTraces(target.getInspectedTraces() + source.getInspectedTraces());
        target.setInspectedBytes(target.getInspectedBytes() + source.getInspectedBytes());
        target.setTotalBlocks(target.getTotalBlocks() + source.getTotalBlocks());
        target.setCompletedJobs(target.getCompletedJobs() + source.getCompletedJobs());
        target.setTotalJobs(target.getTotalJobs() + source.getTotalJobs());
        target.setTotalBlockBytes(target.getTotalBlockBytes() + source.getTotalBlockBytes());
        target.setInspectedSpans(target.getInspectedSpans() + source.getInspectedSpans());
    }

    private static void addAllNonNull(TreeSet<String> target, List<String> values) {
        for (String value : values) {
            if (value != null) {
                target.add(value);
            }
        }
    }

    private void recordFailure(String op, InstanceResult.Failure<?> failure) {
        incrementCounter("federated_instance_failed_total", op);
        log.warn("event=instance_failed op={} instance={} cause={}", op, failure.instance(), failure.cause());
    }

    private void recordNotFound(String op, String instance) {
        incrementCounter("federated_instance_not_found_total", op);
        log.debug("event=instance_not_found op={} instance={}", op, instance);
    }

    private void recordTimer(String op, long startNanos) {
        if (meterRegistry == null) {
            return;
        }
        meterRegistry.timer("federated_combine_duration_ms", "op", op)
                .record(System.nanoTime() - startNanos, TimeUnit.NANOSECONDS);
    }

    private void incrementCounter(String metricName, String op) {
        if (meterRegistry == null) {
            return;
        }
        meterRegistry.counter(metricName, "op", op).increment();
    }
}
