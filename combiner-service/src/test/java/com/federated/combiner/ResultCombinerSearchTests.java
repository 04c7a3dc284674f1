package com.federated.combiner;

import com.federated.combiner.model.InstanceResult;
import com.federated.combiner.model.SearchCombineResult;
import com.federated.combiner.model.SearchMetrics;
import com.federated.combiner.model.SearchResponse;
import com.federated.combiner.model.ServiceStats;
import com.federated.combiner.model.TraceSearchMetadata;
import com.federated.combiner.service.ResultCombiner;
import org.junit.jupiter.api.Test;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;

class ResultCombinerSearchTests {

    private final ResultCombiner combiner = new ResultCombiner();

    @Test
    void testSameTraceFromTwoInstancesIsReturnedOnce() {
        List<InstanceResult<SearchResponse>> results = List.of(
                InstanceResult.success("instance-a", response(hit("abc123", "svc1", 1_000_000_000L, 100))),
                InstanceResult.success("instance-b", response(hit("abc123", "svc1", 1_000_000_000L, 100)))
        );

        SearchCombineResult result = combiner.combineSearch(results);

        assertThat(result.getMetadata().getInstancesResponded()).isEqualTo(2);
        assertThat(result.getResponse().getTraces()).hasSize(1);
        TraceSearchMetadata merged = result.getResponse().getTraces().get(0);
        assertThat(merged.getTraceId()).isEqualTo("abc123");
        assertThat(merged.getRootServiceName()).isEqualTo("svc1");
        assertThat(merged.getStartTimeUnixNano()).isEqualTo(1_000_000_000L);
        assertThat(merged.getDurationMs()).isEqualTo(100);
    }

    @Test
    void testNotFoundCountsAsFailedForSearch() {
        List<InstanceResult<SearchResponse>> results = List.of(
                InstanceResult.success("instance-a", response(hit("abc123", "svc1", 10, 5))),
                InstanceResult.failure("instance-b", "503 service unavailable"),
                InstanceResult.notFound("instance-c")
        );

        SearchCombineResult result = combiner.combineSearch(results);

        assertThat(result.getMetadata().getInstancesQueried()).isEqualTo(3);
        assertThat(result.getMetadata().getInstancesResponded()).isEqualTo(1);
        assertThat(result.getMetadata().getInstancesFailed()).isEqualTo(2);
        assertThat(result.getMetadata().isPartialResponse()).isTrue();
        assertThat(result.getMetadata().getErrors())
                .containsExactly("instance-b: 503 service unavailable", "instance-c: not found");
    }

    @Test
    void testMetricsAreSummedAcrossInstances() {
        SearchResponse first = response(hit("t1", "svc", 10, 1));
        first.setMetrics(metrics(5, 100, 2, 1, 3, 4096, 50));
        SearchResponse second = response(hit("t2", "svc", 20, 1));
        second.setMetrics(metrics(7, 200, 3, 2, 2, 1024, 70));

        SearchCombineResult result = combiner.combineSearch(List.of(
                InstanceResult.success("instance-a", first),
                InstanceResult.success("instance-b", second),
                InstanceResult.success("instance-c", response())
        ));

        SearchMetrics combined = result.getResponse().getMetrics();
        assertThat(combined.getInspectedTraces()).isEqualTo(12);
        assertThat(combined.getInspectedBytes()).isEqualTo(300);
        assertThat(combined.getTotalBlocks()).isEqualTo(5);
        assertThat(combined.getCompletedJobs()).isEqualTo(3);
        assertThat(combined.getTotalJobs()).isEqualTo(5);
        assertThat(combined.getTotalBlockBytes()).isEqualTo(5120);
        assertThat(combined.getInspectedSpans()).isEqualTo(120);
    }

    @Test
    void testTracesOrderedMostRecentFirstWithTraceIdTieBreak() {
        SearchCombineResult result = combiner.combineSearch(List.of(
                InstanceResult.success("instance-a", response(hit("old", "svc", 100, 1), hit("tie-b", "svc", 500, 1))),
                InstanceResult.success("instance-b", response(hit("new", "svc", 900, 1), hit("tie-a", "svc", 500, 1)))
        ));

        assertThat(result.getResponse().getTraces())
                .extracting(TraceSearchMetadata::getTraceId)
                .containsExactly("new", "tie-a", "tie-b", "old");
    }

    @Test
    void testEarliestStartAndLongestDurationWinInEitherOrder() {
        TraceSearchMetadata early = hit("abc", "svc", 100, 10);
        TraceSearchMetadata late = hit("abc", "svc", 200, 40);

        TraceSearchMetadata forward = combiner.combineSearch(List.of(
                InstanceResult.success("a", response(early)),
                InstanceResult.success("b", response(late))
        )).getResponse().getTraces().get(0);
        TraceSearchMetadata backward = combiner.combineSearch(List.of(
                InstanceResult.success("a", response(hit("abc", "svc", 200, 40))),
                InstanceResult.success("b", response(hit("abc", "svc", 100, 10)))
        )).getResponse().getTraces().get(0);

        assertThat(forward.getStartTimeUnixNano()).isEqualTo(100);
        assertThat(forward.getDurationMs()).isEqualTo(40);
        assertThat(backward.getStartTimeUnixNano()).isEqualTo(100);
        assertThat(backward.getDurationMs()).isEqualTo(40);
    }

    @Test
    void testDurationAboveSignedIntRangeIsKept() {
        TraceSearchMetadata merged = combiner.combineSearch(List.of(
                InstanceResult.success("a", response(hit("abc", "svc", 100, 40))),
                InstanceResult.success("b", response(hit("abc", "svc", 100, 3_000_000_000L)))
        )).getResponse().getTraces().get(0);

        assertThat(merged.getDurationMs()).isEqualTo(3_000_000_000L);
    }

    @Test
    void testLargeCountersDoNotWrapWhenSummed() {
        SearchResponse first = response(hit("t1", "svc", 10, 1));
        first.setMetrics(metrics(2_000_000_000, 0, 2_000_000_000, 0, 0, 0, 0));
        SearchResponse second = response(hit("t2", "svc", 20, 1));
        second.setMetrics(metrics(2_000_000_000, 0, 2_000_000_000, 0, 0, 0, 0));

        SearchMetrics combined = combiner.combineSearch(List.of(
                InstanceResult.success("a", first),
                InstanceResult.success("b", second)
        )).getResponse().getMetrics();

        assertThat(combined.getInspectedTraces()).isEqualTo(4_000_000_000L);
        assertThat(combined.getTotalBlocks()).isEqualTo(4_000_000_000L);
    }

    @Test
    void testNullResponseAndNullHitsAreSkipped() {
        SearchResponse withNullHit = new SearchResponse(new ArrayList<>(Arrays.asList(null, hit("t1", "svc", 1, 1))), null);

        SearchCombineResult result = combiner.combineSearch(List.of(
                InstanceResult.success("instance-a", null),
                InstanceResult.success("instance-b", withNullHit)
        ));

        assertThat(result.getMetadata().getInstancesResponded()).isEqualTo(2);
        assertThat(result.getMetadata().getInstancesFailed()).isZero();
        assertThat(result.getResponse().getTraces()).extracting(TraceSearchMetadata::getTraceId).containsExactly("t1");
        assertThat(result.getResponse().getMetrics().getInspectedTraces()).isZero();
    }

    @Test
    void testInputHitsAreNotMutated() {
        TraceSearchMetadata first = hit("abc", "svc", 300, 10);
        first.getServiceStats().put("svc", new ServiceStats(1, 0));
        TraceSearchMetadata second = hit("abc", "svc", 100, 90);
        second.getServiceStats().put("svc", new ServiceStats(9, 2));

        combiner.combineSearch(List.of(
                InstanceResult.success("a", response(first)),
                InstanceResult.success("b", response(second))
        ));

        assertThat(first.getStartTimeUnixNano()).isEqualTo(300);
        assertThat(first.getDurationMs()).isEqualTo(10);
        assertThat(first.getServiceStats().get("svc").getSpanCount()).isEqualTo(1);
    }

    static SearchResponse response(TraceSearchMetadata... hits) {
        return new SearchResponse(new ArrayList<>(List.of(hits)), null);
    }

    static TraceSearchMetadata hit(String traceId, String rootService, long start, long durationMs) {
        return new TraceSearchMetadata(traceId, rootService, "GET /checkout", start, durationMs);
    }

    private static SearchMetrics metrics(int traces, long bytes, int blocks, int completedJobs, int totalJobs, long blockBytes, long spans) {
        SearchMetrics metrics = new SearchMetrics();
        metrics.setInspectedTraces(traces);
        metrics.setInspectedBytes(bytes);
        metrics.setTotalBlocks(blocks);
        metrics.setCompletedJobs(completedJobs);
        metrics.setTotalJobs(totalJobs);
        metrics.setTotalBlockBytes(blockBytes);
        metrics.setInspectedSpans(spans);
        return metrics;
    }
}
