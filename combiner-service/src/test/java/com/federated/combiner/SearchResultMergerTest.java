package com.federated.combiner;

import com.federated.combiner.model.SearchSpan;
import com.federated.combiner.model.ServiceStats;
import com.federated.combiner.model.SpanSet;
import com.federated.combiner.model.TraceSearchMetadata;
import com.federated.combiner.service.SearchResultMerger;
import org.junit.jupiter.api.Test;

import java.util.ArrayList;
import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;

class SearchResultMergerTest {

    @Test
    void testServiceStatsTakeIndependentMaximums() {
        TraceSearchMetadata existing = new TraceSearchMetadata("t1", "svc", "root", 10, 10);
        existing.getServiceStats().put("payments", new ServiceStats(5, 1));
        TraceSearchMetadata incoming = new TraceSearchMetadata("t1", "svc", "root", 10, 10);
        incoming.getServiceStats().put("payments", new ServiceStats(3, 2));
        incoming.getServiceStats().put("ledger", new ServiceStats(4, 0));

        SearchResultMerger.merge(existing, incoming);

        assertThat(existing.getServiceStats().get("payments")).isEqualTo(new ServiceStats(5, 2));
        assertThat(existing.getServiceStats().get("ledger")).isEqualTo(new ServiceStats(4, 0));
    }

    @Test
    void testEmptyFieldsAreFilledFromIncoming() {
        TraceSearchMetadata existing = new TraceSearchMetadata("", null, "", 0, 0);
        TraceSearchMetadata incoming = new TraceSearchMetadata("t1", "svc", "root", 500, 20);

        SearchResultMerger.merge(existing, incoming);

        assertThat(existing.getTraceId()).isEqualTo("t1");
        assertThat(existing.getRootServiceName()).isEqualTo("svc");
        assertThat(existing.getRootTraceName()).isEqualTo("root");
        assertThat(existing.getStartTimeUnixNano()).isEqualTo(500);
        assertThat(existing.getDurationMs()).isEqualTo(20);
    }

    @Test
    void testExistingNamesTakePriority() {
        TraceSearchMetadata existing = new TraceSearchMetadata("t1", "frontend", "GET /", 100, 50);
        TraceSearchMetadata incoming = new TraceSearchMetadata("t1", "backend", "POST /", 200, 10);

        SearchResultMerger.merge(existing, incoming);

        assertThat(existing.getRootServiceName()).isEqualTo("frontend");
        assertThat(existing.getRootTraceName()).isEqualTo("GET /");
        assertThat(existing.getStartTimeUnixNano()).isEqualTo(100);
        assertThat(existing.getDurationMs()).isEqualTo(50);
    }

    @Test
    void testSpanSetsAreDedupedByFirstSpanId() {
        TraceSearchMetadata existing = new TraceSearchMetadata("t1", "svc", "root", 1, 1);
        existing.setSpanSets(new ArrayList<>(List.of(spanSet("span-1", 3))));
        TraceSearchMetadata incoming = new TraceSearchMetadata("t1", "svc", "root", 1, 1);
        incoming.setSpanSets(new ArrayList<>(List.of(spanSet("span-1", 7), spanSet("span-2", 1))));

        SearchResultMerger.merge(existing, incoming);

        assertThat(existing.getSpanSets()).hasSize(2);
        assertThat(existing.getSpanSets().get(0).getMatched()).isEqualTo(3);
        assertThat(existing.getSpanSets().get(1).getSpans().get(0).getSpanId()).isEqualTo("span-2");
        assertThat(existing.getSpanSet()).isSameAs(existing.getSpanSets().get(0));
    }

    @Test
    void testSpanSetsWithoutSpansAreKeyedByMatchedCount() {
        TraceSearchMetadata existing = new TraceSearchMetadata("t1", "svc", "root", 1, 1);
        TraceSearchMetadata incoming = new TraceSearchMetadata("t1", "svc", "root", 1, 1);
        incoming.setSpanSets(new ArrayList<>(List.of(
                new SpanSet(new ArrayList<>(), 4),
                new SpanSet(new ArrayList<>(), 4),
                new SpanSet(new ArrayList<>(), 6)
        )));

        SearchResultMerger.merge(existing, incoming);

        assertThat(existing.getSpanSets()).extracting(SpanSet::getMatched).containsExactly(4, 6);
        assertThat(existing.getSpanSet().getMatched()).isEqualTo(4);
    }

    @Test
    void testMergingIdenticalRecordIsIdempotent() {
        TraceSearchMetadata original = new TraceSearchMetadata("abc123", "svc1", "root", 1_000_000_000L, 100);
        original.getServiceStats().put("svc1", new ServiceStats(2, 0));
        original.setSpanSets(new ArrayList<>(List.of(spanSet("span-1", 1))));
        original.setSpanSet(original.getSpanSets().get(0));
        TraceSearchMetadata merged = TraceSearchMetadata.copyOf(original);

        SearchResultMerger.merge(merged, TraceSearchMetadata.copyOf(original));

        assertThat(merged).usingRecursiveComparison().isEqualTo(original);
    }

    private static SpanSet spanSet(String firstSpanId, int matched) {
        return new SpanSet(new ArrayList<>(List.of(new SearchSpan(firstSpanId))), matched);
    }
}
