package com.federated.combiner.controller;

import com.federated.combiner.model.InstanceResult;
import com.federated.combiner.model.InstanceResultRequest;
import com.federated.combiner.model.SearchCombineResult;
import com.federated.combiner.model.SearchResponse;
import com.federated.combiner.model.SearchTagValuesResponse;
import com.federated.combiner.model.SearchTagValuesV2Response;
import com.federated.combiner.model.SearchTagsResponse;
import com.federated.combiner.model.SearchTagsV2Response;
import com.federated.combiner.model.TraceByIdResponse;
import com.federated.combiner.model.TraceCombineResult;
import com.federated.combiner.service.ResultCombiner;
import com.federated.tracemerge.model.Trace;
import org.springframework.web.bind.annotation.*;

import java.util.ArrayList;
import java.util.List;

@RestController
@RequestMapping("/api/combine")
public class CombinerController {

    private final ResultCombiner resultCombiner;

    public CombinerController(ResultCombiner resultCombiner) {
        this.resultCombiner = resultCombiner;
    }

    @PostMapping("/trace")
    public TraceCombineResult combineTrace(@RequestBody List<InstanceResultRequest<Trace>> results) {
        return resultCombiner.combineTrace(toResults(results));
    }

    @PostMapping("/trace/v2")
    public TraceCombineResult combineTraceV2(@RequestBody List<InstanceResultRequest<TraceByIdResponse>> results) {
        return resultCombiner.combineTraceV2(toResults(results));
    }

    @PostMapping("/search")
    public SearchCombineResult combineSearch(@RequestBody List<InstanceResultRequest<SearchResponse>> results) {
        return resultCombiner.combineSearch(toResults(results));
    }

    @PostMapping("/tags")
    public SearchTagsResponse combineTags(@RequestBody List<InstanceResultRequest<SearchTagsResponse>> results) {
        return resultCombiner.combineTags(toResults(results));
    }

    @PostMapping("/tags/v2")
    public SearchTagsV2Response combineTagsV2(@RequestBody List<InstanceResultRequest<SearchTagsV2Response>> results) {
        return resultCombiner.combineTagsV2(toResults(results));
    }

    @PostMapping("/tag-values")
    public SearchTagValuesResponse combineTagValues(@RequestBody List<InstanceResultRequest<SearchTagValuesResponse>> results) {
        return resultCombiner.combineTagValues(toResults(results));
    }

    @PostMapping("/tag-values/v2")
    public SearchTagValuesV2Response combineTagValuesV2(@RequestBody List<InstanceResultRequest<SearchTagValuesV2Response>> results) {
        return resultCombiner.combineTagValuesV2(toResults(results));
    }

    private static <T> List<InstanceResult<T>> toResults(List<InstanceResultRequest<T>> requests) {
        List<InstanceResult<T>> results = new ArrayList<>();
        if (requests == null) {
            return results;
        }
        for (InstanceResultRequest<T> request : requests) {
            if (request != null) {
                results.add(request.toInstanceResult());
            }
        }
        return results;
    }
}
