package com.federated.combiner.model;

public class SearchCombineResult {
    private SearchResponse response;
    private SearchMetadata metadata;

    public SearchCombineResult() {
    }

    public SearchCombineResult(SearchResponse response, SearchMetadata metadata) {
        this.response = response;
        this.metadata = metadata;
    }

    public SearchResponse getResponse() {
        return response;
    }

    public void setResponse(SearchResponse response) {
        this.response = response;
    }

    public SearchMetadata getMetadata() {
        return metadata;
    }

    public void setMetadata(SearchMetadata metadata) {
        this.metadata = metadata;
    }
}
