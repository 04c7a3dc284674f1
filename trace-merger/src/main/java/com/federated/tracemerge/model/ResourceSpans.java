package com.federated.tracemerge.model;

import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Map;

public class ResourceSpans {
    private Map<String, String> resourceAttributes = new HashMap<>();
    private List<ScopeSpans> scopeSpans = new ArrayList<>();

    public ResourceSpans() {
    }

    public ResourceSpans(Map<String, String> resourceAttributes, List<ScopeSpans> scopeSpans) {
        this.resourceAttributes = resourceAttributes == null ? new HashMap<>() : resourceAttributes;
        this.scopeSpans = scopeSpans == null ? new ArrayList<>() : scopeSpans;
    }

    public Map<String, String> getResourceAttributes() {
        return resourceAttributes;
    }

    public void setResourceAttributes(Map<String, String> resourceAttributes) {
        this.resourceAttributes = resourceAttributes;
    }

    public List<ScopeSpans> getScopeSpans() {
        return scopeSpans;
    }

    public void setScopeSpans(List<ScopeSpans> scopeSpans) {
        this.scopeSpans = scopeSpans;
    }
}
