package com.federated.tracemerge.model;

import java.util.ArrayList;
import java.util.List;

public class Trace {
    private List<ResourceSpans> resourceSpans = new ArrayList<>();

    public Trace() {
    }

    public Trace(List<ResourceSpans> resourceSpans) {
        this.resourceSpans = resourceSpans == null ? new ArrayList<>() : resourceSpans;
    }

    public List<ResourceSpans> getResourceSpans() {
        return resourceSpans;
    }

    public void setResourceSpans(List<ResourceSpans> resourceSpans) {
        this.resourceSpans = resourceSpans;
    }

    public boolean hasResourceSpans() {
        return resourceSpans != null && !resourceSpans.isEmpty();
    }

    public int spanCount() {
        if (resourceSpans == null) {
            return 0;
        }
        int count = 0;
        for (ResourceSpans rs : resourceSpans) {
            if (rs == null || rs.getScopeSpans() == null) {
                continue;
            }
            for (ScopeSpans ss : rs.getScopeSpans()) {
                if (ss != null && ss.getSpans() != null) {
                    count += ss.getSpans().size();
                }
            }
        }
        return count;
    }
}
