package com.federated.tracemerge.model;

import java.util.ArrayList;
import java.util.List;

public class ScopeSpans {
    private String scopeName;
    private String scopeVersion;
    private List<Span> spans = new ArrayList<>();

    public ScopeSpans() {
    }

    public ScopeSpans(String scopeName, String scopeVersion, List<Span> spans) {
        this.scopeName = scopeName;
        this.scopeVersion = scopeVersion;
        this.spans = spans == null ? new ArrayList<>() : spans;
    }

    public String getScopeName() {
        return scopeName;
    }

    public void setScopeName(String scopeName) {
        this.scopeName = scopeName;
    }

    public String getScopeVersion() {
        return scopeVersion;
    }

    public void setScopeVersion(String scopeVersion) {
        this.scopeVersion = scopeVersion;
    }

    public List<Span> getSpans() {
        return spans;
    }

    public void setSpans(List<Span> spans) {
        this.spans = spans;
    }
}
