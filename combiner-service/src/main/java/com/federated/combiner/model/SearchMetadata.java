package com.federated.combiner.model;

import java.util.ArrayList;
import java.util.List;

public class SearchMetadata {
    private int instancesQueried;
    private int instancesResponded;
    private int instancesFailed;
    private List<String> errors = new ArrayList<>();

    public SearchMetadata() {
    }

    public SearchMetadata(int instancesQueried) {
        this.instancesQueried = instancesQueried;
    }

    public void addError(String instance, String cause) {
        errors.add(instance + ": " + cause);
    }

    public boolean isPartialResponse() {
        return instancesFailed > 0;
    }

    public int getInstancesQueried() {
        return instancesQueried;
    }

    public void setInstancesQueried(int instancesQueried) {
        this.instancesQueried = instancesQueried;
    }

    public int getInstancesResponded() {
        return instancesResponded;
    }

    public void setInstancesResponded(int instancesResponded) {
        this.instancesResponded = instancesResponded;
    }

    public int getInstancesFailed() {
        return instancesFailed;
    }

    public void setInstancesFailed(int instancesFailed) {
        this.instancesFailed = instancesFailed;
    }

    public List<String> getErrors() {
        return errors;
    }

    public void setErrors(List<String> errors) {
        this.errors = errors;
    }
}
