package com.federated.combiner.model;

import java.util.ArrayList;
import java.util.List;

public class CombineMetadata {
    private int instancesQueried;
    private int instancesResponded;
    private int instancesWithTrace;
    private int instancesNotFound;
    private int instancesFailed;
    private int totalSpans;
    private boolean partialResponse;
    private List<String> errors = new ArrayList<>();

    public CombineMetadata() {
    }

    public CombineMetadata(int instancesQueried) {
        this.instancesQueried = instancesQueried;
    }

    public void addError(String instance, String cause) {
        errors.add(instance + ": " + cause);
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

    public int getInstancesWithTrace() {
        return instancesWithTrace;
    }

    public void setInstancesWithTrace(int instancesWithTrace) {
        this.instancesWithTrace = instancesWithTrace;
    }

    public int getInstancesNotFound() {
        return instancesNotFound;
    }

    public void setInstancesNotFound(int instancesNotFound) {
        this.instancesNotFound = instancesNotFound;
    }

    public int getInstancesFailed() {
        return instancesFailed;
    }

    public void setInstancesFailed(int instancesFailed) {
        this.instancesFailed = instancesFailed;
    }

    public int getTotalSpans() {
        return totalSpans;
    }

    public void setTotalSpans(int totalSpans) {
        this.totalSpans = totalSpans;
    }

    public boolean isPartialResponse() {
        return partialResponse;
    }

    public void setPartialResponse(boolean partialResponse) {
        this.partialResponse = partialResponse;
    }

    public List<String> getErrors() {
        return errors;
    }

    public void setErrors(List<String> errors) {
        this.errors = errors;
    }
}
