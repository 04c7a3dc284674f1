package com.federated.combiner.model;

import lombok.Data;

@Data
public class InstanceResultRequest<T> {
    private String instance;
    private String error;
    private boolean notFound;
    private T payload;

    public InstanceResult<T> toInstanceResult() {
        if (error != null && !error.isBlank()) {
            return InstanceResult.failure(instance, error);
        }
        if (notFound) {
            return InstanceResult.notFound(instance);
        }
        return InstanceResult.success(instance, payload);
    }
}
