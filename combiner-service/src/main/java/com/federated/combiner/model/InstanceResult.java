package com.federated.combiner.model;

/**
 * Outcome of querying one federated instance. Exactly one of the three shapes applies, so an
 * instance can never be both failed and not-found.
 */
public sealed interface InstanceResult<T> permits InstanceResult.Success, InstanceResult.Failure, InstanceResult.NotFound {

    String instance();

    static <T> InstanceResult<T> success(String instance, T payload) {
        return new Success<>(instance, payload);
    }

    static <T> InstanceResult<T> failure(String instance, String cause) {
        return new Failure<>(instance, cause);
    }

    static <T> InstanceResult<T> failure(String instance, Throwable cause) {
        String message = cause.getMessage() == null ? cause.toString() : cause.getMessage();
        return new Failure<>(instance, message);
    }

    static <T> InstanceResult<T> notFound(String instance) {
        return new NotFound<>(instance);
    }

    /** The payload may itself be null or empty. */
    record Success<T>(String instance, T payload) implements InstanceResult<T> {
    }

    record Failure<T>(String instance, String cause) implements InstanceResult<T> {
    }

    record NotFound<T>(String instance) implements InstanceResult<T> {
    }
}
