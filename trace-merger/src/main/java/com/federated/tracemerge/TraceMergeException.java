package com.federated.tracemerge;

public class TraceMergeException extends Exception {

    public TraceMergeException(String message) {
        super(message);
    }

    public TraceMergeException(String message, Throwable cause) {
        super(message, cause);
    }
}
