package com.federated.tracemerge;

public class TraceTooLargeException extends TraceMergeException {

    public TraceTooLargeException(long attemptedSizeBytes, long maxSizeBytes) {
        super(String.format("trace exceeds max size (max bytes: %d, attempted: %d)", maxSizeBytes, attemptedSizeBytes));
    }
}
