package com.federated.tracemerge;

import com.federated.tracemerge.model.MergedTrace;
import com.federated.tracemerge.model.Trace;

/**
 * Accumulates fragments of a single trace reported by different sources.
 * Implementations are stateful and meant to be used for one merge only.
 */
public interface TraceMerger {

    /**
     * Merges a fragment into the accumulated trace.
     *
     * @return the number of spans from the fragment that were admitted
     * @throws TraceMergeException if the fragment is rejected; nothing of it is merged
     */
    int consume(Trace fragment) throws TraceMergeException;

    MergedTrace result();
}
