package com.ednataxa.api.resolution;

/**
 * Stage that produced a key's terminal result.
 */
public enum ResolutionPath {
    CACHE_HIT,
    LOCAL_HIT,
    REMOTE_QUERY,
    /** Empty or incertae sedis lineage, no lookup needed. */
    SHORT_CIRCUIT,
    WORKER_FAILURE
}
