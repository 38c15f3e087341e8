package com.ednataxa.api.model;

public enum FailureCause {
    /** Empty, unassigned or otherwise unusable lineage. */
    INPUT_ERROR,
    /** Every rank was tried and the backbone had no candidate. */
    NOT_FOUND,
    RETRIES_EXHAUSTED,
    PERMANENT_API_ERROR,
    WORKER_FAILURE,
    /** Lineage only names a group that is placed as incertae sedis. */
    INCERTAE_SEDIS
}
