package com.imageinsight.describer.entity;

/**
 * Overall result of a description run.
 */
public enum RunOutcome {
    /** Every field produced descriptions and nothing failed. */
    COMPLETE,
    /** At least one field produced an aggregate, but some work failed or came back empty. */
    PARTIAL,
    /** Every field failed for every chunk. */
    NO_RESULTS
}
