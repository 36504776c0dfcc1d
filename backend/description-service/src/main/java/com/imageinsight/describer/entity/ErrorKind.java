package com.imageinsight.describer.entity;

/**
 * Classification of a problem captured for a (field, chunk) unit of work.
 */
public enum ErrorKind {
    /** Network or HTTP-level failure on submit or poll. */
    TRANSPORT,
    /** Explicit error or message in the response body. */
    REMOTE_REJECTION,
    /** Response matched no recognised shape. */
    SHAPE,
    /** Poll attempts exhausted while the job was still running. */
    TIMEOUT,
    /** Errors reported by the AI backends alongside (or instead of) assets. */
    BACKEND
}
