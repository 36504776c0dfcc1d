package com.imageinsight.describer.entity;

public enum SubmissionState {
    SYNC_RESULT,
    NEEDS_POLLING,
    FAILED
}
