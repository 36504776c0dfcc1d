package com.imageinsight.describer.entity;

public enum PollState {
    RESOLVED,
    FAILED,
    TIMED_OUT;

    public boolean isFailure() {
        return this != RESOLVED;
    }
}
