package com.imageinsight.describer.dto;

import com.imageinsight.describer.entity.DescriptionField;
import com.imageinsight.describer.entity.ErrorKind;
import com.imageinsight.describer.entity.PollState;

import java.util.List;

/**
 * Terminal state of a {@link PollJob}. Every job produces exactly one outcome.
 */
public record PollOutcome(
        PollJob job,
        PollState state,
        int attempts,
        List<AssetResult> assets,
        List<String> errors,
        ErrorKind errorKind,
        String failure,
        Integer credits
) {

    public PollOutcome {
        assets = assets != null ? List.copyOf(assets) : List.of();
        errors = errors != null ? List.copyOf(errors) : List.of();
    }

    public static PollOutcome resolved(PollJob job, int attempts, List<AssetResult> assets,
                                       List<String> errors, Integer credits) {
        return new PollOutcome(job, PollState.RESOLVED, attempts, assets, errors, null, null, credits);
    }

    public static PollOutcome failed(PollJob job, int attempts, ErrorKind kind, String failure) {
        return new PollOutcome(job, PollState.FAILED, attempts, null, null, kind, failure, null);
    }

    public static PollOutcome timedOut(PollJob job, int attempts, String failure) {
        return new PollOutcome(job, PollState.TIMED_OUT, attempts, null, null, ErrorKind.TIMEOUT, failure, null);
    }

    public DescriptionField field() {
        return job.field();
    }

    public int chunkIndex() {
        return job.chunkIndex();
    }

    public ChunkResult toChunkResult() {
        if (state != PollState.RESOLVED) {
            throw new IllegalStateException("Poll job " + job + " did not resolve");
        }
        return new ChunkResult(job.field(), job.chunkIndex(), assets, errors);
    }
}
