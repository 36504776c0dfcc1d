package com.imageinsight.describer.dto;

import com.imageinsight.describer.entity.DescriptionField;
import com.imageinsight.describer.entity.ErrorKind;
import com.imageinsight.describer.entity.SubmissionState;

import java.util.List;

/**
 * Classified outcome of submitting one (field, chunk) pair.
 * Only the members relevant to {@link #state()} are populated.
 */
public record Submission(
        DescriptionField field,
        int chunkIndex,
        SubmissionState state,
        String jobHandle,
        List<AssetResult> assets,
        List<String> errors,
        ErrorKind errorKind,
        String failure,
        Integer credits
) {

    public Submission {
        assets = assets != null ? List.copyOf(assets) : List.of();
        errors = errors != null ? List.copyOf(errors) : List.of();
    }

    public static Submission syncResult(DescriptionField field, int chunkIndex,
                                        List<AssetResult> assets, List<String> errors, Integer credits) {
        return new Submission(field, chunkIndex, SubmissionState.SYNC_RESULT, null, assets, errors, null, null, credits);
    }

    public static Submission needsPolling(DescriptionField field, int chunkIndex, String jobHandle, Integer credits) {
        return new Submission(field, chunkIndex, SubmissionState.NEEDS_POLLING, jobHandle, null, null, null, null, credits);
    }

    public static Submission failed(DescriptionField field, int chunkIndex, ErrorKind kind, String failure) {
        return new Submission(field, chunkIndex, SubmissionState.FAILED, null, null, null, kind, failure, null);
    }

    public PollJob toPollJob() {
        if (state != SubmissionState.NEEDS_POLLING) {
            throw new IllegalStateException("Submission " + field + "#" + chunkIndex + " does not need polling");
        }
        return new PollJob(field, chunkIndex, jobHandle);
    }

    public ChunkResult toChunkResult() {
        if (state != SubmissionState.SYNC_RESULT) {
            throw new IllegalStateException("Submission " + field + "#" + chunkIndex + " has no results");
        }
        return new ChunkResult(field, chunkIndex, assets, errors);
    }
}
