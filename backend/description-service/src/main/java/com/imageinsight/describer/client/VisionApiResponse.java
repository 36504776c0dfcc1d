package com.imageinsight.describer.client;

import com.imageinsight.describer.dto.AssetResult;

import java.util.List;

/**
 * A vision API response, classified once at the client boundary.
 * Downstream code switches on {@link #kind()} and never inspects raw JSON.
 */
public record VisionApiResponse(
        Kind kind,
        String jobHandle,
        String status,
        List<AssetResult> assets,
        List<String> errors,
        String message,
        Integer credits,
        String rawSnippet
) {

    public enum Kind {
        /** Non-empty asset list; the work is done */
        COMPLETED,
        /** Queued or processing, or a response_uri to poll */
        PENDING,
        /** Explicit error or message field */
        REMOTE_ERROR,
        /** Backend errors and no assets */
        BACKEND_ERRORS,
        /** Finished with an empty asset list */
        EMPTY,
        /** Nothing recognisable */
        UNKNOWN
    }

    public VisionApiResponse {
        assets = assets != null ? List.copyOf(assets) : List.of();
        errors = errors != null ? List.copyOf(errors) : List.of();
    }

    public static VisionApiResponse pending(String jobHandle) {
        return new VisionApiResponse(Kind.PENDING, jobHandle, null, null, null, null, null, null);
    }

    public static VisionApiResponse unknown(String rawSnippet) {
        return new VisionApiResponse(Kind.UNKNOWN, null, null, null, null, null, null, rawSnippet);
    }

    public boolean hasJobHandle() {
        return jobHandle != null && !jobHandle.isBlank();
    }
}
