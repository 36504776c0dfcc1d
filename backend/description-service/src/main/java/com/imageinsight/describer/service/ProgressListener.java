package com.imageinsight.describer.service;

import com.imageinsight.describer.dto.ProgressEventDto;

/**
 * Receives progress notifications from a running job. Must not block.
 */
@FunctionalInterface
public interface ProgressListener {

    ProgressListener NONE = event -> { };

    void onProgress(ProgressEventDto event);
}
