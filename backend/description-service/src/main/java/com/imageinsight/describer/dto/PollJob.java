package com.imageinsight.describer.dto;

import com.imageinsight.describer.entity.DescriptionField;

/**
 * A submitted (field, chunk) unit whose results must be fetched from {@code jobHandle}.
 */
public record PollJob(DescriptionField field, int chunkIndex, String jobHandle) {
}
