package com.imageinsight.describer.dto;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.imageinsight.describer.entity.DescriptionField;
import com.imageinsight.describer.entity.ErrorKind;

/**
 * A problem attributed to a field, and to a chunk when one is known.
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
public record FieldError(DescriptionField field, Integer chunkIndex, ErrorKind kind, String message) {
}
