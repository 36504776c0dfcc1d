package com.imageinsight.describer.dto;

import com.imageinsight.describer.entity.DescriptionField;

/**
 * Non-fatal field-level finding, e.g. a call that succeeded but carried no usable text.
 */
public record RunWarning(DescriptionField field, String message) {
}
