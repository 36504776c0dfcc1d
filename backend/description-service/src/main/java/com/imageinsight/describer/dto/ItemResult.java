package com.imageinsight.describer.dto;

import com.imageinsight.describer.entity.DescriptionField;

import java.util.List;

/**
 * Final per-image view: every field that received a non-empty description.
 */
public record ItemResult(String itemId, List<FieldText> fields) {

    public ItemResult {
        fields = List.copyOf(fields);
    }

    public record FieldText(DescriptionField field, String text, String backend) {
    }
}
