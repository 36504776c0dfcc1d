package com.imageinsight.describer.service;

import com.imageinsight.describer.entity.DescriptionField;

import java.util.Collection;
import java.util.stream.Collectors;

/**
 * Human-readable names for (field, chunk) units used in error messages.
 */
final class UnitLabels {

    private UnitLabels() {
    }

    /**
     * "Alt Text" for single-chunk runs, "Alt Text (batch 2)" otherwise.
     */
    static String of(DescriptionField field, int chunkIndex, int chunkCount) {
        return chunkCount > 1
                ? field.getLabel() + " (batch " + (chunkIndex + 1) + ")"
                : field.getLabel();
    }

    static String fieldList(Collection<DescriptionField> fields) {
        return fields.stream().map(DescriptionField::getLabel).collect(Collectors.joining(", "));
    }

    static String images(int count) {
        return count + " image" + (count != 1 ? "s" : "");
    }
}
