package com.imageinsight.describer.dto;

import com.imageinsight.describer.entity.DescriptionField;

import java.util.ArrayList;
import java.util.List;

/**
 * Merged result for one field across all of its chunks.
 */
public record FieldAggregate(DescriptionField field, List<AssetResult> assets, List<String> errors) {

    public FieldAggregate {
        assets = List.copyOf(assets);
        errors = List.copyOf(errors);
    }

    public static FieldAggregate empty(DescriptionField field) {
        return new FieldAggregate(field, List.of(), List.of());
    }

    /**
     * Returns a new aggregate with {@code other}'s assets and errors appended after this one's.
     */
    public FieldAggregate append(FieldAggregate other) {
        if (other.field != field) {
            throw new IllegalArgumentException("Cannot merge " + other.field + " into " + field);
        }
        List<AssetResult> mergedAssets = new ArrayList<>(assets);
        mergedAssets.addAll(other.assets);
        List<String> mergedErrors = new ArrayList<>(errors);
        mergedErrors.addAll(other.errors);
        return new FieldAggregate(field, mergedAssets, mergedErrors);
    }

    public boolean hasErrors() {
        return !errors.isEmpty();
    }
}
