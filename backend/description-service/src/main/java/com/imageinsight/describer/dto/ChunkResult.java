package com.imageinsight.describer.dto;

import com.imageinsight.describer.entity.DescriptionField;

import java.util.List;

/**
 * Successful contribution of a single (field, chunk) unit, either returned
 * synchronously on submit or obtained by polling.
 */
public record ChunkResult(DescriptionField field, int chunkIndex, List<AssetResult> assets, List<String> errors) {

    public ChunkResult {
        assets = List.copyOf(assets);
        errors = List.copyOf(errors);
    }

    public FieldAggregate toAggregate() {
        return new FieldAggregate(field, assets, errors);
    }
}
