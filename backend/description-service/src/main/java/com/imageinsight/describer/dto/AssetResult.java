package com.imageinsight.describer.dto;

import java.util.List;

/**
 * One processed image as reported by the vision API.
 * {@code returnedName} is not guaranteed to equal the id that was sent.
 */
public record AssetResult(String returnedName, List<Description> descriptions) {

    public AssetResult {
        returnedName = returnedName != null ? returnedName : "";
        descriptions = descriptions != null ? List.copyOf(descriptions) : List.of();
    }

    public record Description(String text, String sourceBackend) {
    }
}
