package com.imageinsight.describer.dto;

import java.util.List;

/**
 * A bounded group of work items sent together in one API call.
 * {@code itemIds} and {@code payloads} are aligned by position.
 */
public record Chunk(int index, List<String> itemIds, List<byte[]> payloads) {

    public Chunk {
        if (itemIds.size() != payloads.size()) {
            throw new IllegalArgumentException("itemIds and payloads must be the same length");
        }
        itemIds = List.copyOf(itemIds);
        payloads = List.copyOf(payloads);
    }

    public int size() {
        return itemIds.size();
    }
}
