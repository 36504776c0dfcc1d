package com.imageinsight.describer.dto;

import java.util.Arrays;
import java.util.Objects;

/**
 * One image to describe. The id is supplied by the caller and must be unique
 * within a run; it is sent to the vision API as the file name.
 */
public record WorkItem(String id, byte[] payload) {

    public WorkItem {
        if (id == null || id.isBlank()) {
            throw new IllegalArgumentException("WorkItem id must not be blank");
        }
        Objects.requireNonNull(payload, "payload");
        payload = payload.clone();
    }

    @Override
    public byte[] payload() {
        return payload.clone();
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof WorkItem other)) return false;
        return id.equals(other.id) && Arrays.equals(payload, other.payload);
    }

    @Override
    public int hashCode() {
        return 31 * id.hashCode() + Arrays.hashCode(payload);
    }

    @Override
    public String toString() {
        return "WorkItem[id=" + id + ", bytes=" + payload.length + "]";
    }
}
