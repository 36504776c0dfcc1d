package com.imageinsight.describer.entity;

import java.util.Arrays;
import java.util.Optional;

/**
 * Output kinds a caller can request for an image.
 * Each field maps to exactly one role understood by the vision API.
 */
public enum DescriptionField {
    /**
     * Short accessibility text.
     */
    ALT_TEXT("alt_text", "alttext", "Alt Text", "green", "ALT TEXT"),

    /**
     * One-line caption suitable for display under the image.
     */
    CAPTION("caption", "caption", "Caption", "blue", "CAPTION"),

    /**
     * Longer free-form description.
     */
    DESCRIPTION("description", "general", "Description", "violet", "DESCRIPTION");

    private final String key;
    private final String role;
    private final String label;
    private final String annotationColor;
    private final String annotationPrefix;

    DescriptionField(String key, String role, String label, String annotationColor, String annotationPrefix) {
        this.key = key;
        this.role = role;
        this.label = label;
        this.annotationColor = annotationColor;
        this.annotationPrefix = annotationPrefix;
    }

    public String getKey() {
        return key;
    }

    public String getRole() {
        return role;
    }

    public String getLabel() {
        return label;
    }

    public String getAnnotationColor() {
        return annotationColor;
    }

    public String getAnnotationPrefix() {
        return annotationPrefix;
    }

    /**
     * Resolve a field from its wire key ("alt_text") or enum name ("ALT_TEXT").
     */
    public static Optional<DescriptionField> fromKey(String value) {
        if (value == null || value.isBlank()) {
            return Optional.empty();
        }
        String trimmed = value.trim();
        return Arrays.stream(values())
                .filter(f -> f.key.equalsIgnoreCase(trimmed) || f.name().equalsIgnoreCase(trimmed))
                .findFirst();
    }
}
