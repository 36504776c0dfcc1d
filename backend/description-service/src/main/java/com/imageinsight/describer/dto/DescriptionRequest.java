package com.imageinsight.describer.dto;

import jakarta.validation.Valid;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotEmpty;
import jakarta.validation.constraints.NotNull;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.List;

/**
 * Request body for {@code POST /api/v1/descriptions}.
 * Backend, language and prompt fall back to the configured defaults when omitted.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class DescriptionRequest {

    @NotEmpty(message = "At least one image is required")
    private List<@NotNull(message = "Image entries must not be null") @Valid ImagePayload> images;

    @NotEmpty(message = "At least one field is required")
    private List<String> fields;

    private String backend;
    private String language;
    private String prompt;

    /**
     * Optional caller-chosen id for correlating progress events; generated when absent
     */
    private String runId;

    @Data
    @NoArgsConstructor
    @AllArgsConstructor
    public static class ImagePayload {
        @NotBlank(message = "Image id is required")
        private String id;

        /**
         * Base64-encoded image bytes (PNG or JPEG)
         */
        @NotBlank(message = "Image data is required")
        private String data;
    }
}
