package com.imageinsight.describer.dto;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.imageinsight.describer.entity.DescriptionField;
import com.imageinsight.describer.entity.RunOutcome;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.ArrayList;
import java.util.List;

/**
 * Result of one description run: per-image texts plus everything that went wrong.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
@JsonInclude(JsonInclude.Include.NON_NULL)
public class DescriptionRunResult {
    private String runId;
    private RunOutcome outcome;
    private List<DescriptionField> fields;
    private int totalItems;
    @Builder.Default
    private List<ItemResult> results = new ArrayList<>();
    @Builder.Default
    private List<FieldError> fieldErrors = new ArrayList<>();
    @Builder.Default
    private List<RunWarning> warnings = new ArrayList<>();
    private int unattributedAssets;
    private Integer credits;

    public boolean hasProblems() {
        return !fieldErrors.isEmpty() || !warnings.isEmpty();
    }
}
