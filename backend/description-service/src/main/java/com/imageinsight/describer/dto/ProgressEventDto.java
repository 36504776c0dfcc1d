package com.imageinsight.describer.dto;

import com.fasterxml.jackson.annotation.JsonInclude;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.Instant;

/**
 * Progress notification for a running description job.
 * Purely observational; listeners never influence control flow.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
@JsonInclude(JsonInclude.Include.NON_NULL)
public class ProgressEventDto {

    /**
     * Run that produced the event; set by the orchestrator
     */
    private String runId;

    private Phase phase;

    /**
     * Images known to be complete (counted once per chunk, not per API call)
     */
    private int completedUnits;

    private int totalUnits;

    private String message;

    @Builder.Default
    private Instant timestamp = Instant.now();

    public enum Phase {
        SUBMITTING,
        POLLING
    }

    public static ProgressEventDto submitting(int totalUnits, String message) {
        return ProgressEventDto.builder()
                .phase(Phase.SUBMITTING)
                .completedUnits(0)
                .totalUnits(totalUnits)
                .message(message)
                .build();
    }

    public static ProgressEventDto polling(int completedUnits, int totalUnits, String message) {
        return ProgressEventDto.builder()
                .phase(Phase.POLLING)
                .completedUnits(completedUnits)
                .totalUnits(totalUnits)
                .message(message)
                .build();
    }
}
