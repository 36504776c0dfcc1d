package com.imageinsight.describer.service;

import com.imageinsight.describer.config.DescriptionSettings;
import com.imageinsight.describer.dto.Chunk;
import com.imageinsight.describer.dto.ChunkResult;
import com.imageinsight.describer.dto.DescriptionRunResult;
import com.imageinsight.describer.dto.FieldAggregate;
import com.imageinsight.describer.dto.FieldError;
import com.imageinsight.describer.dto.PollJob;
import com.imageinsight.describer.dto.PollOutcome;
import com.imageinsight.describer.dto.RunWarning;
import com.imageinsight.describer.dto.Submission;
import com.imageinsight.describer.dto.WorkItem;
import com.imageinsight.describer.entity.DescriptionField;
import com.imageinsight.describer.entity.ErrorKind;
import com.imageinsight.describer.entity.RunOutcome;
import com.imageinsight.describer.exception.InvalidRunRequestException;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;
import reactor.core.publisher.Mono;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.HashSet;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.UUID;
import java.util.function.Function;
import java.util.function.ToIntFunction;
import java.util.stream.Collectors;

/**
 * Entry point for a description run.
 *
 * <pre>
 * run(runId, items, fields, settings)
 *   1. batch        items → chunks of batch-size
 *   2. submit       one call per (field, chunk), all at once
 *   3. poll         every submission that returned a job handle, all at once
 *   4. merge        chunk results → one aggregate per field
 *   5. reconcile    returned asset names → the caller's image ids
 *   6. report       NO_RESULTS if no field produced anything,
 *                   otherwise results plus per-field errors and warnings
 * </pre>
 *
 * <p>Failures of individual (field, chunk) units are captured as {@link FieldError}s
 * and never abort the rest of the run. Only invalid input fails the returned Mono.</p>
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class DescriptionOrchestrationService {

    static final String NO_RESULTS_MESSAGE =
            "The API returned no results. Try a different model or check your API credits.";

    private final ImageBatcher imageBatcher;
    private final SubmissionService submissionService;
    private final JobPollingService jobPollingService;
    private final ResultMergeService resultMergeService;
    private final AssetNameReconciler assetNameReconciler;
    private final DescriptionEventService descriptionEventService;

    /**
     * Run with progress published to the SSE event stream under a generated run id.
     */
    public Mono<DescriptionRunResult> run(List<WorkItem> items, List<DescriptionField> fields,
                                          DescriptionSettings settings) {
        return run(newRunId(), items, fields, settings, descriptionEventService);
    }

    /**
     * Run with progress published to the SSE event stream under the caller's run id,
     * so the caller can subscribe to {@code /events?runId=...} before the run starts.
     */
    public Mono<DescriptionRunResult> run(String runId, List<WorkItem> items, List<DescriptionField> fields,
                                          DescriptionSettings settings) {
        return run(runId, items, fields, settings, descriptionEventService);
    }

    public Mono<DescriptionRunResult> run(List<WorkItem> items, List<DescriptionField> fields,
                                          DescriptionSettings settings, ProgressListener listener) {
        return run(newRunId(), items, fields, settings, listener);
    }

    /**
     * Every progress event delivered to {@code listener} carries {@code runId}, and so does the result.
     */
    public Mono<DescriptionRunResult> run(String runId, List<WorkItem> items, List<DescriptionField> fields,
                                          DescriptionSettings settings, ProgressListener listener) {
        return Mono.defer(() -> {
            if (runId == null || runId.isBlank()) {
                throw InvalidRunRequestException.missingRunId();
            }
            validate(items, fields, settings);

            List<DescriptionField> requested = fields.stream().distinct().toList();
            List<Chunk> chunks = imageBatcher.partition(items, settings.batchSize());
            ProgressListener progress = guard(runId, listener != null ? listener : ProgressListener.NONE);
            RunAccumulator acc = new RunAccumulator(requested);

            log.info("Starting description run {}: {} image(s) in {} chunk(s), fields=[{}], {}",
                    runId, items.size(), chunks.size(), UnitLabels.fieldList(requested), settings);

            return submissionService.submitAll(chunks, requested, settings, progress)
                    .flatMap(submissions -> {
                        List<PollJob> jobs = acc.addSubmissions(submissions);
                        return jobPollingService.pollAll(jobs, chunks, acc.completedChunkIndices(), settings, progress);
                    })
                    .map(outcomes -> {
                        acc.addPollOutcomes(outcomes);
                        return assemble(runId, items, requested, settings, acc);
                    });
        });
    }

    private DescriptionRunResult assemble(String runId, List<WorkItem> items, List<DescriptionField> fields,
                                          DescriptionSettings settings, RunAccumulator acc) {
        Map<DescriptionField, FieldAggregate> aggregates = resultMergeService.merge(acc.chunkResults, fields);
        List<FieldError> fieldErrors = acc.sortedErrors();

        if (aggregates.isEmpty()) {
            if (fieldErrors.isEmpty()) {
                fieldErrors.add(new FieldError(null, null, ErrorKind.SHAPE, NO_RESULTS_MESSAGE));
            }
            log.warn("Description run produced no results: {} error(s)", fieldErrors.size());
            return DescriptionRunResult.builder()
                    .runId(runId)
                    .outcome(RunOutcome.NO_RESULTS)
                    .fields(fields)
                    .totalItems(items.size())
                    .fieldErrors(fieldErrors)
                    .credits(acc.credits)
                    .build();
        }

        // backend errors riding along with assets, unless the field already failed somewhere
        Set<DescriptionField> erroredDuringCalls = fieldErrors.stream()
                .map(FieldError::field)
                .collect(Collectors.toSet());
        for (FieldAggregate aggregate : aggregates.values()) {
            if (aggregate.hasErrors() && !erroredDuringCalls.contains(aggregate.field())) {
                log.warn("{} backend errors: {}", aggregate.field().getLabel(), aggregate.errors());
                fieldErrors.add(new FieldError(aggregate.field(), null, ErrorKind.BACKEND,
                        aggregate.field().getLabel() + ": " + String.join("; ", aggregate.errors())));
            }
        }

        List<String> itemIds = items.stream().map(WorkItem::id).toList();
        AssetNameReconciler.Reconciliation reconciliation =
                assetNameReconciler.reconcile(itemIds, aggregates.values(), settings.backend());

        Set<DescriptionField> erroredFields = fieldErrors.stream()
                .map(FieldError::field)
                .collect(Collectors.toSet());
        List<RunWarning> warnings = new ArrayList<>();
        for (DescriptionField field : aggregates.keySet()) {
            if (!reconciliation.fieldsWithText().contains(field) && !erroredFields.contains(field)) {
                log.warn("{}: API returned assets but no descriptions", field.getLabel());
                warnings.add(new RunWarning(field, field.getLabel()
                        + ": No descriptions returned. The model may not have produced output for this role."
                        + " Try a different model."));
            }
        }

        RunOutcome outcome = fieldErrors.isEmpty() && warnings.isEmpty() ? RunOutcome.COMPLETE : RunOutcome.PARTIAL;
        log.info("Description run {} finished {}: {}/{} image(s) described, {} error(s), {} warning(s)",
                runId, outcome, reconciliation.results().size(), items.size(), fieldErrors.size(), warnings.size());

        return DescriptionRunResult.builder()
                .runId(runId)
                .outcome(outcome)
                .fields(fields)
                .totalItems(items.size())
                .results(new ArrayList<>(reconciliation.results()))
                .fieldErrors(fieldErrors)
                .warnings(warnings)
                .unattributedAssets(reconciliation.unattributed())
                .credits(acc.credits)
                .build();
    }

    private void validate(List<WorkItem> items, List<DescriptionField> fields, DescriptionSettings settings) {
        if (settings == null || !settings.hasApiKey()) {
            throw InvalidRunRequestException.missingApiKey();
        }
        if (fields == null || fields.isEmpty()) {
            throw InvalidRunRequestException.noFields();
        }
        if (items == null || items.isEmpty()) {
            throw InvalidRunRequestException.noItems();
        }
        Set<String> ids = new HashSet<>();
        for (WorkItem item : items) {
            if (!ids.add(item.id())) {
                throw InvalidRunRequestException.duplicateItemId(item.id());
            }
        }
    }

    private static String newRunId() {
        return UUID.randomUUID().toString();
    }

    private static ProgressListener guard(String runId, ProgressListener delegate) {
        return event -> {
            event.setRunId(runId);
            try {
                delegate.onProgress(event);
            } catch (RuntimeException e) {
                log.warn("Progress listener failed: {}", e.getMessage());
            }
        };
    }

    /**
     * Run-scoped bookkeeping. Only touched from the single collector stage after each join.
     */
    private static final class RunAccumulator {

        private final List<DescriptionField> fields;
        private final List<ChunkResult> chunkResults = new ArrayList<>();
        private final List<FieldError> errors = new ArrayList<>();
        private final Set<Integer> syncChunks = new LinkedHashSet<>();
        private Integer credits;

        RunAccumulator(List<DescriptionField> fields) {
            this.fields = fields;
        }

        List<PollJob> addSubmissions(List<Submission> submissions) {
            List<PollJob> jobs = new ArrayList<>();
            submissions.stream()
                    .sorted(unitOrder(Submission::field, Submission::chunkIndex))
                    .forEach(submission -> {
                        if (submission.credits() != null) {
                            credits = submission.credits();
                        }
                        switch (submission.state()) {
                            case SYNC_RESULT -> {
                                chunkResults.add(submission.toChunkResult());
                                syncChunks.add(submission.chunkIndex());
                            }
                            case NEEDS_POLLING -> jobs.add(submission.toPollJob());
                            case FAILED -> errors.add(new FieldError(submission.field(), submission.chunkIndex(),
                                    submission.errorKind(), submission.failure()));
                        }
                    });
            return jobs;
        }

        void addPollOutcomes(List<PollOutcome> outcomes) {
            outcomes.stream()
                    .sorted(unitOrder(PollOutcome::field, PollOutcome::chunkIndex))
                    .forEach(outcome -> {
                        if (outcome.state().isFailure()) {
                            errors.add(new FieldError(outcome.field(), outcome.chunkIndex(),
                                    outcome.errorKind(), outcome.failure()));
                        } else {
                            chunkResults.add(outcome.toChunkResult());
                            if (outcome.credits() != null) {
                                credits = outcome.credits();
                            }
                        }
                    });
        }

        Set<Integer> completedChunkIndices() {
            return syncChunks;
        }

        List<FieldError> sortedErrors() {
            List<FieldError> sorted = new ArrayList<>(errors);
            sorted.sort(unitOrder(FieldError::field,
                    e -> e.chunkIndex() != null ? e.chunkIndex() : Integer.MAX_VALUE));
            return sorted;
        }

        private <T> Comparator<T> unitOrder(Function<T, DescriptionField> field, ToIntFunction<T> chunkIndex) {
            return Comparator.<T>comparingInt(t -> fields.indexOf(field.apply(t))).thenComparingInt(chunkIndex);
        }
    }
}
