package com.imageinsight.describer.service;

import com.imageinsight.describer.client.VisionApiClient;
import com.imageinsight.describer.client.VisionApiResponse;
import com.imageinsight.describer.config.DescriptionSettings;
import com.imageinsight.describer.dto.Chunk;
import com.imageinsight.describer.dto.ProgressEventDto;
import com.imageinsight.describer.dto.Submission;
import com.imageinsight.describer.entity.DescriptionField;
import com.imageinsight.describer.entity.ErrorKind;
import com.imageinsight.describer.exception.VisionApiException;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;
import reactor.core.publisher.Flux;
import reactor.core.publisher.Mono;

import java.util.ArrayList;
import java.util.List;

/**
 * Issues one submit call per (field, chunk) pair and classifies each answer.
 *
 * <p>All calls are started together and joined with all-settled semantics: a
 * failing call becomes a FAILED {@link Submission} and never cancels its siblings.
 * For 32 images, 3 fields and batch size 10 that is 4 x 3 = 12 concurrent calls.</p>
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class SubmissionService {

    private final VisionApiClient visionApiClient;

    public Mono<List<Submission>> submitAll(List<Chunk> chunks, List<DescriptionField> fields,
                                            DescriptionSettings settings, ProgressListener listener) {
        int totalImages = chunks.stream().mapToInt(Chunk::size).sum();
        listener.onProgress(ProgressEventDto.submitting(totalImages,
                "Processing " + UnitLabels.images(totalImages) + " (" + UnitLabels.fieldList(fields) + ")..."));

        List<Mono<Submission>> calls = new ArrayList<>(chunks.size() * fields.size());
        for (DescriptionField field : fields) {
            for (Chunk chunk : chunks) {
                calls.add(submitOne(chunk, field, chunks.size(), settings));
            }
        }

        log.info("Submitting {} call(s): {} chunk(s) x {} field(s)", calls.size(), chunks.size(), fields.size());
        return Flux.merge(calls).collectList();
    }

    Mono<Submission> submitOne(Chunk chunk, DescriptionField field, int chunkCount, DescriptionSettings settings) {
        String label = UnitLabels.of(field, chunk.index(), chunkCount);

        return Mono.defer(() -> visionApiClient.submit(chunk, field, settings))
                .map(response -> classify(field, chunk.index(), label, response))
                .onErrorResume(e -> {
                    ErrorKind kind = e instanceof VisionApiException vae ? vae.getKind() : ErrorKind.TRANSPORT;
                    log.warn("Submission {} failed: {}", label, e.getMessage());
                    return Mono.just(Submission.failed(field, chunk.index(), kind, label + ": " + e.getMessage()));
                });
    }

    Submission classify(DescriptionField field, int chunkIndex, String label, VisionApiResponse response) {
        log.debug("Submission {}: kind={}, status={}, hasHandle={}",
                label, response.kind(), response.status(), response.hasJobHandle());

        return switch (response.kind()) {
            case COMPLETED -> Submission.syncResult(field, chunkIndex,
                    response.assets(), response.errors(), response.credits());
            case PENDING -> response.hasJobHandle()
                    ? Submission.needsPolling(field, chunkIndex, response.jobHandle(), response.credits())
                    : Submission.failed(field, chunkIndex, ErrorKind.SHAPE, label + ": No results returned.");
            case REMOTE_ERROR -> Submission.failed(field, chunkIndex, ErrorKind.REMOTE_REJECTION,
                    label + ": " + response.message());
            case BACKEND_ERRORS -> Submission.failed(field, chunkIndex, ErrorKind.BACKEND,
                    label + ": " + String.join("; ", response.errors()));
            case EMPTY -> Submission.failed(field, chunkIndex, ErrorKind.SHAPE, label + ": No results returned.");
            case UNKNOWN -> {
                log.warn("Unexpected submit response for {}: {}", label, response.rawSnippet());
                yield Submission.failed(field, chunkIndex, ErrorKind.SHAPE, label + ": Unexpected API response.");
            }
        };
    }
}
