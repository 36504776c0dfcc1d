package com.imageinsight.describer.service;

import com.imageinsight.describer.client.VisionApiClient;
import com.imageinsight.describer.client.VisionApiResponse;
import com.imageinsight.describer.config.DescriptionSettings;
import com.imageinsight.describer.dto.Chunk;
import com.imageinsight.describer.dto.PollJob;
import com.imageinsight.describer.dto.PollOutcome;
import com.imageinsight.describer.dto.ProgressEventDto;
import com.imageinsight.describer.entity.ErrorKind;
import com.imageinsight.describer.entity.PollState;
import com.imageinsight.describer.exception.VisionApiException;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;
import reactor.core.publisher.Flux;
import reactor.core.publisher.Mono;

import java.util.Collection;
import java.util.List;
import java.util.Set;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * Polls every pending job until it resolves, fails or runs out of attempts.
 *
 * <pre>
 * ACTIVE ── assets ─────────────────────────► RESOLVED
 *   │  ├── queued / processing / 202 ──► wait interval, ACTIVE again
 *   │  ├── errors, empty, unknown, HTTP ─► FAILED
 *   │  └── max attempts reached ────────► TIMED_OUT
 * </pre>
 *
 * <p>Jobs run concurrently and independently. Each job always yields exactly one
 * {@link PollOutcome}, so one slow or broken job never holds back or cancels the rest.
 * Once resolved a job is not queried again.</p>
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class JobPollingService {

    private final VisionApiClient visionApiClient;

    /**
     * @param completedChunks chunk indices already complete from synchronous submissions
     */
    public Mono<List<PollOutcome>> pollAll(List<PollJob> jobs, List<Chunk> chunks, Collection<Integer> completedChunks,
                                           DescriptionSettings settings, ProgressListener listener) {
        if (jobs.isEmpty()) {
            return Mono.just(List.of());
        }

        PollProgress progress = new PollProgress(chunks, listener);
        completedChunks.forEach(progress::seed);
        listener.onProgress(ProgressEventDto.polling(progress.completedImages(), progress.totalImages(),
                "Waiting for results (" + progress.completedImages() + "/" + progress.totalImages() + " images)..."));

        log.info("Polling {} job(s) every {}ms, up to {} attempts each",
                jobs.size(), settings.pollInterval().toMillis(), settings.maxPollAttempts());

        return Flux.fromIterable(jobs)
                .flatMap(job -> pollJob(job, chunks.size(), settings, progress), jobs.size())
                .collectList();
    }

    Mono<PollOutcome> pollJob(PollJob job, int chunkCount, DescriptionSettings settings, PollProgress progress) {
        String label = UnitLabels.of(job.field(), job.chunkIndex(), chunkCount);

        return attempt(job, label, 0, settings, progress)
                .doOnNext(outcome -> {
                    if (outcome.state() == PollState.RESOLVED) {
                        log.debug("{} resolved after {} attempt(s): {} asset(s)",
                                label, outcome.attempts(), outcome.assets().size());
                        progress.chunkCompleted(job.chunkIndex());
                    } else {
                        log.warn("{} ended {} after {} attempt(s): {}",
                                label, outcome.state(), outcome.attempts(), outcome.failure());
                    }
                });
    }

    private Mono<PollOutcome> attempt(PollJob job, String label, int attemptsMade,
                                      DescriptionSettings settings, PollProgress progress) {
        if (attemptsMade >= settings.maxPollAttempts()) {
            return Mono.just(PollOutcome.timedOut(job, attemptsMade,
                    label + ": Timed out waiting for results. Please try again."));
        }

        Mono<Long> wait = attemptsMade == 0 ? Mono.just(0L) : Mono.delay(settings.pollInterval());
        int attemptNumber = attemptsMade + 1;

        return wait
                .then(Mono.defer(() -> {
                    progress.attempted();
                    return visionApiClient.poll(job.jobHandle(), settings);
                }))
                .flatMap(response -> handle(job, label, attemptNumber, response, settings, progress))
                .onErrorResume(e -> {
                    ErrorKind kind = e instanceof VisionApiException vae ? vae.getKind() : ErrorKind.TRANSPORT;
                    return Mono.just(PollOutcome.failed(job, attemptNumber, kind, label + ": " + e.getMessage()));
                });
    }

    private Mono<PollOutcome> handle(PollJob job, String label, int attemptNumber, VisionApiResponse response,
                                     DescriptionSettings settings, PollProgress progress) {
        return switch (response.kind()) {
            case COMPLETED -> Mono.just(PollOutcome.resolved(job, attemptNumber,
                    response.assets(), response.errors(), response.credits()));
            case PENDING -> {
                log.debug("{} attempt {}: still {}", label, attemptNumber,
                        response.status() != null ? response.status() : "waiting");
                yield attempt(job, label, attemptNumber, settings, progress);
            }
            case BACKEND_ERRORS -> Mono.just(PollOutcome.failed(job, attemptNumber, ErrorKind.BACKEND,
                    label + ": " + String.join("; ", response.errors())));
            case EMPTY -> {
                log.warn("{} completed with empty assets: {}", label, response.rawSnippet());
                yield Mono.just(PollOutcome.failed(job, attemptNumber, ErrorKind.SHAPE,
                        label + ": No results returned. The AI backend may have timed out. Please try again."));
            }
            case REMOTE_ERROR -> Mono.just(PollOutcome.failed(job, attemptNumber, ErrorKind.REMOTE_REJECTION,
                    label + ": " + response.message()));
            case UNKNOWN -> {
                log.warn("Unexpected poll response for {}: {}", label, response.rawSnippet());
                yield Mono.just(PollOutcome.failed(job, attemptNumber, ErrorKind.SHAPE,
                        label + ": Unexpected API response: " + response.rawSnippet()));
            }
        };
    }

    /**
     * Image-level progress: a chunk counts once, however many fields finish it.
     */
    static class PollProgress {

        private final List<Chunk> chunks;
        private final ProgressListener listener;
        private final Set<Integer> completedChunks = ConcurrentHashMap.newKeySet();
        private final AtomicInteger completedImages = new AtomicInteger();
        private final int totalImages;

        PollProgress(List<Chunk> chunks, ProgressListener listener) {
            this.chunks = chunks;
            this.listener = listener;
            this.totalImages = chunks.stream().mapToInt(Chunk::size).sum();
        }

        void seed(int chunkIndex) {
            if (completedChunks.add(chunkIndex)) {
                completedImages.addAndGet(chunks.get(chunkIndex).size());
            }
        }

        void chunkCompleted(int chunkIndex) {
            seed(chunkIndex);
            emit();
        }

        void attempted() {
            emit();
        }

        int completedImages() {
            return completedImages.get();
        }

        int totalImages() {
            return totalImages;
        }

        private void emit() {
            listener.onProgress(ProgressEventDto.polling(completedImages.get(), totalImages, null));
        }
    }
}
