package com.imageinsight.describer.service;

import com.imageinsight.describer.dto.ProgressEventDto;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;
import reactor.core.publisher.Flux;
import reactor.core.publisher.Sinks;

/**
 * Fan-out of progress events to SSE subscribers.
 * Events published while nobody is subscribed are dropped.
 */
@Service
@Slf4j
public class DescriptionEventService implements ProgressListener {

    private final Sinks.Many<ProgressEventDto> eventSink;

    public DescriptionEventService() {
        this.eventSink = Sinks.many().multicast().directBestEffort();
    }

    /**
     * Events of a single run, or of every run when {@code runId} is null or blank.
     */
    public Flux<ProgressEventDto> getEventStream(String runId) {
        Flux<ProgressEventDto> events = getEventStream();
        return runId == null || runId.isBlank() ? events : events.filter(event -> runId.equals(event.getRunId()));
    }

    public Flux<ProgressEventDto> getEventStream() {
        return eventSink.asFlux()
                .doOnSubscribe(sub -> log.debug("New subscriber connected to progress stream"))
                .doOnCancel(() -> log.debug("Subscriber disconnected from progress stream"));
    }

    /**
     * Poll jobs report from several threads at once, so emission is serialized here.
     */
    @Override
    public synchronized void onProgress(ProgressEventDto event) {
        log.debug("Progress {}: {}/{} {}", event.getPhase(), event.getCompletedUnits(),
                event.getTotalUnits(), event.getMessage() != null ? event.getMessage() : "");
        Sinks.EmitResult result = eventSink.tryEmitNext(event);
        if (result.isFailure() && result != Sinks.EmitResult.FAIL_ZERO_SUBSCRIBER) {
            log.debug("Progress event dropped: {}", result);
        }
    }
}
