package com.imageinsight.describer.controller;

import com.imageinsight.describer.config.DescriptionSettings;
import com.imageinsight.describer.dto.DescriptionRequest;
import com.imageinsight.describer.dto.DescriptionRunResult;
import com.imageinsight.describer.dto.ProgressEventDto;
import com.imageinsight.describer.dto.WorkItem;
import com.imageinsight.describer.entity.DescriptionField;
import com.imageinsight.describer.entity.RunOutcome;
import com.imageinsight.describer.exception.InvalidRunRequestException;
import com.imageinsight.describer.service.DescriptionEventService;
import com.imageinsight.describer.service.DescriptionOrchestrationService;
import jakarta.validation.Valid;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.HttpStatus;
import org.springframework.http.MediaType;
import org.springframework.http.ResponseEntity;
import org.springframework.http.codec.ServerSentEvent;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;
import reactor.core.publisher.Flux;
import reactor.core.publisher.Mono;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.Base64;
import java.util.List;
import java.util.Map;
import java.util.UUID;

/**
 * REST surface for image description runs.
 */
@RestController
@RequestMapping("/api/v1/descriptions")
@RequiredArgsConstructor
@Slf4j
public class DescriptionController {

    private final DescriptionOrchestrationService orchestrationService;
    private final DescriptionEventService descriptionEventService;
    private final DescriptionSettings defaultDescriptionSettings;

    /**
     * Describe a set of images for the requested fields.
     *
     * @return 200 with the run result, or 502 when no field produced any result
     */
    @PostMapping
    public Mono<ResponseEntity<DescriptionRunResult>> describe(@Valid @RequestBody DescriptionRequest request) {
        List<DescriptionField> fields = resolveFields(request.getFields());
        List<WorkItem> items = decodeImages(request.getImages());
        DescriptionSettings settings = defaultDescriptionSettings.withOverrides(
                request.getBackend(), request.getLanguage(), request.getPrompt());

        String runId = request.getRunId() == null || request.getRunId().isBlank()
                ? UUID.randomUUID().toString()
                : request.getRunId().trim();

        log.info("Description requested: run={}, {} image(s), fields={}", runId, items.size(), request.getFields());

        return orchestrationService.run(runId, items, fields, settings)
                .map(result -> result.getOutcome() == RunOutcome.NO_RESULTS
                        ? ResponseEntity.status(HttpStatus.BAD_GATEWAY).body(result)
                        : ResponseEntity.ok(result));
    }

    /**
     * Progress of running jobs; {@code runId} limits the stream to one run.
     */
    @GetMapping(value = "/events", produces = MediaType.TEXT_EVENT_STREAM_VALUE)
    public Flux<ServerSentEvent<ProgressEventDto>> streamEvents(@RequestParam(required = false) String runId) {
        log.debug("New SSE client connected to description progress stream (run={})", runId != null ? runId : "all");

        return descriptionEventService.getEventStream(runId)
                .map(event -> ServerSentEvent.<ProgressEventDto>builder()
                        .event(event.getPhase().name().toLowerCase())
                        .data(event)
                        .build())
                .doOnCancel(() -> log.debug("SSE client disconnected from description progress stream"));
    }

    /**
     * Available fields.
     */
    @GetMapping("/fields")
    public ResponseEntity<List<Map<String, String>>> getFields() {
        List<Map<String, String>> fields = Arrays.stream(DescriptionField.values())
                .map(f -> Map.of(
                        "key", f.getKey(),
                        "role", f.getRole(),
                        "label", f.getLabel(),
                        "color", f.getAnnotationColor(),
                        "annotationPrefix", f.getAnnotationPrefix()
                ))
                .toList();
        return ResponseEntity.ok(fields);
    }

    private List<DescriptionField> resolveFields(List<String> keys) {
        List<DescriptionField> fields = new ArrayList<>();
        for (String key : keys) {
            fields.add(DescriptionField.fromKey(key)
                    .orElseThrow(() -> InvalidRunRequestException.unknownField(key)));
        }
        return fields;
    }

    private List<WorkItem> decodeImages(List<DescriptionRequest.ImagePayload> images) {
        Base64.Decoder decoder = Base64.getDecoder();
        List<WorkItem> items = new ArrayList<>(images.size());
        for (DescriptionRequest.ImagePayload image : images) {
            try {
                items.add(new WorkItem(image.getId(), decoder.decode(stripDataUri(image.getData()).replaceAll("\\s", ""))));
            } catch (IllegalArgumentException e) {
                throw new InvalidRunRequestException("Image " + image.getId() + " is not valid base64", e);
            }
        }
        return items;
    }

    private static String stripDataUri(String data) {
        int comma = data.indexOf(',');
        return data.startsWith("data:") && comma > 0 ? data.substring(comma + 1) : data;
    }
}
