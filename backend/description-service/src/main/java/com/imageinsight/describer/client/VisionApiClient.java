package com.imageinsight.describer.client;

import com.imageinsight.describer.config.DescriberProperties;
import com.imageinsight.describer.config.DescriptionSettings;
import com.imageinsight.describer.dto.Chunk;
import com.imageinsight.describer.entity.DescriptionField;
import com.imageinsight.describer.exception.VisionApiException;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.HttpStatus;
import org.springframework.http.MediaType;
import org.springframework.stereotype.Component;
import org.springframework.web.reactive.function.client.WebClient;
import reactor.core.publisher.Mono;

import java.net.URI;
import java.time.Duration;
import java.util.Base64;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Client for the vision API.
 *
 * Submit: POST {base-url}{fetch-path}
 *   - file: base64 images
 *   - file_name: ids, aligned with file
 *   - role: field role (alttext, caption, general)
 *   - backend: [model backend]
 *   - language, feature: ["descriptions"]
 *   - prompt: optional, overrides role
 *
 * Poll: GET {response_uri}; 202 means the job is still running.
 *
 * Both calls authenticate with {@code X-API-Key: Token <key>}.
 */
@Component
@RequiredArgsConstructor
@Slf4j
public class VisionApiClient {

    static final String API_KEY_HEADER = "X-API-Key";

    private final WebClient visionWebClient;
    private final VisionResponseParser responseParser;
    private final DescriberProperties properties;

    /**
     * Submit one chunk of images for one field.
     *
     * @return the classified response; errors with {@link VisionApiException} on
     *         non-2xx status or transport failure
     */
    public Mono<VisionApiResponse> submit(Chunk chunk, DescriptionField field, DescriptionSettings settings) {
        Map<String, Object> body = buildSubmitBody(chunk, field, settings);

        return visionWebClient.post()
                .uri(properties.getApi().getFetchPath())
                .header(API_KEY_HEADER, "Token " + settings.apiKey())
                .contentType(MediaType.APPLICATION_JSON)
                .accept(MediaType.APPLICATION_JSON)
                .bodyValue(body)
                .exchangeToMono(response -> response.bodyToMono(String.class)
                        .defaultIfEmpty("")
                        .flatMap(text -> {
                            int status = response.statusCode().value();
                            if (response.statusCode().is2xxSuccessful()) {
                                return Mono.just(responseParser.parse(text));
                            }
                            return Mono.error(VisionApiException.rejected(
                                    responseParser.extractErrorMessage(status, text), status));
                        }))
                .timeout(readTimeout())
                .onErrorMap(e -> !(e instanceof VisionApiException), VisionApiException::transport)
                .doOnError(e -> log.debug("Submit failed for {} chunk {}: {}", field, chunk.index(), e.getMessage()));
    }

    /**
     * Query a job's status once.
     *
     * @return the classified response; a 202 answer is reported as PENDING
     */
    public Mono<VisionApiResponse> poll(String jobHandle, DescriptionSettings settings) {
        return visionWebClient.get()
                .uri(URI.create(jobHandle))
                .header(API_KEY_HEADER, "Token " + settings.apiKey())
                .accept(MediaType.APPLICATION_JSON)
                .exchangeToMono(response -> response.bodyToMono(String.class)
                        .defaultIfEmpty("")
                        .flatMap(text -> {
                            int status = response.statusCode().value();
                            if (status == HttpStatus.ACCEPTED.value()) {
                                return Mono.just(VisionApiResponse.pending(jobHandle));
                            }
                            if (response.statusCode().is2xxSuccessful()) {
                                return Mono.just(responseParser.parse(text));
                            }
                            return Mono.error(VisionApiException.pollingFailed(
                                    status, VisionResponseParser.snippet(text)));
                        }))
                .timeout(readTimeout())
                .onErrorMap(e -> !(e instanceof VisionApiException), VisionApiException::transport);
    }

    Map<String, Object> buildSubmitBody(Chunk chunk, DescriptionField field, DescriptionSettings settings) {
        Base64.Encoder encoder = Base64.getEncoder();
        List<String> files = chunk.payloads().stream()
                .map(encoder::encodeToString)
                .toList();

        Map<String, Object> body = new LinkedHashMap<>();
        body.put("file", files);
        body.put("file_name", chunk.itemIds());
        body.put("role", field.getRole());
        body.put("backend", List.of(settings.backend()));
        body.put("language", settings.language());
        body.put("feature", List.of("descriptions"));
        if (settings.hasCustomPrompt()) {
            body.put("prompt", settings.prompt().trim());
        }
        return body;
    }

    private Duration readTimeout() {
        return Duration.ofMillis(Math.max(1000, properties.getApi().getReadTimeoutMs()));
    }
}
