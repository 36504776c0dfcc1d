package com.imageinsight.describer.client;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.imageinsight.describer.config.DescriberProperties;
import com.imageinsight.describer.config.DescriptionSettings;
import com.imageinsight.describer.dto.Chunk;
import com.imageinsight.describer.entity.DescriptionField;
import com.imageinsight.describer.entity.ErrorKind;
import com.imageinsight.describer.exception.VisionApiException;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.springframework.http.HttpMethod;
import org.springframework.http.HttpStatus;
import org.springframework.web.reactive.function.client.ClientRequest;
import org.springframework.web.reactive.function.client.ClientResponse;
import org.springframework.web.reactive.function.client.WebClient;
import reactor.core.publisher.Mono;
import reactor.test.StepVerifier;

import java.time.Duration;
import java.util.ArrayList;
import java.util.Base64;
import java.util.List;
import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;

class VisionApiClientTest {

    private final List<ClientRequest> requests = new ArrayList<>();
    private final DescriptionSettings settings =
            new DescriptionSettings("secret", "gemini", "English", "", 10, Duration.ofMillis(1), 3);
    private final Chunk chunk = new Chunk(0, List.of("1:2504", "1:2505"),
            List.of(new byte[]{1, 2, 3}, new byte[]{4, 5}));

    private HttpStatus status;
    private String body;
    private VisionApiClient client;

    @BeforeEach
    void setUp() {
        WebClient webClient = WebClient.builder()
                .baseUrl("http://vision.test")
                .exchangeFunction(request -> {
                    requests.add(request);
                    return Mono.just(ClientResponse.create(status)
                            .header("Content-Type", "application/json")
                            .body(body)
                            .build());
                })
                .build();
        client = new VisionApiClient(webClient, new VisionResponseParser(new ObjectMapper()), new DescriberProperties());
    }

    @Test
    @DisplayName("Submit posts to the fetch path with the token header")
    void submitSendsAuthenticatedPost() {
        status = HttpStatus.OK;
        body = "{\"response_uri\": \"http://vision.test/api/response/1\"}";

        StepVerifier.create(client.submit(chunk, DescriptionField.ALT_TEXT, settings))
                .assertNext(response -> {
                    assertThat(response.kind()).isEqualTo(VisionApiResponse.Kind.PENDING);
                    assertThat(response.jobHandle()).isEqualTo("http://vision.test/api/response/1");
                })
                .verifyComplete();

        ClientRequest request = requests.get(0);
        assertThat(request.method()).isEqualTo(HttpMethod.POST);
        assertThat(request.url().toString()).isEqualTo("http://vision.test/api/fetch");
        assertThat(request.headers().getFirst("X-API-Key")).isEqualTo("Token secret");
    }

    @Test
    @DisplayName("Non-2xx submit fails with a remote rejection")
    void submitRejected() {
        status = HttpStatus.UNAUTHORIZED;
        body = "{\"error\": \"Invalid API key\"}";

        StepVerifier.create(client.submit(chunk, DescriptionField.CAPTION, settings))
                .expectErrorSatisfies(e -> {
                    assertThat(e).isInstanceOf(VisionApiException.class).hasMessage("Invalid API key");
                    assertThat(((VisionApiException) e).getKind()).isEqualTo(ErrorKind.REMOTE_REJECTION);
                    assertThat(((VisionApiException) e).getStatusCode()).isEqualTo(401);
                })
                .verify();
    }

    @Test
    @DisplayName("Exchange failure is mapped to a transport error")
    void submitTransportFailure() {
        WebClient failing = WebClient.builder()
                .exchangeFunction(request -> Mono.error(new IllegalStateException("connection refused")))
                .build();
        VisionApiClient failingClient =
                new VisionApiClient(failing, new VisionResponseParser(new ObjectMapper()), new DescriberProperties());

        StepVerifier.create(failingClient.submit(chunk, DescriptionField.ALT_TEXT, settings))
                .expectErrorSatisfies(e -> {
                    assertThat(e).isInstanceOf(VisionApiException.class);
                    assertThat(((VisionApiException) e).getKind()).isEqualTo(ErrorKind.TRANSPORT);
                })
                .verify();
    }

    @Test
    @DisplayName("Poll treats 202 as pending")
    void pollAccepted() {
        status = HttpStatus.ACCEPTED;
        body = "";

        StepVerifier.create(client.poll("http://vision.test/api/response/1", settings))
                .assertNext(response -> assertThat(response.kind()).isEqualTo(VisionApiResponse.Kind.PENDING))
                .verifyComplete();

        ClientRequest request = requests.get(0);
        assertThat(request.method()).isEqualTo(HttpMethod.GET);
        assertThat(request.url().toString()).isEqualTo("http://vision.test/api/response/1");
        assertThat(request.headers().getFirst("X-API-Key")).isEqualTo("Token secret");
    }

    @Test
    @DisplayName("Poll with a non-2xx status fails with the status and body")
    void pollFailed() {
        status = HttpStatus.INTERNAL_SERVER_ERROR;
        body = "boom";

        StepVerifier.create(client.poll("http://vision.test/api/response/1", settings))
                .expectErrorSatisfies(e -> assertThat(e)
                        .isInstanceOf(VisionApiException.class)
                        .hasMessage("Polling error (500): boom"))
                .verify();
    }

    @Test
    @DisplayName("Submit body carries aligned files and names, role and backend")
    void submitBody() {
        Map<String, Object> submitBody = client.buildSubmitBody(chunk, DescriptionField.DESCRIPTION, settings);

        Base64.Encoder encoder = Base64.getEncoder();
        assertThat(submitBody.get("file")).isEqualTo(List.of(
                encoder.encodeToString(new byte[]{1, 2, 3}), encoder.encodeToString(new byte[]{4, 5})));
        assertThat(submitBody.get("file_name")).isEqualTo(List.of("1:2504", "1:2505"));
        assertThat(submitBody.get("role")).isEqualTo("general");
        assertThat(submitBody.get("backend")).isEqualTo(List.of("gemini"));
        assertThat(submitBody.get("language")).isEqualTo("English");
        assertThat(submitBody.get("feature")).isEqualTo(List.of("descriptions"));
        assertThat(submitBody).doesNotContainKey("prompt");
    }

    @Test
    @DisplayName("Custom prompt is trimmed and sent")
    void submitBodyWithPrompt() {
        DescriptionSettings withPrompt = settings.withOverrides(null, null, "  Describe the colours  ");

        Map<String, Object> submitBody = client.buildSubmitBody(chunk, DescriptionField.ALT_TEXT, withPrompt);

        assertThat(submitBody.get("prompt")).isEqualTo("Describe the colours");
        assertThat(submitBody.get("role")).isEqualTo("alttext");
    }
}
